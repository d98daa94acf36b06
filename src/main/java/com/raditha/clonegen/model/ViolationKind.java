package com.raditha.clonegen.model;

public enum ViolationKind {
    TOKEN_MISMATCH,
    TOKEN_COUNT_MISMATCH,
    KIND_MISMATCH,
    STRUCTURE_MISMATCH,
    CONTROL_FLOW_MISMATCH,
    UNBALANCED_BRACKETS,
    MISSING_CRITICAL_LINE,
    INDENTATION_INCONSISTENT,
    LENGTH_BELOW_MINIMUM,
    SIMILARITY_OUT_OF_WINDOW
}
