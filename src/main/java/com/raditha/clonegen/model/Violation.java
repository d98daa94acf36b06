package com.raditha.clonegen.model;

/**
 * A single broken clone-type rule.
 */
public record Violation(ViolationKind kind, String detail) {

    @Override
    public String toString() {
        return kind + ": " + detail;
    }
}
