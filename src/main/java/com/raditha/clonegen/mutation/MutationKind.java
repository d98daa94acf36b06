package com.raditha.clonegen.mutation;

/**
 * Statement-level edits available to the Type-3 engine.
 */
public enum MutationKind {
    /** Insert a no-op declaration or a comment before the target line. */
    STATEMENT_INSERT("statement_insert"),
    /** Remove a non-essential target line. */
    STATEMENT_DELETE("statement_delete"),
    /** Wrap the target line in an always-true conditional. */
    CONDITIONAL_PADDING("conditional_padding"),
    /** Insert a trivially true check or a validation comment before the target line. */
    VALIDATION_INSERT("validation_insert");

    private final String label;

    MutationKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
