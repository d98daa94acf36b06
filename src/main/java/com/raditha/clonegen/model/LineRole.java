package com.raditha.clonegen.model;

/**
 * Closed classification of a source line for structural mutation.
 * Only {@link #STATEMENT} lines may be targeted; critical roles must survive
 * verbatim.
 */
public enum LineRole {
    BLANK(false),
    COMMENT(false),
    IMPORT(true),
    DECORATOR(true),
    DECLARATION(true),
    CONTROL(true),
    CLOSING(true),
    EXIT(true),
    /** Part of a construct that started on an earlier line. */
    CONTINUATION(true),
    STATEMENT(false),
    OTHER(false);

    private final boolean critical;

    LineRole(boolean critical) {
        this.critical = critical;
    }

    public boolean isCritical() {
        return critical;
    }
}
