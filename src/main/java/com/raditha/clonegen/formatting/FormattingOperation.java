package com.raditha.clonegen.formatting;

/**
 * Steps of the Type-1 pipeline, in pipeline order.
 */
public enum FormattingOperation {
    INDENTATION("indentation_remap"),
    BLANK_LINES("blank_line_jitter"),
    COMMENTS("comment_edit"),
    OPERATOR_SPACING("operator_spacing"),
    BRACE_POSITION("brace_position");

    private final String label;

    FormattingOperation(String label) {
        this.label = label;
    }

    /**
     * Name recorded in provenance.
     */
    public String label() {
        return label;
    }
}
