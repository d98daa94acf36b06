package com.raditha.clonegen.config;

/**
 * Toggles for the Type-1 formatting pipeline.
 *
 * @param indentation     Remap indentation width and style
 * @param blankLines      Insert and collapse blank lines
 * @param comments        Remove, reword and add comments
 * @param operatorSpacing Adjust whitespace around operators and commas
 * @param bracePosition   Move opening braces between lines (C family only)
 * @param spacingStyle    Operator spacing style
 */
public record FormattingOptions(
        boolean indentation,
        boolean blankLines,
        boolean comments,
        boolean operatorSpacing,
        boolean bracePosition,
        SpacingStyle spacingStyle) {

    public FormattingOptions {
        if (spacingStyle == null) {
            spacingStyle = SpacingStyle.RANDOM;
        }
    }

    /**
     * Every step enabled, spacing style chosen per call.
     */
    public static FormattingOptions all() {
        return new FormattingOptions(true, true, true, true, true, SpacingStyle.RANDOM);
    }

    public static FormattingOptions none() {
        return new FormattingOptions(false, false, false, false, false, SpacingStyle.RANDOM);
    }

    public FormattingOptions withSpacingStyle(SpacingStyle style) {
        return new FormattingOptions(indentation, blankLines, comments, operatorSpacing, bracePosition, style);
    }

    public boolean anyEnabled() {
        return indentation || blankLines || comments || operatorSpacing || bracePosition;
    }
}
