package com.raditha.clonegen.config;

/**
 * Complete option set for one {@code generate} call.
 *
 * @param formatting     Type-1 pipeline toggles
 * @param renaming       Type-2 options
 * @param mutation       Type-3 options
 * @param thresholds     Type-3 similarity window
 * @param maxAttempts    Seeded attempts before degrading to a lower clone type
 * @param minSourceLines Minimum number of non-blank source lines
 */
public record GenerationOptions(
        FormattingOptions formatting,
        RenamingOptions renaming,
        MutationOptions mutation,
        ValidationThresholds thresholds,
        int maxAttempts,
        int minSourceLines) {

    public GenerationOptions {
        if (formatting == null) {
            throw new IllegalArgumentException("formatting cannot be null");
        }
        if (renaming == null) {
            throw new IllegalArgumentException("renaming cannot be null");
        }
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds cannot be null");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (minSourceLines < 1) {
            throw new IllegalArgumentException("minSourceLines must be >= 1");
        }
    }

    /**
     * Defaults: every formatting step, renaming with literal changes at 50%,
     * up to 5 structural edits, similarity window [0.5, 1.0).
     */
    public static GenerationOptions defaults() {
        return new GenerationOptions(
                FormattingOptions.all(),
                RenamingOptions.defaults(),
                MutationOptions.defaults(),
                ValidationThresholds.defaults(),
                3, // maxAttempts
                1); // minSourceLines
    }

    public GenerationOptions withFormatting(FormattingOptions options) {
        return new GenerationOptions(options, renaming, mutation, thresholds, maxAttempts, minSourceLines);
    }

    public GenerationOptions withRenaming(RenamingOptions options) {
        return new GenerationOptions(formatting, options, mutation, thresholds, maxAttempts, minSourceLines);
    }

    public GenerationOptions withMutation(MutationOptions options) {
        return new GenerationOptions(formatting, renaming, options, thresholds, maxAttempts, minSourceLines);
    }

    public GenerationOptions withThresholds(ValidationThresholds options) {
        return new GenerationOptions(formatting, renaming, mutation, options, maxAttempts, minSourceLines);
    }

    public GenerationOptions withMinSourceLines(int lines) {
        return new GenerationOptions(formatting, renaming, mutation, thresholds, maxAttempts, lines);
    }
}
