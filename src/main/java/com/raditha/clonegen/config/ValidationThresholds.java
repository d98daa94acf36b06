package com.raditha.clonegen.config;

/**
 * Token similarity window for Type-3 clones: {@code [minSimilarity, maxSimilarity)}.
 * The upper bound is exclusive so that an unchanged token sequence never
 * passes as a Type-3 clone.
 */
public record ValidationThresholds(double minSimilarity, double maxSimilarity) {

    public ValidationThresholds {
        if (minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("minSimilarity must be between 0.0 and 1.0");
        }
        if (maxSimilarity <= minSimilarity || maxSimilarity > 1.0) {
            throw new IllegalArgumentException("maxSimilarity must be in (minSimilarity, 1.0]");
        }
    }

    public static ValidationThresholds defaults() {
        return new ValidationThresholds(0.5, 1.0);
    }

    public boolean accepts(double similarity) {
        return similarity >= minSimilarity && similarity < maxSimilarity;
    }
}
