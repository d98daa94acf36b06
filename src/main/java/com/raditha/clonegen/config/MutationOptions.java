package com.raditha.clonegen.config;

/**
 * Options for the Type-3 engine.
 *
 * @param maxTransformations    Upper bound on committed edits per call
 * @param maxRetries            Upper bound on attempted edits, committed or rolled back
 * @param minLengthRatio        Smallest allowed output/input length ratio
 * @param useCandidateGenerator Ask the external candidate generator first, when one is configured
 */
public record MutationOptions(
        int maxTransformations,
        int maxRetries,
        double minLengthRatio,
        boolean useCandidateGenerator) {

    public MutationOptions {
        if (maxTransformations < 1) {
            throw new IllegalArgumentException("maxTransformations must be >= 1");
        }
        if (maxRetries < maxTransformations) {
            throw new IllegalArgumentException("maxRetries must be >= maxTransformations");
        }
        if (minLengthRatio < 0.0 || minLengthRatio > 1.0) {
            throw new IllegalArgumentException("minLengthRatio must be between 0.0 and 1.0");
        }
    }

    public static MutationOptions defaults() {
        return new MutationOptions(5, 20, 0.7, false);
    }

    public MutationOptions withMaxTransformations(int max) {
        return new MutationOptions(max, Math.max(maxRetries, max), minLengthRatio, useCandidateGenerator);
    }

    public MutationOptions withCandidateGenerator(boolean enabled) {
        return new MutationOptions(maxTransformations, maxRetries, minLengthRatio, enabled);
    }
}
