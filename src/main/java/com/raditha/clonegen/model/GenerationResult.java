package com.raditha.clonegen.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result returned to callers of {@code generate}.
 *
 * @param variant       Certified variant
 * @param provenance    Applied operations, skips, retries and degradations
 * @param requestedType Clone type the caller asked for
 * @param achievedType  Clone type the variant was certified as
 * @param seed          Effective seed used for the successful attempt
 * @param report        Validation report for {@code achievedType}
 * @param renameStats   Renames and literal changes when a Type-2 variant was
 *                      certified, otherwise null
 */
public record GenerationResult(
        String variant,
        List<String> provenance,
        CloneType requestedType,
        CloneType achievedType,
        long seed,
        ValidationReport report,
        @Nullable RenameStats renameStats) {

    public GenerationResult {
        provenance = List.copyOf(provenance);
    }

    public GenerationResult(String variant, List<String> provenance, CloneType requestedType,
            CloneType achievedType, long seed, ValidationReport report) {
        this(variant, provenance, requestedType, achievedType, seed, report, null);
    }

    public boolean degraded() {
        return requestedType != achievedType;
    }
}
