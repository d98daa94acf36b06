package com.raditha.clonegen.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Output of a single engine invocation.
 *
 * @param variant     Transformed source
 * @param provenance  Names of the operations applied (or skipped), in order
 * @param renameStats Renames and literal changes, set by the Type-2 engine only
 */
public record TransformationResult(String variant, List<String> provenance, @Nullable RenameStats renameStats) {

    public TransformationResult {
        provenance = List.copyOf(provenance);
    }

    public TransformationResult(String variant, List<String> provenance) {
        this(variant, provenance, null);
    }

    public static TransformationResult unchanged(String source, List<String> provenance) {
        return new TransformationResult(source, provenance);
    }
}
