package com.raditha.clonegen.model;

/**
 * One occurrence of a renameable identifier.
 *
 * @param name       Identifier text
 * @param category   Category inferred for the name (shared by all its occurrences)
 * @param span       Character range in the source
 * @param context    Declaration context of this occurrence
 * @param tokenIndex Index of the token in its {@link TokenStream}
 */
public record IdentifierOccurrence(
        String name,
        IdentifierCategory category,
        Span span,
        OccurrenceContext context,
        int tokenIndex) {
}
