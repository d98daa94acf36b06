package com.raditha.clonegen.model;

/**
 * A literal token together with its value kind.
 */
public record LiteralOccurrence(
        String rawText,
        LiteralKind valueKind,
        Span span,
        int tokenIndex) {
}
