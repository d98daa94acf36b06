package com.raditha.clonegen.model;

/**
 * A single lexical token of a source snippet.
 *
 * @param kind        Token category
 * @param text        Exact source text of the token
 * @param startOffset Offset of the first character (inclusive)
 * @param endOffset   Offset after the last character (exclusive)
 * @param line        1-based line on which the token starts
 */
public record Token(
        TokenKind kind,
        String text,
        int startOffset,
        int endOffset,
        int line) {

    public boolean isCode() {
        return kind.isCode();
    }

    /**
     * Check if this token has the same kind and text as another token.
     * Positions are ignored, which is what clone comparison needs.
     */
    public boolean sameAs(Token other) {
        if (other == null)
            return false;
        return this.kind == other.kind && this.text.equals(other.text);
    }

    public boolean is(String value) {
        return text.equals(value);
    }

    /**
     * Line on which the token ends. Differs from {@link #line()} only for
     * tokens that span newlines (block comments, triple-quoted strings).
     */
    public int endLine() {
        int newlines = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                newlines++;
            }
        }
        return line + newlines;
    }

    public Span span() {
        return new Span(startOffset, endOffset);
    }
}
