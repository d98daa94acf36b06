package com.raditha.clonegen.model;

/**
 * Lexical categories produced by the tokenizer.
 */
public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    LITERAL_NUMBER,
    LITERAL_STRING,
    LITERAL_BOOL,
    LITERAL_NULL,
    OPERATOR,
    PUNCTUATION,
    COMMENT,
    WHITESPACE;

    /**
     * Whitespace and comments carry no meaning for clone equivalence.
     */
    public boolean isCode() {
        return this != WHITESPACE && this != COMMENT;
    }

    public boolean isLiteral() {
        return this == LITERAL_NUMBER || this == LITERAL_STRING || this == LITERAL_BOOL || this == LITERAL_NULL;
    }
}
