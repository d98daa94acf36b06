package com.raditha.clonegen.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable token sequence for one snippet.
 * Concatenating the text of every token reproduces the source exactly.
 */
public final class TokenStream {

    private final Language language;
    private final List<Token> tokens;
    private final List<Token> codeTokens;

    public TokenStream(Language language, List<Token> tokens) {
        this.language = language;
        this.tokens = List.copyOf(tokens);
        this.codeTokens = this.tokens.stream().filter(Token::isCode).toList();
    }

    public Language language() {
        return language;
    }

    public List<Token> tokens() {
        return tokens;
    }

    /**
     * The code-significant subsequence: everything except whitespace and
     * comments.
     */
    public List<Token> codeTokens() {
        return codeTokens;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * Rebuild the source text from the tokens.
     */
    public String text() {
        return tokens.stream().map(Token::text).collect(Collectors.joining());
    }

    /**
     * Type-1 equivalence: identical code tokens in kind, text, order and count.
     */
    public boolean codeEquals(TokenStream other) {
        List<Token> mine = codeTokens;
        List<Token> theirs = other.codeTokens;
        if (mine.size() != theirs.size()) {
            return false;
        }
        for (int i = 0; i < mine.size(); i++) {
            if (!mine.get(i).sameAs(theirs.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "TokenStream[" + language + ", " + tokens.size() + " tokens, " + codeTokens.size() + " code]";
    }
}
