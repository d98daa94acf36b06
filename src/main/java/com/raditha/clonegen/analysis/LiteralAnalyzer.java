package com.raditha.clonegen.analysis;

import com.raditha.clonegen.lexer.LanguageProfile;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.LiteralKind;
import com.raditha.clonegen.model.LiteralOccurrence;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies literal tokens by value kind.
 */
public class LiteralAnalyzer {

    private static final Set<String> MODULE_LOADERS = Set.of(
            "require", "import", "__import__", "import_module", "loadLibrary", "dlopen");

    public List<LiteralOccurrence> extractLiterals(TokenStream stream) {
        List<LiteralOccurrence> literals = new ArrayList<>();
        for (int i = 0; i < stream.size(); i++) {
            Token token = stream.get(i);
            if (token.kind().isLiteral()) {
                literals.add(new LiteralOccurrence(token.text(), classify(token, stream.language()), token.span(), i));
            }
        }
        return literals;
    }

    /**
     * Token indices of literals whose value refers to something outside the
     * snippet: literals on import, include and package lines, inside
     * annotation or decorator arguments, and the first argument of a module
     * loading call such as {@code require("fs")}.
     */
    public Set<Integer> fixedLiterals(TokenStream stream) {
        LanguageProfile profile = LanguageProfile.of(stream.language());
        List<Integer> codeIndices = IdentifierAnalyzer.codeIndices(stream);
        boolean[] importFlags = IdentifierAnalyzer.importFlags(stream, codeIndices, profile);

        Set<Integer> fixed = new HashSet<>();
        boolean annotationName = false;
        int annotationDepth = 0;
        Token prev = null;
        Token prev2 = null;
        for (int c = 0; c < codeIndices.size(); c++) {
            Token token = stream.get(codeIndices.get(c));
            if (token.kind().isLiteral() && (importFlags[c] || annotationDepth > 0 || isLoaderArgument(prev, prev2))) {
                fixed.add(codeIndices.get(c));
            }

            if (annotationDepth > 0) {
                if (token.is("(")) {
                    annotationDepth++;
                } else if (token.is(")")) {
                    annotationDepth--;
                }
            } else if (annotationName) {
                if (token.is("(")) {
                    annotationDepth = 1;
                    annotationName = false;
                } else if (!token.is(".") && token.kind() != TokenKind.IDENTIFIER) {
                    annotationName = false;
                }
            } else if (token.is("@") && !isOperand(prev, token)) {
                annotationName = true;
            }
            prev2 = prev;
            prev = token;
        }
        return fixed;
    }

    private static boolean isLoaderArgument(Token prev, Token prev2) {
        return prev != null && prev.is("(") && prev2 != null && MODULE_LOADERS.contains(prev2.text());
    }

    /**
     * True when {@code prev} ends an expression on the same line, which makes
     * a following {@code @} the matrix multiplication operator.
     */
    private static boolean isOperand(Token prev, Token at) {
        if (prev == null || prev.endLine() < at.line()) {
            return false;
        }
        return prev.kind() == TokenKind.IDENTIFIER || prev.kind().isLiteral() || prev.is(")") || prev.is("]");
    }

    /**
     * Value kind of a literal token.
     *
     * @throws IllegalArgumentException if the token is not a literal
     */
    public LiteralKind classify(Token token, Language language) {
        return switch (token.kind()) {
            case LITERAL_STRING -> LiteralKind.STRING;
            case LITERAL_BOOL -> LiteralKind.BOOL;
            case LITERAL_NULL -> LiteralKind.NULL;
            case LITERAL_NUMBER -> classifyNumber(token.text(), language);
            default -> throw new IllegalArgumentException("Not a literal token: " + token);
        };
    }

    static LiteralKind classifyNumber(String text, Language language) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            return LiteralKind.HEX;
        }
        if (lower.startsWith("0b")) {
            return LiteralKind.BINARY;
        }
        if (lower.startsWith("0o")) {
            return LiteralKind.OCTAL;
        }
        if (hasLegacyOctalPrefix(lower, language)) {
            return LiteralKind.OCTAL;
        }
        if (isScientific(lower)) {
            return LiteralKind.SCIENTIFIC;
        }
        if (lower.indexOf('.') >= 0) {
            return LiteralKind.FLOAT;
        }
        if (language != Language.PYTHON && (lower.endsWith("f") || lower.endsWith("d"))) {
            return LiteralKind.FLOAT;
        }
        return LiteralKind.INT;
    }

    private static boolean isScientific(String lower) {
        int e = lower.indexOf('e');
        if (e <= 0 || e + 1 >= lower.length()) {
            return false;
        }
        int digit = e + 1;
        if (lower.charAt(digit) == '+' || lower.charAt(digit) == '-') {
            digit++;
        }
        return digit < lower.length() && Character.isDigit(lower.charAt(digit));
    }

    /**
     * C-family {@code 017} style octal. Python and JavaScript do not treat a
     * leading zero that way.
     */
    private static boolean hasLegacyOctalPrefix(String lower, Language language) {
        if (language == Language.PYTHON || language == Language.JAVASCRIPT) {
            return false;
        }
        if (lower.length() < 2 || lower.charAt(0) != '0') {
            return false;
        }
        for (int i = 1; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c < '0' || c > '7') {
                return i > 1 && (c == 'l' || c == 'u') && lower.substring(i).matches("[lu]+");
            }
        }
        return true;
    }
}
