package com.raditha.clonegen.lexer;

import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Lossless, language-aware tokenizer.
 * <p>
 * Tokenization is total: malformed input (unterminated strings, stray
 * characters) degrades to best-effort tokens instead of raising. Every
 * character of the input ends up in exactly one token, so concatenating the
 * token texts reproduces the source.
 */
public class Tokenizer {

    private static final Set<String> PYTHON_STRING_PREFIXES = Set.of(
            "", "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final Set<String> C_STRING_PREFIXES = Set.of("", "L", "u", "U", "u8");

    /** Code tokens after which a JavaScript {@code /} starts a regular expression. */
    private static final Set<String> REGEX_PRECEDING_KEYWORDS = Set.of(
            "return", "typeof", "case", "do", "else", "in", "of", "new", "delete", "void", "throw", "yield",
            "await");

    public TokenStream tokenize(String source, Language language) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(language, "language");
        return new Scan(source, LanguageProfile.of(language)).run();
    }

    /**
     * Scanner state for a single call.
     */
    private static final class Scan {
        private final String src;
        private final int len;
        private final LanguageProfile profile;
        private final Language language;
        private final List<Token> tokens = new ArrayList<>();
        private Token lastCode;
        private int pos;
        private int line = 1;

        Scan(String src, LanguageProfile profile) {
            this.src = src;
            this.len = src.length();
            this.profile = profile;
            this.language = profile.language();
        }

        TokenStream run() {
            while (pos < len) {
                int start = pos;
                TokenKind kind = next();
                if (pos <= start) {
                    // Never stall: consume one character as punctuation.
                    pos = start + 1;
                    kind = TokenKind.PUNCTUATION;
                }
                emit(kind, start);
            }
            return new TokenStream(language, tokens);
        }

        private void emit(TokenKind kind, int start) {
            String text = src.substring(start, pos);
            if (kind == TokenKind.IDENTIFIER) {
                kind = classifyWord(text);
            }
            Token token = new Token(kind, text, start, pos, line);
            tokens.add(token);
            if (token.isCode()) {
                lastCode = token;
            }
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                }
            }
        }

        private TokenKind next() {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                while (pos < len && Character.isWhitespace(src.charAt(pos))) {
                    pos++;
                }
                return TokenKind.WHITESPACE;
            }
            if (scanComment()) {
                return TokenKind.COMMENT;
            }
            if (scanString()) {
                return TokenKind.LITERAL_STRING;
            }
            if (Character.isDigit(c) || (c == '.' && pos + 1 < len && Character.isDigit(src.charAt(pos + 1)))) {
                scanNumber();
                return TokenKind.LITERAL_NUMBER;
            }
            if (isIdentifierStart(c)) {
                while (pos < len && isIdentifierPart(src.charAt(pos))) {
                    pos++;
                }
                return TokenKind.IDENTIFIER;
            }
            if (language == Language.JAVASCRIPT && c == '/' && regexAllowed() && scanRegex()) {
                return TokenKind.LITERAL_STRING;
            }
            for (String op : profile.operators()) {
                if (src.startsWith(op, pos)) {
                    pos += op.length();
                    return TokenKind.OPERATOR;
                }
            }
            pos++;
            return TokenKind.PUNCTUATION;
        }

        private TokenKind classifyWord(String word) {
            if (profile.isBoolLiteral(word)) {
                return TokenKind.LITERAL_BOOL;
            }
            if (profile.isNullLiteral(word)) {
                return TokenKind.LITERAL_NULL;
            }
            if (profile.isKeyword(word)) {
                return TokenKind.KEYWORD;
            }
            return TokenKind.IDENTIFIER;
        }

        private boolean isIdentifierStart(char c) {
            return Character.isLetter(c) || c == '_' || (c == '$' && language != Language.PYTHON);
        }

        private boolean isIdentifierPart(char c) {
            return isIdentifierStart(c) || Character.isDigit(c);
        }

        private boolean scanComment() {
            if (language == Language.PYTHON) {
                if (src.charAt(pos) != '#') {
                    return false;
                }
                skipToEndOfLine();
                return true;
            }
            if (src.startsWith("//", pos)) {
                skipToEndOfLine();
                return true;
            }
            if (src.startsWith("/*", pos)) {
                int close = src.indexOf("*/", pos + 2);
                pos = close < 0 ? len : close + 2;
                return true;
            }
            return false;
        }

        private void skipToEndOfLine() {
            while (pos < len && src.charAt(pos) != '\n') {
                pos++;
            }
        }

        private boolean scanString() {
            return switch (language) {
                case PYTHON -> scanPythonString();
                case JAVA -> scanJavaString();
                case JAVASCRIPT -> scanJavaScriptString();
                case CPP, C -> scanCString();
            };
        }

        private boolean scanPythonString() {
            int j = pos;
            while (j < len && j - pos < 2 && "rRbBuUfF".indexOf(src.charAt(j)) >= 0) {
                j++;
            }
            if (j >= len || !isQuote(src.charAt(j))) {
                return false;
            }
            String prefix = src.substring(pos, j).toLowerCase(Locale.ROOT);
            if (!PYTHON_STRING_PREFIXES.contains(prefix)) {
                return false;
            }
            pos = j;
            scanQuoted(src.charAt(j), true);
            return true;
        }

        private boolean scanJavaString() {
            char c = src.charAt(pos);
            if (!isQuote(c)) {
                return false;
            }
            scanQuoted(c, c == '"');
            return true;
        }

        private boolean scanJavaScriptString() {
            char c = src.charAt(pos);
            if (c == '`') {
                pos = findClosing(pos + 1, "`", true);
                return true;
            }
            if (!isQuote(c)) {
                return false;
            }
            scanQuoted(c, false);
            return true;
        }

        private boolean scanCString() {
            int j = pos;
            while (j < len && j - pos < 2 && "LuU8".indexOf(src.charAt(j)) >= 0) {
                j++;
            }
            String prefix = src.substring(pos, j);
            boolean raw = language == Language.CPP && j < len && src.charAt(j) == 'R'
                    && j + 1 < len && src.charAt(j + 1) == '"';
            if (raw && C_STRING_PREFIXES.contains(prefix)) {
                return scanRawString(j + 2);
            }
            if (j >= len || !isQuote(src.charAt(j)) || !C_STRING_PREFIXES.contains(prefix)) {
                return false;
            }
            pos = j;
            scanQuoted(src.charAt(j), false);
            return true;
        }

        /**
         * C++ raw string: {@code R"delim( ... )delim"}. Falls back to a plain
         * identifier when the delimiter is malformed.
         */
        private boolean scanRawString(int delimStart) {
            int open = src.indexOf('(', delimStart);
            if (open < 0 || open - delimStart > 16) {
                return false;
            }
            String delimiter = src.substring(delimStart, open);
            if (delimiter.contains("\n") || delimiter.contains(" ") || delimiter.contains("\"")) {
                return false;
            }
            String terminator = ")" + delimiter + "\"";
            int close = src.indexOf(terminator, open + 1);
            pos = close < 0 ? len : close + terminator.length();
            return true;
        }

        /**
         * Consume a quoted literal starting at {@code pos}, which points at the
         * opening quote character.
         */
        private void scanQuoted(char quote, boolean allowTriple) {
            String q = String.valueOf(quote);
            String triple = q.repeat(3);
            if (allowTriple && src.startsWith(triple, pos)) {
                pos = findClosing(pos + 3, triple, true);
                return;
            }
            pos = findClosing(pos + 1, q, false);
        }

        /**
         * Find the end of a literal body, honouring backslash escapes.
         * Single-line literals that are unterminated stop before the newline.
         */
        private int findClosing(int from, String terminator, boolean multiLine) {
            int i = from;
            while (i < len) {
                char ch = src.charAt(i);
                if (ch == '\\') {
                    i += 2;
                    continue;
                }
                if (!multiLine && ch == '\n') {
                    return i;
                }
                if (src.startsWith(terminator, i)) {
                    return i + terminator.length();
                }
                i++;
            }
            return len;
        }

        private boolean isQuote(char c) {
            return c == '"' || c == '\'';
        }

        private void scanNumber() {
            char c = src.charAt(pos);
            if (c == '0' && pos + 1 < len) {
                char marker = Character.toLowerCase(src.charAt(pos + 1));
                if (marker == 'x' || marker == 'b' || marker == 'o') {
                    pos += 2;
                    while (pos < len && (isHexDigit(src.charAt(pos)) || isSeparator(src.charAt(pos)))) {
                        pos++;
                    }
                    consumeSuffix();
                    return;
                }
            }
            consumeDigits();
            if (pos < len && src.charAt(pos) == '.') {
                char after = pos + 1 < len ? src.charAt(pos + 1) : '\0';
                if (Character.isDigit(after)) {
                    pos++;
                    consumeDigits();
                } else if (!isIdentifierStart(after) && after != '.') {
                    pos++;
                }
            }
            if (pos < len && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int save = pos;
                pos++;
                if (pos < len && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < len && Character.isDigit(src.charAt(pos))) {
                    consumeDigits();
                } else {
                    pos = save;
                }
            }
            consumeSuffix();
        }

        private void consumeDigits() {
            while (pos < len && (Character.isDigit(src.charAt(pos)) || isSeparator(src.charAt(pos)))) {
                pos++;
            }
        }

        /**
         * Digit separators: {@code _} everywhere except C, {@code '} in C++.
         */
        private boolean isSeparator(char c) {
            if (pos + 1 >= len || !isHexDigit(src.charAt(pos + 1))) {
                return false;
            }
            return (c == '_' && language != Language.C) || (c == '\'' && language == Language.CPP);
        }

        private void consumeSuffix() {
            while (pos < len && Character.isLetterOrDigit(src.charAt(pos))) {
                pos++;
            }
        }

        private boolean isHexDigit(char c) {
            return Character.digit(c, 16) >= 0;
        }

        private boolean regexAllowed() {
            if (lastCode == null) {
                return true;
            }
            return switch (lastCode.kind()) {
                case IDENTIFIER, LITERAL_NUMBER, LITERAL_STRING, LITERAL_BOOL, LITERAL_NULL -> false;
                case KEYWORD -> REGEX_PRECEDING_KEYWORDS.contains(lastCode.text());
                case PUNCTUATION -> !(lastCode.is(")") || lastCode.is("]") || lastCode.is("}"));
                default -> true;
            };
        }

        /**
         * JavaScript regular expression literal on a single line, including
         * character classes and trailing flags.
         */
        private boolean scanRegex() {
            int i = pos + 1;
            if (i < len && (src.charAt(i) == '/' || src.charAt(i) == '*')) {
                return false;
            }
            boolean inClass = false;
            while (i < len) {
                char ch = src.charAt(i);
                if (ch == '\n') {
                    return false;
                }
                if (ch == '\\') {
                    i += 2;
                    continue;
                }
                if (ch == '[') {
                    inClass = true;
                } else if (ch == ']') {
                    inClass = false;
                } else if (ch == '/' && !inClass) {
                    i++;
                    while (i < len && Character.isLetter(src.charAt(i))) {
                        i++;
                    }
                    pos = Math.min(i, len);
                    return true;
                }
                i++;
            }
            return false;
        }
    }
}
