package com.raditha.clonegen.renaming;

import com.raditha.clonegen.model.Language;

import java.util.Locale;

/**
 * A string or character literal split into prefix, quote delimiter and body.
 *
 * @param prefix    Letters before the opening quote ({@code r}, {@code f}, {@code L}, {@code u8} ...)
 * @param delimiter Opening and closing quote ({@code "}, {@code '}, {@code """}, {@code '''} or a backtick)
 * @param body      Text between the quotes, escapes left as written
 * @param language  Language the literal belongs to
 */
public record StringLiteralParts(String prefix, String delimiter, String body, Language language) {

    /**
     * Split a literal token. Returns null for unterminated literals and C++
     * raw strings, which are never rewritten.
     */
    public static StringLiteralParts parse(String text, Language language) {
        int quote = 0;
        while (quote < text.length() && Character.isLetterOrDigit(text.charAt(quote))) {
            quote++;
        }
        if (quote >= text.length()) {
            return null;
        }
        String prefix = text.substring(0, quote);
        if (language == Language.CPP && prefix.endsWith("R")) {
            return null;
        }
        char q = text.charAt(quote);
        if (q != '"' && q != '\'' && q != '`') {
            return null;
        }
        String delimiter = String.valueOf(q);
        if (q != '`' && text.startsWith(delimiter.repeat(3), quote) && text.length() >= quote + 6) {
            delimiter = delimiter.repeat(3);
        }
        int bodyStart = quote + delimiter.length();
        int bodyEnd = text.length() - delimiter.length();
        if (bodyEnd < bodyStart || !text.endsWith(delimiter) || isEscaped(text, bodyEnd)) {
            return null;
        }
        return new StringLiteralParts(prefix, delimiter, text.substring(bodyStart, bodyEnd), language);
    }

    private static boolean isEscaped(String text, int position) {
        int backslashes = 0;
        for (int i = position - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    public boolean isRaw() {
        return prefix.toLowerCase(Locale.ROOT).contains("r");
    }

    /**
     * Python f-string or JavaScript template literal.
     */
    public boolean isInterpolated() {
        return delimiter.equals("`") || prefix.toLowerCase(Locale.ROOT).contains("f");
    }

    public boolean isMultiLine() {
        return delimiter.length() == 3 || body.indexOf('\n') >= 0;
    }

    /**
     * Single-quoted character literal in Java, C or C++.
     */
    public boolean isCharacter() {
        return delimiter.equals("'")
                && (language == Language.JAVA || language == Language.C || language == Language.CPP);
    }

    public String withBody(String newBody) {
        return prefix + delimiter + newBody + delimiter;
    }
}
