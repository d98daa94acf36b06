package com.raditha.clonegen.mutation;

import com.raditha.clonegen.model.Language;

import java.util.List;

/**
 * Source templates for inserted and wrapping lines, per language.
 */
final class StatementTemplates {

    static final List<String> INSERT_COMMENTS = List.of("Additional operation", "Logging placeholder");
    static final String VALIDATION_COMMENT = "Validation check";

    private StatementTemplates() {
    }

    static String tempName(Language language, int counter) {
        return language == Language.PYTHON ? "temp_" + counter : "temp" + counter;
    }

    /**
     * An unused local declaration. Where a declaration is not allowed (right
     * after a C label, or in a C/C++ switch body where it could be jumped
     * over) a null statement is used instead.
     */
    static String declaration(Language language, String name, boolean declarationUnsafe) {
        return switch (language) {
            case PYTHON -> name + " = 0";
            case JAVA -> "int " + name + " = 0;";
            case JAVASCRIPT -> "let " + name + " = 0;";
            case CPP, C -> declarationUnsafe ? "(void) 0;" : "int " + name + " = 0;";
        };
    }

    static String comment(Language language, String text) {
        return (language == Language.PYTHON ? "# " : "// ") + text;
    }

    static String check(Language language) {
        return switch (language) {
            case PYTHON -> "assert True";
            case JAVA -> "assert true;";
            case JAVASCRIPT -> "console.assert(true);";
            case CPP, C -> "(void) 0;";
        };
    }

    static String guardOpen(Language language) {
        return switch (language) {
            case PYTHON -> "if True:";
            case C -> "if (1) {";
            default -> "if (true) {";
        };
    }

    /**
     * Closing line of the guard, or null for Python.
     */
    static String guardClose(Language language) {
        return language == Language.PYTHON ? null : "}";
    }

    /**
     * One level of indentation as used by the snippet: a tab, or the
     * greatest common width of space-indented lines. Four spaces when the
     * snippet has no indentation.
     */
    static String indentUnit(List<String> lines) {
        int unit = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith("\t")) {
                return "\t";
            }
            int width = 0;
            while (width < line.length() && line.charAt(width) == ' ') {
                width++;
            }
            if (width > 0) {
                unit = gcd(unit, width);
            }
        }
        return unit >= 2 ? " ".repeat(unit) : "    ";
    }

    static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
