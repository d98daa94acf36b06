package com.raditha.clonegen.model;

import java.util.Locale;

/**
 * Supported source languages.
 */
public enum Language {
    PYTHON("python"),
    JAVA("java"),
    JAVASCRIPT("javascript"),
    CPP("cpp"),
    C("c");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Languages with C-style braces, semicolons and comments.
     */
    public boolean isCFamily() {
        return this != PYTHON;
    }

    /**
     * Resolve a language tag such as {@code python}, {@code js} or {@code c++}.
     *
     * @throws InputException if the tag is not a supported language
     */
    public static Language fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new InputException("Language tag is required");
        }
        return switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "python", "py" -> PYTHON;
            case "java" -> JAVA;
            case "javascript", "js" -> JAVASCRIPT;
            case "cpp", "c++", "cxx" -> CPP;
            case "c" -> C;
            default -> throw new InputException("Unsupported language: " + tag);
        };
    }
}
