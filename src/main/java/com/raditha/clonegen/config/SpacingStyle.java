package com.raditha.clonegen.config;

/**
 * Operator spacing style used by the formatting engine.
 */
public enum SpacingStyle {
    /** Pick compact or spaced from the seeded random source. */
    RANDOM,
    /** Remove spaces around operators and after commas where safe. */
    COMPACT,
    /** Single space around operators and after commas. */
    SPACED;

    public static SpacingStyle fromString(String value) {
        if (value == null) {
            return RANDOM;
        }
        return switch (value.trim().toLowerCase()) {
            case "compact" -> COMPACT;
            case "spaced" -> SPACED;
            case "random", "" -> RANDOM;
            default -> throw new IllegalArgumentException("Unknown spacing style: " + value);
        };
    }
}
