package com.raditha.clonegen.model;

import java.util.Locale;

/**
 * Clone categories that can be generated and certified.
 */
public enum CloneType {
    TYPE_1(1),
    TYPE_2(2),
    TYPE_3(3);

    private final int number;

    CloneType(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public String label() {
        return "type" + number;
    }

    public static CloneType fromNumber(int number) {
        for (CloneType type : values()) {
            if (type.number == number) {
                return type;
            }
        }
        throw new InputException("Unsupported clone type: " + number);
    }

    /**
     * Accepts {@code 2}, {@code type2}, {@code TYPE_2} and similar spellings.
     */
    public static CloneType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new InputException("Clone type is required");
        }
        String digits = tag.trim().toLowerCase(Locale.ROOT).replace("type", "").replace("_", "").replace("-", "");
        try {
            return fromNumber(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            throw new InputException("Unsupported clone type: " + tag);
        }
    }
}
