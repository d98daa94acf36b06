package com.raditha.clonegen.model;

/**
 * Raised for caller mistakes: unsupported language, missing or too short
 * source, unknown clone type. Never retried.
 */
public class InputException extends IllegalArgumentException {

    public InputException(String message) {
        super(message);
    }
}
