package com.raditha.clonegen.model;

/**
 * Value kinds recognised for literal tokens.
 */
public enum LiteralKind {
    INT,
    FLOAT,
    HEX,
    OCTAL,
    BINARY,
    SCIENTIFIC,
    STRING,
    BOOL,
    NULL
}
