package com.raditha.clonegen.model;

/**
 * Naming category of an identifier, with the prefix used for generated names.
 */
public enum IdentifierCategory {
    CLASS("Class_"),
    CONSTANT("CONST_"),
    FUNCTION("func_"),
    VARIABLE("var_");

    private final String prefix;

    IdentifierCategory(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
