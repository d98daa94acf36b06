package com.raditha.clonegen.analysis;

import com.raditha.clonegen.model.IdentifierCategory;

import java.util.List;

/**
 * Default category heuristic based on naming conventions and declaration
 * keywords.
 * <p>
 * Precedence when several rules match: class, constant, function, variable.
 */
public class NamingConventionHeuristic implements CategoryHeuristic {

    public static final List<String> DEFAULT_FUNCTION_PREFIXES = List.of(
            "get", "set", "calculate", "compute", "process", "handle", "create", "delete", "update",
            "fetch", "load", "save", "add", "remove", "init", "run", "execute", "validate");

    private final List<String> functionPrefixes;

    public NamingConventionHeuristic() {
        this(DEFAULT_FUNCTION_PREFIXES);
    }

    public NamingConventionHeuristic(List<String> functionPrefixes) {
        this.functionPrefixes = List.copyOf(functionPrefixes);
    }

    @Override
    public IdentifierCategory categorize(String name, NameEvidence evidence) {
        if (evidence.declaredAsClass() || evidence.instantiated() || isPascalCase(name)) {
            return IdentifierCategory.CLASS;
        }
        if (isConstantCase(name)) {
            return IdentifierCategory.CONSTANT;
        }
        if (evidence.declaredAsFunction() || evidence.invoked() || hasFunctionPrefix(name)) {
            return IdentifierCategory.FUNCTION;
        }
        return IdentifierCategory.VARIABLE;
    }

    static boolean isPascalCase(String name) {
        if (name.isEmpty() || !Character.isUpperCase(name.charAt(0))) {
            return false;
        }
        return name.chars().anyMatch(Character::isLowerCase);
    }

    static boolean isConstantCase(String name) {
        if (name.length() < 2) {
            return false;
        }
        boolean hasLetter = false;
        for (char c : name.toCharArray()) {
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isLetter(c)) {
                hasLetter = true;
            } else if (c != '_' && !Character.isDigit(c)) {
                return false;
            }
        }
        return hasLetter;
    }

    /**
     * {@code getValue}, {@code get_value} and {@code get} match the prefix
     * {@code get}; {@code settings} does not match {@code set}.
     */
    boolean hasFunctionPrefix(String name) {
        for (String prefix : functionPrefixes) {
            if (!name.startsWith(prefix)) {
                continue;
            }
            if (name.length() == prefix.length()) {
                return true;
            }
            char next = name.charAt(prefix.length());
            if (Character.isUpperCase(next) || next == '_' || Character.isDigit(next)) {
                return true;
            }
        }
        return false;
    }
}
