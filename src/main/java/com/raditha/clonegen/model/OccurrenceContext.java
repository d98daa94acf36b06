package com.raditha.clonegen.model;

/**
 * Syntactic context in which an identifier occurrence appears.
 */
public enum OccurrenceContext {
    CLASS_DECLARATION,
    FUNCTION_DECLARATION,
    /** Qualified by another expression: {@code obj.name}, {@code ptr->name}, {@code ns::name}. */
    MEMBER_ACCESS,
    /** Python {@code f(name=value)}. */
    KEYWORD_ARGUMENT,
    ANNOTATION,
    IMPORT,
    REFERENCE
}
