package com.raditha.clonegen.analysis;

/**
 * Syntactic evidence collected for one identifier name across all of its
 * occurrences.
 *
 * @param declaredAsClass    Appears right after a type-declaring keyword
 * @param declaredAsFunction Appears right after {@code def} or {@code function}
 * @param invoked            At least one occurrence is followed by {@code (}
 * @param instantiated       At least one occurrence follows {@code new}
 */
public record NameEvidence(
        boolean declaredAsClass,
        boolean declaredAsFunction,
        boolean invoked,
        boolean instantiated) {

    public static NameEvidence none() {
        return new NameEvidence(false, false, false, false);
    }

    public NameEvidence merge(NameEvidence other) {
        return new NameEvidence(
                declaredAsClass || other.declaredAsClass,
                declaredAsFunction || other.declaredAsFunction,
                invoked || other.invoked,
                instantiated || other.instantiated);
    }
}
