package com.raditha.clonegen.model;

/**
 * Per-line mutation guard.
 *
 * @param lineNumber 1-based line number
 * @param role       Role assigned by the line tagger
 */
public record MutationGuard(int lineNumber, LineRole role) {

    public boolean isCritical() {
        return role.isCritical();
    }

    public boolean isMutable() {
        return role == LineRole.STATEMENT;
    }
}
