package com.raditha.clonegen.model;

import java.util.List;

/**
 * Outcome of checking a variant against a claimed clone type.
 *
 * @param claimedType        Clone type the variant was checked against
 * @param valid              True when no violation was found
 * @param tokenMatch         True when code tokens are identical (Type-1 equivalence)
 * @param violations         Every broken rule
 * @param originalTokenCount Code token count of the original
 * @param variantTokenCount  Code token count of the variant
 * @param similarity         Token LCS similarity between the two (0.0 to 1.0)
 */
public record ValidationReport(
        CloneType claimedType,
        boolean valid,
        boolean tokenMatch,
        List<Violation> violations,
        int originalTokenCount,
        int variantTokenCount,
        double similarity) {

    public ValidationReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
        if (valid && !violations.isEmpty()) {
            throw new IllegalArgumentException("A valid report cannot carry violations");
        }
    }

    /**
     * Get a human-readable summary.
     */
    public String summary() {
        if (valid) {
            return String.format("Valid %s clone (%d/%d code tokens, similarity %.2f)",
                    claimedType.label(), originalTokenCount, variantTokenCount, similarity);
        }
        return String.format("Invalid %s clone: %d violation(s), first: %s",
                claimedType.label(), violations.size(), violations.get(0));
    }
}
