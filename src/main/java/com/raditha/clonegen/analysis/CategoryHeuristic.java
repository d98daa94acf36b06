package com.raditha.clonegen.analysis;

import com.raditha.clonegen.model.IdentifierCategory;

/**
 * Strategy that assigns a naming category to an identifier.
 * Implementations must be deterministic.
 */
public interface CategoryHeuristic {

    IdentifierCategory categorize(String name, NameEvidence evidence);
}
