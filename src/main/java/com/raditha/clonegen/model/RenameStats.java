package com.raditha.clonegen.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a Type-2 transformation changed.
 *
 * @param renameMap      Original name to generated name, longest original first
 * @param categoryCounts Number of renamed names per category, zero included
 * @param literalsChanged Number of literal tokens given a new value
 */
public record RenameStats(
        Map<String, String> renameMap,
        Map<IdentifierCategory, Integer> categoryCounts,
        int literalsChanged) {

    public RenameStats {
        if (literalsChanged < 0) {
            throw new IllegalArgumentException("literalsChanged must be >= 0, got: " + literalsChanged);
        }
        renameMap = Collections.unmodifiableMap(new LinkedHashMap<>(renameMap));
        Map<IdentifierCategory, Integer> counts = new EnumMap<>(IdentifierCategory.class);
        for (IdentifierCategory category : IdentifierCategory.values()) {
            counts.put(category, categoryCounts.getOrDefault(category, 0));
        }
        categoryCounts = Collections.unmodifiableMap(counts);
    }

    public int identifiersRenamed() {
        return renameMap.size();
    }
}
