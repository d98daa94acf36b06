package com.raditha.clonegen.renaming;

import com.raditha.clonegen.model.IdentifierCategory;
import com.raditha.clonegen.model.IdentifierOccurrence;
import com.raditha.clonegen.model.RenameMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the rename map and the per-token replacements for a snippet.
 */
public class IdentifierRenamer {

    /**
     * Assign {@code <prefix><counter>} names per category. Names are sorted,
     * then shuffled with {@code random}, so the assignment depends only on
     * the set of names and the seed. Candidates already present in
     * {@code taken} are skipped.
     */
    public RenameMap buildRenameMap(List<IdentifierOccurrence> occurrences, Set<String> taken, Random random) {
        Map<IdentifierCategory, Set<String>> byCategory = new EnumMap<>(IdentifierCategory.class);
        for (IdentifierOccurrence occurrence : occurrences) {
            byCategory.computeIfAbsent(occurrence.category(), c -> new TreeSet<>()).add(occurrence.name());
        }

        Map<String, String> mapping = new HashMap<>();
        for (IdentifierCategory category : IdentifierCategory.values()) {
            Set<String> names = byCategory.get(category);
            if (names == null) {
                continue;
            }
            List<String> order = new ArrayList<>(names);
            Collections.shuffle(order, random);
            int counter = 0;
            for (String name : order) {
                String candidate = category.prefix() + counter++;
                while (taken.contains(candidate)) {
                    candidate = category.prefix() + counter++;
                }
                mapping.put(name, candidate);
            }
        }
        return new RenameMap(mapping);
    }

    /**
     * Number of renamed names per category.
     */
    public Map<IdentifierCategory, Integer> countByCategory(List<IdentifierOccurrence> occurrences,
            RenameMap renameMap) {
        Map<String, IdentifierCategory> categories = new HashMap<>();
        for (IdentifierOccurrence occurrence : occurrences) {
            if (renameMap.contains(occurrence.name())) {
                categories.putIfAbsent(occurrence.name(), occurrence.category());
            }
        }
        Map<IdentifierCategory, Integer> counts = new EnumMap<>(IdentifierCategory.class);
        for (IdentifierCategory category : categories.values()) {
            counts.merge(category, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Token index to replacement text for every occurrence covered by the map.
     */
    public Map<Integer, String> replacements(List<IdentifierOccurrence> occurrences, RenameMap renameMap) {
        Map<Integer, String> replacements = new HashMap<>();
        for (IdentifierOccurrence occurrence : occurrences) {
            String target = renameMap.get(occurrence.name());
            if (target != null) {
                replacements.put(occurrence.tokenIndex(), target);
            }
        }
        return replacements;
    }
}
