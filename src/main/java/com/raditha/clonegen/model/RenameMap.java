package com.raditha.clonegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mapping from original identifier names to generated names, built once per
 * generation call. Injective; iteration order is longest original name first.
 */
public final class RenameMap {

    private final Map<String, String> mapping;

    public RenameMap(Map<String, String> mapping) {
        Set<String> targets = new HashSet<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            if (!targets.add(entry.getValue())) {
                throw new IllegalArgumentException(
                        "Rename map is not injective: " + entry.getValue() + " is assigned twice");
            }
            if (mapping.containsKey(entry.getValue()) && !entry.getValue().equals(entry.getKey())) {
                throw new IllegalArgumentException(
                        "Rename target " + entry.getValue() + " collides with an original name");
            }
        }

        List<String> keys = new ArrayList<>(mapping.keySet());
        keys.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String key : keys) {
            ordered.put(key, mapping.get(key));
        }
        this.mapping = Collections.unmodifiableMap(ordered);
    }

    public static RenameMap empty() {
        return new RenameMap(Map.of());
    }

    public String get(String original) {
        return mapping.get(original);
    }

    public boolean contains(String original) {
        return mapping.containsKey(original);
    }

    public Map<String, String> asMap() {
        return mapping;
    }

    public int size() {
        return mapping.size();
    }

    public boolean isEmpty() {
        return mapping.isEmpty();
    }

    @Override
    public String toString() {
        return mapping.toString();
    }
}
