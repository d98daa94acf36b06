package com.raditha.clonegen.util;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diff between a snippet and its generated variant.
 * Uses java-diff-utils.
 */
public class DiffGenerator {

    /**
     * Unified diff with three lines of context.
     *
     * @param name     Label used in the {@code a/} and {@code b/} headers
     * @param original Original snippet
     * @param revised  Generated variant
     * @return Unified diff, empty when the texts are equal
     */
    public String generateUnifiedDiff(String name, String original, String revised) {
        return generateUnifiedDiff(name, original, revised, 3);
    }

    public String generateUnifiedDiff(String name, String original, String revised, int contextLines) {
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + name,
                "b/" + name,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }
}
