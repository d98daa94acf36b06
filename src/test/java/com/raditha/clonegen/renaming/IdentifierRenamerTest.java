package com.raditha.clonegen.renaming;

import com.raditha.clonegen.model.IdentifierCategory;
import com.raditha.clonegen.model.IdentifierOccurrence;
import com.raditha.clonegen.model.OccurrenceContext;
import com.raditha.clonegen.model.RenameMap;
import com.raditha.clonegen.model.Span;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierRenamerTest {

    private IdentifierRenamer renamer;
    private List<IdentifierOccurrence> occurrences;

    @BeforeEach
    void setUp() {
        renamer = new IdentifierRenamer();
        occurrences = List.of(
                occurrence("Shape", IdentifierCategory.CLASS, 0),
                occurrence("area", IdentifierCategory.FUNCTION, 2),
                occurrence("width", IdentifierCategory.VARIABLE, 4),
                occurrence("height", IdentifierCategory.VARIABLE, 6),
                occurrence("width", IdentifierCategory.VARIABLE, 8),
                occurrence("MAX", IdentifierCategory.CONSTANT, 10));
    }

    private static IdentifierOccurrence occurrence(String name, IdentifierCategory category, int index) {
        return new IdentifierOccurrence(name, category, new Span(index, index + name.length()),
                OccurrenceContext.REFERENCE, index);
    }

    @Test
    void testPrefixesPerCategory() {
        RenameMap map = renamer.buildRenameMap(occurrences, Set.of(), new Random(1));

        assertEquals(5, map.size());
        assertEquals("Class_0", map.get("Shape"));
        assertEquals("func_0", map.get("area"));
        assertEquals("CONST_0", map.get("MAX"));
        assertEquals(Set.of("var_0", "var_1"), Set.of(map.get("width"), map.get("height")));
    }

    @Test
    void testOccurrenceOrderDoesNotMatter() {
        List<IdentifierOccurrence> reversed = new ArrayList<>(occurrences);
        Collections.reverse(reversed);

        assertEquals(renamer.buildRenameMap(occurrences, Set.of(), new Random(9)).asMap(),
                renamer.buildRenameMap(reversed, Set.of(), new Random(9)).asMap());
    }

    @Test
    void testTakenNamesSkipped() {
        RenameMap map = renamer.buildRenameMap(occurrences, Set.of("var_0", "func_0"), new Random(1));

        assertEquals("func_1", map.get("area"));
        assertEquals(Set.of("var_1", "var_2"), Set.of(map.get("width"), map.get("height")));
    }

    @Test
    void testReplacementsCoverEveryOccurrence() {
        RenameMap map = renamer.buildRenameMap(occurrences, Set.of(), new Random(1));

        Map<Integer, String> replacements = renamer.replacements(occurrences, map);

        assertEquals(6, replacements.size());
        assertEquals(replacements.get(4), replacements.get(8));
        assertEquals("Class_0", replacements.get(0));
    }

    @Test
    void testEmptyInput() {
        assertTrue(renamer.buildRenameMap(List.of(), Set.of(), new Random(1)).isEmpty());
    }
}
