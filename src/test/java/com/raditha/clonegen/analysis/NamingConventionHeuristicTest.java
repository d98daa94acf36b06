package com.raditha.clonegen.analysis;

import com.raditha.clonegen.model.IdentifierCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamingConventionHeuristicTest {

    private final NamingConventionHeuristic heuristic = new NamingConventionHeuristic();

    @Test
    void testNamingConventions() {
        assertEquals(IdentifierCategory.CLASS, heuristic.categorize("UserAccount", NameEvidence.none()));
        assertEquals(IdentifierCategory.CONSTANT, heuristic.categorize("MAX_RETRIES", NameEvidence.none()));
        assertEquals(IdentifierCategory.FUNCTION, heuristic.categorize("getValue", NameEvidence.none()));
        assertEquals(IdentifierCategory.FUNCTION, heuristic.categorize("load_config", NameEvidence.none()));
        assertEquals(IdentifierCategory.VARIABLE, heuristic.categorize("settings", NameEvidence.none()));
        assertEquals(IdentifierCategory.VARIABLE, heuristic.categorize("x", NameEvidence.none()));
    }

    @Test
    void testEvidenceOverridesNaming() {
        assertEquals(IdentifierCategory.CLASS,
                heuristic.categorize("point", new NameEvidence(true, false, false, false)));
        assertEquals(IdentifierCategory.CLASS,
                heuristic.categorize("widget", new NameEvidence(false, false, true, true)));
        assertEquals(IdentifierCategory.FUNCTION,
                heuristic.categorize("area", new NameEvidence(false, false, true, false)));
    }

    @Test
    void testClassWinsOverFunction() {
        assertEquals(IdentifierCategory.CLASS,
                heuristic.categorize("Parser", new NameEvidence(false, true, true, false)));
    }

    @Test
    void testCustomPrefixes() {
        NamingConventionHeuristic custom = new NamingConventionHeuristic(List.of("make"));

        assertEquals(IdentifierCategory.FUNCTION, custom.categorize("makeWidget", NameEvidence.none()));
        assertEquals(IdentifierCategory.VARIABLE, custom.categorize("getValue", NameEvidence.none()));
    }

    @Test
    void testPrefixNeedsWordBoundary() {
        assertTrue(heuristic.hasFunctionPrefix("get"));
        assertTrue(heuristic.hasFunctionPrefix("set_value"));
        assertFalse(heuristic.hasFunctionPrefix("settings"));
        assertFalse(heuristic.hasFunctionPrefix("address"));
    }
}
