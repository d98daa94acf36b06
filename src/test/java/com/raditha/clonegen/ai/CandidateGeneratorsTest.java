package com.raditha.clonegen.ai;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CandidateGeneratorsTest {

    @Test
    void testNoProvider() {
        assertTrue(CandidateGenerators.fromConfig(null).isEmpty());
        assertTrue(CandidateGenerators.fromConfig(Map.of()).isEmpty());
        assertTrue(CandidateGenerators.fromConfig(Map.of("provider", "none")).isEmpty());
    }

    @Test
    void testUnknownProvider() {
        assertTrue(CandidateGenerators.fromConfig(Map.of("provider", "oracle")).isEmpty());
    }

    @Test
    void testOllama() {
        assertInstanceOf(OllamaCandidateGenerator.class,
                CandidateGenerators.fromConfig(Map.of("provider", "Ollama")).orElseThrow());
    }

    @Test
    void testGemini() {
        assertInstanceOf(GeminiCandidateGenerator.class,
                CandidateGenerators.fromConfig(Map.of("provider", "gemini", "api_key", "k")).orElseThrow());
    }

    @Test
    void testGeminiWithoutKey() {
        assumeTrue(System.getenv("GEMINI_API_KEY") == null);

        assertTrue(CandidateGenerators.fromConfig(Map.of("provider", "gemini")).isEmpty());
    }

    @Test
    void testTimeoutSeconds() {
        assertEquals(60, CandidateGenerators.timeoutSeconds(null));
        assertEquals(60, CandidateGenerators.timeoutSeconds(Map.of("timeout_seconds", 0)));
        assertEquals(60, CandidateGenerators.timeoutSeconds(Map.of("timeout_seconds", "ten")));
        assertEquals(15, CandidateGenerators.timeoutSeconds(Map.of("timeout_seconds", 15)));
    }
}
