package com.raditha.clonegen.formatting;

import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BracePositionStepTest {

    private BracePositionStep step;

    @BeforeEach
    void setUp() {
        step = new BracePositionStep(new Tokenizer());
    }

    @Test
    void testMoveBraceToOwnLine() {
        String result = step.apply("if (a) {\n    b();\n}", Language.JAVA, new FixedRandom(0.0, true));

        assertEquals("if (a)\n{\n    b();\n}", result);
    }

    @Test
    void testJoinBraceToHeader() {
        String result = step.apply("if (a)\n{\n    b();\n}", Language.JAVA, new FixedRandom(0.0, false));

        assertEquals("if (a) {\n    b();\n}", result);
    }

    @Test
    void testTypeDeclarationBrace() {
        String result = step.apply("class Point {\n}", Language.JAVA, new FixedRandom(0.0, true));

        assertEquals("class Point\n{\n}", result);
    }

    @Test
    void testInitializerBraceStays() {
        String source = "int[] v = {1, 2};";

        assertEquals(source, step.apply(source, Language.JAVA, new FixedRandom(0.0, true)));
        assertEquals(source, step.apply(source, Language.JAVA, new FixedRandom(0.0, false)));
    }

    @Test
    void testJavaScriptJoinNeedsKeyword() {
        String withKeyword = "if (a)\n{\n  b();\n}";
        String withoutKeyword = "foo(a)\n{\n  b();\n}";

        assertEquals("if (a) {\n  b();\n}", step.apply(withKeyword, Language.JAVASCRIPT, new FixedRandom(0.0, false)));
        assertEquals(withoutKeyword, step.apply(withoutKeyword, Language.JAVASCRIPT, new FixedRandom(0.0, false)));
    }

    @Test
    void testOnlyCFamily() {
        assertFalse(step.appliesTo(Language.PYTHON));
        assertTrue(step.appliesTo(Language.C));
        assertTrue(step.appliesTo(Language.JAVASCRIPT));
    }
}
