package com.raditha.clonegen.formatting;

import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlankLineStepTest {

    private BlankLineStep step;

    @BeforeEach
    void setUp() {
        step = new BlankLineStep(new Tokenizer());
    }

    @Test
    void testInsertAndDrop() {
        String result = step.apply("a = 1\n\nb = 2\nc = 3", Language.PYTHON, new FixedRandom(0.0, true));

        assertEquals("a = 1\n\nb = 2\n\nc = 3", result);
    }

    @Test
    void testCollapseRun() {
        String result = step.apply("a = 1\n\n\n\nb = 2", Language.PYTHON, new FixedRandom(0.0, true));

        assertEquals("a = 1\n\n\nb = 2", result);
    }

    @Test
    void testHighRollLeavesSourceAlone() {
        String source = "a = 1\n\n\nb = 2\n\nc = 3";

        assertEquals(source, step.apply(source, Language.PYTHON, new FixedRandom(0.99, true)));
    }

    @Test
    void testBackslashContinuationNotSplit() {
        String result = step.apply("x = 1 + \\\n    2\ny = 3", Language.PYTHON, new FixedRandom(0.0, true));

        assertEquals("x = 1 + \\\n    2\n\ny = 3", result);
    }

    @Test
    void testBlankLinesInsideStringKept() {
        String source = "s = \"\"\"\n\ntext\"\"\"\nz = 1";

        assertEquals(source, step.apply(source, Language.PYTHON, new FixedRandom(0.0, true)));
    }
}
