package com.raditha.clonegen.formatting;

import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IndentationStepTest {

    private IndentationStep step;

    @BeforeEach
    void setUp() {
        step = new IndentationStep(new Tokenizer());
    }

    @Test
    void testRemapKeepsNesting() {
        String source = "if x:\n    y = 1\n    if y:\n        z = 2";
        Set<String> expected = Set.of(
                "if x:\n\ty = 1\n\tif y:\n\t\tz = 2",
                "if x:\n  y = 1\n  if y:\n    z = 2",
                "if x:\n   y = 1\n   if y:\n      z = 2");

        for (int seed = 0; seed < 10; seed++) {
            String result = step.apply(source, Language.PYTHON, new Random(seed));
            assertTrue(expected.contains(result), result);
        }
    }

    @Test
    void testTabsBecomeSpaces() {
        String source = "void f() {\n\tif (x) {\n\t\ty();\n\t}\n}";

        String result = step.apply(source, Language.C, new FixedRandom(0.0, false));

        assertEquals("void f() {\n  if (x) {\n    y();\n  }\n}", result);
    }

    @Test
    void testUnindentedSourceUnchanged() {
        String source = "x = 1\ny = 2";

        assertEquals(source, step.apply(source, Language.PYTHON, new Random(1)));
    }

    @Test
    void testMixedIndentationUnchanged() {
        String source = "if x:\n\ty = 1\nif z:\n    w = 2";

        assertEquals(source, step.apply(source, Language.PYTHON, new Random(1)));
    }

    @Test
    void testMultiLineStringUntouched() {
        String source = "def f():\n    s = \"\"\"\n    keep\n    \"\"\"\n    return s";

        String result = step.apply(source, Language.PYTHON, new FixedRandom(0.0, false));

        assertEquals("def f():\n\ts = \"\"\"\n    keep\n    \"\"\"\n\treturn s", result);
    }
}
