package com.raditha.clonegen.formatting;

import com.raditha.clonegen.config.SpacingStyle;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class OperatorSpacingStepTest {

    private Tokenizer tokenizer;

    @BeforeEach
    void setUp() {
        tokenizer = new Tokenizer();
    }

    private String apply(SpacingStyle style, String source, Language language) {
        return new OperatorSpacingStep(tokenizer, style).apply(source, language, new Random(7));
    }

    @Test
    void testCompactPython() {
        String source = "def calculate(a, b):\n    result = a + b * 2\n    return result";

        assertEquals("def calculate(a,b):\n    result=a+b*2\n    return result",
                apply(SpacingStyle.COMPACT, source, Language.PYTHON));
    }

    @Test
    void testSpacedKeepsOperators() {
        assertEquals("x = a + b", apply(SpacingStyle.SPACED, "x=a+b", Language.PYTHON));
        assertEquals("x = a + b", apply(SpacingStyle.SPACED, "x = a + b", Language.PYTHON));
    }

    @Test
    void testCompactNeverMergesOperators() {
        assertEquals("x=a- -b;", apply(SpacingStyle.COMPACT, "x = a - -b;", Language.JAVA));
    }

    @Test
    void testKeywordsKeepTheirSpace() {
        String source = "return -x;";

        assertEquals(source, apply(SpacingStyle.COMPACT, source, Language.JAVA));
    }

    @Test
    void testPreprocessorLinesUntouched() {
        String source = "#define SUM(a, b) a + b\nint x = 1 + 2;";

        assertEquals("#define SUM(a, b) a + b\nint x=1+2;", apply(SpacingStyle.COMPACT, source, Language.C));
    }

    @Test
    void testCodeTokensPreserved() {
        String source = "let total = items.reduce((acc, x) => acc + x, 0);";

        for (SpacingStyle style : new SpacingStyle[] { SpacingStyle.COMPACT, SpacingStyle.SPACED }) {
            String result = apply(style, source, Language.JAVASCRIPT);
            assertTrue(tokenizer.tokenize(source, Language.JAVASCRIPT)
                    .codeEquals(tokenizer.tokenize(result, Language.JAVASCRIPT)), result);
        }
    }
}
