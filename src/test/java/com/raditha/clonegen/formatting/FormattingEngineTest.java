package com.raditha.clonegen.formatting;

import com.raditha.clonegen.config.FormattingOptions;
import com.raditha.clonegen.config.SpacingStyle;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.TransformationResult;
import com.raditha.clonegen.validation.StructureChecker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormattingEngineTest {

    private static final String PYTHON_SOURCE = """
            # Sum two values
            def calculate(a, b):
                result = a + b * 2  # weighted

                return result
            """;

    private static final String JAVA_SOURCE = """
            public class Counter {
                private int count = 0;

                // increments
                public void increment(int step) {
                    if (step > 0) {
                        count += step;
                    } else {
                        count--;
                    }
                }
            }
            """;

    private FormattingEngine engine;
    private Tokenizer tokenizer;

    @BeforeEach
    void setUp() {
        tokenizer = new Tokenizer();
        engine = new FormattingEngine(tokenizer);
    }

    @Test
    void testCompactOperatorSpacingOnly() {
        FormattingOptions options = new FormattingOptions(false, false, false, true, false, SpacingStyle.COMPACT);

        TransformationResult result = engine.format(
                "def calculate(a, b):\n    result = a + b * 2\n    return result", Language.PYTHON, 42L, options);

        assertEquals("def calculate(a,b):\n    result=a+b*2\n    return result", result.variant());
        assertEquals(List.of("operator_spacing"), result.provenance());
        assertEquals(17, tokenizer.tokenize(result.variant(), Language.PYTHON).codeTokens().size());
    }

    @Test
    void testNoStepsLeavesSourceAlone() {
        TransformationResult result = engine.format(PYTHON_SOURCE, Language.PYTHON, 1L, FormattingOptions.none());

        assertEquals(PYTHON_SOURCE, result.variant());
        assertTrue(result.provenance().isEmpty());
    }

    @Test
    void testCodeTokensPreservedForEverySeed() {
        StructureChecker checker = new StructureChecker();
        for (long seed = 0; seed < 25; seed++) {
            TransformationResult python = engine.format(PYTHON_SOURCE, Language.PYTHON, seed, FormattingOptions.all());
            assertTrue(tokenizer.tokenize(PYTHON_SOURCE, Language.PYTHON)
                    .codeEquals(tokenizer.tokenize(python.variant(), Language.PYTHON)), python.variant());
            assertTrue(checker.checkPythonIndentation(tokenizer.tokenize(python.variant(), Language.PYTHON))
                    .isEmpty(), python.variant());

            TransformationResult java = engine.format(JAVA_SOURCE, Language.JAVA, seed, FormattingOptions.all());
            assertTrue(tokenizer.tokenize(JAVA_SOURCE, Language.JAVA)
                    .codeEquals(tokenizer.tokenize(java.variant(), Language.JAVA)), java.variant());
        }
    }

    @Test
    void testDeterministic() {
        TransformationResult first = engine.format(JAVA_SOURCE, Language.JAVA, 99L, FormattingOptions.all());
        TransformationResult second = new FormattingEngine().format(JAVA_SOURCE, Language.JAVA, 99L,
                FormattingOptions.all());

        assertEquals(first, second);
    }

    @Test
    void testBracePositionNeverRunsOnPython() {
        for (long seed = 0; seed < 10; seed++) {
            TransformationResult result = engine.format(PYTHON_SOURCE, Language.PYTHON, seed, FormattingOptions.all());
            assertFalse(result.provenance().contains("brace_position"));
            assertFalse(result.provenance().contains("skipped:brace_position"));
        }
    }

    @Test
    void testPipelineOrder() {
        List<FormattingOperation> operations = engine.pipeline(FormattingOptions.all()).stream()
                .map(FormattingStep::operation)
                .toList();

        assertEquals(List.of(FormattingOperation.values()), operations);
    }
}
