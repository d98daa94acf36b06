package com.raditha.clonegen.mutation;

import com.raditha.clonegen.analysis.LineGuard;
import com.raditha.clonegen.config.ValidationThresholds;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.TokenStream;
import com.raditha.clonegen.model.Violation;
import com.raditha.clonegen.model.ViolationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OutputValidatorTest {

    private static final String SOURCE = "def f(x):\n    y = x + 1\n    z = y * 2\n    return z";

    private OutputValidator validator;

    @BeforeEach
    void setUp() {
        Tokenizer tokenizer = new Tokenizer();
        TokenStream stream = tokenizer.tokenize(SOURCE, Language.PYTHON);
        validator = new OutputValidator(tokenizer, stream, new LineGuard(tokenizer).tag(stream), 0.7,
                ValidationThresholds.defaults());
    }

    private static Set<ViolationKind> kinds(List<Violation> violations) {
        return violations.stream().map(Violation::kind).collect(Collectors.toSet());
    }

    @Test
    void testInsertAccepted() {
        assertTrue(validator.check("def f(x):\n    temp_0 = 0\n    y = x + 1\n    z = y * 2\n    return z").isEmpty());
    }

    @Test
    void testIdenticalAccepted() {
        assertTrue(validator.check(SOURCE).isEmpty());
    }

    @Test
    void testMissingReturnRejected() {
        Set<ViolationKind> kinds = kinds(validator.check("def f(x):\n    y = x + 1\n    z = y * 2\n    z"));

        assertTrue(kinds.contains(ViolationKind.MISSING_CRITICAL_LINE));
    }

    @Test
    void testBrokenIndentationRejected() {
        Set<ViolationKind> kinds = kinds(validator.check(
                "def f(x):\n    y = x + 1\n        z = y * 2\n    return z"));

        assertEquals(Set.of(ViolationKind.INDENTATION_INCONSISTENT), kinds);
    }

    @Test
    void testTooShortRejected() {
        Set<ViolationKind> kinds = kinds(validator.check("def f(x):\n    return z"));

        assertTrue(kinds.contains(ViolationKind.LENGTH_BELOW_MINIMUM));
    }

    @Test
    void testUnbalancedRejected() {
        Set<ViolationKind> kinds = kinds(validator.check(
                "def f(x):\n    y = (x + 1\n    z = y * 2\n    return z"));

        assertTrue(kinds.contains(ViolationKind.UNBALANCED_BRACKETS));
    }
}
