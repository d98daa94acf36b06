package com.raditha.clonegen.validation;

import com.raditha.clonegen.config.ValidationThresholds;
import com.raditha.clonegen.model.CloneType;
import com.raditha.clonegen.model.InputException;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.ValidationReport;
import com.raditha.clonegen.model.Violation;
import com.raditha.clonegen.model.ViolationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CloneValidatorTest {

    private static final String CALCULATE = "def calculate(a, b):\n    result = a + b * 2\n    return result";

    private static final String PROCESS = """
            def process(items):
                total = 0
                for item in items:
                    total += item
                return total""";

    private static final String JAVA_METHOD = "int f() {\n    int x = 1;\n    return x;\n}";

    private CloneValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CloneValidator();
    }

    private static Set<ViolationKind> kinds(ValidationReport report) {
        return report.violations().stream().map(Violation::kind).collect(Collectors.toSet());
    }

    @Test
    void testType1Valid() {
        String variant = "def calculate(a,b):\n  result=a+b*2\n\n  # changed\n  return result\n";

        ValidationReport report = validator.validate(CALCULATE, variant, Language.PYTHON, CloneType.TYPE_1);

        assertTrue(report.valid());
        assertTrue(report.tokenMatch());
        assertEquals(17, report.originalTokenCount());
        assertEquals(17, report.variantTokenCount());
        assertEquals(1.0, report.similarity(), 0.0001);
    }

    @Test
    void testType1RejectsRenaming() {
        String renamed = "def func_0(var_0, var_1):\n    var_2 = var_0 + var_1 * 2\n    return var_2";

        ValidationReport report = validator.validate(CALCULATE, renamed, Language.PYTHON, CloneType.TYPE_1);

        assertFalse(report.valid());
        assertFalse(report.tokenMatch());
        assertEquals(Set.of(ViolationKind.TOKEN_MISMATCH), kinds(report));
        assertEquals(7, report.violations().size());
    }

    @Test
    void testType1CountMismatch() {
        ValidationReport report = validator.validate("x = 1", "x = 1 + 0", Language.PYTHON, CloneType.TYPE_1);

        assertEquals(Set.of(ViolationKind.TOKEN_COUNT_MISMATCH), kinds(report));
    }

    @Test
    void testType2Valid() {
        String renamed = "def func_0(var_0, var_1):\n    var_2 = var_0 + var_1 * 3\n    return var_2";

        ValidationReport report = validator.validate(CALCULATE, renamed, Language.PYTHON, CloneType.TYPE_2);

        assertTrue(report.valid(), report.summary());
        assertFalse(report.tokenMatch());
    }

    @Test
    void testType2LiteralKindMustMatch() {
        ValidationReport report = validator.validate("x = 2", "x = 2.5", Language.PYTHON, CloneType.TYPE_2);

        assertEquals(Set.of(ViolationKind.KIND_MISMATCH), kinds(report));
    }

    @Test
    void testType2TokenKindMustMatch() {
        ValidationReport report = validator.validate("x = a", "x = 1", Language.PYTHON, CloneType.TYPE_2);

        assertEquals(Set.of(ViolationKind.KIND_MISMATCH), kinds(report));
    }

    @Test
    void testType2ControlFlowChange() {
        ValidationReport report = validator.validate("if (a) { return b; }", "while (a) { return b; }",
                Language.JAVA, CloneType.TYPE_2);

        assertEquals(Set.of(ViolationKind.CONTROL_FLOW_MISMATCH), kinds(report));
    }

    @Test
    void testType2OperatorChange() {
        ValidationReport report = validator.validate("x = a + b", "x = a - b", Language.PYTHON, CloneType.TYPE_2);

        assertEquals(Set.of(ViolationKind.STRUCTURE_MISMATCH), kinds(report));
    }

    @Test
    void testType2CountMismatch() {
        ValidationReport report = validator.validate("x = a", "x = a + b", Language.PYTHON, CloneType.TYPE_2);

        assertEquals(1, report.violations().size());
        assertEquals(ViolationKind.TOKEN_COUNT_MISMATCH, report.violations().get(0).kind());
    }

    @Test
    void testType3InsertedStatement() {
        String variant = PROCESS.replace("    total = 0\n", "    total = 0\n    temp_0 = 0\n");

        ValidationReport report = validator.validate(PROCESS, variant, Language.PYTHON, CloneType.TYPE_3);

        assertTrue(report.valid(), report.summary());
        assertEquals(19, report.originalTokenCount());
        assertEquals(22, report.variantTokenCount());
        assertEquals(19.0 / 22.0, report.similarity(), 0.0001);
    }

    @Test
    void testType3RejectsIdenticalTokens() {
        ValidationReport report = validator.validate(PROCESS, PROCESS + "\n", Language.PYTHON, CloneType.TYPE_3);

        assertEquals(Set.of(ViolationKind.SIMILARITY_OUT_OF_WINDOW), kinds(report));
        assertTrue(report.tokenMatch());
    }

    @Test
    void testType3MissingCriticalLine() {
        String variant = PROCESS.replace("    return total", "    total = total");

        ValidationReport report = validator.validate(PROCESS, variant, Language.PYTHON, CloneType.TYPE_3);

        assertTrue(kinds(report).contains(ViolationKind.MISSING_CRITICAL_LINE));
    }

    @Test
    void testType3UnbalancedBraces() {
        String variant = "int f() {\n    int x = 1;\n    if (1) {\n    return x;\n}";

        ValidationReport report = validator.validate(JAVA_METHOD, variant, Language.C, CloneType.TYPE_3);

        assertTrue(kinds(report).contains(ViolationKind.UNBALANCED_BRACKETS));
    }

    @Test
    void testType3BrokenIndentation() {
        String variant = PROCESS.replace("    total = 0\n", "    total = 0\n      extra = 1\n");

        ValidationReport report = validator.validate(PROCESS, variant, Language.PYTHON, CloneType.TYPE_3);

        assertEquals(Set.of(ViolationKind.INDENTATION_INCONSISTENT), kinds(report));
    }

    @Test
    void testType3CustomThresholds() {
        String variant = PROCESS.replace("    total = 0\n", "    total = 0\n    temp_0 = 0\n");

        ValidationReport report = validator.validate(PROCESS, variant, Language.PYTHON, CloneType.TYPE_3,
                new ValidationThresholds(0.9, 1.0));

        assertEquals(Set.of(ViolationKind.SIMILARITY_OUT_OF_WINDOW), kinds(report));
    }

    @Test
    void testSummary() {
        ValidationReport valid = validator.validate("x = 1", "x=1", Language.PYTHON, CloneType.TYPE_1);
        ValidationReport invalid = validator.validate("x = 1", "y = 1", Language.PYTHON, CloneType.TYPE_1);

        assertTrue(valid.summary().startsWith("Valid type1 clone"));
        assertTrue(invalid.summary().startsWith("Invalid type1 clone: 1 violation(s)"));
    }

    @Test
    void testNullArguments() {
        assertThrows(InputException.class, () -> validator.validate(null, "x", Language.PYTHON, CloneType.TYPE_1));
        assertThrows(InputException.class, () -> validator.validate("x", "x", null, CloneType.TYPE_1));
        assertThrows(InputException.class, () -> validator.validate("x", "x", Language.PYTHON, null));
    }
}
