package com.raditha.clonegen.analysis;

import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.LineRole;
import com.raditha.clonegen.model.MutationGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineGuardTest {

    private LineGuard lineGuard;

    @BeforeEach
    void setUp() {
        lineGuard = new LineGuard();
    }

    private List<LineRole> roles(String source, Language language) {
        return lineGuard.tag(source, language).stream().map(MutationGuard::role).toList();
    }

    @Test
    void testPythonFunction() {
        String source = """
                import os

                def calculate(a, b):
                    # comment
                    result = a + b
                    if result > 0:
                        return result
                    return 0""";

        assertEquals(List.of(
                LineRole.IMPORT,
                LineRole.BLANK,
                LineRole.DECLARATION,
                LineRole.COMMENT,
                LineRole.STATEMENT,
                LineRole.CONTROL,
                LineRole.EXIT,
                LineRole.EXIT), roles(source, Language.PYTHON));
    }

    @Test
    void testPythonMultiLineCall() {
        String source = "total = compute(\n    a,\n    b)\nprint(total)";

        assertEquals(List.of(
                LineRole.CONTINUATION,
                LineRole.CONTINUATION,
                LineRole.CONTINUATION,
                LineRole.STATEMENT), roles(source, Language.PYTHON));
    }

    @Test
    void testPythonDecoratorAndDocstring() {
        String source = "@cached\ndef f():\n    \"\"\"Doc\n    more\"\"\"\n    x = 1";

        assertEquals(List.of(
                LineRole.DECORATOR,
                LineRole.DECLARATION,
                LineRole.CONTINUATION,
                LineRole.CONTINUATION,
                LineRole.STATEMENT), roles(source, Language.PYTHON));
    }

    @Test
    void testSingleLineDocstringIsNotAStatement() {
        assertEquals(List.of(
                LineRole.DECLARATION,
                LineRole.OTHER,
                LineRole.STATEMENT), roles("def f():\n    \"\"\"Doc\"\"\"\n    x = 1", Language.PYTHON));
    }

    @Test
    void testJavaClass() {
        String source = """
                public class Calc {
                    private int total;
                    public int add(int a, int b) {
                        int sum = a + b;
                        if (sum > 10) {
                            sum = 10;
                        }
                        return sum;
                    }
                }""";

        assertEquals(List.of(
                LineRole.DECLARATION,
                LineRole.DECLARATION,
                LineRole.DECLARATION,
                LineRole.STATEMENT,
                LineRole.CONTROL,
                LineRole.STATEMENT,
                LineRole.CLOSING,
                LineRole.EXIT,
                LineRole.CLOSING,
                LineRole.CLOSING), roles(source, Language.JAVA));
    }

    @Test
    void testCPreprocessorAndInitializer() {
        String source = "#include <stdio.h>\nint main() {\n    int v[] = {\n        1, 2};\n    printf(\"%d\", v[0]);\n}";

        assertEquals(List.of(
                LineRole.IMPORT,
                LineRole.DECLARATION,
                LineRole.DECLARATION,
                LineRole.CONTINUATION,
                LineRole.STATEMENT,
                LineRole.CLOSING), roles(source, Language.C));
    }

    @Test
    void testOneGuardPerLine() {
        List<MutationGuard> guards = lineGuard.tag("a = 1\n\nb = 2\n", Language.PYTHON);

        assertEquals(4, guards.size());
        for (int i = 0; i < guards.size(); i++) {
            assertEquals(i + 1, guards.get(i).lineNumber());
        }
        assertTrue(guards.get(0).isMutable());
        assertFalse(guards.get(1).isCritical());
    }
}
