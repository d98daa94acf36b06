package com.raditha.clonegen.formatting;

import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommentStepTest {

    private CommentStep step;

    @BeforeEach
    void setUp() {
        step = new CommentStep(new Tokenizer());
    }

    @Test
    void testRemoveAndAdd() {
        String result = step.apply("# header\nx = 1  # trailing\ny = 2", Language.PYTHON,
                new FixedRandom(0.0, true));

        assertEquals("# Modified\nx = 1\n# Modified\ny = 2", result);
    }

    @Test
    void testRewordLineComment() {
        String result = step.apply("x = 1  # note", Language.PYTHON, new FixedRandom(0.35, true));

        assertEquals("x = 1  # Modified", result);
    }

    @Test
    void testRewordBlockComment() {
        String result = step.apply("int x = /* note */ 1;", Language.JAVA, new FixedRandom(0.35, true));

        assertEquals("int x = /* Modified */ 1;", result);
    }

    @Test
    void testShebangAndEncodingKept() {
        String source = "#!/usr/bin/env python\n# -*- coding: utf-8 -*-\nx = 1";

        String result = step.apply(source, Language.PYTHON, new FixedRandom(0.0, true));

        assertEquals("#!/usr/bin/env python\n# -*- coding: utf-8 -*-\n# Modified\nx = 1", result);
    }

    @Test
    void testHighRollLeavesSourceAlone() {
        String source = "// first\nint x = 1; // second\n/* third */";

        assertEquals(source, step.apply(source, Language.JAVA, new FixedRandom(0.99, true)));
    }
}
