package com.raditha.clonegen.analysis;

import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.LiteralKind;
import com.raditha.clonegen.model.LiteralOccurrence;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiteralAnalyzerTest {

    private LiteralAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new LiteralAnalyzer();
    }

    @Test
    void testNumberClassification() {
        assertEquals(LiteralKind.INT, LiteralAnalyzer.classifyNumber("42", Language.PYTHON));
        assertEquals(LiteralKind.HEX, LiteralAnalyzer.classifyNumber("0x1F", Language.JAVA));
        assertEquals(LiteralKind.BINARY, LiteralAnalyzer.classifyNumber("0b101", Language.PYTHON));
        assertEquals(LiteralKind.OCTAL, LiteralAnalyzer.classifyNumber("0o17", Language.PYTHON));
        assertEquals(LiteralKind.FLOAT, LiteralAnalyzer.classifyNumber("3.14", Language.C));
        assertEquals(LiteralKind.SCIENTIFIC, LiteralAnalyzer.classifyNumber("1e10", Language.PYTHON));
        assertEquals(LiteralKind.SCIENTIFIC, LiteralAnalyzer.classifyNumber("2.5e-3", Language.JAVA));
    }

    @Test
    void testLegacyOctalOnlyInCFamily() {
        assertEquals(LiteralKind.OCTAL, LiteralAnalyzer.classifyNumber("017", Language.JAVA));
        assertEquals(LiteralKind.OCTAL, LiteralAnalyzer.classifyNumber("017", Language.C));
        assertEquals(LiteralKind.INT, LiteralAnalyzer.classifyNumber("017", Language.JAVASCRIPT));
        assertEquals(LiteralKind.INT, LiteralAnalyzer.classifyNumber("0", Language.C));
    }

    @Test
    void testSuffixes() {
        assertEquals(LiteralKind.FLOAT, LiteralAnalyzer.classifyNumber("2f", Language.JAVA));
        assertEquals(LiteralKind.FLOAT, LiteralAnalyzer.classifyNumber("1.5f", Language.JAVA));
        assertEquals(LiteralKind.INT, LiteralAnalyzer.classifyNumber("10L", Language.JAVA));
        assertEquals(LiteralKind.HEX, LiteralAnalyzer.classifyNumber("0xFFd", Language.C));
    }

    @Test
    void testExtractLiterals() {
        TokenStream stream = new Tokenizer().tokenize(
                "String s = \"hi\"; boolean f = true; Object o = null; int n = 7;", Language.JAVA);

        List<LiteralOccurrence> literals = analyzer.extractLiterals(stream);

        assertEquals(List.of(LiteralKind.STRING, LiteralKind.BOOL, LiteralKind.NULL, LiteralKind.INT),
                literals.stream().map(LiteralOccurrence::valueKind).toList());
        assertEquals("\"hi\"", literals.get(0).rawText());
        for (LiteralOccurrence literal : literals) {
            assertEquals(literal.rawText(), stream.get(literal.tokenIndex()).text());
        }
    }

    @Test
    void testClassifyRejectsNonLiterals() {
        Token identifier = new Tokenizer().tokenize("x", Language.PYTHON).get(0);

        assertThrows(IllegalArgumentException.class, () -> analyzer.classify(identifier, Language.PYTHON));
    }
}
