package com.raditha.clonegen.renaming;

import com.raditha.clonegen.model.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StringLiteralPartsTest {

    @Test
    void testPlainString() {
        StringLiteralParts parts = StringLiteralParts.parse("\"abc\"", Language.JAVA);

        assertNotNull(parts);
        assertEquals("", parts.prefix());
        assertEquals("\"", parts.delimiter());
        assertEquals("abc", parts.body());
        assertEquals("\"xyz\"", parts.withBody("xyz"));
        assertFalse(parts.isRaw());
        assertFalse(parts.isInterpolated());
        assertFalse(parts.isMultiLine());
    }

    @Test
    void testEmptyString() {
        StringLiteralParts parts = StringLiteralParts.parse("\"\"", Language.PYTHON);

        assertNotNull(parts);
        assertEquals("", parts.body());
    }

    @Test
    void testPrefixes() {
        StringLiteralParts fString = StringLiteralParts.parse("f'{x}'", Language.PYTHON);
        assertEquals("f", fString.prefix());
        assertTrue(fString.isInterpolated());

        StringLiteralParts raw = StringLiteralParts.parse("rb'\\n'", Language.PYTHON);
        assertTrue(raw.isRaw());

        StringLiteralParts utf8 = StringLiteralParts.parse("u8\"x\"", Language.CPP);
        assertEquals("u8", utf8.prefix());
    }

    @Test
    void testTripleQuoted() {
        StringLiteralParts parts = StringLiteralParts.parse("'''doc'''", Language.PYTHON);

        assertEquals("'''", parts.delimiter());
        assertEquals("doc", parts.body());
        assertTrue(parts.isMultiLine());
    }

    @Test
    void testTemplateLiteral() {
        StringLiteralParts parts = StringLiteralParts.parse("`hi`", Language.JAVASCRIPT);

        assertTrue(parts.isInterpolated());
        assertEquals("hi", parts.body());
    }

    @Test
    void testCharacterLiteral() {
        assertTrue(StringLiteralParts.parse("'c'", Language.JAVA).isCharacter());
        assertFalse(StringLiteralParts.parse("'c'", Language.PYTHON).isCharacter());
    }

    @Test
    void testUnparseable() {
        assertNull(StringLiteralParts.parse("\"abc", Language.JAVA));
        assertNull(StringLiteralParts.parse("\"a\\\"", Language.JAVA));
        assertNull(StringLiteralParts.parse("R\"(raw)\"", Language.CPP));
        assertNull(StringLiteralParts.parse("abc", Language.JAVA));
    }
}
