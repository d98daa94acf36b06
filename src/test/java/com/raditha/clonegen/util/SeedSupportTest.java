package com.raditha.clonegen.util;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SeedSupportTest {

    @Test
    void testContentSeedUsesFirstFourDigestBytes() {
        // md5("hello") = 5d41402a bc4b2a76 ...
        assertEquals(0x5d41402aL, SeedSupport.contentSeed("hello"));
    }

    @Test
    void testBaseSeedWithoutExplicitSeed() {
        assertEquals(SeedSupport.contentSeed("x = 1"), SeedSupport.baseSeed("x = 1", null));
    }

    @Test
    void testExplicitSeedChangesBaseSeed() {
        long a = SeedSupport.baseSeed("x = 1", 1L);
        long b = SeedSupport.baseSeed("x = 1", 2L);

        assertNotEquals(a, b);
        assertEquals(a, SeedSupport.baseSeed("x = 1", 1L));
        assertNotEquals(SeedSupport.baseSeed("x = 2", 1L), a);
    }

    @Test
    void testVariantSeeds() {
        assertEquals(7L, SeedSupport.forVariant(7L, 0));
        assertNull(SeedSupport.forVariant(null, 0));
        assertNotNull(SeedSupport.forVariant(null, 1));
        assertNotEquals(SeedSupport.forVariant(7L, 1), SeedSupport.forVariant(7L, 2));
        assertEquals(SeedSupport.forVariant(7L, 3), SeedSupport.forVariant(7L, 3));
    }

    @Test
    void testAttemptSeeds() {
        long base = SeedSupport.baseSeed("x = 1", 7L);

        assertEquals(base, SeedSupport.forAttempt(base, 0));
        assertNotEquals(SeedSupport.forAttempt(base, 1), SeedSupport.forAttempt(base, 2));
        assertEquals(SeedSupport.forAttempt(base, 1), SeedSupport.forAttempt(base, 1));
    }

    @Test
    void testStagesAreIndependent() {
        Random first = SeedSupport.random(42L, "type1:indentation_remap");
        Random again = SeedSupport.random(42L, "type1:indentation_remap");
        Random other = SeedSupport.random(42L, "type2:rename");

        long value = first.nextLong();
        assertEquals(value, again.nextLong());
        assertNotEquals(value, other.nextLong());
    }
}
