package com.raditha.clonegen.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

/**
 * Seed derivation for reproducible generation.
 * <p>
 * Every random choice is drawn from a {@link Random} built from the base seed
 * and a stage name, so the same source, seed and options always produce the
 * same variant, and adding a choice to one stage does not shift another.
 */
public final class SeedSupport {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private SeedSupport() {
    }

    /**
     * Base seed for a source: the first 32 bits of its MD5 digest, mixed with
     * the caller's seed when one is given.
     */
    public static long baseSeed(String source, Long explicitSeed) {
        long contentSeed = contentSeed(source);
        if (explicitSeed == null) {
            return contentSeed;
        }
        return contentSeed ^ (explicitSeed * GOLDEN_GAMMA);
    }

    /**
     * Seed for retry {@code attempt}. Attempt 0 uses the base seed unchanged.
     */
    public static long forAttempt(long baseSeed, int attempt) {
        if (attempt == 0) {
            return baseSeed;
        }
        return mix(baseSeed + attempt * GOLDEN_GAMMA);
    }

    /**
     * Explicit seed for the {@code index}-th of several variants of one source.
     * Index 0 keeps the caller's seed, so the first variant matches a single
     * {@code generate} call.
     */
    public static Long forVariant(Long explicitSeed, int index) {
        if (index == 0) {
            return explicitSeed;
        }
        long seed = explicitSeed == null ? 0L : explicitSeed;
        return mix(seed ^ (index * GOLDEN_GAMMA));
    }

    public static Random random(long seed, String stage) {
        return new Random(mix(seed + stage.hashCode()));
    }

    static long contentSeed(String source) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(source.getBytes(StandardCharsets.UTF_8));
            long value = 0;
            for (int i = 0; i < 4; i++) {
                value = (value << 8) | (digest[i] & 0xFF);
            }
            return value;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }

    // splitmix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
