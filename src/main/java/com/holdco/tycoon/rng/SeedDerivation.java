package com.holdco.tycoon.rng;

import java.security.SecureRandom;

/**
 * Seed hierarchy: master seed, then a round seed, then one seed per named stream.
 * All arithmetic wraps at 32 bits.
 */
public final class SeedDerivation {

    private static final double GOLDEN_GAMMA = 2654435769.0; // 0x9e3779b9

    private SeedDerivation() {
        // Utility class - prevent instantiation
    }

    /**
     * Mix two 32-bit integers into one.
     * The first multiply happens in double precision before wrapping to 32 bits.
     */
    public static int hashTwo(int a, int b) {
        int mixed = (int) (long) ((double) b * GOLDEN_GAMMA);
        int h = a ^ mixed;
        h = (h ^ (h >>> 16)) * 0x85ebca6b;
        h = (h ^ (h >>> 13)) * 0xc2b2ae35;
        return h ^ (h >>> 16);
    }

    /**
     * 31-multiplier string hash with 32-bit wraparound.
     */
    public static int stringHash(String key) {
        int sum = 0;
        for (int i = 0; i < key.length(); i++) {
            sum = sum * 31 + key.charAt(i);
        }
        return sum;
    }

    public static int deriveRoundSeed(int masterSeed, int round) {
        return hashTwo(masterSeed, round);
    }

    public static int deriveStreamSeed(int roundSeed, String streamId) {
        return hashTwo(roundSeed, stringHash(streamId));
    }

    /**
     * Fresh master seed for a non-challenge game, in [0, 2^31 - 1).
     */
    public static int generateRandomSeed() {
        return new SecureRandom().nextInt(0x7fffffff);
    }
}
