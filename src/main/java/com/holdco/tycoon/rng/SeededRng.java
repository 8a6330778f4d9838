package com.holdco.tycoon.rng;

import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator for reproducible games.
 * Uses the Mulberry32 PRNG so that a seed replays the same sequence on every platform.
 */
public class SeededRng {
    private long state;

    /**
     * Create a new SeededRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public SeededRng(long seed) {
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        // state = state.wrapping_add(0x6D2B79F5)
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        // t = (t ^ (t >> 15)).wrapping_mul(t | 1)
        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;

        // t ^= t.wrapping_add((t ^ (t >> 7)).wrapping_mul(t | 61))
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        // result = t ^ (t >> 14)
        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;

        return result / 4294967296.0;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        return (int) (next() * bound);
    }

    /**
     * Generate a random integer in range [min, max], both inclusive.
     */
    public int nextInt(int min, int max) {
        return (int) Math.floor(next() * (max - min + 1)) + min;
    }

    /**
     * Generate a random double in [min, max).
     */
    public double nextInRange(double min, double max) {
        return min + next() * (max - min);
    }

    /**
     * Pick a random element, or null for an empty list.
     */
    public <T> T pick(List<T> list) {
        if (list.isEmpty()) {
            return null;
        }
        return list.get((int) Math.floor(next() * list.size()));
    }

    /**
     * Fisher-Yates shuffle for a list.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * Fork an independent child stream keyed by a string (entity ID, action occurrence key).
     * Forking does not advance this stream.
     */
    public SeededRng fork(String key) {
        return fork(SeedDerivation.stringHash(key));
    }

    /**
     * Fork an independent child stream keyed by an integer.
     * Forking does not advance this stream.
     */
    public SeededRng fork(int key) {
        return new SeededRng(SeedDerivation.hashTwo((int) state, key));
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
