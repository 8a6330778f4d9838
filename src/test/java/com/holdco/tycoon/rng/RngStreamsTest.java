package com.holdco.tycoon.rng;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-round stream hierarchy.
 */
class RngStreamsTest {

    @ParameterizedTest
    @EnumSource(StreamId.class)
    void testStreamsAreDeterministic(StreamId id) {
        SeededRng a = RngStreams.create(12345, 3).get(id);
        SeededRng b = RngStreams.create(12345, 3).get(id);
        for (int i = 0; i < 1000; i++) {
            assertEquals(a.next(), b.next(), id + " draw " + i + " should replay");
        }
    }

    @Test
    void testSeed42RoundOneReplays() {
        SeededRng a = new SeededRng(SeedDerivation.deriveRoundSeed(42, 1));
        SeededRng b = new SeededRng(SeedDerivation.deriveRoundSeed(42, 1));
        for (int i = 0; i < 100; i++) {
            assertEquals(a.next(), b.next());
        }
    }

    @Test
    void testDrawsOnOneStreamDoNotShiftAnother() {
        RngStreams untouched = RngStreams.create(777, 5);
        RngStreams busy = RngStreams.create(777, 5);

        for (int i = 0; i < 250; i++) {
            busy.deals().next();
            busy.market().next();
        }

        assertEquals(untouched.events().next(), busy.events().next());
        assertEquals(untouched.simulation().next(), busy.simulation().next());
        assertEquals(untouched.cosmetic().next(), busy.cosmetic().next());
    }

    @Test
    void testStreamsDifferFromEachOther() {
        RngStreams streams = RngStreams.create(99, 1);
        double deals = streams.deals().next();
        assertNotEquals(deals, streams.events().next());
        assertNotEquals(deals, streams.simulation().next());
        assertNotEquals(deals, streams.market().next());
        assertNotEquals(deals, streams.cosmetic().next());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 10, 20})
    void testRoundsGetDifferentSeeds(int round) {
        int roundSeed = SeedDerivation.deriveRoundSeed(2024, round);
        assertNotEquals(SeedDerivation.deriveRoundSeed(2024, round + 1), roundSeed);
    }

    @Test
    void testStringHashWrapsLikeJava() {
        assertEquals("deals".hashCode(), SeedDerivation.stringHash("deals"));
        assertEquals(0, SeedDerivation.stringHash(""));
    }

    @Test
    void testRandomSeedIsNonNegative() {
        for (int i = 0; i < 20; i++) {
            int seed = SeedDerivation.generateRandomSeed();
            assertTrue(seed >= 0);
        }
    }
}
