package com.holdco.tycoon.rng;

/**
 * Round-scoped random streams. Each stream is seeded independently from the round seed,
 * so draws on one never shift another.
 */
public record RngStreams(
    SeededRng deals,
    SeededRng events,
    SeededRng simulation,
    SeededRng market,
    SeededRng cosmetic
) {

    /**
     * Create all five streams for a master seed and round.
     */
    public static RngStreams create(int masterSeed, int round) {
        int roundSeed = SeedDerivation.deriveRoundSeed(masterSeed, round);
        return new RngStreams(
            stream(roundSeed, StreamId.DEALS),
            stream(roundSeed, StreamId.EVENTS),
            stream(roundSeed, StreamId.SIMULATION),
            stream(roundSeed, StreamId.MARKET),
            stream(roundSeed, StreamId.COSMETIC));
    }

    private static SeededRng stream(int roundSeed, StreamId id) {
        return new SeededRng(SeedDerivation.deriveStreamSeed(roundSeed, id.getKey()));
    }

    public SeededRng get(StreamId id) {
        return switch (id) {
            case DEALS -> deals;
            case EVENTS -> events;
            case SIMULATION -> simulation;
            case MARKET -> market;
            case COSMETIC -> cosmetic;
        };
    }
}
