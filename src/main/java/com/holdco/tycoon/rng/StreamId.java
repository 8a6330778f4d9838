package com.holdco.tycoon.rng;

/**
 * The five per-round random streams.
 */
public enum StreamId {
    DEALS("deals"),
    EVENTS("events"),
    SIMULATION("simulation"),
    MARKET("market"),
    COSMETIC("cosmetic");

    private final String key;

    StreamId(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
