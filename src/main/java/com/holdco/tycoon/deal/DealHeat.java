package com.holdco.tycoon.deal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Competitiveness of a deal. Hotter deals cost more; contested ones can be lost outright.
 */
public enum DealHeat {
    COLD("cold"),
    WARM("warm"),
    HOT("hot"),
    CONTESTED("contested");

    /** Chance a third party outbids the player on a contested deal. */
    public static final double CONTESTED_SNATCH_PROBABILITY = 0.40;

    private final String jsonValue;

    DealHeat(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public static DealHeat fromIndex(int index) {
        DealHeat[] values = values();
        return values[Math.max(0, Math.min(values.length - 1, index))];
    }
}
