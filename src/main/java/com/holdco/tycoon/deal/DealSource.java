package com.holdco.tycoon.deal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a deal reached the holdco.
 */
public enum DealSource {
    INBOUND("inbound"),
    BROKERED("brokered"),
    /** Paid sourcing batch. */
    SOURCED("sourced"),
    /** Proactive outreach; off-market. */
    PROPRIETARY("proprietary");

    private final String jsonValue;

    DealSource(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Deals the player went looking for. Only these are cooled by sourcing capability.
     */
    public boolean isSourced() {
        return this == SOURCED || this == PROPRIETARY;
    }
}
