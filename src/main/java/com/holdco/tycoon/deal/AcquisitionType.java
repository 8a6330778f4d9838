package com.holdco.tycoon.deal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a target fits a roll-up strategy.
 */
public enum AcquisitionType {
    STANDALONE("standalone"),
    TUCK_IN("tuck_in"),
    PLATFORM("platform");

    private final String jsonValue;

    AcquisitionType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
