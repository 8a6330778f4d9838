package com.holdco.tycoon.business;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of folding one business into another.
 */
public enum IntegrationOutcome {
    SUCCESS("success"),
    PARTIAL("partial"),
    FAILURE("failure");

    private final String jsonValue;

    IntegrationOutcome(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
