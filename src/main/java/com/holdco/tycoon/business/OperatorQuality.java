package com.holdco.tycoon.business;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Diligence read on the management team.
 */
public enum OperatorQuality {
    STRONG("strong", 1),
    MODERATE("moderate", 2),
    WEAK("weak", 3);

    private final String jsonValue;
    private final int integrationRounds;

    OperatorQuality(String jsonValue, int integrationRounds) {
        this.jsonValue = jsonValue;
        this.integrationRounds = integrationRounds;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Rounds of post-acquisition integration drag.
     */
    public int getIntegrationRounds() {
        return integrationRounds;
    }

    public OperatorQuality upgraded() {
        return this == WEAK ? MODERATE : STRONG;
    }
}
