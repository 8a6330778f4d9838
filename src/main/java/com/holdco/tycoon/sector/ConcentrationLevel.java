package com.holdco.tycoon.sector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Low/medium/high rating used for client concentration and talent dependency.
 */
public enum ConcentrationLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String jsonValue;

    ConcentrationLevel(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static ConcentrationLevel fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Concentration level cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "low" -> LOW;
            case "medium" -> MEDIUM;
            case "high" -> HIGH;
            default -> throw new IllegalArgumentException("Unknown concentration level: " + value);
        };
    }
}
