package com.holdco.tycoon.config;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Game length in rounds (years).
 */
public enum GameDuration {
    STANDARD("standard", 20),
    QUICK("quick", 10);

    private final String jsonValue;
    private final int rounds;

    GameDuration(String jsonValue, int rounds) {
        this.jsonValue = jsonValue;
        this.rounds = rounds;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public int getRounds() {
        return rounds;
    }
}
