package com.holdco.tycoon.sector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Valuation band of a sector, used to weight deal flow across the game.
 */
public enum PriceTier {
    CHEAP("cheap"),
    MID("mid"),
    PREMIUM("premium");

    private final String jsonValue;

    PriceTier(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static PriceTier fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Price tier cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "cheap" -> CHEAP;
            case "mid" -> MID;
            case "premium" -> PREMIUM;
            default -> throw new IllegalArgumentException("Unknown price tier: " + value);
        };
    }

    /**
     * Share of deal flow going to this tier at a point in the game.
     * Early rounds lean cheap, late rounds lean premium.
     */
    public double weightForRound(int round, int maxRounds) {
        int earlyEnd = (int) Math.ceil(maxRounds * 0.25);
        int midEnd = (int) Math.ceil(maxRounds * 0.60);
        if (round <= earlyEnd) {
            return switch (this) {
                case CHEAP -> 0.60;
                case MID -> 0.30;
                case PREMIUM -> 0.10;
            };
        }
        if (round <= midEnd) {
            return switch (this) {
                case CHEAP -> 0.30;
                case MID -> 0.40;
                case PREMIUM -> 0.30;
            };
        }
        return switch (this) {
            case CHEAP -> 0.20;
            case MID -> 0.30;
            case PREMIUM -> 0.50;
        };
    }
}
