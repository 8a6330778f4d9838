package com.holdco.tycoon.config;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Starting conditions. All money amounts are in thousands.
 */
public enum Difficulty {
    /** Institutional fund: patient LP money, clean balance sheet, 80% founder ownership. */
    EASY("easy", 20_000, 800, 1000, 0, 1000, null),
    /** Self-funded search: personal equity plus a holdco bank loan, 100% ownership. */
    NORMAL("normal", 5_000, 1000, 1000, 3_000, 800, 4.0);

    private final String jsonValue;
    private final long initialCash;
    private final double founderShares;
    private final double totalShares;
    private final long startingDebt;
    private final long startingEbitda;
    private final Double startingMultipleCap;

    Difficulty(String jsonValue, long initialCash, double founderShares, double totalShares,
               long startingDebt, long startingEbitda, Double startingMultipleCap) {
        this.jsonValue = jsonValue;
        this.initialCash = initialCash;
        this.founderShares = founderShares;
        this.totalShares = totalShares;
        this.startingDebt = startingDebt;
        this.startingEbitda = startingEbitda;
        this.startingMultipleCap = startingMultipleCap;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public long getInitialCash() {
        return initialCash;
    }

    public double getFounderShares() {
        return founderShares;
    }

    public double getTotalShares() {
        return totalShares;
    }

    public long getStartingDebt() {
        return startingDebt;
    }

    public long getStartingEbitda() {
        return startingEbitda;
    }

    /**
     * Cap on the starting business's multiple, or null when uncapped.
     */
    public Double getStartingMultipleCap() {
        return startingMultipleCap;
    }

    public static Difficulty fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Difficulty cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "easy" -> EASY;
            case "normal", "hard" -> NORMAL;
            default -> throw new IllegalArgumentException("Unknown difficulty: " + value);
        };
    }
}
