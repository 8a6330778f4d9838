package com.holdco.tycoon.deal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Preferred target size for M&A focus. EBITDA bounds are in thousands.
 */
public enum SizePreference {
    ANY("any", 0, 0),
    SMALL("small", 500, 1500),
    MEDIUM("medium", 1500, 3000),
    LARGE("large", 3000, 8000);

    private final String jsonValue;
    private final long minEbitda;
    private final long maxEbitda;

    SizePreference(String jsonValue, long minEbitda, long maxEbitda) {
        this.jsonValue = jsonValue;
        this.minEbitda = minEbitda;
        this.maxEbitda = maxEbitda;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public long getMinEbitda() {
        return minEbitda;
    }

    public long getMaxEbitda() {
        return maxEbitda;
    }

    /**
     * Bigger portfolios see bigger deals: up to 2.5x at 30M portfolio EBITDA.
     */
    public static double portfolioScaler(long portfolioEbitda) {
        return 1 + Math.min(1.5, Math.max(0, portfolioEbitda) / 20000.0);
    }
}
