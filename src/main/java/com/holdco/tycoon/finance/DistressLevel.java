package com.holdco.tycoon.finance;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Leverage band and the lender restrictions that come with it.
 */
public enum DistressLevel {
    COMFORTABLE("comfortable", "Healthy", true, true, true, true, 0.0),
    ELEVATED("elevated", "Elevated", true, true, true, true, 0.0),
    STRESSED("stressed", "Covenant Watch", true, false, true, true, 0.01),
    BREACH("breach", "COVENANT BREACH", false, false, false, false, 0.02);

    private final String jsonValue;
    private final String label;
    private final boolean canAcquire;
    private final boolean canTakeDebt;
    private final boolean canDistribute;
    private final boolean canBuyback;
    private final double interestPenalty;

    DistressLevel(String jsonValue, String label, boolean canAcquire, boolean canTakeDebt,
                  boolean canDistribute, boolean canBuyback, double interestPenalty) {
        this.jsonValue = jsonValue;
        this.label = label;
        this.canAcquire = canAcquire;
        this.canTakeDebt = canTakeDebt;
        this.canDistribute = canDistribute;
        this.canBuyback = canBuyback;
        this.interestPenalty = interestPenalty;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public String getLabel() {
        return label;
    }

    public boolean canAcquire() {
        return canAcquire;
    }

    public boolean canTakeDebt() {
        return canTakeDebt;
    }

    public boolean canDistribute() {
        return canDistribute;
    }

    public boolean canBuyback() {
        return canBuyback;
    }

    /**
     * Added to the base rate on holdco and bank debt.
     */
    public double getInterestPenalty() {
        return interestPenalty;
    }
}
