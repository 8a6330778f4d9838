package com.holdco.tycoon.deal;

/**
 * Holdco M&A sourcing capability. Costs are in thousands.
 */
public enum MASourcingTier {
    NONE(0, 0, 0, 0, 2),
    TIER_1(1, 800, 350, 2, 3),
    TIER_2(2, 1200, 450, 3, 4),
    TIER_3(3, 1600, 600, 4, 4);

    private final int level;
    private final long upgradeCost;
    private final long annualCost;
    private final int requiredOpcos;
    private final int maxAcquisitions;

    MASourcingTier(int level, long upgradeCost, long annualCost, int requiredOpcos, int maxAcquisitions) {
        this.level = level;
        this.upgradeCost = upgradeCost;
        this.annualCost = annualCost;
        this.requiredOpcos = requiredOpcos;
        this.maxAcquisitions = maxAcquisitions;
    }

    public int getLevel() {
        return level;
    }

    /** Cost to reach this tier from the one below. */
    public long getUpgradeCost() {
        return upgradeCost;
    }

    public long getAnnualCost() {
        return annualCost;
    }

    public int getRequiredOpcos() {
        return requiredOpcos;
    }

    public int getMaxAcquisitions() {
        return maxAcquisitions;
    }

    /**
     * The next tier, or null at the top.
     */
    public MASourcingTier next() {
        MASourcingTier[] values = values();
        return ordinal() + 1 < values.length ? values[ordinal() + 1] : null;
    }
}
