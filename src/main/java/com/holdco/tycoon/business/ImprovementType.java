package com.holdco.tycoon.business;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operational improvements a holdco can fund inside an opco.
 * Cost is a share of |EBITDA|; boosts are margin points, revenue percent and growth points.
 */
public enum ImprovementType {
    OPERATING_PLAYBOOK("operating_playbook", 0.15, 0.03, 0.0, 0.0),
    PRICING_MODEL("pricing_model", 0.10, 0.02, 0.01, 0.01),
    SERVICE_EXPANSION("service_expansion", 0.20, -0.01, 0.08, 0.0),
    FIX_UNDERPERFORMANCE("fix_underperformance", 0.12, 0.04, 0.0, 0.0),
    RECURRING_REVENUE_CONVERSION("recurring_revenue_conversion", 0.25, -0.02, 0.0, 0.03),
    MANAGEMENT_PROFESSIONALIZATION("management_professionalization", 0.18, 0.01, 0.0, 0.01),
    DIGITAL_TRANSFORMATION("digital_transformation", 0.22, 0.02, 0.03, 0.02);

    /** No improvement costs less than this, however small the business. */
    public static final long COST_FLOOR = 200;

    private final String jsonValue;
    private final double costRate;
    private final double marginBoost;
    private final double revenueBoost;
    private final double growthBoost;

    ImprovementType(String jsonValue, double costRate, double marginBoost, double revenueBoost, double growthBoost) {
        this.jsonValue = jsonValue;
        this.costRate = costRate;
        this.marginBoost = marginBoost;
        this.revenueBoost = revenueBoost;
        this.growthBoost = growthBoost;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public double getCostRate() {
        return costRate;
    }

    public double getMarginBoost() {
        return marginBoost;
    }

    public double getRevenueBoost() {
        return revenueBoost;
    }

    public double getGrowthBoost() {
        return growthBoost;
    }

    public long costFor(long ebitda) {
        long absEbitda = Math.max(1, Math.abs(ebitda));
        return Math.max(COST_FLOOR, Math.round(absEbitda * costRate));
    }

    /**
     * Higher-quality businesses get more out of positive boosts.
     */
    public static double qualityMultiplier(int qualityRating) {
        return switch (qualityRating) {
            case 1 -> 0.7;
            case 2 -> 0.85;
            case 4 -> 1.1;
            case 5 -> 1.2;
            default -> 1.0;
        };
    }
}
