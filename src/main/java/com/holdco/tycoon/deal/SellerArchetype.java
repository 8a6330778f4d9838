package com.holdco.tycoon.deal;

import com.fasterxml.jackson.annotation.JsonValue;
import com.holdco.tycoon.business.OperatorQuality;
import com.holdco.tycoon.rng.SeededRng;

/**
 * Who is selling and why. Shapes price, heat and the management team left behind.
 */
public enum SellerArchetype {
    RETIRING_FOUNDER("retiring_founder", 0.30, -1, 0.0, 0.05),
    BURNT_OUT_OPERATOR("burnt_out_operator", 0.20, 0, -0.10, -0.05),
    ACCIDENTAL_HOLDCO("accidental_holdco", 0.10, 1, 0.05, 0.10),
    DISTRESSED_SELLER("distressed_seller", 0.08, -2, -0.20, -0.10),
    MBO_CANDIDATE("mbo_candidate", 0.15, 0, 0.0, 0.05),
    FRANCHISE_BREAKAWAY("franchise_breakaway", 0.15, 0, 0.05, 0.10);

    private final String jsonValue;
    private final double baseWeight;
    private final int heatModifier;
    private final double priceModifierMin;
    private final double priceModifierMax;

    SellerArchetype(String jsonValue, double baseWeight, int heatModifier,
                    double priceModifierMin, double priceModifierMax) {
        this.jsonValue = jsonValue;
        this.baseWeight = baseWeight;
        this.heatModifier = heatModifier;
        this.priceModifierMin = priceModifierMin;
        this.priceModifierMax = priceModifierMax;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public int getHeatModifier() {
        return heatModifier;
    }

    /**
     * Weight adjusted for target quality: good businesses attract retiring founders, poor ones distress.
     */
    double weightFor(int quality) {
        double adjustment = switch (this) {
            case RETIRING_FOUNDER -> quality >= 4 ? 0.10 : quality <= 2 ? -0.10 : 0;
            case BURNT_OUT_OPERATOR -> quality <= 2 ? 0.05 : quality >= 4 ? -0.05 : 0;
            case ACCIDENTAL_HOLDCO -> 0;
            case DISTRESSED_SELLER -> quality <= 2 ? 0.12 : quality >= 4 ? -0.05 : 0;
            case MBO_CANDIDATE -> quality >= 4 ? 0.05 : quality <= 2 ? -0.05 : 0;
            case FRANCHISE_BREAKAWAY -> quality <= 2 ? -0.05 : 0;
        };
        return Math.max(0.01, baseWeight + adjustment);
    }

    /**
     * Pick an archetype for a target of the given quality.
     */
    public static SellerArchetype assign(int quality, SeededRng rng) {
        double total = 0;
        for (SellerArchetype archetype : values()) {
            total += archetype.weightFor(quality);
        }
        double roll = rng.next() * total;
        for (SellerArchetype archetype : values()) {
            roll -= archetype.weightFor(quality);
            if (roll <= 0) {
                return archetype;
            }
        }
        return RETIRING_FOUNDER;
    }

    /**
     * Fractional price adjustment; negative values are discounts.
     */
    public double rollPriceModifier(SeededRng rng) {
        return rng.nextInRange(priceModifierMin, priceModifierMax);
    }

    /**
     * Management team the seller leaves behind.
     */
    public OperatorQuality rollOperatorQuality(SeededRng rng) {
        return switch (this) {
            case RETIRING_FOUNDER, FRANCHISE_BREAKAWAY ->
                rng.next() > 0.5 ? OperatorQuality.STRONG : OperatorQuality.MODERATE;
            case BURNT_OUT_OPERATOR -> rng.next() > 0.5 ? OperatorQuality.WEAK : OperatorQuality.MODERATE;
            case ACCIDENTAL_HOLDCO -> OperatorQuality.MODERATE;
            case DISTRESSED_SELLER -> OperatorQuality.WEAK;
            case MBO_CANDIDATE -> OperatorQuality.STRONG;
        };
    }
}
