package com.holdco.tycoon.finance;

/**
 * Breakdown of what a business would fetch if sold now.
 * The total multiple is never below {@link Valuation#MULTIPLE_FLOOR}.
 */
public record ExitValuation(
    double baseMultiple,
    double growthPremium,
    double qualityPremium,
    double platformPremium,
    double holdPremium,
    double improvementsPremium,
    double marketModifier,
    double sizeTierPremium,
    double deRiskingPremium,
    BuyerPoolTier buyerPoolTier,
    double totalMultiple,
    long exitPrice,
    long netProceeds,
    double ebitdaGrowth,
    int yearsHeld
) {
}
