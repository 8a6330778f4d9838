package com.holdco.tycoon.deal;

/**
 * Per-deal generation knobs.
 *
 * @param qualityFloor      minimum quality, or null
 * @param subType           forced sub-type, or null
 * @param source            forced source, or null to roll inbound/brokered
 * @param multipleDiscount  off-market discount; the largest discount applies, they never stack
 * @param forcedHeat        heat to use instead of rolling, or null
 */
public record DealOptions(
    SizePreference size,
    Integer qualityFloor,
    String subType,
    DealSource source,
    int freshnessBonus,
    double multipleDiscount,
    DealHeat forcedHeat
) {
    public static DealOptions of(SizePreference size) {
        return new DealOptions(size, null, null, null, 0, 0, null);
    }

    public DealOptions withQualityFloor(Integer floor) {
        return new DealOptions(size, floor, subType, source, freshnessBonus, multipleDiscount, forcedHeat);
    }

    public DealOptions withSubType(String value) {
        return new DealOptions(size, qualityFloor, value, source, freshnessBonus, multipleDiscount, forcedHeat);
    }

    public DealOptions withSource(DealSource value) {
        return new DealOptions(size, qualityFloor, subType, value, freshnessBonus, multipleDiscount, forcedHeat);
    }

    public DealOptions withFreshnessBonus(int bonus) {
        return new DealOptions(size, qualityFloor, subType, source, bonus, multipleDiscount, forcedHeat);
    }

    public DealOptions withForcedHeat(DealHeat heat) {
        return new DealOptions(size, qualityFloor, subType, source, freshnessBonus, multipleDiscount, heat);
    }
}
