package com.holdco.tycoon.finance;

/**
 * Distance to the covenant breach line and next year's mandatory debt service.
 *
 * @param headroomCash cash that can be spent before net debt/EBITDA reaches the breach threshold
 */
public record CovenantHeadroom(
    double currentLeverage,
    double breachThreshold,
    double headroomRatio,
    long headroomCash,
    long nextYearDebtService,
    long projectedCashAfterDebt,
    boolean cashWillGoNegative
) {
}
