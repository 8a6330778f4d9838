package com.holdco.tycoon.game;

import com.holdco.tycoon.finance.DistressLevel;

/**
 * Portfolio and holdco metrics derived from a game state. Every ratio is guarded and finite.
 *
 * @param totalDebt       holdco loan plus opco seller notes and bank debt
 * @param totalFcf        FCF after tax, interest and holdco overhead
 * @param nopat           EBITDA less portfolio tax
 * @param portfolioValue  EBITDA at sector average multiples
 */
public record Metrics(
    long cash,
    long totalDebt,
    long totalEbitda,
    long totalRevenue,
    double averageMargin,
    long totalFcf,
    double fcfPerShare,
    long nopat,
    double portfolioRoic,
    double roiic,
    double portfolioMoic,
    double netDebtToEbitda,
    DistressLevel distressLevel,
    double cashConversion,
    double interestRate,
    double sharesOutstanding,
    long portfolioValue,
    long intrinsicValue,
    double intrinsicValuePerShare,
    long totalInvestedCapital,
    long totalDistributions,
    long totalBuybacks,
    long totalExitProceeds,
    int activeBusinessCount
) {
}
