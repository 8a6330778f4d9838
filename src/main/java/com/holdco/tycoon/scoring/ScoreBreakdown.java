package com.holdco.tycoon.scoring;

/**
 * Final score split into its five components. Components are rounded to one decimal; the total is
 * the rounded sum of the unrounded components.
 *
 * @param fcfShareGrowth      out of 25
 * @param portfolioRoic       out of 20
 * @param capitalDeployment   out of 20 (MOIC and ROIIC)
 * @param balanceSheetHealth  out of 15
 * @param strategicDiscipline out of 20
 */
public record ScoreBreakdown(
    double fcfShareGrowth,
    double portfolioRoic,
    double capitalDeployment,
    double balanceSheetHealth,
    double strategicDiscipline,
    int total,
    Grade grade,
    String title
) {
    public static final int MAX_TOTAL = 100;
}
