package com.holdco.tycoon.finance;

import com.holdco.tycoon.business.Business;

import java.util.List;

/**
 * Covenant tests on net debt / EBITDA.
 */
public final class Distress {

    public static final double ELEVATED_THRESHOLD = 2.5;
    public static final double STRESSED_THRESHOLD = 3.5;
    public static final double BREACH_THRESHOLD = 4.5;

    /** Consecutive breach rounds that force a restructuring. */
    public static final int COVENANT_BREACH_ROUNDS_THRESHOLD = 2;

    private Distress() {
        // Utility class - prevent instantiation
    }

    /**
     * Distress level for a leverage ratio. Debt against non-positive EBITDA is a breach.
     */
    public static DistressLevel calculateDistressLevel(double netDebtToEbitda, long totalDebt, long totalEbitda) {
        if (totalDebt <= 0 && netDebtToEbitda <= 0) return DistressLevel.COMFORTABLE;
        if (totalEbitda <= 0 && totalDebt > 0) return DistressLevel.BREACH;
        if (netDebtToEbitda >= BREACH_THRESHOLD) return DistressLevel.BREACH;
        if (netDebtToEbitda >= STRESSED_THRESHOLD) return DistressLevel.STRESSED;
        if (netDebtToEbitda >= ELEVATED_THRESHOLD) return DistressLevel.ELEVATED;
        return DistressLevel.COMFORTABLE;
    }

    public static CovenantHeadroom calculateCovenantHeadroom(long cash, long totalDebt, long totalEbitda,
                                                             long holdcoLoanBalance, double holdcoRate,
                                                             int holdcoRoundsRemaining,
                                                             List<Business> businesses, double interestPenalty) {
        double currentLeverage;
        long headroomCash;
        if (totalEbitda > 0) {
            currentLeverage = Math.max(0, totalDebt - cash) / (double) totalEbitda;
            headroomCash = Math.round(cash - (totalDebt - BREACH_THRESHOLD * totalEbitda));
        } else {
            currentLeverage = totalDebt > 0 ? BREACH_THRESHOLD : 0;
            headroomCash = totalDebt > 0 ? 0 : cash;
        }

        long debtService = 0;
        if (holdcoLoanBalance > 0) {
            debtService += DebtPayment.scheduled(holdcoLoanBalance, holdcoRate + interestPenalty, holdcoRoundsRemaining);
        }
        for (Business business : businesses) {
            if (!business.getStatus().isOwned()) {
                continue;
            }
            if (business.getSellerNoteBalance() > 0) {
                debtService += DebtPayment.scheduled(business.getSellerNoteBalance(),
                    business.getSellerNoteRate(), business.getSellerNoteRoundsRemaining());
            }
            if (business.getBankDebtBalance() > 0) {
                debtService += DebtPayment.scheduled(business.getBankDebtBalance(),
                    business.getBankDebtRate() + interestPenalty, business.getBankDebtRoundsRemaining());
            }
        }
        long projected = cash - debtService;
        return new CovenantHeadroom(currentLeverage, BREACH_THRESHOLD, BREACH_THRESHOLD - currentLeverage,
            headroomCash, debtService, projected, projected < 0);
    }
}
