package com.holdco.tycoon.finance;

/**
 * What the collection waterfall paid, step by step.
 *
 * @param preTaxFcf         step (a) portfolio FCF before overhead
 * @param overheadCost      shared-service and M&A sourcing annual cost
 * @param taxPaid           step (b)
 * @param holdcoPayment     step (c)
 * @param opcoInterestPaid  step (d) interest across all seller notes and bank debt
 * @param opcoPrincipalPaid step (d) principal across all seller notes and bank debt
 * @param earnoutsPaid      step (e)
 * @param earnoutsForfeited earn-out balances written off because their window closed
 * @param shortfall         scheduled debt payments that could not be made
 * @param cashExhausted     cash would have gone negative or a debt payment fell short
 */
public record WaterfallResult(
    long cashBefore,
    long preTaxFcf,
    long overheadCost,
    long taxPaid,
    DebtPayment holdcoPayment,
    long opcoInterestPaid,
    long opcoPrincipalPaid,
    long earnoutsPaid,
    long earnoutsForfeited,
    long shortfall,
    long cashAfter,
    boolean cashExhausted
) {

    public long totalDebtService() {
        return holdcoPayment.totalPaid() + opcoInterestPaid + opcoPrincipalPaid;
    }
}
