package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.finance.CashFlow;
import com.holdco.tycoon.finance.DebtPayment;
import com.holdco.tycoon.finance.WaterfallResult;

/**
 * The annual collection waterfall. Claims are settled in a fixed order against one cash balance:
 * <ol>
 *   <li>portfolio pre-tax FCF, less shared-service and M&A sourcing overhead</li>
 *   <li>portfolio tax</li>
 *   <li>holdco loan interest and principal</li>
 *   <li>per business, in portfolio order: seller note, then bank debt</li>
 *   <li>earn-outs whose growth target is met; expired ones are forfeited</li>
 * </ol>
 * Every payment is capped at the cash on hand, interest before principal, and balances only fall
 * by principal actually paid. Cash never ends below zero; running short on tax or debt service raises
 * the restructuring flag, or bankruptcy when the holdco has already restructured once. An earn-out the
 * cash cannot cover is deferred and never counts as running short.
 */
public final class CollectionWaterfall {

    private CollectionWaterfall() {
        // Utility class - prevent instantiation
    }

    /**
     * Run the waterfall on a copy of the state.
     */
    public static GameState collect(GameState state) {
        GameState next = state.copy();
        apply(next);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Run the waterfall in place on a working copy owned by the caller.
     */
    static WaterfallResult apply(GameState working) {
        double penalty = MetricsCalculator.distressLevel(working).getInterestPenalty();
        long cashBefore = working.getCash();
        long cash = cashBefore;
        long shortfall = 0;

        // (a) operating cash flow
        long preTaxFcf = CashFlow.portfolioPreTaxFcf(working.getBusinesses(), working.getSectors(),
            MetricsCalculator.sharedServiceBenefits(working));
        long overhead = MetricsCalculator.holdcoOverhead(working);
        cash += preTaxFcf - overhead;

        // (b) tax
        long tax = MetricsCalculator.portfolioTax(working).taxAmount();
        cash -= tax;
        boolean wentNegative = cash < 0;

        // (c) holdco loan
        DebtPayment holdco = DebtPayment.settle(working.getHoldcoLoanBalance(),
            working.getInterestRate() + penalty, working.getHoldcoLoanRoundsRemaining(), cash);
        if (holdco != DebtPayment.NONE) {
            cash -= holdco.totalPaid();
            shortfall += holdco.shortfall();
            working.setHoldcoLoanBalance(working.getHoldcoLoanBalance() - holdco.principalPaid());
            if (holdco.isFull()) {
                working.setHoldcoLoanRoundsRemaining(Math.max(0, working.getHoldcoLoanRoundsRemaining() - 1));
            }
        }

        // (d) opco debt
        long opcoInterest = 0;
        long opcoPrincipal = 0;
        for (Business business : working.getBusinesses()) {
            if (!business.getStatus().isOwned()) {
                continue;
            }
            DebtPayment note = DebtPayment.settle(business.getSellerNoteBalance(), business.getSellerNoteRate(),
                business.getSellerNoteRoundsRemaining(), cash);
            if (note != DebtPayment.NONE) {
                cash -= note.totalPaid();
                shortfall += note.shortfall();
                opcoInterest += note.interestPaid();
                opcoPrincipal += note.principalPaid();
                business.setSellerNoteBalance(business.getSellerNoteBalance() - note.principalPaid());
                if (note.isFull()) {
                    business.setSellerNoteRoundsRemaining(Math.max(0, business.getSellerNoteRoundsRemaining() - 1));
                }
            }

            DebtPayment bank = DebtPayment.settle(business.getBankDebtBalance(),
                business.getBankDebtRate() + penalty, business.getBankDebtRoundsRemaining(), cash);
            if (bank != DebtPayment.NONE) {
                cash -= bank.totalPaid();
                shortfall += bank.shortfall();
                opcoInterest += bank.interestPaid();
                opcoPrincipal += bank.principalPaid();
                business.setBankDebtBalance(business.getBankDebtBalance() - bank.principalPaid());
                if (bank.isFull()) {
                    business.setBankDebtRoundsRemaining(Math.max(0, business.getBankDebtRoundsRemaining() - 1));
                }
            }
        }

        // (e) earn-outs
        long earnoutsPaid = 0;
        long earnoutsForfeited = 0;
        for (Business business : working.getBusinesses()) {
            if (!business.getStatus().isOwned() || business.getEarnoutRemaining() <= 0) {
                continue;
            }
            if (earnoutGrowth(working, business) >= business.getEarnoutTarget()) {
                // Whatever cash cannot cover stays owed for a later collection
                long payment = Math.min(business.getEarnoutRemaining(), Math.max(0, cash));
                cash -= payment;
                earnoutsPaid += payment;
                business.setEarnoutRemaining(business.getEarnoutRemaining() - payment);
                if (business.getEarnoutRemaining() == 0) {
                    business.setEarnoutRoundsRemaining(0);
                }
            } else {
                int remaining = business.getEarnoutRoundsRemaining() - 1;
                business.setEarnoutRoundsRemaining(Math.max(0, remaining));
                if (remaining <= 0) {
                    earnoutsForfeited += business.getEarnoutRemaining();
                    business.setEarnoutRemaining(0);
                }
            }
        }

        if (cash < 0) {
            wentNegative = true;
            cash = 0;
        }
        working.setCash(cash);

        boolean exhausted = wentNegative || shortfall > 0;
        if (exhausted) {
            if (working.isHasRestructured()) {
                working.declareBankrupt();
            } else {
                working.setRequiresRestructuring(true);
            }
        }

        WaterfallResult result = new WaterfallResult(cashBefore, preTaxFcf, overhead, tax, holdco,
            opcoInterest, opcoPrincipal, earnoutsPaid, earnoutsForfeited, shortfall, cash, exhausted);
        working.setLastWaterfall(result);
        return result;
    }

    /**
     * Growth an earn-out is measured on. A bolt-on's own EBITDA is folded into its platform,
     * so it is measured on the platform's growth.
     */
    static double earnoutGrowth(GameState state, Business business) {
        if (business.getParentPlatformId() != null) {
            Business parent = state.findBusiness(business.getParentPlatformId());
            if (parent != null) {
                return parent.ebitdaGrowthSinceAcquisition();
            }
        }
        return business.ebitdaGrowthSinceAcquisition();
    }
}
