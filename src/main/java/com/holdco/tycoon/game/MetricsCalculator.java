package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.finance.CashFlow;
import com.holdco.tycoon.finance.CovenantHeadroom;
import com.holdco.tycoon.finance.Distress;
import com.holdco.tycoon.finance.DistressLevel;
import com.holdco.tycoon.finance.PortfolioTax;
import com.holdco.tycoon.finance.SharedServiceBenefits;
import com.holdco.tycoon.sector.SectorDefinition;

import java.util.List;

/**
 * Derives {@link Metrics} from a game state.
 */
public final class MetricsCalculator {

    private MetricsCalculator() {
        // Utility class - prevent instantiation
    }

    public static SharedServiceBenefits sharedServiceBenefits(GameState state) {
        return SharedServiceBenefits.calculate(state.getActiveSharedServices(), state.activeBusinessCount());
    }

    /**
     * Shared-service plus M&A sourcing annual cost.
     */
    public static long holdcoOverhead(GameState state) {
        return state.sharedServicesCost() + state.maSourcingCost();
    }

    public static PortfolioTax portfolioTax(GameState state) {
        return PortfolioTax.calculate(state.getBusinesses(), state.getHoldcoLoanBalance(),
            state.getInterestRate(), holdcoOverhead(state));
    }

    /**
     * Net debt / EBITDA, 0 for non-positive EBITDA (the distress level treats that case itself).
     */
    public static double netDebtToEbitda(long totalDebt, long cash, long totalEbitda) {
        return totalEbitda > 0 ? (totalDebt - cash) / (double) totalEbitda : 0;
    }

    public static DistressLevel distressLevel(GameState state) {
        long totalDebt = state.totalDebt();
        long totalEbitda = state.totalEbitda();
        return Distress.calculateDistressLevel(netDebtToEbitda(totalDebt, state.getCash(), totalEbitda),
            totalDebt, totalEbitda);
    }

    /**
     * Distance to the breach line and the debt service due at the next collection.
     */
    public static CovenantHeadroom covenantHeadroom(GameState state) {
        return Distress.calculateCovenantHeadroom(state.getCash(), state.totalDebt(), state.totalEbitda(),
            state.getHoldcoLoanBalance(), state.getInterestRate(), state.getHoldcoLoanRoundsRemaining(),
            state.getBusinesses(), distressLevel(state).getInterestPenalty());
    }

    /**
     * EBITDA at sector average multiples.
     */
    public static long portfolioValue(GameState state) {
        double value = 0;
        for (Business business : state.getBusinesses()) {
            if (business.isActive()) {
                SectorDefinition sector = state.getSectors().getSector(business.getSectorId());
                value += business.getEbitda() * sector.averageMultiple();
            }
        }
        return Math.round(value);
    }

    public static long intrinsicValue(GameState state) {
        return portfolioValue(state) + state.getCash() - state.totalDebt();
    }

    public static double intrinsicValuePerShare(GameState state) {
        return state.getSharesOutstanding() > 0 ? intrinsicValue(state) / state.getSharesOutstanding() : 0;
    }

    public static Metrics calculate(GameState state) {
        List<Business> businesses = state.getBusinesses();
        SharedServiceBenefits benefits = sharedServiceBenefits(state);
        long overhead = holdcoOverhead(state);

        long totalEbitda = 0;
        long totalRevenue = 0;
        int active = 0;
        long opcoInterest = 0;
        for (Business business : businesses) {
            if (!business.isActive()) {
                continue;
            }
            active++;
            totalEbitda += business.getEbitda();
            totalRevenue += business.getRevenue();
            opcoInterest += Math.round(business.getSellerNoteBalance() * business.getSellerNoteRate());
            opcoInterest += Math.round(business.getBankDebtBalance() * business.getBankDebtRate());
        }
        double averageMargin = totalRevenue > 0 ? (double) totalEbitda / totalRevenue : 0;

        long preTaxFcf = CashFlow.portfolioPreTaxFcf(businesses, state.getSectors(), benefits);
        PortfolioTax tax = portfolioTax(state);
        long holdcoInterest = Math.round(state.getHoldcoLoanBalance() * state.getInterestRate());
        long netFcf = preTaxFcf - tax.taxAmount() - holdcoInterest - opcoInterest - overhead;

        long totalDebt = state.totalDebt();
        long portfolioValue = portfolioValue(state);
        long intrinsicValue = portfolioValue + state.getCash() - totalDebt;
        double shares = state.getSharesOutstanding();
        double intrinsicPerShare = shares > 0 ? intrinsicValue / shares : 0;
        double fcfPerShare = shares > 0 ? netFcf / shares : 0;

        long nopat = totalEbitda - tax.taxAmount();
        long invested = state.getTotalInvestedCapital();
        double roic = invested > 0 ? (double) nopat / invested : 0;

        double roiic = 0;
        List<RoundHistoryEntry> history = state.getHistory();
        if (!history.isEmpty()) {
            Metrics previous = history.get(history.size() - 1).metrics();
            long deltaInvested = invested - previous.totalInvestedCapital();
            if (deltaInvested > 0) {
                roiic = (double) (nopat - previous.nopat()) / deltaInvested;
            }
        }

        long totalReturns = state.getTotalDistributions() + state.getTotalExitProceeds() + portfolioValue
            + state.getCash();
        double moic = invested > 0 ? (double) totalReturns / invested : 1;

        double leverage = netDebtToEbitda(totalDebt, state.getCash(), totalEbitda);
        DistressLevel distress = Distress.calculateDistressLevel(leverage, totalDebt, totalEbitda);
        double cashConversion = totalEbitda > 0 ? (double) preTaxFcf / totalEbitda : 0;

        return new Metrics(state.getCash(), totalDebt, totalEbitda, totalRevenue, averageMargin, netFcf,
            fcfPerShare, nopat, roic, roiic, moic, leverage, distress, cashConversion, state.getInterestRate(),
            shares, portfolioValue, intrinsicValue, intrinsicPerShare, invested, state.getTotalDistributions(),
            state.getTotalBuybacks(), state.getTotalExitProceeds(), active);
    }

    /**
     * Recompute and store metrics on a state being built by a transition.
     */
    static GameState refresh(GameState state) {
        state.setMetrics(calculate(state));
        return state;
    }
}
