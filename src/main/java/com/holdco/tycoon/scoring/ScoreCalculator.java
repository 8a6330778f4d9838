package com.holdco.tycoon.scoring;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessStatus;
import com.holdco.tycoon.finance.DistressLevel;
import com.holdco.tycoon.finance.SectorFocusBonus;
import com.holdco.tycoon.finance.Valuation;
import com.holdco.tycoon.game.GameState;
import com.holdco.tycoon.game.Metrics;
import com.holdco.tycoon.game.MetricsCalculator;
import com.holdco.tycoon.game.RoundHistoryEntry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * End-of-game valuation, scoring and post-game insights.
 */
public final class ScoreCalculator {

    public static final int MAX_INSIGHTS = 3;

    private ScoreCalculator() {
        // Utility class - prevent instantiation
    }

    // ==================== ENTERPRISE VALUE ====================

    /**
     * Exit value of every active opco plus cash and distributions already paid, less all debt.
     * Never negative.
     */
    public static long enterpriseValue(GameState state) {
        List<Business> active = state.activeBusinesses();
        long debt = state.totalDebt();
        if (active.isEmpty()) {
            return Math.max(0, state.getCash() - debt);
        }
        int round = Math.min(state.getRound(), state.getMaxRounds());
        double portfolio = 0;
        for (Business business : active) {
            portfolio += business.getEbitda()
                * Valuation.calculateExitValuation(business, round, state.getLastEventType()).totalMultiple();
        }
        long value = Math.round(portfolio) + state.getCash() + state.getTotalDistributions() - debt;
        return Math.max(0, value);
    }

    // ==================== FINAL SCORE ====================

    public static ScoreBreakdown calculateFinalScore(GameState state) {
        if (state.isBankrupt()) {
            Integer year = state.getBankruptRound();
            return new ScoreBreakdown(0, 0, 0, 0, 0, 0, Grade.F,
                "Bankrupt - Filed for bankruptcy in Year " + (year != null ? year : state.getRound()));
        }

        Metrics metrics = MetricsCalculator.calculate(state);
        List<RoundHistoryEntry> history = state.getHistory();
        double avgRoiic = averageRoiic(history);

        double fcfShareGrowth = fcfShareGrowthScore(history);
        double portfolioRoic = roicScore(metrics.portfolioRoic());
        double capitalDeployment = moicScore(averageMoic(state)) + roiicScore(avgRoiic);
        double balanceSheetHealth = balanceSheetScore(state, metrics);
        double strategicDiscipline = sectorFocusScore(state) + sharedServicesScore(state)
            + distributionScore(state, metrics, avgRoiic) + dealQualityScore(state);

        int total = (int) Math.round(
            fcfShareGrowth + portfolioRoic + capitalDeployment + balanceSheetHealth + strategicDiscipline);
        Grade grade = Grade.forTotal(total);
        return new ScoreBreakdown(oneDecimal(fcfShareGrowth), oneDecimal(portfolioRoic),
            oneDecimal(capitalDeployment), oneDecimal(balanceSheetHealth), oneDecimal(strategicDiscipline),
            total, grade, grade.getTitle());
    }

    /**
     * Up to 25 points for FCF per share growth from the first recorded round to the last.
     * Tripling earns full marks.
     */
    static double fcfShareGrowthScore(List<RoundHistoryEntry> history) {
        if (history.size() <= 1) {
            return 0;
        }
        double start = history.get(0).metrics().fcfPerShare();
        double end = history.get(history.size() - 1).metrics().fcfPerShare();
        if (start > 0) {
            double growth = (end - start) / start;
            return Math.min(25, Math.max(0, growth / 3 * 25));
        }
        return end > 0 ? 15 : 0;
    }

    static double roicScore(double roic) {
        if (roic >= 0.25) {
            return 20;
        }
        if (roic >= 0.15) {
            return 15 + (roic - 0.15) / 0.10 * 5;
        }
        if (roic >= 0.08) {
            return 8 + (roic - 0.08) / 0.07 * 7;
        }
        return Math.max(0, roic / 0.08 * 8);
    }

    static double moicScore(double moic) {
        if (moic >= 2.5) {
            return 10;
        }
        if (moic >= 1.5) {
            return 5 + (moic - 1.5) * 5;
        }
        return Math.max(0, moic / 1.5 * 5);
    }

    static double roiicScore(double roiic) {
        if (roiic >= 0.20) {
            return 10;
        }
        if (roiic >= 0.10) {
            return 5 + (roiic - 0.10) / 0.10 * 5;
        }
        return Math.max(0, roiic / 0.10 * 5);
    }

    static double leverageScore(double netDebtToEbitda) {
        if (netDebtToEbitda < 1) {
            return 15;
        }
        if (netDebtToEbitda < 2.5) {
            return 10 + (2.5 - netDebtToEbitda) / 1.5 * 5;
        }
        if (netDebtToEbitda < 3.5) {
            return 5 + (3.5 - netDebtToEbitda) * 5;
        }
        return Math.max(0, 5 - (netDebtToEbitda - 3.5) * 2);
    }

    private static double balanceSheetScore(GameState state, Metrics metrics) {
        double score = leverageScore(metrics.netDebtToEbitda());
        boolean everAboveFour = false;
        boolean everInBreach = false;
        for (RoundHistoryEntry entry : state.getHistory()) {
            everAboveFour |= entry.metrics().netDebtToEbitda() > 4;
            everInBreach |= entry.metrics().distressLevel() == DistressLevel.BREACH;
        }
        if (everAboveFour) {
            score = Math.max(0, score - 5);
        }
        if (everInBreach) {
            score = Math.max(0, score - 3);
        }
        if (state.isHasRestructured()) {
            score = Math.max(0, score - 5);
        }
        return score;
    }

    // ==================== STRATEGIC DISCIPLINE ====================

    private static double sectorFocusScore(GameState state) {
        SectorFocusBonus focus = SectorFocusBonus.calculate(state.getBusinesses(), state.getSectors());
        if (focus != null) {
            return Math.min(5, focus.tier() * 1.5 + (focus.opcoCount() >= 4 ? 1 : 0));
        }
        List<Business> active = state.activeBusinesses();
        if (active.size() >= 4) {
            Set<String> sectors = new HashSet<>();
            for (Business business : active) {
                sectors.add(business.getSectorId());
            }
            return Math.min(4, sectors.size());
        }
        return 0;
    }

    private static double sharedServicesScore(GameState state) {
        int count = state.getActiveSharedServices().size();
        if (count > 0 && state.activeBusinessCount() >= 3) {
            return Math.min(5, count * 1.5);
        }
        return 0;
    }

    /**
     * Rewards returning capital when reinvestment returns fell and the balance sheet allowed it,
     * and penalises hoarding cash that had nowhere to go.
     */
    static double distributionScore(GameState state, Metrics metrics, double avgRoiic) {
        double netDebt = metrics.netDebtToEbitda();
        if (state.getTotalDistributions() > 0) {
            double score = 0;
            if (avgRoiic < 0.15 && netDebt < 2.0) {
                score = 4;
            } else if (avgRoiic < 0.20 && netDebt < 2.5) {
                score = 2;
            }
            if (netDebt > 2.5) {
                score = Math.max(0, score - 2);
            }
            double returnedShare = state.getTotalInvestedCapital() > 0
                ? state.getTotalDistributions() / (double) state.getTotalInvestedCapital()
                : 0;
            if (returnedShare > 0.10 && netDebt < 1.5) {
                score = Math.min(5, score + 1);
            }
            return score;
        }
        double cashToEbitda = metrics.totalEbitda() > 0 ? state.getCash() / (double) metrics.totalEbitda() : 0;
        boolean hasExcessCash = cashToEbitda > 2 && netDebt < 1;
        if (hasExcessCash) {
            return 1;
        }
        return avgRoiic > 0.15 ? 4 : 2;
    }

    private static double dealQualityScore(GameState state) {
        List<Business> owned = scoredBusinesses(state);
        double avgQuality = 3;
        if (!owned.isEmpty()) {
            double sum = 0;
            for (Business business : owned) {
                sum += business.getQualityRating();
            }
            avgQuality = sum / owned.size();
        }
        return Math.min(5, avgQuality / 5 * 5);
    }

    // ==================== INSIGHTS ====================

    /**
     * The first few patterns this game shows, in declaration order.
     */
    public static List<PostGameInsight> generatePostGameInsights(GameState state) {
        Metrics metrics = MetricsCalculator.calculate(state);
        List<Business> active = state.activeBusinesses();
        List<Business> scored = scoredBusinesses(state);
        List<PostGameInsight> insights = new ArrayList<>();

        if (scored.size() <= 1) {
            insights.add(PostGameInsight.NEVER_ACQUIRED);
        }
        if (metrics.netDebtToEbitda() > 3) {
            insights.add(PostGameInsight.OVER_LEVERAGED);
        }
        if (active.size() >= 3 && active.stream().map(Business::getSectorId).distinct().count() == 1) {
            insights.add(PostGameInsight.SINGLE_SECTOR);
        }
        if (metrics.roiic() > 0.20 && metrics.portfolioMoic() > 2.0) {
            insights.add(PostGameInsight.HIGH_ROIIC_MOIC);
        }
        if (state.getActiveSharedServices().isEmpty()
            && scored.stream().allMatch(b -> b.getImprovements().isEmpty())) {
            insights.add(PostGameInsight.IGNORED_REINVESTMENT);
        }
        if (metrics.cashConversion() > 0.80) {
            insights.add(PostGameInsight.STRONG_CONVERSION);
        }
        if (smartExitCount(state) >= 2) {
            insights.add(PostGameInsight.SMART_EXITS);
        }
        if (active.stream().anyMatch(b -> b.getEbitda() < b.getAcquisitionEbitda() * 0.5)) {
            insights.add(PostGameInsight.HELD_LOSERS);
        }
        if (state.getActiveSharedServices().size() >= 2) {
            insights.add(PostGameInsight.GOOD_SHARED_SERVICES);
        }
        if (state.getEquityRaisesUsed() > 0) {
            insights.add(metrics.portfolioRoic() > 0.15
                ? PostGameInsight.EQUITY_WELL_DEPLOYED
                : PostGameInsight.EQUITY_POORLY_DEPLOYED);
        }
        if (state.getTotalBuybacks() > 0 && metrics.portfolioRoic() < 0.15) {
            insights.add(PostGameInsight.WELL_TIMED_BUYBACKS);
        }
        double avgRoiic = averageRoiic(state.getHistory());
        if (state.getTotalDistributions() > 0 && avgRoiic < 0.15 && metrics.netDebtToEbitda() < 2.0) {
            insights.add(PostGameInsight.SMART_DISTRIBUTIONS);
        }
        double cashToEbitda = metrics.totalEbitda() > 0 ? state.getCash() / (double) metrics.totalEbitda() : 0;
        if (state.getTotalDistributions() == 0 && cashToEbitda > 2.0 && metrics.netDebtToEbitda() < 1.0) {
            insights.add(PostGameInsight.HOARDED_CASH);
        }
        return insights.size() > MAX_INSIGHTS ? List.copyOf(insights.subList(0, MAX_INSIGHTS)) : insights;
    }

    // ==================== HELPERS ====================

    /**
     * Every business ever owned, except bolt-ons (their cost sits in the platform) and the halves
     * of a merger (their cost sits in the merged company).
     */
    private static List<Business> scoredBusinesses(GameState state) {
        Set<String> boltOns = new HashSet<>();
        for (Business business : state.getBusinesses()) {
            boltOns.addAll(business.getBoltOnIds());
        }
        List<Business> result = new ArrayList<>();
        for (Business business : state.getBusinesses()) {
            BusinessStatus status = business.getStatus();
            if (status != BusinessStatus.INTEGRATED && status != BusinessStatus.MERGED
                && !boltOns.contains(business.getId())) {
                result.add(business);
            }
        }
        return result;
    }

    /**
     * Realised or marked return over purchase price across every scored business. Active opcos are
     * marked at their entry multiple plus 10%.
     */
    static double averageMoic(GameState state) {
        double capital = 0;
        double returns = 0;
        for (Business business : scoredBusinesses(state)) {
            capital += business.getAcquisitionPrice();
            if (business.getStatus() == BusinessStatus.SOLD && business.getExitPrice() != null) {
                returns += business.getExitPrice();
            } else if (business.isActive()) {
                returns += business.getEbitda() * business.getAcquisitionMultiple() * 1.1;
            }
        }
        return capital > 0 ? returns / capital : 1;
    }

    private static double averageRoiic(List<RoundHistoryEntry> history) {
        if (history.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (RoundHistoryEntry entry : history) {
            sum += entry.metrics().roiic();
        }
        return sum / history.size();
    }

    private static long smartExitCount(GameState state) {
        return scoredBusinesses(state).stream()
            .filter(b -> b.getStatus() == BusinessStatus.SOLD && b.getExitPrice() != null)
            .filter(b -> b.getAcquisitionPrice() > 0 && b.getExitPrice() / (double) b.getAcquisitionPrice() > 2.0)
            .count();
    }

    private static double oneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
