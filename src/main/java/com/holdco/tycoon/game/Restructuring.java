package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.finance.ExitValuation;
import com.holdco.tycoon.finance.Valuation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corrective actions available while the holdco is in the restructure phase. At least one of them
 * must be taken before {@link RoundManager#advanceFromRestructure(GameState)} lets the round go on.
 */
public final class Restructuring {
    private static final Logger logger = LoggerFactory.getLogger(Restructuring.class);

    public static final double DISTRESSED_SALE_FACTOR = 0.70;
    public static final double EMERGENCY_PRICE_FACTOR = 0.50;

    private Restructuring() {
        // Utility class - prevent instantiation
    }

    /**
     * Fire-sell an active business at 70% of its exit value.
     */
    public static GameState distressedSale(GameState state, String businessId) {
        if (!inRestructure(state)) {
            return state;
        }
        Business business = state.findBusiness(businessId);
        if (business == null || !business.isActive()) {
            return state;
        }
        GameState next = state.copy();
        Business target = next.findBusiness(businessId);
        ExitValuation valuation = Valuation.calculateExitValuation(target, next.getRound(), next.getLastEventType());
        long exitPrice = Math.round(valuation.exitPrice() * DISTRESSED_SALE_FACTOR);
        long net = Exits.completeSale(next, target, exitPrice);
        next.setRestructuringActionTaken(true);
        logger.info("Round {}: distressed sale of {} for {} (net {})", next.getRound(), target.getName(),
            exitPrice, net);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Issue shares at half of intrinsic value per share. No ownership floor applies, but the holdco
     * must still be worth something.
     */
    public static GameState emergencyEquityRaise(GameState state, long amount) {
        if (!inRestructure(state) || amount <= 0) {
            return state;
        }
        double valuePerShare = MetricsCalculator.intrinsicValuePerShare(state);
        if (valuePerShare <= 0) {
            return state;
        }
        double newShares = Math.round(amount / (valuePerShare * EMERGENCY_PRICE_FACTOR) * 1000) / 1000.0;
        GameState next = state.copy();
        next.addCash(amount);
        next.setSharesOutstanding(next.getSharesOutstanding() + newShares);
        next.setEquityRaisesUsed(next.getEquityRaisesUsed() + 1);
        next.setRestructuringActionTaken(true);
        logger.info("Round {}: emergency equity raise of {} for {} shares", next.getRound(), amount, newShares);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Give up. The game ends in bankruptcy this round.
     */
    public static GameState declareBankruptcy(GameState state) {
        if (!inRestructure(state)) {
            return state;
        }
        GameState next = state.copy();
        next.declareBankrupt();
        logger.info("Round {}: bankruptcy declared", next.getRound());
        return MetricsCalculator.refresh(next);
    }

    private static boolean inRestructure(GameState state) {
        return !state.isGameOver() && state.getPhase() == Phase.RESTRUCTURE;
    }
}
