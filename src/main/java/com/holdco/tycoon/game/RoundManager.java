package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessGenerator;
import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.config.GameDuration;
import com.holdco.tycoon.deal.DealFlowContext;
import com.holdco.tycoon.deal.DealGenerator;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.finance.Distress;
import com.holdco.tycoon.finance.DistressLevel;
import com.holdco.tycoon.finance.SectorFocusBonus;
import com.holdco.tycoon.finance.WaterfallResult;
import com.holdco.tycoon.rng.RngStreams;
import com.holdco.tycoon.rng.SeededRng;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The annual cycle: collect, event, allocate, and the forced restructure detour.
 *
 * Every transition takes a state and returns a new one; the input is never modified. A
 * transition called in the wrong phase or after the game has ended returns its input unchanged.
 */
public final class RoundManager {
    private static final Logger logger = LoggerFactory.getLogger(RoundManager.class);

    public static final double STARTING_INTEREST_RATE = 0.07;

    private RoundManager() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a new game: the starting business, the cap table and any holdco loan.
     * The pipeline starts empty and fills when round 1 reaches allocation.
     */
    public static GameState startGame(GameData data, int masterSeed, Difficulty difficulty, GameDuration duration) {
        int maxRounds = duration.getRounds();
        GameState state = new GameState(data, masterSeed, difficulty, maxRounds);
        RngStreams streams = state.streams();

        Business starting = BusinessGenerator.createStartingBusiness(data.sectors(), difficulty,
            streams.cosmetic().fork(BusinessGenerator.STARTING_BUSINESS_ID));
        state.getBusinesses().add(starting);

        state.setCash(difficulty.getInitialCash() - starting.getAcquisitionPrice());
        state.setInterestRate(STARTING_INTEREST_RATE);
        state.setSharesOutstanding(difficulty.getTotalShares());
        state.setInitialShares(difficulty.getTotalShares());
        state.setFounderShares(difficulty.getFounderShares());
        state.setTotalInvestedCapital(starting.getAcquisitionPrice());

        long loan = difficulty.getStartingDebt();
        if (loan > 0) {
            state.setHoldcoLoanBalance(loan);
            state.setHoldcoLoanRoundsRemaining(duration == GameDuration.QUICK
                ? maxRounds
                : Math.max(4, (int) Math.ceil(maxRounds * 0.5)));
        }

        logger.debug("Started game seed={} difficulty={} rounds={}", masterSeed, difficulty, maxRounds);
        return MetricsCalculator.refresh(state);
    }

    /**
     * collect -> event. Runs the waterfall and draws the round's event.
     *
     * When the waterfall forces a restructuring the event is held back and the game enters the
     * restructure phase instead; a holdco that has already restructured goes bankrupt.
     */
    public static GameState advanceToEvent(GameState state) {
        if (state.isGameOver() || state.getPhase() != Phase.COLLECT) {
            return state;
        }
        GameState next = state.copy();
        next.resetRoundCounters();
        RngStreams streams = next.streams();

        WaterfallResult waterfall = CollectionWaterfall.apply(next);
        if (next.isBankrupt()) {
            logger.info("Round {}: cash exhausted after restructuring, bankrupt (shortfall {})",
                next.getRound(), waterfall.shortfall());
            return MetricsCalculator.refresh(next);
        }

        GameEvent event = EventGenerator.generateEvent(next, streams.events());
        next.getEventHistory().add(event);

        if (next.isRequiresRestructuring()) {
            next.setCurrentEvent(event);
            next.setCurrentEventApplied(false);
            next.setCurrentEventImpacts(java.util.List.of());
            next.setRestructuringActionTaken(false);
            next.setPhase(Phase.RESTRUCTURE);
            logger.info("Round {}: restructuring required (cash {}, shortfall {})",
                next.getRound(), next.getCash(), waterfall.shortfall());
            return MetricsCalculator.refresh(next);
        }

        GameState applied = resolveEvent(next, event);
        applied.setPhase(Phase.EVENT);
        logger.debug("Round {}: collect -> event ({})", applied.getRound(), event.type());
        return MetricsCalculator.refresh(applied);
    }

    /**
     * Apply the round's event, then run down the macro counters. A shock drawn this round
     * therefore still counts through this round's allocate and growth.
     */
    static GameState resolveEvent(GameState state, GameEvent event) {
        GameState applied = EventResolver.applyEventEffects(state, event, effectStream(state, event));
        tickMacroCounters(applied);
        return applied;
    }

    private static void tickMacroCounters(GameState state) {
        state.setCreditTighteningRoundsRemaining(Math.max(0, state.getCreditTighteningRoundsRemaining() - 1));
        state.setInflationRoundsRemaining(Math.max(0, state.getInflationRoundsRemaining() - 1));
    }

    /**
     * event -> allocate. Refreshes the deal pipeline against the current portfolio.
     * Blocked while a choice event is unresolved.
     */
    public static GameState advanceToAllocate(GameState state) {
        if (state.isGameOver() || state.getPhase() != Phase.EVENT) {
            return state;
        }
        GameEvent event = state.getCurrentEvent();
        if (event != null && !state.isCurrentEventApplied()) {
            return state;
        }
        GameState next = state.copy();
        if (event != null) {
            next.setLastEventType(event.type());
        }
        next.setDealPipeline(DealGenerator.generatePipeline(next.getDealPipeline(), dealFlowContext(next),
            next.getSectors(), next.streams().deals()));
        next.setPhase(Phase.ALLOCATE);
        logger.debug("Round {}: event -> allocate, {} deals", next.getRound(), next.getDealPipeline().size());
        return MetricsCalculator.refresh(next);
    }

    /**
     * allocate -> collect. Grows the portfolio, records history, checks covenants and end
     * conditions, then moves to the next round.
     */
    public static GameState endRound(GameState state) {
        if (state.isGameOver() || state.getPhase() != Phase.ALLOCATE) {
            return state;
        }
        GameState next = state.copy();
        OrganicGrowth.apply(next, next.streams().simulation());
        MetricsCalculator.refresh(next);

        DistressLevel distress = next.getMetrics().distressLevel();
        if (distress == DistressLevel.BREACH) {
            next.setCovenantBreachRounds(next.getCovenantBreachRounds() + 1);
        } else if (!next.isHasRestructured()) {
            next.setCovenantBreachRounds(0);
        }
        if (next.getCovenantBreachRounds() >= Distress.COVENANT_BREACH_ROUNDS_THRESHOLD) {
            if (next.isHasRestructured()) {
                logger.info("Round {}: covenant breach after restructuring, bankrupt", next.getRound());
                next.declareBankrupt();
            } else if (!next.isRequiresRestructuring()) {
                logger.info("Round {}: {} rounds in covenant breach, restructuring required",
                    next.getRound(), next.getCovenantBreachRounds());
                next.setRequiresRestructuring(true);
            }
        }
        if (!next.isBankrupt() && next.isHasRestructured()) {
            boolean noBusinesses = next.activeBusinessCount() == 0 && next.getCash() <= 0;
            if (next.getMetrics().intrinsicValue() <= 0 || noBusinesses) {
                logger.info("Round {}: insolvent after restructuring, bankrupt", next.getRound());
                next.declareBankrupt();
            }
        }

        next.getHistory().add(historyEntry(next));
        if (next.isBankrupt()) {
            return MetricsCalculator.refresh(next);
        }

        next.setRound(next.getRound() + 1);
        next.setPhase(Phase.COLLECT);
        if (next.getRound() > next.getMaxRounds()) {
            next.setGameOver(true);
            logger.debug("Game over after {} rounds", next.getMaxRounds());
        } else {
            logger.debug("Round {}: allocate -> collect", next.getRound());
        }
        return MetricsCalculator.refresh(next);
    }

    /**
     * restructure -> event, once at least one corrective action has been taken. An immediate event
     * held back by the restructuring is applied now, and the macro counters tick as they would have.
     */
    public static GameState advanceFromRestructure(GameState state) {
        if (state.isGameOver() || state.getPhase() != Phase.RESTRUCTURE || !state.isRestructuringActionTaken()) {
            return state;
        }
        GameState next = state.copy();
        next.setHasRestructured(true);
        next.setRequiresRestructuring(false);
        next.setCovenantBreachRounds(0);
        next.setPhase(Phase.EVENT);
        logger.info("Round {}: restructuring complete", next.getRound());

        GameEvent pending = next.getCurrentEvent();
        if (pending != null && !next.isCurrentEventApplied() && !pending.requiresChoice()) {
            return MetricsCalculator.refresh(resolveEvent(next, pending));
        }
        tickMacroCounters(next);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Stream for an event's effect sizes. Keyed by event ID so a deferred event resolves exactly as
     * it would have on the spot.
     */
    static SeededRng effectStream(GameState state, GameEvent event) {
        return state.streams().events().fork(event.id());
    }

    /**
     * What deal generation needs to know about the current state.
     */
    public static DealFlowContext dealFlowContext(GameState state) {
        SectorFocusBonus focus = SectorFocusBonus.calculate(state.getBusinesses(), state.getSectors());
        return new DealFlowContext(state.getRound(), state.getMaxRounds(), state.getMaFocus(),
            focus != null ? focus.focusGroup() : null, focus != null ? focus.tier() : 0,
            state.totalEbitda(), state.getMaSourcingTier(), state.isMaSourcingActive(),
            state.getLastEventType(), state.isCreditTightening());
    }

    private static RoundHistoryEntry historyEntry(GameState state) {
        GameEvent event = state.getCurrentEvent();
        return new RoundHistoryEntry(state.getRound(), state.getMetrics(),
            event != null ? event.type() : null, event != null ? event.title() : null,
            state.getCurrentEventImpacts(), state.getLastWaterfall(), state.getAcquisitionsThisRound(),
            state.getCash(), state.totalEbitda());
    }
}
