package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.deal.Deal;
import com.holdco.tycoon.deal.MAFocus;
import com.holdco.tycoon.deal.MASourcingTier;
import com.holdco.tycoon.event.EventImpact;
import com.holdco.tycoon.event.EventType;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.finance.SharedServiceType;
import com.holdco.tycoon.finance.WaterfallResult;
import com.holdco.tycoon.rng.ActionOutcomes;
import com.holdco.tycoon.rng.ActionRoll;
import com.holdco.tycoon.rng.RngStreams;
import com.holdco.tycoon.sector.SectorCatalog;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Complete state of one game. Money amounts are in thousands.
 *
 * Transitions never mutate the state they are given: they call {@link #copy()}, change the copy
 * and return it. Businesses are copied deeply; deals, events and history entries are immutable
 * and shared.
 */
public class GameState {
    // Identity and static data
    private final GameData data;
    private final int masterSeed;
    private final Difficulty difficulty;
    private final int maxRounds;

    // Cycle
    private int round;
    private Phase phase;
    private boolean gameOver;

    // Holdco balance sheet
    private long cash;
    private double interestRate;
    private long holdcoLoanBalance;
    private int holdcoLoanRoundsRemaining;
    private double sharesOutstanding;
    private double founderShares;
    private double initialShares;
    private int equityRaisesUsed;

    // Portfolio
    private List<Business> businesses = new ArrayList<>();
    private List<Deal> dealPipeline = new ArrayList<>();
    private List<SharedServiceType> activeSharedServices = new ArrayList<>();
    private MASourcingTier maSourcingTier = MASourcingTier.NONE;
    private boolean maSourcingActive;
    private MAFocus maFocus = MAFocus.NONE;

    // Events
    private GameEvent currentEvent;
    private boolean currentEventApplied;
    private List<EventImpact> currentEventImpacts = new ArrayList<>();
    private List<GameEvent> eventHistory = new ArrayList<>();
    private EventType lastEventType;
    private int creditTighteningRoundsRemaining;
    private int inflationRoundsRemaining;

    // Distress
    private boolean requiresRestructuring;
    private boolean hasRestructured;
    private boolean restructuringActionTaken;
    private int covenantBreachRounds;
    private boolean bankrupt;
    private Integer bankruptRound;

    // Per-round counters, reset when a round starts
    private int acquisitionsThisRound;
    private int sourcingCount;
    private int outreachCount;
    private Map<ActionRoll, Integer> actionRollCounters = new EnumMap<>(ActionRoll.class);

    // Lifetime totals
    private long totalInvestedCapital;
    private long totalDistributions;
    private long totalBuybacks;
    private long totalExitProceeds;

    // Outputs
    private WaterfallResult lastWaterfall;
    private List<RoundHistoryEntry> history = new ArrayList<>();
    private Metrics metrics;

    public GameState(GameData data, int masterSeed, Difficulty difficulty, int maxRounds) {
        if (data == null) {
            throw new IllegalArgumentException("Game data cannot be null");
        }
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive: " + maxRounds);
        }
        this.data = data;
        this.masterSeed = masterSeed;
        this.difficulty = difficulty;
        this.maxRounds = maxRounds;
        this.round = 1;
        this.phase = Phase.COLLECT;
    }

    /**
     * Copy constructor. Businesses are deep-copied; everything else in a list is immutable.
     */
    public GameState(GameState other) {
        this.data = other.data;
        this.masterSeed = other.masterSeed;
        this.difficulty = other.difficulty;
        this.maxRounds = other.maxRounds;
        this.round = other.round;
        this.phase = other.phase;
        this.gameOver = other.gameOver;
        this.cash = other.cash;
        this.interestRate = other.interestRate;
        this.holdcoLoanBalance = other.holdcoLoanBalance;
        this.holdcoLoanRoundsRemaining = other.holdcoLoanRoundsRemaining;
        this.sharesOutstanding = other.sharesOutstanding;
        this.founderShares = other.founderShares;
        this.initialShares = other.initialShares;
        this.equityRaisesUsed = other.equityRaisesUsed;
        this.businesses = new ArrayList<>(other.businesses.size());
        for (Business business : other.businesses) {
            this.businesses.add(business.copy());
        }
        this.dealPipeline = new ArrayList<>(other.dealPipeline);
        this.activeSharedServices = new ArrayList<>(other.activeSharedServices);
        this.maSourcingTier = other.maSourcingTier;
        this.maSourcingActive = other.maSourcingActive;
        this.maFocus = other.maFocus;
        this.currentEvent = other.currentEvent;
        this.currentEventApplied = other.currentEventApplied;
        this.currentEventImpacts = new ArrayList<>(other.currentEventImpacts);
        this.eventHistory = new ArrayList<>(other.eventHistory);
        this.lastEventType = other.lastEventType;
        this.creditTighteningRoundsRemaining = other.creditTighteningRoundsRemaining;
        this.inflationRoundsRemaining = other.inflationRoundsRemaining;
        this.requiresRestructuring = other.requiresRestructuring;
        this.hasRestructured = other.hasRestructured;
        this.restructuringActionTaken = other.restructuringActionTaken;
        this.covenantBreachRounds = other.covenantBreachRounds;
        this.bankrupt = other.bankrupt;
        this.bankruptRound = other.bankruptRound;
        this.acquisitionsThisRound = other.acquisitionsThisRound;
        this.sourcingCount = other.sourcingCount;
        this.outreachCount = other.outreachCount;
        this.actionRollCounters = new EnumMap<>(ActionRoll.class);
        this.actionRollCounters.putAll(other.actionRollCounters);
        this.totalInvestedCapital = other.totalInvestedCapital;
        this.totalDistributions = other.totalDistributions;
        this.totalBuybacks = other.totalBuybacks;
        this.totalExitProceeds = other.totalExitProceeds;
        this.lastWaterfall = other.lastWaterfall;
        this.history = new ArrayList<>(other.history);
        this.metrics = other.metrics;
    }

    public GameState copy() {
        return new GameState(this);
    }

    // ---- Static data ----

    public GameData getData() {
        return data;
    }

    public SectorCatalog getSectors() {
        return data.sectors();
    }

    public int getMasterSeed() {
        return masterSeed;
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    /**
     * Fresh round-scoped streams. Rebuilding them is deterministic, so every caller starts from
     * the same stream positions for this round.
     */
    public RngStreams streams() {
        return RngStreams.create(masterSeed, round);
    }

    // ---- Cycle ----

    public int getRound() {
        return round;
    }

    public void setRound(int round) {
        this.round = round;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    public boolean isGameOver() {
        return gameOver;
    }

    public void setGameOver(boolean gameOver) {
        this.gameOver = gameOver;
    }

    // ---- Holdco balance sheet ----

    public long getCash() {
        return cash;
    }

    public void setCash(long cash) {
        this.cash = cash;
    }

    public void addCash(long amount) {
        this.cash += amount;
    }

    public double getInterestRate() {
        return interestRate;
    }

    public void setInterestRate(double interestRate) {
        this.interestRate = interestRate;
    }

    public long getHoldcoLoanBalance() {
        return holdcoLoanBalance;
    }

    public void setHoldcoLoanBalance(long holdcoLoanBalance) {
        this.holdcoLoanBalance = holdcoLoanBalance;
    }

    public int getHoldcoLoanRoundsRemaining() {
        return holdcoLoanRoundsRemaining;
    }

    public void setHoldcoLoanRoundsRemaining(int holdcoLoanRoundsRemaining) {
        this.holdcoLoanRoundsRemaining = holdcoLoanRoundsRemaining;
    }

    public double getSharesOutstanding() {
        return sharesOutstanding;
    }

    public void setSharesOutstanding(double sharesOutstanding) {
        this.sharesOutstanding = sharesOutstanding;
    }

    public double getFounderShares() {
        return founderShares;
    }

    public void setFounderShares(double founderShares) {
        this.founderShares = founderShares;
    }

    public double getInitialShares() {
        return initialShares;
    }

    public void setInitialShares(double initialShares) {
        this.initialShares = initialShares;
    }

    /**
     * Founder's share of the company, 0 when no shares exist.
     */
    public double founderOwnership() {
        return sharesOutstanding > 0 ? founderShares / sharesOutstanding : 0;
    }

    public int getEquityRaisesUsed() {
        return equityRaisesUsed;
    }

    public void setEquityRaisesUsed(int equityRaisesUsed) {
        this.equityRaisesUsed = equityRaisesUsed;
    }

    // ---- Portfolio ----

    /**
     * Every business the holdco has owned, in acquisition order. Status tells which are still held.
     */
    public List<Business> getBusinesses() {
        return businesses;
    }

    public Business findBusiness(String id) {
        if (id == null) {
            return null;
        }
        for (Business business : businesses) {
            if (id.equals(business.getId())) {
                return business;
            }
        }
        return null;
    }

    public List<Business> activeBusinesses() {
        List<Business> active = new ArrayList<>();
        for (Business business : businesses) {
            if (business.isActive()) {
                active.add(business);
            }
        }
        return active;
    }

    public int activeBusinessCount() {
        int count = 0;
        for (Business business : businesses) {
            if (business.isActive()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Consolidated EBITDA. Integrated bolt-ons are already inside their platform's figure.
     */
    public long totalEbitda() {
        long total = 0;
        for (Business business : businesses) {
            if (business.isActive()) {
                total += business.getEbitda();
            }
        }
        return total;
    }

    /**
     * Holdco loan plus all opco seller notes and bank debt.
     */
    public long totalDebt() {
        long total = holdcoLoanBalance;
        for (Business business : businesses) {
            if (business.getStatus().isOwned()) {
                total += business.getSellerNoteBalance() + business.getBankDebtBalance();
            }
        }
        return total;
    }

    public List<Deal> getDealPipeline() {
        return dealPipeline;
    }

    public void setDealPipeline(List<Deal> dealPipeline) {
        this.dealPipeline = new ArrayList<>(dealPipeline);
    }

    public Deal findDeal(String id) {
        if (id == null) {
            return null;
        }
        for (Deal deal : dealPipeline) {
            if (id.equals(deal.getId())) {
                return deal;
            }
        }
        return null;
    }

    public List<SharedServiceType> getActiveSharedServices() {
        return activeSharedServices;
    }

    /**
     * Annual cost of the active shared services.
     */
    public long sharedServicesCost() {
        long total = 0;
        for (SharedServiceType service : activeSharedServices) {
            total += service.getAnnualCost();
        }
        return total;
    }

    public MASourcingTier getMaSourcingTier() {
        return maSourcingTier;
    }

    public void setMaSourcingTier(MASourcingTier maSourcingTier) {
        this.maSourcingTier = maSourcingTier;
    }

    public boolean isMaSourcingActive() {
        return maSourcingActive;
    }

    public void setMaSourcingActive(boolean maSourcingActive) {
        this.maSourcingActive = maSourcingActive;
    }

    /**
     * Tier level when sourcing is switched on, else 0.
     */
    public int activeSourcingLevel() {
        return maSourcingActive ? maSourcingTier.getLevel() : 0;
    }

    /**
     * Annual M&A sourcing cost; nothing is charged while sourcing is switched off.
     */
    public long maSourcingCost() {
        return maSourcingActive ? maSourcingTier.getAnnualCost() : 0;
    }

    public MAFocus getMaFocus() {
        return maFocus;
    }

    public void setMaFocus(MAFocus maFocus) {
        this.maFocus = maFocus == null ? MAFocus.NONE : maFocus;
    }

    // ---- Events ----

    public GameEvent getCurrentEvent() {
        return currentEvent;
    }

    public void setCurrentEvent(GameEvent currentEvent) {
        this.currentEvent = currentEvent;
    }

    /**
     * False while the current event's effects are still pending: an unresolved choice, or an
     * immediate event held back by a forced restructuring.
     */
    public boolean isCurrentEventApplied() {
        return currentEventApplied;
    }

    public void setCurrentEventApplied(boolean currentEventApplied) {
        this.currentEventApplied = currentEventApplied;
    }

    public List<EventImpact> getCurrentEventImpacts() {
        return currentEventImpacts;
    }

    public void setCurrentEventImpacts(List<EventImpact> currentEventImpacts) {
        this.currentEventImpacts = new ArrayList<>(currentEventImpacts);
    }

    public List<GameEvent> getEventHistory() {
        return eventHistory;
    }

    public EventType getLastEventType() {
        return lastEventType;
    }

    public void setLastEventType(EventType lastEventType) {
        this.lastEventType = lastEventType;
    }

    public int getCreditTighteningRoundsRemaining() {
        return creditTighteningRoundsRemaining;
    }

    public void setCreditTighteningRoundsRemaining(int creditTighteningRoundsRemaining) {
        this.creditTighteningRoundsRemaining = creditTighteningRoundsRemaining;
    }

    public boolean isCreditTightening() {
        return creditTighteningRoundsRemaining > 0;
    }

    public int getInflationRoundsRemaining() {
        return inflationRoundsRemaining;
    }

    public void setInflationRoundsRemaining(int inflationRoundsRemaining) {
        this.inflationRoundsRemaining = inflationRoundsRemaining;
    }

    public boolean isInflationActive() {
        return inflationRoundsRemaining > 0;
    }

    // ---- Distress ----

    public boolean isRequiresRestructuring() {
        return requiresRestructuring;
    }

    public void setRequiresRestructuring(boolean requiresRestructuring) {
        this.requiresRestructuring = requiresRestructuring;
    }

    public boolean isHasRestructured() {
        return hasRestructured;
    }

    public void setHasRestructured(boolean hasRestructured) {
        this.hasRestructured = hasRestructured;
    }

    public boolean isRestructuringActionTaken() {
        return restructuringActionTaken;
    }

    public void setRestructuringActionTaken(boolean restructuringActionTaken) {
        this.restructuringActionTaken = restructuringActionTaken;
    }

    public int getCovenantBreachRounds() {
        return covenantBreachRounds;
    }

    public void setCovenantBreachRounds(int covenantBreachRounds) {
        this.covenantBreachRounds = covenantBreachRounds;
    }

    public boolean isBankrupt() {
        return bankrupt;
    }

    public Integer getBankruptRound() {
        return bankruptRound;
    }

    /**
     * End the game in bankruptcy this round.
     */
    public void declareBankrupt() {
        this.bankrupt = true;
        this.bankruptRound = round;
        this.gameOver = true;
        this.requiresRestructuring = false;
    }

    // ---- Per-round counters ----

    public int getAcquisitionsThisRound() {
        return acquisitionsThisRound;
    }

    public void setAcquisitionsThisRound(int acquisitionsThisRound) {
        this.acquisitionsThisRound = acquisitionsThisRound;
    }

    public int getSourcingCount() {
        return sourcingCount;
    }

    public void setSourcingCount(int sourcingCount) {
        this.sourcingCount = sourcingCount;
    }

    public int getOutreachCount() {
        return outreachCount;
    }

    public void setOutreachCount(int outreachCount) {
        this.outreachCount = outreachCount;
    }

    /**
     * Take the next pre-rolled outcome of a kind for this round.
     */
    public double nextActionRoll(ActionRoll kind) {
        int index = actionRollCounters.getOrDefault(kind, 0);
        actionRollCounters.put(kind, index + 1);
        return ActionOutcomes.preRoll(streams().market()).roll(kind, index);
    }

    public int actionRollsUsed(ActionRoll kind) {
        return actionRollCounters.getOrDefault(kind, 0);
    }

    /**
     * Reset counters that are scoped to one round.
     */
    void resetRoundCounters() {
        acquisitionsThisRound = 0;
        sourcingCount = 0;
        outreachCount = 0;
        actionRollCounters.clear();
    }

    // ---- Lifetime totals ----

    public long getTotalInvestedCapital() {
        return totalInvestedCapital;
    }

    public void setTotalInvestedCapital(long totalInvestedCapital) {
        this.totalInvestedCapital = totalInvestedCapital;
    }

    public long getTotalDistributions() {
        return totalDistributions;
    }

    public void setTotalDistributions(long totalDistributions) {
        this.totalDistributions = totalDistributions;
    }

    public long getTotalBuybacks() {
        return totalBuybacks;
    }

    public void setTotalBuybacks(long totalBuybacks) {
        this.totalBuybacks = totalBuybacks;
    }

    public long getTotalExitProceeds() {
        return totalExitProceeds;
    }

    public void setTotalExitProceeds(long totalExitProceeds) {
        this.totalExitProceeds = totalExitProceeds;
    }

    // ---- Outputs ----

    public WaterfallResult getLastWaterfall() {
        return lastWaterfall;
    }

    public void setLastWaterfall(WaterfallResult lastWaterfall) {
        this.lastWaterfall = lastWaterfall;
    }

    public List<RoundHistoryEntry> getHistory() {
        return history;
    }

    /**
     * Metrics as of the last transition.
     */
    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public String toString() {
        return String.format("GameState[round=%d/%d phase=%s cash=%d debt=%d businesses=%d%s]",
            round, maxRounds, phase, cash, totalDebt(), activeBusinessCount(),
            bankrupt ? " BANKRUPT" : gameOver ? " OVER" : "");
    }
}
