package com.holdco.tycoon.simulation;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.ImprovementType;
import com.holdco.tycoon.deal.Deal;
import com.holdco.tycoon.deal.DealStructure;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.finance.SharedServiceType;
import com.holdco.tycoon.finance.Valuation;
import com.holdco.tycoon.game.EventChoices;
import com.holdco.tycoon.game.GameState;
import com.holdco.tycoon.game.MetricsCalculator;
import com.holdco.tycoon.game.PlayerActions;
import com.holdco.tycoon.game.Restructuring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A simple, fully deterministic player. Buys quality opcos with a cash cushion, funds the
 * operating playbook, builds shared services once the portfolio is large enough, pays down the
 * holdco loan and sells businesses that have collapsed.
 *
 * Every decision reads only the state it is given, so two runs from the same seed make the same
 * moves.
 */
public final class AutoPilot {

    // ---- Constants ----
    static final int MIN_DEAL_QUALITY = 3;
    static final long BASE_CASH_RESERVE = 500;
    static final double RESERVE_EBITDA_SHARE = 0.10;
    static final double MAX_LEVERAGE_FOR_DEBT = 2.0;
    static final long PLATFORM_EBITDA_THRESHOLD = 2000;
    static final double LOSER_EBITDA_RATIO = 0.5;

    private AutoPilot() {
        // Utility class - no instantiation
    }

    // ==================== EVENT PHASE ====================

    /**
     * Answer the pending choice event, if any. Offers are taken only above what an open-market sale
     * would fetch today.
     */
    public static GameState resolveChoice(GameState state) {
        GameEvent event = state.getCurrentEvent();
        if (event == null || state.isCurrentEventApplied() || !event.requiresChoice()) {
            return state;
        }
        switch (event.type()) {
            case UNSOLICITED_OFFER: {
                GameEvent.UnsolicitedOffer offer = (GameEvent.UnsolicitedOffer) event;
                return beatsMarket(state, offer.affectedBusinessId(), offer.offerAmount())
                    ? EventChoices.acceptOffer(state)
                    : EventChoices.declineOffer(state);
            }
            case MBO_PROPOSAL: {
                GameEvent.MboProposal proposal = (GameEvent.MboProposal) event;
                return beatsMarket(state, proposal.affectedBusinessId(), proposal.offerAmount())
                    ? EventChoices.acceptMboOffer(state)
                    : EventChoices.declineMboOffer(state);
            }
            case PORTFOLIO_EQUITY_DEMAND:
                return EventChoices.grantEquityDemand(state);
            case PORTFOLIO_SELLER_NOTE_RENEGO: {
                GameState accepted = EventChoices.acceptSellerNoteRenegotiation(state);
                return accepted != state ? accepted : EventChoices.declineSellerNoteRenegotiation(state);
            }
            default:
                return state;
        }
    }

    private static boolean beatsMarket(GameState state, String businessId, long offerAmount) {
        Business business = state.findBusiness(businessId);
        if (business == null || !business.isActive()) {
            return false;
        }
        long marketPrice = Valuation.calculateExitValuation(business, state.getRound(), state.getLastEventType())
            .exitPrice();
        return offerAmount > marketPrice;
    }

    // ==================== RESTRUCTURE PHASE ====================

    /**
     * Fire-sell the most indebted opco; with nothing left to sell, raise emergency equity, and
     * failing that, file.
     */
    public static GameState restructure(GameState state) {
        Business mostIndebted = state.activeBusinesses().stream()
            .max(Comparator.comparingLong(Business::totalObligations))
            .orElse(null);
        if (mostIndebted != null) {
            GameState sold = Restructuring.distressedSale(state, mostIndebted.getId());
            if (sold != state) {
                return sold;
            }
        }
        long shortfall = Math.max(BASE_CASH_RESERVE, -state.getCash() + BASE_CASH_RESERVE);
        GameState raised = Restructuring.emergencyEquityRaise(state, shortfall);
        return raised != state ? raised : Restructuring.declareBankruptcy(state);
    }

    // ==================== ALLOCATE PHASE ====================

    public static GameState allocate(GameState state) {
        GameState next = sellLosers(state);
        next = acquireDeals(next);
        next = investInOperations(next);
        next = manageCapital(next);
        return next;
    }

    static long cashReserve(GameState state) {
        return BASE_CASH_RESERVE + Math.round(Math.max(0, state.totalEbitda()) * RESERVE_EBITDA_SHARE);
    }

    private static GameState sellLosers(GameState state) {
        GameState next = state;
        for (Business business : state.activeBusinesses()) {
            boolean collapsed = business.getAcquisitionEbitda() > 0
                && business.getEbitda() < business.getAcquisitionEbitda() * LOSER_EBITDA_RATIO;
            if (collapsed && next.activeBusinessCount() > 1) {
                next = PlayerActions.sell(next, business.getId());
            }
        }
        return next;
    }

    private static GameState acquireDeals(GameState state) {
        GameState next = state;
        while (PlayerActions.canAcquire(next)) {
            GameState bought = acquireBestDeal(next);
            if (bought == next) {
                break;
            }
            next = bought;
        }
        return next;
    }

    /**
     * Try deals best-first until one is accepted. Returns the input when none can be bought.
     */
    private static GameState acquireBestDeal(GameState state) {
        List<Deal> candidates = new ArrayList<>();
        for (Deal deal : state.getDealPipeline()) {
            if (deal.getBusiness().getQualityRating() >= MIN_DEAL_QUALITY) {
                candidates.add(deal);
            }
        }
        candidates.sort(Comparator
            .comparingInt((Deal d) -> -d.getBusiness().getQualityRating())
            .thenComparingLong(Deal::getEffectivePrice)
            .thenComparing(Deal::getId));

        long spendable = state.getCash() - cashReserve(state);
        boolean debtAllowed = state.getMetrics().netDebtToEbitda() < MAX_LEVERAGE_FOR_DEBT;
        for (Deal deal : candidates) {
            for (DealStructure structure : PlayerActions.availableStructures(state, deal)) {
                if (structure.cashRequired() > spendable || (!debtAllowed && structure.debtAmount() > 0)) {
                    continue;
                }
                Business platform = platformFor(state, deal.getBusiness().getSectorId());
                GameState next = platform != null
                    ? PlayerActions.acquireTuckIn(state, deal.getId(), structure.type(), platform.getId())
                    : PlayerActions.acquire(state, deal.getId(), structure.type());
                if (next == state && platform != null) {
                    next = PlayerActions.acquire(state, deal.getId(), structure.type());
                }
                if (next != state) {
                    return next;
                }
            }
        }
        return state;
    }

    private static Business platformFor(GameState state, String sectorId) {
        for (Business business : state.activeBusinesses()) {
            if (business.isPlatform() && business.getSectorId().equals(sectorId)) {
                return business;
            }
        }
        return null;
    }

    private static GameState investInOperations(GameState state) {
        GameState next = state;
        for (Business business : state.activeBusinesses()) {
            if (next.getCash() < cashReserve(next) * 2) {
                break;
            }
            if (!business.isPlatform() && business.getEbitda() >= PLATFORM_EBITDA_THRESHOLD) {
                next = PlayerActions.designatePlatform(next, business.getId());
            }
            if (!business.hasImprovement(ImprovementType.OPERATING_PLAYBOOK)) {
                next = PlayerActions.improve(next, business.getId(), ImprovementType.OPERATING_PLAYBOOK);
            }
        }
        if (next.activeBusinessCount() >= SharedServiceType.MIN_OPCOS
            && next.getActiveSharedServices().isEmpty()
            && next.getCash() > cashReserve(next) + SharedServiceType.FINANCE_REPORTING.getUnlockCost()) {
            next = PlayerActions.unlockSharedService(next, SharedServiceType.FINANCE_REPORTING);
        }
        return next;
    }

    private static GameState manageCapital(GameState state) {
        GameState next = state;
        long excess = next.getCash() - cashReserve(next) * 3;
        if (next.getHoldcoLoanBalance() > 0 && excess > 0) {
            next = PlayerActions.payDownHoldcoDebt(next, Math.min(excess, next.getHoldcoLoanBalance()));
        }
        boolean finalRound = next.getRound() == next.getMaxRounds();
        double leverage = MetricsCalculator.netDebtToEbitda(next.totalDebt(), next.getCash(), next.totalEbitda());
        long distributable = next.getCash() - cashReserve(next) * 2;
        if (finalRound && leverage < 1.0 && distributable > 0) {
            next = PlayerActions.distribute(next, distributable);
        }
        return next;
    }
}
