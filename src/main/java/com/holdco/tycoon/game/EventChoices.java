package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.event.EventImpact;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.rng.ActionRoll;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves choice events during the event phase.
 *
 * Each resolution applies to the pending event of its own kind only; anything else is a no-op that
 * returns the input. Once resolved, the event counts as applied and the round can move on to
 * allocation. Random outcomes use this round's pre-rolled event-decline slots.
 */
public final class EventChoices {
    private static final Logger logger = LoggerFactory.getLogger(EventChoices.class);

    public static final double EQUITY_DEMAND_DEPARTURE_CHANCE = 0.60;
    public static final double MBO_CEO_DEPARTURE_CHANCE = 0.40;

    private EventChoices() {
        // Utility class - prevent instantiation
    }

    // ==================== UNSOLICITED OFFER ====================

    public static GameState acceptOffer(GameState state) {
        GameEvent.UnsolicitedOffer offer = pending(state, GameEvent.UnsolicitedOffer.class);
        if (offer == null) {
            return state;
        }
        return sellAtOffer(state, offer.affectedBusinessId(), offer.offerAmount());
    }

    public static GameState declineOffer(GameState state) {
        return pending(state, GameEvent.UnsolicitedOffer.class) == null ? state : resolve(state.copy(), List.of());
    }

    // ==================== EQUITY DEMAND ====================

    /**
     * Management gets its stake: dilution for the holdco, a better-run business in return.
     */
    public static GameState grantEquityDemand(GameState state) {
        GameEvent.EquityDemand demand = pending(state, GameEvent.EquityDemand.class);
        if (demand == null) {
            return state;
        }
        GameState next = state.copy();
        List<EventImpact> impacts = new ArrayList<>();
        double sharesBefore = next.getSharesOutstanding();
        next.setSharesOutstanding(sharesBefore + demand.sharesRequested());
        impacts.add(EventImpact.holdco(EventImpact.Metric.SHARES, sharesBefore, next.getSharesOutstanding()));

        Business business = next.findBusiness(demand.affectedBusinessId());
        if (business != null && business.isActive()) {
            adjustMargin(business, 0.01, impacts);
            EventResolver.adjustGrowth(business, 0.02, impacts);
        }
        return resolve(next, impacts);
    }

    /**
     * Management is refused; with some probability the team walks and takes clients with it.
     */
    public static GameState declineEquityDemand(GameState state) {
        GameEvent.EquityDemand demand = pending(state, GameEvent.EquityDemand.class);
        if (demand == null) {
            return state;
        }
        GameState next = state.copy();
        List<EventImpact> impacts = new ArrayList<>();
        double roll = next.nextActionRoll(ActionRoll.EVENT_DECLINE);
        Business business = next.findBusiness(demand.affectedBusinessId());
        if (roll < EQUITY_DEMAND_DEPARTURE_CHANCE && business != null && business.isActive()) {
            long before = business.getEbitda();
            business.setRevenue(Math.round(business.getRevenue() * 0.94));
            business.setEbitdaMargin(Business.clampMargin(business.getEbitdaMargin() - 0.02));
            business.recomputeEbitda();
            impacts.add(EventImpact.business(business.getId(), business.getName(), EventImpact.Metric.EBITDA,
                before, business.getEbitda()));
            EventResolver.adjustGrowth(business, -0.015, impacts);
            logger.debug("Round {}: management of {} left after equity demand was declined",
                next.getRound(), business.getName());
        }
        return resolve(next, impacts);
    }

    // ==================== SELLER NOTE RENEGOTIATION ====================

    /**
     * Retire the seller note at the offered discount.
     */
    public static GameState acceptSellerNoteRenegotiation(GameState state) {
        GameEvent.SellerNoteRenegotiation renegotiation = pending(state, GameEvent.SellerNoteRenegotiation.class);
        if (renegotiation == null) {
            return state;
        }
        Business business = state.findBusiness(renegotiation.affectedBusinessId());
        if (business == null || !business.getStatus().isOwned() || business.getSellerNoteBalance() <= 0) {
            return state;
        }
        long payoff = Math.round(business.getSellerNoteBalance() * renegotiation.discountRate());
        if (state.getCash() < payoff) {
            return state;
        }

        GameState next = state.copy();
        Business target = next.findBusiness(renegotiation.affectedBusinessId());
        List<EventImpact> impacts = new ArrayList<>();
        impacts.add(EventImpact.holdco(EventImpact.Metric.CASH, next.getCash(), next.getCash() - payoff));
        next.addCash(-payoff);
        target.setSellerNoteBalance(0);
        target.setSellerNoteRoundsRemaining(0);
        return resolve(next, impacts);
    }

    public static GameState declineSellerNoteRenegotiation(GameState state) {
        return pending(state, GameEvent.SellerNoteRenegotiation.class) == null
            ? state
            : resolve(state.copy(), List.of());
    }

    // ==================== MBO PROPOSAL ====================

    public static GameState acceptMboOffer(GameState state) {
        GameEvent.MboProposal proposal = pending(state, GameEvent.MboProposal.class);
        if (proposal == null) {
            return state;
        }
        return sellAtOffer(state, proposal.affectedBusinessId(), proposal.offerAmount());
    }

    /**
     * Turning management down: either the CEO leaves (quality and margin drop) or stays on with
     * less drive (growth drops).
     */
    public static GameState declineMboOffer(GameState state) {
        GameEvent.MboProposal proposal = pending(state, GameEvent.MboProposal.class);
        if (proposal == null) {
            return state;
        }
        GameState next = state.copy();
        List<EventImpact> impacts = new ArrayList<>();
        double roll = next.nextActionRoll(ActionRoll.EVENT_DECLINE);
        Business business = next.findBusiness(proposal.affectedBusinessId());
        if (business != null && business.isActive()) {
            if (roll < MBO_CEO_DEPARTURE_CHANCE) {
                int quality = business.getQualityRating();
                business.setQualityRating(Math.max(1, quality - 1));
                impacts.add(EventImpact.business(business.getId(), business.getName(), EventImpact.Metric.QUALITY,
                    quality, business.getQualityRating()));
                adjustMargin(business, -0.015, impacts);
            } else {
                EventResolver.adjustGrowth(business, -0.02, impacts);
            }
        }
        return resolve(next, impacts);
    }

    // ==================== HELPERS ====================

    /**
     * The unresolved choice event of the given kind, or null.
     */
    static <T extends GameEvent> T pending(GameState state, Class<T> kind) {
        if (state.isGameOver() || state.getPhase() != Phase.EVENT || state.isCurrentEventApplied()) {
            return null;
        }
        GameEvent event = state.getCurrentEvent();
        return kind.isInstance(event) ? kind.cast(event) : null;
    }

    private static GameState sellAtOffer(GameState state, String businessId, long offerAmount) {
        Business business = state.findBusiness(businessId);
        if (business == null || !business.isActive()) {
            return state;
        }
        GameState next = state.copy();
        Business target = next.findBusiness(businessId);
        long cashBefore = next.getCash();
        long net = Exits.completeSale(next, target, offerAmount);
        logger.debug("Round {}: accepted {} for {} (net {})", next.getRound(), target.getName(), offerAmount, net);
        List<EventImpact> impacts = new ArrayList<>();
        impacts.add(EventImpact.holdco(EventImpact.Metric.CASH, cashBefore, next.getCash()));
        return resolve(next, impacts);
    }

    private static void adjustMargin(Business business, double delta, List<EventImpact> impacts) {
        long before = business.getEbitda();
        business.setEbitdaMargin(Business.clampMargin(business.getEbitdaMargin() + delta));
        business.recomputeEbitda();
        impacts.add(EventImpact.business(business.getId(), business.getName(), EventImpact.Metric.EBITDA,
            before, business.getEbitda()));
    }

    private static GameState resolve(GameState next, List<EventImpact> impacts) {
        next.setCurrentEventApplied(true);
        next.setCurrentEventImpacts(impacts);
        return MetricsCalculator.refresh(next);
    }
}
