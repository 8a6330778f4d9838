package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.deal.Deal;
import com.holdco.tycoon.deal.DealGenerator;
import com.holdco.tycoon.event.EventDefinition;
import com.holdco.tycoon.event.EventImpact;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.rng.SeededRng;
import com.holdco.tycoon.sector.ConcentrationLevel;
import com.holdco.tycoon.sector.SectorDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies an event's immediate effects.
 */
public final class EventResolver {

    public static final double MAX_INTEREST_RATE = 0.15;
    public static final double MIN_INTEREST_RATE = 0.03;
    public static final int MACRO_COUNTER_ROUNDS = 2;
    public static final long COMPLIANCE_COST = 500;

    private EventResolver() {
        // Utility class - prevent instantiation
    }

    /**
     * Apply an event and make it the current event.
     *
     * Choice events are recorded but change nothing; their effects belong to the player's choice.
     *
     * @param rng stream for effect sizes; pass the same stream to reproduce the same effects
     * @return a new state, the input is unchanged
     */
    public static GameState applyEventEffects(GameState state, GameEvent event, SeededRng rng) {
        GameState next = state.copy();
        next.setCurrentEvent(event);
        if (event.requiresChoice()) {
            next.setCurrentEventApplied(false);
            next.setCurrentEventImpacts(List.of());
            return MetricsCalculator.refresh(next);
        }

        List<EventImpact> impacts = new ArrayList<>();
        switch (event.type()) {
            case GLOBAL_BULL_MARKET -> {
                double boost = rng.nextInRange(0.05, 0.15);
                for (Business business : next.getBusinesses()) {
                    if (business.isActive()) {
                        scaleEbitda(business, 1 + boost, impacts);
                    }
                }
            }
            case GLOBAL_RECESSION -> {
                for (Business business : next.getBusinesses()) {
                    if (business.isActive()) {
                        SectorDefinition sector = next.getSectors().getSector(business.getSectorId());
                        scaleEbitda(business, 1 - sector.getRecessionSensitivity() * 0.15, impacts);
                    }
                }
            }
            case GLOBAL_INTEREST_HIKE -> {
                double before = next.getInterestRate();
                double after = Math.min(MAX_INTEREST_RATE, before + rng.nextInRange(0.01, 0.02));
                next.setInterestRate(after);
                impacts.add(EventImpact.holdco(EventImpact.Metric.INTEREST_RATE, before, after));
            }
            case GLOBAL_INTEREST_CUT -> {
                double before = next.getInterestRate();
                double after = Math.max(MIN_INTEREST_RATE, before - rng.nextInRange(0.01, 0.02));
                next.setInterestRate(after);
                impacts.add(EventImpact.holdco(EventImpact.Metric.INTEREST_RATE, before, after));
            }
            case GLOBAL_INFLATION -> next.setInflationRoundsRemaining(MACRO_COUNTER_ROUNDS);
            case GLOBAL_CREDIT_TIGHTENING -> next.setCreditTighteningRoundsRemaining(MACRO_COUNTER_ROUNDS);
            case GLOBAL_QUIET -> {
                // nothing happens
            }
            case PORTFOLIO_STAR_JOINS -> {
                Business business = affected(next, event);
                if (business != null) {
                    scaleEbitda(business, 1.12, impacts);
                    adjustGrowth(business, 0.02, impacts);
                }
            }
            case PORTFOLIO_TALENT_LEAVES -> {
                Business business = affected(next, event);
                if (business != null) {
                    scaleEbitda(business, 0.90, impacts);
                    adjustGrowth(business, -0.015, impacts);
                }
            }
            case PORTFOLIO_CLIENT_SIGNS -> {
                Business business = affected(next, event);
                if (business != null) {
                    scaleEbitda(business, 1 + rng.nextInRange(0.08, 0.12), impacts);
                }
            }
            case PORTFOLIO_CLIENT_CHURNS -> {
                Business business = affected(next, event);
                if (business != null) {
                    SectorDefinition sector = next.getSectors().getSector(business.getSectorId());
                    double impact = rng.nextInRange(0.12, 0.18) * concentrationFactor(sector.getClientConcentration());
                    scaleEbitda(business, 1 - impact, impacts);
                }
            }
            case PORTFOLIO_BREAKTHROUGH -> {
                Business business = affected(next, event);
                if (business != null) {
                    scaleEbitda(business, 1.06, impacts);
                }
            }
            case PORTFOLIO_COMPLIANCE -> {
                Business business = affected(next, event);
                if (business != null) {
                    scaleEbitda(business, 0.92, impacts);
                    chargeCash(next, COMPLIANCE_COST, impacts);
                }
            }
            case PORTFOLIO_REFERRAL_DEAL -> {
                Deal referral = DealGenerator.generateReferralDeal(RoundManager.dealFlowContext(next),
                    next.getSectors(), next.streams().deals());
                next.getDealPipeline().add(referral);
            }
            case SECTOR_EVENT -> applySectorEvent(next, (GameEvent.SectorEvent) event, rng, impacts);
            case PORTFOLIO_EQUITY_DEMAND, PORTFOLIO_SELLER_NOTE_RENEGO, UNSOLICITED_OFFER, MBO_PROPOSAL ->
                throw new IllegalStateException("Choice event reached immediate resolution: " + event.type());
        }

        next.setCurrentEventApplied(true);
        next.setCurrentEventImpacts(impacts);
        return MetricsCalculator.refresh(next);
    }

    private static void applySectorEvent(GameState state, GameEvent.SectorEvent event, SeededRng rng,
                                         List<EventImpact> impacts) {
        EventDefinition definition = event.definition();
        double[] range = definition.getEbitdaEffect();
        double effect = range[0] == range[1] ? range[0] : rng.nextInRange(range[0], range[1]);

        for (Business business : state.getBusinesses()) {
            boolean hit = definition.isAffectsAll()
                ? business.isActive() && business.getSectorId().equals(definition.getSectorId())
                : business.isActive() && business.getId().equals(event.affectedBusinessId());
            if (!hit) {
                continue;
            }
            scaleEbitda(business, 1 + effect, impacts);
            if (definition.getGrowthEffect() != 0) {
                adjustGrowth(business, definition.getGrowthEffect(), impacts);
            }
        }
        if (definition.getCostAmount() > 0) {
            chargeCash(state, definition.getCostAmount(), impacts);
        }
    }

    /**
     * The event's target if it is still active.
     */
    private static Business affected(GameState state, GameEvent event) {
        Business business = state.findBusiness(event.affectedBusinessId());
        return business != null && business.isActive() ? business : null;
    }

    static double concentrationFactor(ConcentrationLevel level) {
        return switch (level) {
            case HIGH -> 1.3;
            case MEDIUM -> 1.0;
            case LOW -> 0.7;
        };
    }

    /**
     * Scale EBITDA at constant margin, so the change carries into next year's growth.
     */
    static void scaleEbitda(Business business, double factor, List<EventImpact> impacts) {
        long before = business.getEbitda();
        long after = Math.round(before * factor);
        business.setRevenue(Math.round(business.getRevenue() * factor));
        business.setEbitda(after);
        business.setPeakEbitda(Math.max(business.getPeakEbitda(), after));
        business.setPeakRevenue(Math.max(business.getPeakRevenue(), business.getRevenue()));
        impacts.add(EventImpact.business(business.getId(), business.getName(), EventImpact.Metric.EBITDA,
            before, after));
    }

    static void adjustGrowth(Business business, double delta, List<EventImpact> impacts) {
        double before = business.getOrganicGrowthRate();
        double after = OrganicGrowth.capGrowthRate(before + delta);
        business.setOrganicGrowthRate(after);
        impacts.add(EventImpact.business(business.getId(), business.getName(), EventImpact.Metric.GROWTH_RATE,
            before, after));
    }

    /**
     * Charge a cost, never taking cash below zero.
     */
    static void chargeCash(GameState state, long amount, List<EventImpact> impacts) {
        long before = state.getCash();
        long charged = Math.min(amount, Math.max(0, before));
        state.setCash(before - charged);
        impacts.add(EventImpact.holdco(EventImpact.Metric.CASH, before, before - charged));
    }
}
