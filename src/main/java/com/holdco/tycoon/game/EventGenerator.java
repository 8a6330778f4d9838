package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.deal.SellerArchetype;
import com.holdco.tycoon.event.EventDefinition;
import com.holdco.tycoon.event.EventType;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.finance.BuyerPoolTier;
import com.holdco.tycoon.finance.ExitValuation;
import com.holdco.tycoon.finance.SharedServiceBenefits;
import com.holdco.tycoon.finance.Valuation;
import com.holdco.tycoon.rng.SeededRng;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Draws the round's event from the probability tables.
 *
 * Tables are tried in priority order (global, portfolio, sector, unsolicited offer) with one roll
 * each, and a quiet year when none fires. Eligibility is checked against the state passed in, so
 * it always reflects the portfolio at draw time.
 */
public final class EventGenerator {

    /** Shares management asks for in an equity demand. */
    public static final double EQUITY_DEMAND_SHARES = 25;

    /** Seller-note renegotiation is only offered this many rounds after the acquisition. */
    public static final int RENEGOTIATION_WINDOW_ROUNDS = 4;

    /** Minimum hold before an MBO candidate's team proposes a buyout. */
    public static final int MBO_MIN_HOLD_ROUNDS = 2;

    private static final List<String> BUYER_NAMES = List.of(
        "Summit Ridge Capital", "Harbor Point Partners", "Granite Peak Equity", "Northlight Holdings",
        "Blue Heron Capital", "Ironwood Partners", "Cedar Lane Group", "Meridian Strategic");

    private EventGenerator() {
        // Utility class - prevent instantiation
    }

    /**
     * Draw one event. Consumes the events stream in table order; never returns null.
     */
    public static GameEvent generateEvent(GameState state, SeededRng rng) {
        int round = state.getRound();
        List<Business> active = state.activeBusinesses();

        double globalRoll = rng.next();
        double cumulative = 0;
        for (EventDefinition definition : state.getData().events().globalEvents()) {
            cumulative += definition.getProbability();
            if (globalRoll < cumulative) {
                return new GameEvent.MarketEvent(eventId(round, definition.getType()), definition.getType(),
                    definition.getTitle(), definition.getDescription());
            }
        }

        if (!active.isEmpty()) {
            GameEvent portfolioEvent = rollPortfolioEvent(state, active, rng);
            if (portfolioEvent != null) {
                return portfolioEvent;
            }
        }

        GameEvent sectorEvent = rollSectorEvent(state, active, rng);
        if (sectorEvent != null) {
            return sectorEvent;
        }

        if (!active.isEmpty()) {
            double offerChance = 1 - Math.pow(0.95, active.size());
            if (rng.next() < offerChance) {
                return unsolicitedOffer(state, rng.pick(active), rng);
            }
        }

        return new GameEvent.QuietYear("event_" + round + "_quiet");
    }

    private static GameEvent rollPortfolioEvent(GameState state, List<Business> active, SeededRng rng) {
        SharedServiceBenefits benefits = MetricsCalculator.sharedServiceBenefits(state);
        double roll = rng.next();
        double cumulative = 0;
        for (EventDefinition definition : state.getData().events().portfolioEvents()) {
            double probability = definition.getProbability();
            if (definition.getType() == EventType.PORTFOLIO_TALENT_LEAVES) {
                probability *= Math.max(0, 1 - benefits.talentRetentionBonus());
            } else if (definition.getType() == EventType.PORTFOLIO_STAR_JOINS) {
                probability *= 1 + benefits.talentGainBonus();
            }
            cumulative += probability;
            if (roll < Math.min(1.0, cumulative)) {
                return portfolioEvent(state, definition, active, rng);
            }
        }
        return null;
    }

    /**
     * Build the selected portfolio event, or null when no business is eligible for it.
     */
    private static GameEvent portfolioEvent(GameState state, EventDefinition definition, List<Business> active,
                                            SeededRng rng) {
        int round = state.getRound();
        EventType type = definition.getType();
        String id = eventId(round, type);
        switch (type) {
            case PORTFOLIO_REFERRAL_DEAL: {
                Business referrer = rng.pick(active);
                return new GameEvent.ReferralDeal(id, definition.getTitle(),
                    "The CEO of " + referrer.getName() + " introduces you to a seller.", referrer.getId());
            }
            case PORTFOLIO_EQUITY_DEMAND: {
                List<Business> eligible = new ArrayList<>();
                for (Business business : active) {
                    if (business.getQualityRating() >= 3) {
                        eligible.add(business);
                    }
                }
                Business target = rng.pick(eligible);
                if (target == null) {
                    return null;
                }
                return new GameEvent.EquityDemand(id, definition.getTitle(),
                    "The management team of " + target.getName() + " asks for a stake in the company.",
                    target.getId(), EQUITY_DEMAND_SHARES);
            }
            case PORTFOLIO_SELLER_NOTE_RENEGO: {
                List<Business> eligible = new ArrayList<>();
                for (Business business : active) {
                    if (business.getSellerNoteBalance() > 0
                        && round - business.getAcquisitionRound() <= RENEGOTIATION_WINDOW_ROUNDS) {
                        eligible.add(business);
                    }
                }
                Business target = rng.pick(eligible);
                if (target == null) {
                    return null;
                }
                double discountRate = rng.nextInRange(0.70, 0.80);
                long payoff = Math.round(target.getSellerNoteBalance() * discountRate);
                return new GameEvent.SellerNoteRenegotiation(id, definition.getTitle(),
                    "The former owner of " + target.getName() + " offers to settle their note early.",
                    target.getId(), target.getSellerNoteBalance(), discountRate, payoff);
            }
            case MBO_PROPOSAL: {
                List<Business> eligible = new ArrayList<>();
                for (Business business : active) {
                    if (business.getSellerArchetype() == SellerArchetype.MBO_CANDIDATE
                        && round - business.getAcquisitionRound() >= MBO_MIN_HOLD_ROUNDS) {
                        eligible.add(business);
                    }
                }
                Business target = rng.pick(eligible);
                if (target == null) {
                    return null;
                }
                ExitValuation valuation = Valuation.calculateExitValuation(target, round, state.getLastEventType());
                double multiple = Math.max(Valuation.MULTIPLE_FLOOR,
                    valuation.totalMultiple() * rng.nextInRange(0.85, 1.0));
                long offer = Math.round(Math.max(0, target.getEbitda()) * multiple);
                return new GameEvent.MboProposal(id, definition.getTitle(),
                    "The management team of " + target.getName() + " wants to buy the business.",
                    target.getId(), offer, multiple);
            }
            default: {
                Business target = rng.pick(active);
                return new GameEvent.PortfolioEvent(id, type, definition.getTitle(), definition.getDescription(),
                    target.getId());
            }
        }
    }

    private static GameEvent rollSectorEvent(GameState state, List<Business> active, SeededRng rng) {
        Set<String> ownedSectors = new LinkedHashSet<>();
        for (Business business : active) {
            ownedSectors.add(business.getSectorId());
        }
        List<EventDefinition> applicable = new ArrayList<>();
        for (EventDefinition definition : state.getData().events().sectorEvents()) {
            if (ownedSectors.contains(definition.getSectorId())) {
                applicable.add(definition);
            }
        }
        if (applicable.isEmpty()) {
            return null;
        }

        double roll = rng.next();
        double cumulative = 0;
        for (EventDefinition definition : applicable) {
            cumulative += definition.getProbability();
            if (roll < cumulative) {
                String affected = null;
                if (!definition.isAffectsAll()) {
                    List<Business> inSector = new ArrayList<>();
                    for (Business business : active) {
                        if (business.getSectorId().equals(definition.getSectorId())) {
                            inSector.add(business);
                        }
                    }
                    affected = rng.pick(inSector).getId();
                }
                String id = "event_" + state.getRound() + "_" + definition.getSectorId() + "_"
                    + definition.getTitle().replaceAll("\\s+", "_");
                return new GameEvent.SectorEvent(id, definition.getTitle(), definition.getDescription(),
                    definition, affected);
            }
        }
        return null;
    }

    private static GameEvent unsolicitedOffer(GameState state, Business business, SeededRng rng) {
        ExitValuation valuation = Valuation.calculateExitValuation(business, state.getRound(),
            state.getLastEventType());
        double strategicChance = valuation.buyerPoolTier() == BuyerPoolTier.INDIVIDUAL ? 0.15 : 0.30;
        boolean strategic = rng.next() < strategicChance;
        double premium = strategic ? rng.nextInRange(0.5, 1.5) : 0;
        String buyer = rng.pick(BUYER_NAMES);

        double multiple = (valuation.totalMultiple() + premium) * rng.nextInRange(0.9, 1.2);
        multiple = Math.max(Valuation.MULTIPLE_FLOOR, multiple);
        long offer = Math.round(Math.max(0, business.getEbitda()) * multiple);

        String label = strategic ? "Strategic acquirer " + buyer : buyer;
        String description = String.format("%s offers to acquire %s for %d (%.1fx EBITDA).",
            label, business.getName(), offer, multiple);
        return new GameEvent.UnsolicitedOffer("event_" + state.getRound() + "_unsolicited_" + business.getId(),
            "Unsolicited Acquisition Offer", description, business.getId(), offer, multiple, buyer, strategic);
    }

    private static String eventId(int round, EventType type) {
        return "event_" + round + "_" + type.getJsonValue();
    }
}
