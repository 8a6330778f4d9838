package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessGenerator;
import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.config.GameDuration;
import com.holdco.tycoon.event.EventImpact;
import com.holdco.tycoon.event.EventType;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.rng.SeededRng;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventResolverTest {

    private static final String START = BusinessGenerator.STARTING_BUSINESS_ID;

    private static GameData data;

    @BeforeAll
    static void loadData() throws Exception {
        data = GameData.loadDefault();
    }

    @Test
    void testInterestHikeAppliesImmediately() {
        GameState state = eventState();
        GameEvent hike = market(EventType.GLOBAL_INTEREST_HIKE);

        GameState next = EventResolver.applyEventEffects(state, hike, new SeededRng(3));

        assertTrue(next.isCurrentEventApplied());
        assertSame(hike, next.getCurrentEvent());
        double raise = next.getInterestRate() - state.getInterestRate();
        assertTrue(raise > 0.01 - 1e-9 && raise < 0.02 + 1e-9, "Raise was " + raise);
        assertEquals(EventImpact.Metric.INTEREST_RATE, next.getCurrentEventImpacts().get(0).metric());
        assertEquals(RoundManager.STARTING_INTEREST_RATE, state.getInterestRate(), "Input untouched");
    }

    @Test
    void testInterestRateCapped() {
        GameState state = eventState().copy();
        state.setInterestRate(0.145);

        GameState next = EventResolver.applyEventEffects(state, market(EventType.GLOBAL_INTEREST_HIKE),
            new SeededRng(3));

        assertEquals(EventResolver.MAX_INTEREST_RATE, next.getInterestRate(), 1e-9);
    }

    @Test
    void testMacroShocksStartCounters() {
        GameState state = eventState();

        GameState tight = EventResolver.applyEventEffects(state, market(EventType.GLOBAL_CREDIT_TIGHTENING),
            new SeededRng(3));
        assertEquals(EventResolver.MACRO_COUNTER_ROUNDS, tight.getCreditTighteningRoundsRemaining());
        assertTrue(tight.isCreditTightening());

        GameState inflation = EventResolver.applyEventEffects(state, market(EventType.GLOBAL_INFLATION),
            new SeededRng(3));
        assertEquals(EventResolver.MACRO_COUNTER_ROUNDS, inflation.getInflationRoundsRemaining());
        assertTrue(inflation.isInflationActive());
    }

    @Test
    void testPortfolioEventHitsAffectedBusiness() {
        GameState state = eventState();
        long before = state.findBusiness(START).getEbitda();

        GameState next = EventResolver.applyEventEffects(state, new GameEvent.PortfolioEvent("r1-star",
            EventType.PORTFOLIO_STAR_JOINS, "Star Hire", "", START), new SeededRng(3));

        assertEquals(Math.round(before * 1.12), next.findBusiness(START).getEbitda());
        assertEquals(before, state.findBusiness(START).getEbitda());
        assertFalse(next.getCurrentEventImpacts().isEmpty());
    }

    @Test
    void testComplianceChargesCash() {
        GameState state = eventState();

        GameState next = EventResolver.applyEventEffects(state, new GameEvent.PortfolioEvent("r1-compliance",
            EventType.PORTFOLIO_COMPLIANCE, "Compliance Issue", "", START), new SeededRng(3));

        assertEquals(state.getCash() - EventResolver.COMPLIANCE_COST, next.getCash());
    }

    @Test
    void testChoiceEventDefersEffects() {
        GameState state = eventState();
        Business before = state.findBusiness(START);
        GameEvent offer = new GameEvent.UnsolicitedOffer("r1-offer", "Unsolicited Offer", "", START,
            9000, 9.0, "Strategic buyer", true);

        GameState next = EventResolver.applyEventEffects(state, offer, new SeededRng(3));

        assertSame(offer, next.getCurrentEvent());
        assertFalse(next.isCurrentEventApplied(), "Waits for the player's answer");
        assertTrue(next.getCurrentEventImpacts().isEmpty());
        assertEquals(state.getCash(), next.getCash());
        assertEquals(before.getStatus(), next.findBusiness(START).getStatus());
        assertEquals(before.getEbitda(), next.findBusiness(START).getEbitda());
    }

    @Test
    void testSameStreamSameEffects() {
        GameState state = eventState();
        GameEvent hike = market(EventType.GLOBAL_INTEREST_HIKE);

        GameState first = EventResolver.applyEventEffects(state, hike, new SeededRng(11));
        GameState second = EventResolver.applyEventEffects(state, hike, new SeededRng(11));

        assertEquals(first.getInterestRate(), second.getInterestRate());
    }

    private static GameState eventState() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.NORMAL, GameDuration.STANDARD).copy();
        state.setPhase(Phase.EVENT);
        return MetricsCalculator.refresh(state);
    }

    private static GameEvent market(EventType type) {
        return new GameEvent.MarketEvent("event_1_" + type.getJsonValue(), type, "Market", "");
    }
}
