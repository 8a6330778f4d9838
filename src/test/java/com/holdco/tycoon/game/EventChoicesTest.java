package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessGenerator;
import com.holdco.tycoon.business.BusinessStatus;
import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.config.GameDuration;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.rng.ActionRoll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventChoicesTest {

    private static final String START = BusinessGenerator.STARTING_BUSINESS_ID;

    private static GameData data;

    @BeforeAll
    static void loadData() throws Exception {
        data = GameData.loadDefault();
    }

    @Test
    void testAcceptOfferSellsBusiness() {
        GameState state = pendingEvent(new GameEvent.UnsolicitedOffer("r1-offer", "Unsolicited Offer", "",
            START, 9000, 9.0, "Strategic buyer", true));

        GameState next = EventChoices.acceptOffer(state);

        Business sold = next.findBusiness(START);
        assertEquals(BusinessStatus.SOLD, sold.getStatus());
        assertEquals(9000L, sold.getExitPrice());
        assertEquals(state.getCash() + 9000, next.getCash(), "No debt, so the whole offer is net");
        assertTrue(next.isCurrentEventApplied());
        assertFalse(next.getCurrentEventImpacts().isEmpty());
    }

    @Test
    void testDeclineOfferKeepsBusiness() {
        GameState state = pendingEvent(new GameEvent.UnsolicitedOffer("r1-offer", "Unsolicited Offer", "",
            START, 9000, 9.0, "Strategic buyer", true));

        GameState next = EventChoices.declineOffer(state);

        assertTrue(next.isCurrentEventApplied());
        assertEquals(BusinessStatus.ACTIVE, next.findBusiness(START).getStatus());
        assertEquals(state.getCash(), next.getCash());
    }

    @Test
    void testResolutionMustMatchPendingEvent() {
        GameState state = pendingEvent(new GameEvent.UnsolicitedOffer("r1-offer", "Unsolicited Offer", "",
            START, 9000, 9.0, "Strategic buyer", true));

        assertSame(state, EventChoices.grantEquityDemand(state));
        assertSame(state, EventChoices.acceptMboOffer(state));
        assertSame(state, EventChoices.declineSellerNoteRenegotiation(state));

        GameState resolved = EventChoices.declineOffer(state);
        assertSame(resolved, EventChoices.acceptOffer(resolved), "Already resolved");
    }

    @Test
    void testNoPendingEventOutsideEventPhase() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.EASY, GameDuration.STANDARD);
        assertSame(state, EventChoices.declineOffer(state));
        assertSame(state, EventChoices.declineMboOffer(state));
    }

    @Test
    void testGrantEquityDemand() {
        GameState state = pendingEvent(new GameEvent.EquityDemand("r1-equity", "Equity Demand", "", START, 25.0));
        Business before = state.findBusiness(START);

        GameState next = EventChoices.grantEquityDemand(state);

        assertEquals(state.getSharesOutstanding() + 25.0, next.getSharesOutstanding(), 1e-9);
        Business after = next.findBusiness(START);
        assertEquals(before.getEbitdaMargin() + 0.01, after.getEbitdaMargin(), 1e-9);
        assertTrue(after.getOrganicGrowthRate() >= before.getOrganicGrowthRate());
    }

    @Test
    void testDeclineEquityDemandIsDeterministic() {
        GameState state = pendingEvent(new GameEvent.EquityDemand("r1-equity", "Equity Demand", "", START, 25.0));

        GameState a = EventChoices.declineEquityDemand(state);
        GameState b = EventChoices.declineEquityDemand(state);

        assertEquals(1, a.actionRollsUsed(ActionRoll.EVENT_DECLINE));
        assertEquals(a.findBusiness(START).getEbitda(), b.findBusiness(START).getEbitda());
        assertTrue(a.findBusiness(START).getEbitda() <= state.findBusiness(START).getEbitda());
        assertEquals(state.getSharesOutstanding(), a.getSharesOutstanding(), 1e-9);
    }

    @Test
    void testAcceptSellerNoteRenegotiation() {
        GameState state = pendingEvent(new GameEvent.SellerNoteRenegotiation("r1-note", "Note Renegotiation", "",
            START, 1000, 0.7, 700));
        state.findBusiness(START).setSellerNoteBalance(1000);
        state.findBusiness(START).setSellerNoteRoundsRemaining(3);

        GameState next = EventChoices.acceptSellerNoteRenegotiation(state);

        assertEquals(state.getCash() - 700, next.getCash());
        assertEquals(0, next.findBusiness(START).getSellerNoteBalance());
        assertEquals(0, next.findBusiness(START).getSellerNoteRoundsRemaining());
        assertTrue(next.isCurrentEventApplied());
    }

    @Test
    void testRenegotiationWithoutNoteIsNoOp() {
        GameState state = pendingEvent(new GameEvent.SellerNoteRenegotiation("r1-note", "Note Renegotiation", "",
            START, 1000, 0.7, 700));
        assertSame(state, EventChoices.acceptSellerNoteRenegotiation(state));
        assertTrue(EventChoices.declineSellerNoteRenegotiation(state).isCurrentEventApplied());
    }

    @Test
    void testMboProposal() {
        GameState state = pendingEvent(new GameEvent.MboProposal("r1-mbo", "MBO Proposal", "", START, 6000, 6.0));
        Business before = state.findBusiness(START);

        GameState accepted = EventChoices.acceptMboOffer(state);
        assertEquals(BusinessStatus.SOLD, accepted.findBusiness(START).getStatus());
        assertEquals(state.getCash() + 6000, accepted.getCash());

        GameState declined = EventChoices.declineMboOffer(state);
        Business after = declined.findBusiness(START);
        assertEquals(BusinessStatus.ACTIVE, after.getStatus());
        boolean ceoLeft = after.getQualityRating() < before.getQualityRating();
        boolean ceoStayed = after.getOrganicGrowthRate() < before.getOrganicGrowthRate();
        assertTrue(ceoLeft || ceoStayed, "Declining an MBO always costs something");
    }

    /**
     * An easy-mode round-1 state waiting on the given choice.
     */
    private static GameState pendingEvent(GameEvent event) {
        GameState state = RoundManager.startGame(data, 42, Difficulty.EASY, GameDuration.STANDARD).copy();
        state.setPhase(Phase.EVENT);
        state.setCurrentEvent(event);
        state.setCurrentEventApplied(false);
        return MetricsCalculator.refresh(state);
    }
}
