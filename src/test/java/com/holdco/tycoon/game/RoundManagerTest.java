package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessGenerator;
import com.holdco.tycoon.business.BusinessStatus;
import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.config.GameDuration;
import com.holdco.tycoon.event.EventType;
import com.holdco.tycoon.event.GameEvent;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RoundManagerTest {

    private static GameData data;

    @BeforeAll
    static void loadData() throws Exception {
        data = GameData.loadDefault();
    }

    @Test
    void testStartGameNormal() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.NORMAL, GameDuration.STANDARD);

        assertEquals(1, state.getRound());
        assertEquals(Phase.COLLECT, state.getPhase());
        assertFalse(state.isGameOver());
        assertEquals(20, state.getMaxRounds());

        Business starting = state.findBusiness(BusinessGenerator.STARTING_BUSINESS_ID);
        assertNotNull(starting, "Should own the starting business");
        assertEquals(BusinessStatus.ACTIVE, starting.getStatus());
        assertEquals(BusinessGenerator.STARTING_SECTOR, starting.getSectorId());
        assertEquals(800, starting.getEbitda());
        assertTrue(starting.getAcquisitionMultiple() <= 4.0, "Normal caps the starting multiple");

        assertEquals(5000 - starting.getAcquisitionPrice(), state.getCash());
        assertEquals(3000, state.getHoldcoLoanBalance());
        assertEquals(10, state.getHoldcoLoanRoundsRemaining());
        assertEquals(1.0, state.founderOwnership(), 1e-9);
        assertTrue(state.getDealPipeline().isEmpty(), "Pipeline fills at the first allocation");
        assertNotNull(state.getMetrics());
    }

    @Test
    void testStartGameEasy() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.EASY, GameDuration.QUICK);

        assertEquals(10, state.getMaxRounds());
        assertEquals(0, state.getHoldcoLoanBalance());
        assertEquals(0, state.getHoldcoLoanRoundsRemaining());
        assertEquals(1000, state.findBusiness(BusinessGenerator.STARTING_BUSINESS_ID).getEbitda());
        assertEquals(0.8, state.founderOwnership(), 1e-9);
        assertTrue(state.getCash() > 10_000);
    }

    @Test
    void testQuickGameLoanTerm() {
        GameState state = RoundManager.startGame(data, 7, Difficulty.NORMAL, GameDuration.QUICK);
        assertEquals(10, state.getHoldcoLoanRoundsRemaining());
    }

    @Test
    void testWrongPhaseReturnsSameInstance() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.NORMAL, GameDuration.STANDARD);

        assertSame(state, RoundManager.advanceToAllocate(state));
        assertSame(state, RoundManager.endRound(state));
        assertSame(state, RoundManager.advanceFromRestructure(state));
    }

    @Test
    void testTransitionsLeaveInputUnchanged() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.NORMAL, GameDuration.STANDARD);
        long cash = state.getCash();
        long loan = state.getHoldcoLoanBalance();
        long ebitda = state.totalEbitda();

        GameState next = RoundManager.advanceToEvent(state);

        assertNotSame(state, next);
        assertEquals(Phase.COLLECT, state.getPhase());
        assertEquals(cash, state.getCash());
        assertEquals(loan, state.getHoldcoLoanBalance());
        assertEquals(ebitda, state.totalEbitda());
        assertTrue(state.getEventHistory().isEmpty());
        assertEquals(1, next.getEventHistory().size());
    }

    @Test
    void testSameSeedSameRound() {
        GameState a = playRound(RoundManager.startGame(data, 99, Difficulty.NORMAL, GameDuration.STANDARD));
        GameState b = playRound(RoundManager.startGame(data, 99, Difficulty.NORMAL, GameDuration.STANDARD));

        assertEquals(a.getRound(), b.getRound());
        assertEquals(a.getCash(), b.getCash());
        assertEquals(a.totalEbitda(), b.totalEbitda());
        assertEquals(a.getEventHistory().get(0).type(), b.getEventHistory().get(0).type());
        assertEquals(a.getHistory().size(), b.getHistory().size());
    }

    @Test
    void testOneRoundCycle() {
        GameState start = RoundManager.startGame(data, 5, Difficulty.EASY, GameDuration.STANDARD);

        GameState event = RoundManager.advanceToEvent(start);
        assertEquals(Phase.EVENT, event.getPhase());
        assertNotNull(event.getCurrentEvent());
        assertNotNull(event.getLastWaterfall());

        GameState allocate = RoundManager.advanceToAllocate(resolveChoice(event));
        assertEquals(Phase.ALLOCATE, allocate.getPhase());
        assertFalse(allocate.getDealPipeline().isEmpty(), "Allocation opens with a pipeline");
        assertEquals(allocate.getCurrentEvent().type(), allocate.getLastEventType());

        GameState next = RoundManager.endRound(allocate);
        assertEquals(2, next.getRound());
        assertEquals(Phase.COLLECT, next.getPhase());
        assertEquals(1, next.getHistory().size());
        assertEquals(1, next.getHistory().get(0).round());
    }

    @Test
    void testAllocationBlockedByPendingChoice() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.EASY, GameDuration.STANDARD).copy();
        Business starting = state.findBusiness(BusinessGenerator.STARTING_BUSINESS_ID);
        state.setPhase(Phase.EVENT);
        state.setCurrentEvent(new GameEvent.UnsolicitedOffer("r1-offer", "Unsolicited Offer", "A buyer calls",
            starting.getId(), 9000, 9.0, "Strategic buyer", true));
        state.setCurrentEventApplied(false);

        assertSame(state, RoundManager.advanceToAllocate(state), "Unresolved choice should block allocation");

        GameState declined = EventChoices.declineOffer(state);
        assertTrue(declined.isCurrentEventApplied());
        GameState allocate = RoundManager.advanceToAllocate(declined);
        assertEquals(Phase.ALLOCATE, allocate.getPhase());
        assertEquals(BusinessStatus.ACTIVE, allocate.findBusiness(starting.getId()).getStatus());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 17, 256, 4096, 65535, 123456})
    void testCashNeverNegative(int seed) {
        GameState state = RoundManager.startGame(data, seed, Difficulty.NORMAL, GameDuration.QUICK);
        int transitions = 0;
        while (!state.isGameOver() && transitions < 200) {
            state = step(state);
            assertTrue(state.getCash() >= 0, "Cash went negative in round " + state.getRound());
            transitions++;
        }
        assertTrue(state.isGameOver(), "Game should finish");
        assertTrue(state.getHistory().size() <= state.getMaxRounds());
        if (!state.isBankrupt()) {
            assertEquals(state.getMaxRounds(), state.getHistory().size());
        }
    }

    @Test
    void testFinishedGameIgnoresTransitions() {
        GameState state = RoundManager.startGame(data, 3, Difficulty.EASY, GameDuration.QUICK);
        while (!state.isGameOver()) {
            state = step(state);
        }
        assertSame(state, RoundManager.advanceToEvent(state));
        assertSame(state, RoundManager.advanceToAllocate(state));
        assertSame(state, RoundManager.endRound(state));
        assertSame(state, PlayerActions.distribute(state, 1));
    }

    @Test
    void testRestructureRequiresAction() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.NORMAL, GameDuration.STANDARD).copy();
        state.setPhase(Phase.RESTRUCTURE);
        state.setRequiresRestructuring(true);

        assertSame(state, RoundManager.advanceFromRestructure(state), "No corrective action taken yet");

        GameState raised = Restructuring.emergencyEquityRaise(state, 1000);
        assertTrue(raised.isRestructuringActionTaken());
        GameState resumed = RoundManager.advanceFromRestructure(raised);
        assertEquals(Phase.EVENT, resumed.getPhase());
        assertTrue(resumed.isHasRestructured());
        assertFalse(resumed.isRequiresRestructuring());
    }

    @Test
    void testCreditTighteningBindsTheRoundItIsDrawn() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.NORMAL, GameDuration.STANDARD);
        GameEvent crunch = new GameEvent.MarketEvent("event_1_global_credit_tightening",
            EventType.GLOBAL_CREDIT_TIGHTENING, "Credit Tightening", "");

        GameState drawn = RoundManager.resolveEvent(state, crunch);
        assertEquals(1, drawn.getCreditTighteningRoundsRemaining());
        assertTrue(drawn.isCreditTightening(), "Bank debt is off the table for this round's allocation");

        GameState following = RoundManager.resolveEvent(drawn, new GameEvent.QuietYear("event_2_quiet"));
        assertEquals(0, following.getCreditTighteningRoundsRemaining());
        assertFalse(following.isCreditTightening());
    }

    @Test
    void testInflationBindsTheRoundItIsDrawn() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.NORMAL, GameDuration.STANDARD);
        GameEvent inflation = new GameEvent.MarketEvent("event_1_global_inflation",
            EventType.GLOBAL_INFLATION, "Inflation", "");

        GameState drawn = RoundManager.resolveEvent(state, inflation);
        assertTrue(drawn.isInflationActive());

        GameState following = RoundManager.resolveEvent(drawn, new GameEvent.QuietYear("event_2_quiet"));
        assertFalse(following.isInflationActive());
    }

    @Test
    void testCountersTickAfterTheRoundsEvent() {
        for (int seed = 1; seed <= 30; seed++) {
            GameState state = RoundManager.startGame(data, seed, Difficulty.NORMAL, GameDuration.STANDARD).copy();
            state.setCreditTighteningRoundsRemaining(1);

            GameState next = RoundManager.advanceToEvent(state);

            boolean redrawn = next.getCurrentEvent() != null
                && next.getCurrentEvent().type() == EventType.GLOBAL_CREDIT_TIGHTENING;
            assertEquals(redrawn ? 1 : 0, next.getCreditTighteningRoundsRemaining());
        }
    }

    @Test
    void testSecondBreachRoundForcesRestructuring() {
        GameState first = RoundManager.endRound(breachedAllocate(0, false));
        assertEquals(1, first.getCovenantBreachRounds());
        assertFalse(first.isRequiresRestructuring(), "One round in breach is a warning");

        GameState second = RoundManager.endRound(breachedAllocate(1, false));
        assertEquals(2, second.getCovenantBreachRounds());
        assertTrue(second.isRequiresRestructuring());
        assertFalse(second.isBankrupt());
    }

    @Test
    void testBreachAfterRestructuringIsBankruptcy() {
        GameState next = RoundManager.endRound(breachedAllocate(1, true));

        assertTrue(next.isBankrupt());
        assertTrue(next.isGameOver());
    }

    @Test
    void testLeavingBreachResetsCounter() {
        GameState state = RoundManager.startGame(data, 42, Difficulty.EASY, GameDuration.STANDARD).copy();
        state.setPhase(Phase.ALLOCATE);
        state.setCovenantBreachRounds(1);

        GameState next = RoundManager.endRound(MetricsCalculator.refresh(state));

        assertEquals(0, next.getCovenantBreachRounds());
        assertFalse(next.isRequiresRestructuring());
    }

    // ==================== HELPERS ====================

    /**
     * Allocation state buried far past the breach line.
     */
    private static GameState breachedAllocate(int breachRounds, boolean restructured) {
        GameState state = RoundManager.startGame(data, 42, Difficulty.NORMAL, GameDuration.STANDARD).copy();
        state.setPhase(Phase.ALLOCATE);
        state.setHoldcoLoanBalance(200_000);
        state.setCovenantBreachRounds(breachRounds);
        state.setHasRestructured(restructured);
        return MetricsCalculator.refresh(state);
    }

    private static GameState playRound(GameState state) {
        int round = state.getRound();
        while (!state.isGameOver() && state.getRound() == round) {
            state = step(state);
        }
        return state;
    }

    /**
     * Advance with no allocation activity, declining every choice.
     */
    private static GameState step(GameState state) {
        switch (state.getPhase()) {
            case COLLECT:
                return RoundManager.advanceToEvent(state);
            case EVENT:
                return RoundManager.advanceToAllocate(resolveChoice(state));
            case ALLOCATE:
                return RoundManager.endRound(state);
            case RESTRUCTURE:
                GameState raised = Restructuring.emergencyEquityRaise(state, 2000);
                if (raised == state) {
                    return Restructuring.declareBankruptcy(state);
                }
                return RoundManager.advanceFromRestructure(raised);
            default:
                throw new IllegalStateException("Unknown phase " + state.getPhase());
        }
    }

    private static GameState resolveChoice(GameState state) {
        GameState next = EventChoices.declineOffer(state);
        next = EventChoices.declineEquityDemand(next);
        next = EventChoices.declineSellerNoteRenegotiation(next);
        return EventChoices.declineMboOffer(next);
    }
}
