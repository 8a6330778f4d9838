package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessGenerator;
import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.finance.CovenantHeadroom;
import com.holdco.tycoon.finance.WaterfallResult;
import com.holdco.tycoon.rng.SeededRng;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CollectionWaterfallTest {

    private static GameData data;

    @BeforeAll
    static void loadData() throws Exception {
        data = GameData.loadDefault();
    }

    @Test
    void testHoldcoLoanAmortizes() {
        // No EBITDA against debt is a breach: 7% plus the 2% penalty
        GameState state = emptyHoldco(1000, 2000, 4);

        GameState next = CollectionWaterfall.collect(state);

        WaterfallResult result = next.getLastWaterfall();
        assertEquals(180, result.holdcoPayment().interestPaid());
        assertEquals(500, result.holdcoPayment().principalPaid());
        assertEquals(320, next.getCash());
        assertEquals(1500, next.getHoldcoLoanBalance());
        assertEquals(3, next.getHoldcoLoanRoundsRemaining());
        assertFalse(result.cashExhausted());
        assertFalse(next.isRequiresRestructuring());
        assertEquals(1000, state.getCash(), "Input untouched");
    }

    @Test
    void testFinalRoundDueInFull() {
        GameState state = emptyHoldco(5000, 1000, 1);

        GameState next = CollectionWaterfall.collect(state);

        assertEquals(0, next.getHoldcoLoanBalance());
        assertEquals(5000 - 90 - 1000, next.getCash());
    }

    @Test
    void testShortfallRequiresRestructuring() {
        GameState state = emptyHoldco(100, 2000, 4);

        GameState next = CollectionWaterfall.collect(state);

        WaterfallResult result = next.getLastWaterfall();
        assertEquals(100, result.holdcoPayment().interestPaid(), "Interest is paid before principal");
        assertEquals(0, result.holdcoPayment().principalPaid());
        assertEquals(580, result.shortfall());
        assertTrue(result.cashExhausted());
        assertEquals(0, next.getCash());
        assertEquals(2000, next.getHoldcoLoanBalance());
        assertEquals(4, next.getHoldcoLoanRoundsRemaining(), "A missed payment does not run down the term");
        assertTrue(next.isRequiresRestructuring());
        assertFalse(next.isBankrupt());
    }

    @Test
    void testShortfallAfterRestructuringIsBankruptcy() {
        GameState state = emptyHoldco(100, 2000, 4);
        state.setHasRestructured(true);

        GameState next = CollectionWaterfall.collect(state);

        assertTrue(next.isBankrupt());
        assertTrue(next.isGameOver());
        assertEquals(0, next.getCash());
    }

    @Test
    void testEarnoutPaidWhenTargetMet() {
        GameState state = emptyHoldco(10_000, 0, 0);
        Business business = business("biz-earnout");
        business.setEbitda(Math.round(business.getAcquisitionEbitda() * 1.2));
        business.setEarnoutRemaining(500);
        business.setEarnoutTarget(0.10);
        business.setEarnoutRoundsRemaining(3);
        state.getBusinesses().add(business);

        GameState next = CollectionWaterfall.collect(state);

        assertEquals(500, next.getLastWaterfall().earnoutsPaid());
        assertEquals(0, next.findBusiness("biz-earnout").getEarnoutRemaining());
        assertEquals(0, next.findBusiness("biz-earnout").getEarnoutRoundsRemaining());
    }

    @Test
    void testUnaffordableEarnoutIsDeferred() {
        GameState state = emptyHoldco(0, 0, 0);
        state.setHasRestructured(true);
        Business business = business("biz-earnout");
        business.setEbitda(Math.round(business.getAcquisitionEbitda() * 1.2));
        business.setEarnoutRemaining(1_000_000);
        business.setEarnoutTarget(0.10);
        business.setEarnoutRoundsRemaining(3);
        state.getBusinesses().add(business);

        GameState next = CollectionWaterfall.collect(state);

        WaterfallResult result = next.getLastWaterfall();
        assertTrue(result.earnoutsPaid() > 0);
        assertEquals(0, result.shortfall());
        assertFalse(result.cashExhausted());
        assertEquals(0, next.getCash());
        assertEquals(1_000_000 - result.earnoutsPaid(), next.findBusiness("biz-earnout").getEarnoutRemaining());
        assertFalse(next.isBankrupt());
        assertFalse(next.isRequiresRestructuring());
    }

    @Test
    void testEarnoutForfeitedWhenWindowCloses() {
        GameState state = emptyHoldco(10_000, 0, 0);
        Business business = business("biz-earnout");
        business.setEarnoutRemaining(500);
        business.setEarnoutTarget(0.10);
        business.setEarnoutRoundsRemaining(1);
        state.getBusinesses().add(business);

        GameState next = CollectionWaterfall.collect(state);

        WaterfallResult result = next.getLastWaterfall();
        assertEquals(0, result.earnoutsPaid());
        assertEquals(500, result.earnoutsForfeited());
        assertEquals(0, next.findBusiness("biz-earnout").getEarnoutRemaining());
    }

    @Test
    void testOperatingCashFlowLandsInCash() {
        GameState state = emptyHoldco(1000, 0, 0);
        state.getBusinesses().add(business("biz-a"));

        GameState next = CollectionWaterfall.collect(state);

        WaterfallResult result = next.getLastWaterfall();
        assertTrue(result.preTaxFcf() > 0);
        assertEquals(1000 + result.preTaxFcf() - result.overheadCost() - result.taxPaid(), next.getCash());
        assertEquals(result.cashAfter(), next.getCash());
    }

    @Test
    void testCovenantHeadroomForecastsNextCollection() {
        GameState state = emptyHoldco(1000, 2000, 4);

        CovenantHeadroom headroom = MetricsCalculator.covenantHeadroom(state);

        assertEquals(680, headroom.nextYearDebtService());
        assertEquals(320, headroom.projectedCashAfterDebt());
        assertFalse(headroom.cashWillGoNegative());
        assertEquals(0, headroom.headroomCash(), "No EBITDA leaves no room under the breach line");

        assertEquals(headroom.projectedCashAfterDebt(), CollectionWaterfall.collect(state).getCash());
    }

    private static GameState emptyHoldco(long cash, long loan, int loanRounds) {
        GameState state = new GameState(data, 1, Difficulty.NORMAL, 20);
        state.setCash(cash);
        state.setInterestRate(RoundManager.STARTING_INTEREST_RATE);
        state.setSharesOutstanding(1000);
        state.setFounderShares(1000);
        state.setInitialShares(1000);
        state.setHoldcoLoanBalance(loan);
        state.setHoldcoLoanRoundsRemaining(loanRounds);
        return state;
    }

    private static Business business(String id) {
        return BusinessGenerator.generateBusiness(id, data.sectors().getSector("agency"), 1, 3, null, null,
            new SeededRng(7));
    }
}
