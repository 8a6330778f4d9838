package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessGenerator;
import com.holdco.tycoon.business.BusinessStatus;
import com.holdco.tycoon.business.ImprovementType;
import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.config.GameDuration;
import com.holdco.tycoon.deal.Deal;
import com.holdco.tycoon.deal.DealGenerator;
import com.holdco.tycoon.deal.DealHeat;
import com.holdco.tycoon.deal.DealStructure;
import com.holdco.tycoon.deal.DealStructureType;
import com.holdco.tycoon.deal.MASourcingTier;
import com.holdco.tycoon.deal.SizePreference;
import com.holdco.tycoon.finance.SharedServiceType;
import com.holdco.tycoon.rng.ActionRoll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlayerActionsTest {

    private static final String START = BusinessGenerator.STARTING_BUSINESS_ID;

    private static GameData data;

    @BeforeAll
    static void loadData() throws Exception {
        data = GameData.loadDefault();
    }

    // ==================== GATING ====================

    @Test
    void testActionsOutsideAllocateAreNoOps() {
        GameState collect = RoundManager.startGame(data, 42, Difficulty.EASY, GameDuration.STANDARD);

        assertSame(collect, PlayerActions.acquire(collect, "r1-p0", DealStructureType.ALL_CASH));
        assertSame(collect, PlayerActions.sell(collect, START));
        assertSame(collect, PlayerActions.distribute(collect, 100));
        assertSame(collect, PlayerActions.designatePlatform(collect, START));
        assertSame(collect, PlayerActions.improve(collect, START, ImprovementType.OPERATING_PLAYBOOK));
        assertSame(collect, PlayerActions.sourceDeals(collect));
    }

    @Test
    void testInvalidTargetsAreNoOps() {
        GameState state = allocateState(42, Difficulty.EASY);

        assertSame(state, PlayerActions.acquire(state, "no-such-deal", DealStructureType.ALL_CASH));
        assertSame(state, PlayerActions.acquire(state, state.getDealPipeline().get(0).getId(), null));
        assertSame(state, PlayerActions.sell(state, "no-such-business"));
        assertSame(state, PlayerActions.windDown(state, null));
        assertSame(state, PlayerActions.merge(state, START, START));
        assertSame(state, PlayerActions.distribute(state, state.getCash() + 1));
        assertSame(state, PlayerActions.distribute(state, 0));
        assertSame(state, PlayerActions.issueEquity(state, -5));
        assertSame(state, PlayerActions.setMAFocus(state, "no-such-sector", SizePreference.ANY, null));
    }

    // ==================== ACQUISITIONS ====================

    @Test
    void testAcquireRemovesDealFromPipeline() {
        GameState state = allocateState(42, Difficulty.EASY);
        Deal deal = state.getDealPipeline().get(0);
        List<DealStructure> structures = PlayerActions.availableStructures(state, deal);
        assertFalse(structures.isEmpty(), "Easy start can afford something");
        DealStructure structure = structures.get(0);

        GameState next = PlayerActions.acquire(state, deal.getId(), structure.type());

        assertNotSame(state, next);
        assertNull(next.findDeal(deal.getId()));
        assertEquals(1, next.getAcquisitionsThisRound());
        Business bought = next.findBusiness("biz-" + deal.getId());
        if (bought != null) {
            assertEquals(BusinessStatus.ACTIVE, bought.getStatus());
            assertEquals(1, bought.getAcquisitionRound());
            assertEquals(state.getCash() - structure.cashRequired(), next.getCash());
            assertEquals(state.getTotalInvestedCapital() + deal.getEffectivePrice(), next.getTotalInvestedCapital());
        } else {
            assertEquals(state.getCash(), next.getCash(), "A lost deal costs nothing");
        }
        assertNotNull(state.findDeal(deal.getId()), "Input pipeline is untouched");
    }

    @Test
    void testContestedDealFollowsItsOwnMarketFork() {
        for (int seed = 1; seed <= 20; seed++) {
            GameState state = contestedState(seed);
            Deal deal = state.getDealPipeline().get(0);
            boolean expectLost = state.streams().market().fork(deal.getId()).next()
                < DealHeat.CONTESTED_SNATCH_PROBABILITY;

            GameState next = PlayerActions.acquire(state, deal.getId(), DealStructureType.ALL_CASH);

            assertNull(next.findDeal(deal.getId()), "The deal leaves the pipeline either way");
            assertEquals(1, next.getAcquisitionsThisRound());
            if (expectLost) {
                assertNull(next.findBusiness("biz-" + deal.getId()));
                assertEquals(state.getCash(), next.getCash());
            } else {
                assertNotNull(next.findBusiness("biz-" + deal.getId()));
            }
        }
    }

    @Test
    void testContestedDealsLostAboutFortyPercent() {
        int lost = 0;
        int trials = 200;
        for (int seed = 1; seed <= trials; seed++) {
            GameState state = contestedState(seed);
            Deal deal = state.getDealPipeline().get(0);
            GameState next = PlayerActions.acquire(state, deal.getId(), DealStructureType.ALL_CASH);
            if (next.findBusiness("biz-" + deal.getId()) == null) {
                lost++;
            }
        }
        double rate = lost / (double) trials;
        assertTrue(rate > 0.28 && rate < 0.52, "Snatch rate was " + rate);
    }

    @Test
    void testUncontestedDealIsNeverLost() {
        for (int seed = 1; seed <= 20; seed++) {
            GameState state = contestedState(seed);
            Deal contested = state.getDealPipeline().get(0);
            state.getDealPipeline().set(0, withHeat(contested, DealHeat.HOT));

            GameState next = PlayerActions.acquire(state, contested.getId(), DealStructureType.ALL_CASH);

            assertNotNull(next.findBusiness("biz-" + contested.getId()));
        }
    }

    @Test
    void testAcquisitionLimitPerRound() {
        GameState state = allocateState(42, Difficulty.EASY).copy();
        state.setAcquisitionsThisRound(PlayerActions.BASE_MAX_ACQUISITIONS);
        Deal deal = state.getDealPipeline().get(0);

        assertFalse(PlayerActions.canAcquire(state));
        assertSame(state, PlayerActions.acquire(state, deal.getId(), DealStructureType.ALL_CASH));
    }

    @Test
    void testTuckInNeedsPlatform() {
        GameState state = allocateState(42, Difficulty.EASY);
        Deal deal = state.getDealPipeline().get(0);

        assertSame(state, PlayerActions.acquireTuckIn(state, deal.getId(), DealStructureType.ALL_CASH, START));
    }

    @Test
    void testDesignatePlatform() {
        GameState state = allocateState(42, Difficulty.EASY);
        long cost = PlayerActions.platformCost(state.findBusiness(START));

        GameState next = PlayerActions.designatePlatform(state, START);

        Business platform = next.findBusiness(START);
        assertTrue(platform.isPlatform());
        assertEquals(1, platform.getPlatformScale());
        assertEquals(state.getCash() - cost, next.getCash());
        assertFalse(state.findBusiness(START).isPlatform());
        assertSame(next, PlayerActions.designatePlatform(next, START), "Already a platform");
    }

    @Test
    void testMultipleExpansion() {
        assertEquals(0.0, PlayerActions.multipleExpansion(0, 1000), 1e-9);
        assertEquals(0.5, PlayerActions.multipleExpansion(1, 1000), 1e-9);
        assertEquals(1.0 + 0.3, PlayerActions.multipleExpansion(3, 6000), 1e-9);
        assertEquals(2.0 + 0.15, PlayerActions.multipleExpansion(100, 4000), 1e-9);
    }

    // ==================== OPERATIONS ====================

    @Test
    void testImproveOncePerType() {
        GameState state = allocateState(42, Difficulty.EASY);
        Business before = state.findBusiness(START);
        long cost = ImprovementType.OPERATING_PLAYBOOK.costFor(before.getEbitda());

        GameState next = PlayerActions.improve(state, START, ImprovementType.OPERATING_PLAYBOOK);

        Business after = next.findBusiness(START);
        assertTrue(after.hasImprovement(ImprovementType.OPERATING_PLAYBOOK));
        assertTrue(after.getEbitdaMargin() > before.getEbitdaMargin());
        assertEquals(state.getCash() - cost, next.getCash());
        assertEquals(1, next.actionRollsUsed(ActionRoll.QUALITY_IMPROVEMENT));
        assertSame(next, PlayerActions.improve(next, START, ImprovementType.OPERATING_PLAYBOOK));
    }

    @Test
    void testQualityImprovementChance() {
        assertEquals(0.30, PlayerActions.qualityImprovementChance(ImprovementType.FIX_UNDERPERFORMANCE), 1e-9);
        assertEquals(0.15, PlayerActions.qualityImprovementChance(ImprovementType.PRICING_MODEL), 1e-9);
    }

    // ==================== EXITS ====================

    @Test
    void testSellStartingBusiness() {
        GameState state = allocateState(42, Difficulty.EASY);

        GameState next = PlayerActions.sell(state, START);

        Business sold = next.findBusiness(START);
        assertEquals(BusinessStatus.SOLD, sold.getStatus());
        assertNotNull(sold.getExitPrice());
        assertTrue(next.getCash() > state.getCash());
        assertTrue(next.getTotalExitProceeds() > 0);
        assertEquals(0, next.activeBusinessCount());
        assertSame(next, PlayerActions.sell(next, START), "Cannot sell twice");
    }

    @Test
    void testWindDown() {
        GameState state = allocateState(42, Difficulty.EASY);

        GameState next = PlayerActions.windDown(state, START);

        assertEquals(BusinessStatus.WOUND_DOWN, next.findBusiness(START).getStatus());
        assertTrue(next.getCash() < state.getCash());
        assertTrue(next.getCash() >= 0);
    }

    // ==================== CAPITAL STRUCTURE ====================

    @Test
    void testPayDownHoldcoDebt() {
        GameState state = allocateState(42, Difficulty.NORMAL);
        long loan = state.getHoldcoLoanBalance();

        GameState next = PlayerActions.payDownHoldcoDebt(state, 500);

        assertEquals(loan - 500, next.getHoldcoLoanBalance());
        assertEquals(state.getCash() - 500, next.getCash());

        GameState capped = PlayerActions.payDownHoldcoDebt(state, Long.MAX_VALUE);
        assertEquals(Math.max(0, loan - state.getCash()), capped.getHoldcoLoanBalance());
        assertEquals(Math.max(0, state.getCash() - loan), capped.getCash());
    }

    @Test
    void testPayDownWithoutDebtIsNoOp() {
        GameState state = allocateState(42, Difficulty.EASY);
        assertSame(state, PlayerActions.payDownHoldcoDebt(state, 100));
        assertSame(state, PlayerActions.payDownBankDebt(state, START, 100));
    }

    @Test
    void testIssueEquityKeepsFounderMajority() {
        GameState state = allocateState(42, Difficulty.EASY);

        GameState small = PlayerActions.issueEquity(state, 1000);
        assertEquals(state.getCash() + 1000, small.getCash());
        assertTrue(small.getSharesOutstanding() > state.getSharesOutstanding());
        assertEquals(1, small.getEquityRaisesUsed());

        GameState huge = PlayerActions.issueEquity(state, 1_000_000);
        assertSame(state, huge, "Raise would drop the founder below 51%");
    }

    @Test
    void testBuybackNeverTouchesFounderShares() {
        GameState state = allocateState(42, Difficulty.EASY);

        GameState next = PlayerActions.buyback(state, state.getCash());

        assertTrue(next.getSharesOutstanding() >= next.getFounderShares());
        assertTrue(next.getTotalBuybacks() > 0);
        assertEquals(state.getCash() - next.getTotalBuybacks(), next.getCash());
    }

    @Test
    void testDistribute() {
        GameState state = allocateState(42, Difficulty.EASY);

        GameState next = PlayerActions.distribute(state, 1500);

        assertEquals(state.getCash() - 1500, next.getCash());
        assertEquals(1500, next.getTotalDistributions());
    }

    // ==================== SHARED SERVICES AND SOURCING ====================

    @Test
    void testSharedServicesNeedThreeOpcos() {
        GameState state = allocateState(42, Difficulty.EASY);
        assertSame(state, PlayerActions.unlockSharedService(state, SharedServiceType.FINANCE_REPORTING));
        assertSame(state, PlayerActions.deactivateSharedService(state, SharedServiceType.FINANCE_REPORTING));
    }

    @Test
    void testSourcingTierNeedsOpcos() {
        GameState state = allocateState(42, Difficulty.EASY);
        assertEquals(MASourcingTier.NONE, state.getMaSourcingTier());
        assertSame(state, PlayerActions.upgradeMASourcing(state), "Tier 1 needs two opcos");
        assertSame(state, PlayerActions.toggleMASourcing(state));
        assertSame(state, PlayerActions.proactiveOutreach(state));
    }

    @Test
    void testSourceDeals() {
        GameState state = allocateState(42, Difficulty.EASY);

        GameState next = PlayerActions.sourceDeals(state);

        assertEquals(state.getDealPipeline().size() + DealGenerator.SOURCED_BATCH_SIZE, next.getDealPipeline().size());
        assertEquals(1, next.getSourcingCount());
        assertEquals(state.getCash() - DealGenerator.SOURCING_COST, next.getCash());
        assertTrue(next.getDealPipeline().stream().anyMatch(d -> d.getId().startsWith("r1-s0-")));
    }

    @Test
    void testSetFocus() {
        GameState state = allocateState(42, Difficulty.EASY);

        GameState next = PlayerActions.setMAFocus(state, "agency", SizePreference.SMALL, "Digital Marketing");

        assertEquals("agency", next.getMaFocus().sectorId());
        assertEquals(SizePreference.SMALL, next.getMaFocus().sizePreference());
        assertNull(next.getMaFocus().subType(), "Sub-type focus needs sourcing tier 2");
    }

    // ==================== HELPERS ====================

    /**
     * A round-1 state in the allocate phase with a freshly generated pipeline.
     */
    /**
     * Allocation state whose first deal is contested and affordable for cash.
     */
    private static GameState contestedState(int seed) {
        GameState state = allocateState(seed, Difficulty.EASY).copy();
        Deal deal = state.getDealPipeline().get(0);
        state.getDealPipeline().set(0, withHeat(deal, DealHeat.CONTESTED));
        state.setCash(Math.max(state.getCash(), deal.getEffectivePrice() * 2));
        return MetricsCalculator.refresh(state);
    }

    private static Deal withHeat(Deal deal, DealHeat heat) {
        return new Deal(deal.getId(), deal.getBusiness(), deal.getAskingPrice(), deal.getEffectivePrice(),
            deal.getFreshness(), deal.getRoundAppeared(), deal.getSource(), deal.getAcquisitionType(),
            deal.getTuckInDiscount(), heat, deal.getSellerArchetype(), deal.getTermsSeed());
    }

    static GameState allocateState(int seed, Difficulty difficulty) {
        GameState state = RoundManager.startGame(data, seed, difficulty, GameDuration.STANDARD).copy();
        state.setPhase(Phase.ALLOCATE);
        state.setDealPipeline(DealGenerator.generatePipeline(state.getDealPipeline(),
            RoundManager.dealFlowContext(state), state.getSectors(), state.streams().deals()));
        return MetricsCalculator.refresh(state);
    }
}
