package com.holdco.tycoon.finance;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.ImprovementType;
import com.holdco.tycoon.event.EventType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for exit valuation.
 */
class ValuationTest {

    private static Business business(long acquisitionEbitda, long ebitda, double multiple, int quality) {
        Business business = new Business();
        business.setId("b");
        business.setSectorId("agency");
        business.setAcquisitionEbitda(acquisitionEbitda);
        business.setEbitda(ebitda);
        business.setAcquisitionMultiple(multiple);
        business.setQualityRating(quality);
        business.setAcquisitionRound(1);
        return business;
    }

    @Test
    void testPremiumsAddUp() {
        Business b = business(1000, 1000, 4.0, 3);
        ExitValuation v = Valuation.calculateExitValuation(b, 4, null);

        assertEquals(0.0, v.growthPremium(), 1e-9);
        assertEquals(0.0, v.qualityPremium(), 1e-9);
        assertEquals(0.3, v.holdPremium(), 1e-9);
        assertEquals(3, v.yearsHeld());
        assertEquals(4.3, v.totalMultiple(), 1e-9);
        assertEquals(4300, v.exitPrice());
        assertEquals(BuyerPoolTier.INDIVIDUAL, v.buyerPoolTier());
    }

    @Test
    void testHoldPremiumCapped() {
        ExitValuation v = Valuation.calculateExitValuation(business(1000, 1000, 4.0, 3), 20, null);
        assertEquals(0.5, v.holdPremium(), 1e-9);
    }

    @Test
    void testMarketModifier() {
        Business b = business(1000, 1000, 4.0, 3);
        double bull = Valuation.calculateExitValuation(b, 1, EventType.GLOBAL_BULL_MARKET).totalMultiple();
        double neutral = Valuation.calculateExitValuation(b, 1, null).totalMultiple();
        double recession = Valuation.calculateExitValuation(b, 1, EventType.GLOBAL_RECESSION).totalMultiple();
        assertEquals(neutral + 0.5, bull, 1e-9);
        assertEquals(neutral - 0.5, recession, 1e-9);
    }

    @Test
    void testImprovementsAddPremium() {
        Business b = business(1000, 1000, 4.0, 3);
        b.getImprovements().add(ImprovementType.OPERATING_PLAYBOOK);
        b.getImprovements().add(ImprovementType.PRICING_MODEL);
        ExitValuation v = Valuation.calculateExitValuation(b, 1, null);
        assertEquals(0.30, v.improvementsPremium(), 1e-9);
        assertEquals(0.2, v.deRiskingPremium(), 1e-9);
    }

    @ParameterizedTest
    @ValueSource(longs = {-500, 0, 10, 300})
    void testMultipleNeverBelowFloor(long ebitda) {
        Business b = business(2000, ebitda, 1.0, 1);
        ExitValuation v = Valuation.calculateExitValuation(b, 1, EventType.GLOBAL_RECESSION);
        assertTrue(v.totalMultiple() >= Valuation.MULTIPLE_FLOOR, "Multiple should be floored at 2.0");
        assertTrue(v.exitPrice() >= 0);
    }

    @Test
    void testNetProceedsSettleDebt() {
        Business b = business(1000, 1000, 4.0, 3);
        b.setSellerNoteBalance(500);
        b.setBankDebtBalance(4500);
        ExitValuation v = Valuation.calculateExitValuation(b, 1, null);
        assertEquals(0, v.netProceeds(), "Debt above the price leaves nothing, never a negative");
    }

    @Test
    void testSizeTierPremiumInterpolates() {
        assertEquals(0.0, Valuation.sizeTierPremium(1999), 1e-9);
        assertEquals(0.5, Valuation.sizeTierPremium(2000), 1e-9);
        assertEquals(0.8, Valuation.sizeTierPremium(5000), 1e-9);
        assertEquals(3.5, Valuation.sizeTierPremium(50_000), 1e-9);
        assertEquals(BuyerPoolTier.LARGE_PE, Valuation.buyerPoolTier(25_000));
    }
}
