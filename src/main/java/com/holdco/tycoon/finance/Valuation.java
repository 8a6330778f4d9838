package com.holdco.tycoon.finance;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.OperatorQuality;
import com.holdco.tycoon.event.EventType;
import com.holdco.tycoon.sector.ConcentrationLevel;

/**
 * Exit valuation: an additive multiple on EBITDA.
 */
public final class Valuation {

    /** Absolute floor; a distressed sale still clears two turns of EBITDA. */
    public static final double MULTIPLE_FLOOR = 2.0;

    private Valuation() {
        // Utility class - prevent instantiation
    }

    public static ExitValuation calculateExitValuation(Business business, int currentRound, EventType lastEventType) {
        return calculateExitValuation(business, currentRound, lastEventType, null);
    }

    /**
     * @param lastEventType        most recent event, or null
     * @param consolidatedEbitda   EBITDA to size the buyer pool with, or null for the business's own
     */
    public static ExitValuation calculateExitValuation(Business business, int currentRound,
                                                       EventType lastEventType, Long consolidatedEbitda) {
        double baseMultiple = business.getAcquisitionMultiple();

        double growth = business.ebitdaGrowthSinceAcquisition();
        double growthPremium = growth > 0 ? Math.min(2.5, growth * 0.8) : Math.max(-1.0, growth * 0.5);

        double qualityPremium = (business.getQualityRating() - 3) * 0.4;
        double platformPremium = business.isPlatform() ? business.getPlatformScale() * 0.2 : 0;

        int yearsHeld = Math.max(0, currentRound - business.getAcquisitionRound());
        double holdPremium = Math.min(0.5, yearsHeld * 0.1);

        double improvementsPremium = business.getImprovements().size() * 0.15;

        double marketModifier = 0;
        if (lastEventType == EventType.GLOBAL_BULL_MARKET) marketModifier = 0.5;
        if (lastEventType == EventType.GLOBAL_RECESSION) marketModifier = -0.5;

        long effectiveEbitda = consolidatedEbitda != null ? consolidatedEbitda : business.getEbitda();
        BuyerPoolTier tier = buyerPoolTier(effectiveEbitda);
        double sizeTierPremium = sizeTierPremium(effectiveEbitda);
        double deRiskingPremium = deRiskingPremium(business);

        double raw = baseMultiple + growthPremium + qualityPremium + platformPremium + holdPremium
            + improvementsPremium + marketModifier + sizeTierPremium + deRiskingPremium;
        double totalMultiple = Double.isFinite(raw) ? Math.max(MULTIPLE_FLOOR, raw) : MULTIPLE_FLOOR;

        long exitPrice = Math.round(Math.max(0, business.getEbitda()) * totalMultiple);
        long debtPayoff = business.getSellerNoteBalance() + business.getBankDebtBalance();
        long netProceeds = Math.max(0, exitPrice - debtPayoff);

        return new ExitValuation(baseMultiple, growthPremium, qualityPremium, platformPremium, holdPremium,
            improvementsPremium, marketModifier, sizeTierPremium, deRiskingPremium, tier, totalMultiple,
            exitPrice, netProceeds, growth, yearsHeld);
    }

    public static BuyerPoolTier buyerPoolTier(long ebitda) {
        if (ebitda < 2000) return BuyerPoolTier.INDIVIDUAL;
        if (ebitda < 5000) return BuyerPoolTier.SMALL_PE;
        if (ebitda < 10000) return BuyerPoolTier.LOWER_MIDDLE_PE;
        if (ebitda < 20000) return BuyerPoolTier.INSTITUTIONAL_PE;
        return BuyerPoolTier.LARGE_PE;
    }

    /**
     * Larger businesses reach deeper buyer pools; interpolated within each tier, capped at 30M EBITDA.
     */
    public static double sizeTierPremium(long ebitda) {
        if (ebitda < 2000) return 0.0;
        if (ebitda < 5000) return lerp(ebitda, 2000, 5000, 0.5, 0.8);
        if (ebitda < 10000) return lerp(ebitda, 5000, 10000, 0.8, 1.5);
        if (ebitda < 20000) return lerp(ebitda, 10000, 20000, 1.5, 2.5);
        return lerp(Math.min(ebitda, 30000), 20000, 30000, 2.5, 3.5);
    }

    public static double deRiskingPremium(Business business) {
        double premium = 0;
        if (business.getDueDiligence() != null) {
            if (business.getDueDiligence().revenueConcentration() == ConcentrationLevel.LOW) premium += 0.3;
            if (business.getDueDiligence().operatorQuality() == OperatorQuality.STRONG) premium += 0.3;
            if (business.getDueDiligence().customerRetention() >= 90) premium += 0.2;
        }
        if (business.isPlatform() && business.getPlatformScale() > 0) {
            premium += Math.min(0.6, business.getPlatformScale() * 0.2);
        }
        if (business.getImprovements().size() >= 2) premium += 0.2;
        return Math.min(1.5, premium);
    }

    private static double lerp(double x, double x0, double x1, double y0, double y1) {
        return y0 + ((x - x0) / (x1 - x0)) * (y1 - y0);
    }
}
