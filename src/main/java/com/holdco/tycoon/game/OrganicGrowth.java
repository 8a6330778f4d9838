package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.finance.SectorFocusBonus;
import com.holdco.tycoon.finance.SharedServiceBenefits;
import com.holdco.tycoon.rng.SeededRng;
import com.holdco.tycoon.sector.SectorDefinition;

import java.util.HashSet;
import java.util.Set;

/**
 * A year of organic revenue growth and margin drift for every active business.
 */
public final class OrganicGrowth {

    public static final double MAX_GROWTH_RATE = 0.20;
    public static final double MIN_GROWTH_RATE = -0.10;
    public static final double EBITDA_FLOOR_SHARE = 0.30;
    public static final double INFLATION_DRAG = 0.03;

    private OrganicGrowth() {
        // Utility class - prevent instantiation
    }

    public static double capGrowthRate(double rate) {
        return Math.min(MAX_GROWTH_RATE, Math.max(MIN_GROWTH_RATE, rate));
    }

    /**
     * Growth bonus for spreading across sectors: 4% from four sectors, 6% from six.
     */
    public static double diversificationBonus(int distinctSectors) {
        if (distinctSectors >= 6) {
            return 0.06;
        }
        return distinctSectors >= 4 ? 0.04 : 0;
    }

    /**
     * Grow every active business in place, in portfolio order. Each business draws from its own
     * fork of the simulation stream, so adding or removing one never changes another's year.
     */
    static void apply(GameState working, SeededRng simulation) {
        SharedServiceBenefits benefits = MetricsCalculator.sharedServiceBenefits(working);
        SectorFocusBonus focus = SectorFocusBonus.calculate(working.getBusinesses(), working.getSectors());
        Set<String> sectors = new HashSet<>();
        for (Business business : working.getBusinesses()) {
            if (business.isActive()) {
                sectors.add(business.getSectorId());
            }
        }
        double diversification = diversificationBonus(sectors.size());
        boolean inflation = working.isInflationActive();

        for (Business business : working.getBusinesses()) {
            if (!business.isActive()) {
                continue;
            }
            SectorDefinition sector = working.getSectors().getSector(business.getSectorId());
            SeededRng rng = simulation.fork(business.getId());
            double volatilityRoll = rng.next();
            double integrationRoll = rng.next();
            double marginRoll = rng.next();

            double growth = capGrowthRate(business.getOrganicGrowthRate());
            growth += sector.getVolatility() * (volatilityRoll * 2 - 1);
            growth += benefits.growthBonus();
            if (benefits.growthBonus() > 0
                && (business.getSectorId().equals("agency") || business.getSectorId().equals("consumer"))) {
                growth += 0.01;
            }
            if (focus != null && focus.focusGroup().equals(sector.getFocusGroup())) {
                growth += focus.ebitdaBonus();
            }
            growth += diversification;
            if (business.getIntegrationRoundsRemaining() > 0) {
                growth -= 0.03 + integrationRoll * 0.05;
            }
            if (inflation) {
                growth -= INFLATION_DRAG;
            }

            business.setRevenue(Math.max(0, Math.round(business.getRevenue() * (1 + growth))));
            double margin = business.getEbitdaMargin() + business.getMarginDriftRate()
                + sector.getMarginVolatility() * (marginRoll * 2 - 1);
            business.setEbitdaMargin(Business.clampMargin(margin));
            business.recomputeEbitda();

            long floor = Math.round(business.getAcquisitionEbitda() * EBITDA_FLOOR_SHARE);
            if (business.getEbitda() < floor) {
                business.setEbitda(floor);
            }
            business.setIntegrationRoundsRemaining(Math.max(0, business.getIntegrationRoundsRemaining() - 1));
            business.setOrganicGrowthRate(capGrowthRate(business.getOrganicGrowthRate()));
        }
    }
}
