package com.holdco.tycoon.deal;

import com.holdco.tycoon.event.EventType;
import com.holdco.tycoon.rng.SeededRng;

/**
 * Rolls how competitive a deal is and what that competition adds to the price.
 */
public final class DealHeatCalculator {

    /** Combined cooling from source, sourcing tier and seller never exceeds this many steps. */
    public static final int MAX_COOLING = 3;

    private DealHeatCalculator() {
        // Utility class - prevent instantiation
    }

    /**
     * Roll a heat level. Consumes exactly one draw.
     *
     * @param maSourcingTier active sourcing tier; only cools SOURCED deals
     */
    public static DealHeat calculateHeat(int quality, DealSource source, int round, int maxRounds,
                                         EventType lastEventType, SellerArchetype archetype,
                                         boolean creditTightening, int maSourcingTier, SeededRng rng) {
        double roll = rng.next();
        int index;
        if (roll < 0.25) index = 0;
        else if (roll < 0.60) index = 1;
        else if (roll < 0.90) index = 2;
        else index = 3;

        if (quality >= 4) index += 1;
        if (quality <= 2) index -= 1;

        if (lastEventType == EventType.GLOBAL_BULL_MARKET) index += 1;
        if (lastEventType == EventType.GLOBAL_RECESSION) index -= 1;
        if (creditTightening) index -= 1;

        int lateGameRound = (int) Math.ceil(maxRounds * 0.75);
        if (round >= lateGameRound) index += 1;

        int cooling = 0;
        if (source == DealSource.PROPRIETARY) cooling -= 2;
        if (source == DealSource.SOURCED) {
            cooling -= 1;
            if (maSourcingTier >= 2) cooling -= 1;
        }
        if (archetype != null) {
            int modifier = archetype.getHeatModifier();
            if (modifier < 0) {
                cooling += modifier;
            } else {
                index += modifier;
            }
        }
        index += Math.max(-MAX_COOLING, cooling);

        return DealHeat.fromIndex(index);
    }

    /**
     * Price multiplier for a heat level. Draws once for every level except cold.
     */
    public static double heatPremium(DealHeat heat, SeededRng rng) {
        return switch (heat) {
            case COLD -> 1.0;
            case WARM -> rng.nextInRange(1.10, 1.15);
            case HOT -> rng.nextInRange(1.20, 1.30);
            case CONTESTED -> rng.nextInRange(1.20, 1.35);
        };
    }
}
