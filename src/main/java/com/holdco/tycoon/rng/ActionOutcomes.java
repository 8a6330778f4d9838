package com.holdco.tycoon.rng;

import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome rolls for player actions, drawn up front from the market stream.
 * The n-th action of a kind in a round consumes slot n, so results do not depend on
 * the order in which different kinds of actions are taken.
 */
public final class ActionOutcomes {

    public static final int DEFAULT_SLOTS = 16;

    private final Map<ActionRoll, double[]> rolls;
    private final int slots;

    private ActionOutcomes(Map<ActionRoll, double[]> rolls, int slots) {
        this.rolls = rolls;
        this.slots = slots;
    }

    /**
     * Pre-roll all action outcomes for a round from the market stream.
     */
    public static ActionOutcomes preRoll(SeededRng market) {
        return preRoll(market, DEFAULT_SLOTS);
    }

    public static ActionOutcomes preRoll(SeededRng market, int slots) {
        if (slots <= 0) {
            throw new IllegalArgumentException("slots must be positive: " + slots);
        }
        Map<ActionRoll, double[]> rolls = new EnumMap<>(ActionRoll.class);
        for (ActionRoll kind : ActionRoll.values()) {
            rolls.put(kind, new double[slots]);
        }
        for (int i = 0; i < slots; i++) {
            for (ActionRoll kind : ActionRoll.values()) {
                rolls.get(kind)[i] = market.next();
            }
        }
        return new ActionOutcomes(rolls, slots);
    }

    /**
     * Roll for the index-th occurrence of an action kind. Indexes past the last slot wrap around.
     */
    public double roll(ActionRoll kind, int index) {
        return rolls.get(kind)[Math.floorMod(index, slots)];
    }

    public int getSlots() {
        return slots;
    }
}
