package com.holdco.tycoon.rng;

/**
 * Kinds of player-action outcomes pre-rolled from the market stream.
 * Declaration order is the per-slot draw order.
 */
public enum ActionRoll {
    SELL_VARIANCE,
    EVENT_DECLINE,
    INTEGRATION,
    QUALITY_IMPROVEMENT
}
