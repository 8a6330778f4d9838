package com.holdco.tycoon.deal;

import com.holdco.tycoon.event.EventType;

/**
 * The parts of the game state deal generation depends on.
 *
 * @param focusGroup      portfolio focus group, or null
 * @param focusTier       portfolio focus tier, 0 when none
 * @param lastEventType   most recent event, or null
 */
public record DealFlowContext(
    int round,
    int maxRounds,
    MAFocus maFocus,
    String focusGroup,
    int focusTier,
    long portfolioEbitda,
    MASourcingTier maSourcingTier,
    boolean maSourcingActive,
    EventType lastEventType,
    boolean creditTightening
) {
    public DealFlowContext {
        if (maFocus == null) {
            maFocus = MAFocus.NONE;
        }
        if (maSourcingTier == null) {
            maSourcingTier = MASourcingTier.NONE;
        }
    }

    /**
     * Sourcing tier level that is actually switched on.
     */
    public int activeSourcingLevel() {
        return maSourcingActive ? maSourcingTier.getLevel() : 0;
    }
}
