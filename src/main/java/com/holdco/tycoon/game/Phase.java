package com.holdco.tycoon.game;

/**
 * Phases of the annual cycle.
 */
public enum Phase {
    COLLECT,
    EVENT,
    ALLOCATE,
    RESTRUCTURE;

    /**
     * Portfolio actions (buy, sell, improve, capital moves) are only allowed while allocating.
     */
    public boolean isAllocation() {
        return this == ALLOCATE;
    }
}
