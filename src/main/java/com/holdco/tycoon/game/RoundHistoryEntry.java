package com.holdco.tycoon.game;

import com.holdco.tycoon.event.EventImpact;
import com.holdco.tycoon.event.EventType;
import com.holdco.tycoon.finance.WaterfallResult;

import java.util.List;

/**
 * Snapshot of one completed round, appended when the round ends.
 *
 * @param waterfall collection results, or null if the round never collected
 */
public record RoundHistoryEntry(
    int round,
    Metrics metrics,
    EventType eventType,
    String eventTitle,
    List<EventImpact> eventImpacts,
    WaterfallResult waterfall,
    int acquisitions,
    long cash,
    long totalEbitda
) {
    public RoundHistoryEntry {
        eventImpacts = eventImpacts == null ? List.of() : List.copyOf(eventImpacts);
    }
}
