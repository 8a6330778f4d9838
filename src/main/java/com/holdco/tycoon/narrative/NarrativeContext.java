package com.holdco.tycoon.narrative;

/**
 * What a narrative source is told about an event.
 *
 * @param businessName affected business, or null for holdco-wide events
 * @param sectorName   sector of the affected business, or null
 */
public record NarrativeContext(
    int round,
    String eventTitle,
    String businessName,
    String sectorName,
    long cash,
    long totalEbitda
) {
}
