package com.holdco.tycoon.narrative;

import com.holdco.tycoon.event.EventType;

import java.util.Optional;

/**
 * External generator of flavor text. Implementations may return empty, or fail, at any time;
 * the simulation never depends on the result.
 */
@FunctionalInterface
public interface NarrativeSource {

    Optional<String> generate(EventType type, NarrativeContext context);
}
