package com.holdco.tycoon.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.holdco.tycoon.config.CatalogException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Event probability tables loaded from JSON. Table order is draw order.
 */
public class EventCatalog {
    public static final String DEFAULT_RESOURCE = "events.json";

    private final List<EventDefinition> globalEvents;
    private final List<EventDefinition> portfolioEvents;
    private final List<EventDefinition> sectorEvents;

    /**
     * JSON layout of the events file.
     */
    static class Tables {
        @JsonProperty("global")
        List<EventDefinition> global = new ArrayList<>();

        @JsonProperty("portfolio")
        List<EventDefinition> portfolio = new ArrayList<>();

        @JsonProperty("sector")
        List<EventDefinition> sector = new ArrayList<>();
    }

    private EventCatalog(List<EventDefinition> globalEvents, List<EventDefinition> portfolioEvents,
                         List<EventDefinition> sectorEvents) {
        this.globalEvents = Collections.unmodifiableList(globalEvents);
        this.portfolioEvents = Collections.unmodifiableList(portfolioEvents);
        this.sectorEvents = Collections.unmodifiableList(sectorEvents);
    }

    public static EventCatalog loadDefault() throws CatalogException {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static EventCatalog fromFile(String path) throws CatalogException {
        try {
            return fromJson(Files.readString(Path.of(path)));
        } catch (IOException e) {
            throw new CatalogException("IO error: " + e.getMessage(), e);
        }
    }

    public static EventCatalog fromResource(String resourcePath) throws CatalogException {
        try (InputStream is = EventCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CatalogException("Resource not found: " + resourcePath);
            }
            return fromTables(new ObjectMapper().readValue(is, Tables.class));
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    public static EventCatalog fromJson(String json) throws CatalogException {
        try {
            return fromTables(new ObjectMapper().readValue(json, Tables.class));
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static EventCatalog fromTables(Tables tables) throws CatalogException {
        validate(tables.global, EventType.EventCategory.GLOBAL, "global");
        validate(tables.portfolio, EventType.EventCategory.PORTFOLIO, "portfolio");
        for (EventDefinition definition : tables.sector) {
            if (definition.getType() == null) {
                definition.setType(EventType.SECTOR_EVENT);
            }
            if (definition.getType() != EventType.SECTOR_EVENT || definition.getSectorId() == null) {
                throw new CatalogException("Sector event needs a sector_id: " + definition.getTitle());
            }
        }
        return new EventCatalog(tables.global, tables.portfolio, tables.sector);
    }

    private static void validate(List<EventDefinition> table, EventType.EventCategory category, String name)
        throws CatalogException {
        double total = 0;
        for (EventDefinition definition : table) {
            if (definition.getType() == null || !belongsTo(definition.getType(), category)) {
                throw new CatalogException("Bad " + name + " event type: " + definition.getTitle());
            }
            if (definition.getProbability() < 0) {
                throw new CatalogException("Negative probability: " + definition.getTitle());
            }
            total += definition.getProbability();
        }
        if (total > 1.0 + 1e-9) {
            throw new CatalogException(name + " event probabilities sum above 1: " + total);
        }
    }

    /**
     * Choice events other than the unsolicited offer live in the portfolio table.
     */
    private static boolean belongsTo(EventType type, EventType.EventCategory category) {
        if (type.getCategory() == category) {
            return true;
        }
        return category == EventType.EventCategory.PORTFOLIO
            && type.requiresChoice() && type != EventType.UNSOLICITED_OFFER;
    }

    public List<EventDefinition> globalEvents() {
        return globalEvents;
    }

    public List<EventDefinition> portfolioEvents() {
        return portfolioEvents;
    }

    public List<EventDefinition> sectorEvents() {
        return sectorEvents;
    }

    /**
     * Definition of a global or portfolio event type, or null.
     */
    public EventDefinition find(EventType type) {
        for (EventDefinition definition : globalEvents) {
            if (definition.getType() == type) {
                return definition;
            }
        }
        for (EventDefinition definition : portfolioEvents) {
            if (definition.getType() == type) {
                return definition;
            }
        }
        return null;
    }
}
