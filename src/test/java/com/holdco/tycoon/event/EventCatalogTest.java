package com.holdco.tycoon.event;

import com.holdco.tycoon.config.CatalogException;
import com.holdco.tycoon.sector.SectorCatalog;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventCatalog.
 */
class EventCatalogTest {

    private static EventCatalog events;
    private static SectorCatalog sectors;

    @BeforeAll
    static void loadCatalogs() throws CatalogException {
        events = EventCatalog.loadDefault();
        sectors = SectorCatalog.loadDefault();
    }

    @Test
    void testGlobalTableProbabilities() {
        double total = events.globalEvents().stream().mapToDouble(EventDefinition::getProbability).sum();
        assertTrue(total > 0 && total <= 1.0 + 1e-9, "Global probabilities should sum to at most 1");
        for (EventDefinition definition : events.globalEvents()) {
            assertEquals(EventType.EventCategory.GLOBAL, definition.getType().getCategory());
        }
    }

    @Test
    void testPortfolioTableIncludesChoices() {
        assertNotNull(events.find(EventType.PORTFOLIO_EQUITY_DEMAND));
        assertNotNull(events.find(EventType.MBO_PROPOSAL));
        assertNotNull(events.find(EventType.PORTFOLIO_CLIENT_CHURNS));
        assertTrue(EventType.MBO_PROPOSAL.requiresChoice());
        assertFalse(EventType.PORTFOLIO_CLIENT_CHURNS.requiresChoice());
    }

    @Test
    void testRecessionDefinition() {
        EventDefinition recession = events.find(EventType.GLOBAL_RECESSION);
        assertNotNull(recession);
        assertEquals("Recession", recession.getTitle());
        assertTrue(recession.getProbability() > 0);
    }

    @Test
    void testSectorEventsReferToKnownSectors() {
        assertFalse(events.sectorEvents().isEmpty());
        for (EventDefinition definition : events.sectorEvents()) {
            assertEquals(EventType.SECTOR_EVENT, definition.getType());
            assertTrue(sectors.hasSector(definition.getSectorId()),
                "Unknown sector on " + definition.getTitle() + ": " + definition.getSectorId());
        }
    }

    @Test
    void testEventTypeJsonValues() {
        assertEquals(EventType.GLOBAL_QUIET, EventType.fromString("global_quiet"));
        assertEquals("mbo_proposal", EventType.MBO_PROPOSAL.getJsonValue());
        assertThrows(IllegalArgumentException.class, () -> EventType.fromString("alien_invasion"));
    }

    @Test
    void testRejectsOverfullTable() {
        String json = "{\"global\": ["
            + "{\"type\": \"global_recession\", \"title\": \"R\", \"probability\": 0.7},"
            + "{\"type\": \"global_bull_market\", \"title\": \"B\", \"probability\": 0.6}]}";
        CatalogException e = assertThrows(CatalogException.class, () -> EventCatalog.fromJson(json));
        assertTrue(e.getMessage().contains("sum above 1"));
    }

    @Test
    void testRejectsMisfiledType() {
        String json = "{\"portfolio\": [{\"type\": \"global_recession\", \"title\": \"R\", \"probability\": 0.1}]}";
        assertThrows(CatalogException.class, () -> EventCatalog.fromJson(json));
    }

    @Test
    void testRejectsSectorEventWithoutSector() {
        String json = "{\"sector\": [{\"title\": \"Fire\", \"probability\": 0.1}]}";
        assertThrows(CatalogException.class, () -> EventCatalog.fromJson(json));
    }
}
