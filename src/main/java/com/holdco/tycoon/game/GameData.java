package com.holdco.tycoon.game;

import com.holdco.tycoon.config.CatalogException;
import com.holdco.tycoon.event.EventCatalog;
import com.holdco.tycoon.sector.SectorCatalog;

/**
 * Static tables a game reads but never changes. Shared by every copy of a game state.
 */
public record GameData(SectorCatalog sectors, EventCatalog events) {

    /**
     * Load the bundled sector and event tables.
     */
    public static GameData loadDefault() throws CatalogException {
        return new GameData(SectorCatalog.loadDefault(), EventCatalog.loadDefault());
    }
}
