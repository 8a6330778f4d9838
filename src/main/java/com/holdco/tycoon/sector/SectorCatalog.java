package com.holdco.tycoon.sector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.holdco.tycoon.config.CatalogException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sector table loaded from JSON. Iteration order is file order, which fixes the order
 * of weighted sector draws.
 */
public class SectorCatalog {
    public static final String DEFAULT_RESOURCE = "sectors.json";

    private final Map<String, SectorDefinition> sectors;

    private SectorCatalog(Map<String, SectorDefinition> sectors) {
        this.sectors = sectors;
    }

    /**
     * Load the bundled sector table.
     */
    public static SectorCatalog loadDefault() throws CatalogException {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load sectors from a JSON file.
     */
    public static SectorCatalog fromFile(String path) throws CatalogException {
        try {
            return fromJson(Files.readString(Path.of(path)));
        } catch (IOException e) {
            throw new CatalogException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load sectors from a classpath resource.
     */
    public static SectorCatalog fromResource(String resourcePath) throws CatalogException {
        try (InputStream is = SectorCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CatalogException("Resource not found: " + resourcePath);
            }
            ObjectMapper mapper = new ObjectMapper();
            List<SectorDefinition> list = mapper.readValue(is, new TypeReference<List<SectorDefinition>>() {});
            return fromList(list);
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load sectors from a JSON string.
     */
    public static SectorCatalog fromJson(String json) throws CatalogException {
        try {
            ObjectMapper mapper = new ObjectMapper();
            List<SectorDefinition> list = mapper.readValue(json, new TypeReference<List<SectorDefinition>>() {});
            return fromList(list);
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static SectorCatalog fromList(List<SectorDefinition> list) throws CatalogException {
        Map<String, SectorDefinition> sectors = new LinkedHashMap<>();
        for (SectorDefinition sector : list) {
            if (sector.getId() == null) {
                throw new CatalogException("Sector without id: " + sector.getName());
            }
            if (sectors.put(sector.getId(), sector) != null) {
                throw new CatalogException("Duplicate sector id: " + sector.getId());
            }
        }
        if (sectors.isEmpty()) {
            throw new CatalogException("Sector table is empty");
        }
        return new SectorCatalog(sectors);
    }

    /**
     * Get a sector by ID.
     * @throws IllegalArgumentException if the sector is unknown
     */
    public SectorDefinition getSector(String id) {
        SectorDefinition sector = sectors.get(id);
        if (sector == null) {
            throw new IllegalArgumentException("Unknown sector: " + id);
        }
        return sector;
    }

    public boolean hasSector(String id) {
        return sectors.containsKey(id);
    }

    public List<SectorDefinition> all() {
        return Collections.unmodifiableList(new ArrayList<>(sectors.values()));
    }

    public int sectorCount() {
        return sectors.size();
    }
}
