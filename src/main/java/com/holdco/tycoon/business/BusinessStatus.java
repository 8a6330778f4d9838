package com.holdco.tycoon.business;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an operating company.
 */
public enum BusinessStatus {
    ACTIVE("active"),
    /** Folded into a platform; its EBITDA lives in the parent. */
    INTEGRATED("integrated"),
    SOLD("sold"),
    MERGED("merged"),
    WOUND_DOWN("wound_down");

    private final String jsonValue;

    BusinessStatus(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Still owned by the holdco (standalone or folded into a platform).
     */
    public boolean isOwned() {
        return this == ACTIVE || this == INTEGRATED;
    }
}
