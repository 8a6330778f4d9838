package com.holdco.tycoon.deal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Financing shapes, in the order they are offered.
 */
public enum DealStructureType {
    ALL_CASH("all_cash", "All Cash"),
    SELLER_NOTE("seller_note", "Seller Note"),
    BANK_DEBT("bank_debt", "Bank Debt"),
    EARNOUT("earnout", "Earn-out"),
    LBO("seller_note_bank_debt", "LBO (Note + Debt)"),
    ROLLOVER_EQUITY("rollover_equity", "Rollover Equity");

    private final String jsonValue;
    private final String label;

    DealStructureType(String jsonValue, String label) {
        this.jsonValue = jsonValue;
        this.label = label;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public String getLabel() {
        return label;
    }

    public static DealStructureType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Structure type cannot be null");
        }
        for (DealStructureType type : values()) {
            if (type.jsonValue.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown structure type: " + value);
    }
}
