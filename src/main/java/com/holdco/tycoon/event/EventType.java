package com.holdco.tycoon.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every kind of event the engine can draw.
 */
public enum EventType {
    GLOBAL_BULL_MARKET("global_bull_market", EventCategory.GLOBAL),
    GLOBAL_RECESSION("global_recession", EventCategory.GLOBAL),
    GLOBAL_INTEREST_HIKE("global_interest_hike", EventCategory.GLOBAL),
    GLOBAL_INTEREST_CUT("global_interest_cut", EventCategory.GLOBAL),
    GLOBAL_INFLATION("global_inflation", EventCategory.GLOBAL),
    GLOBAL_CREDIT_TIGHTENING("global_credit_tightening", EventCategory.GLOBAL),
    GLOBAL_QUIET("global_quiet", EventCategory.GLOBAL),
    PORTFOLIO_STAR_JOINS("portfolio_star_joins", EventCategory.PORTFOLIO),
    PORTFOLIO_TALENT_LEAVES("portfolio_talent_leaves", EventCategory.PORTFOLIO),
    PORTFOLIO_CLIENT_SIGNS("portfolio_client_signs", EventCategory.PORTFOLIO),
    PORTFOLIO_CLIENT_CHURNS("portfolio_client_churns", EventCategory.PORTFOLIO),
    PORTFOLIO_BREAKTHROUGH("portfolio_breakthrough", EventCategory.PORTFOLIO),
    PORTFOLIO_COMPLIANCE("portfolio_compliance", EventCategory.PORTFOLIO),
    PORTFOLIO_REFERRAL_DEAL("portfolio_referral_deal", EventCategory.PORTFOLIO),
    PORTFOLIO_EQUITY_DEMAND("portfolio_equity_demand", EventCategory.CHOICE),
    PORTFOLIO_SELLER_NOTE_RENEGO("portfolio_seller_note_renego", EventCategory.CHOICE),
    SECTOR_EVENT("sector_event", EventCategory.SECTOR),
    UNSOLICITED_OFFER("unsolicited_offer", EventCategory.CHOICE),
    MBO_PROPOSAL("mbo_proposal", EventCategory.CHOICE);

    /**
     * Broad grouping used for table lookup and effect deferral.
     */
    public enum EventCategory {
        GLOBAL,
        PORTFOLIO,
        SECTOR,
        CHOICE
    }

    private final String jsonValue;
    private final EventCategory category;

    EventType(String jsonValue, EventCategory category) {
        this.jsonValue = jsonValue;
        this.category = category;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public EventCategory getCategory() {
        return category;
    }

    /**
     * Choice events change nothing until the player picks an option.
     */
    public boolean requiresChoice() {
        return category == EventCategory.CHOICE;
    }

    @JsonCreator
    public static EventType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        for (EventType type : values()) {
            if (type.jsonValue.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
