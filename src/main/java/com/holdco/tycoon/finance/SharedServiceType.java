package com.holdco.tycoon.finance;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Holdco-level shared services. Costs are in thousands.
 */
public enum SharedServiceType {
    FINANCE_REPORTING("finance_reporting", "Finance & Reporting", 560, 250),
    RECRUITING_HR("recruiting_hr", "Recruiting & HR", 750, 320),
    PROCUREMENT("procurement", "Procurement", 600, 190),
    MARKETING_BRAND("marketing_brand", "Marketing & Brand", 675, 250),
    TECHNOLOGY_SYSTEMS("technology_systems", "Technology & Systems", 900, 380);

    /** Shared services need at least this many active opcos to run. */
    public static final int MIN_OPCOS = 3;
    public static final int MAX_ACTIVE = 3;

    private final String jsonValue;
    private final String displayName;
    private final long unlockCost;
    private final long annualCost;

    SharedServiceType(String jsonValue, String displayName, long unlockCost, long annualCost) {
        this.jsonValue = jsonValue;
        this.displayName = displayName;
        this.unlockCost = unlockCost;
        this.annualCost = annualCost;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public String getDisplayName() {
        return displayName;
    }

    public long getUnlockCost() {
        return unlockCost;
    }

    public long getAnnualCost() {
        return annualCost;
    }
}
