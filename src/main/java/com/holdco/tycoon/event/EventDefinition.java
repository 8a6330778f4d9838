package com.holdco.tycoon.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the event probability table.
 *
 * Sector events additionally name their sector and carry their effect as data; global and portfolio
 * events have hard-wired effects keyed by {@link #getType()}.
 */
public class EventDefinition {
    @JsonProperty("type")
    private EventType type;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("effect")
    private String effectDescription;

    @JsonProperty("probability")
    private double probability;

    @JsonProperty("sector_id")
    private String sectorId;

    @JsonProperty("ebitda_effect")
    private double[] ebitdaEffect = new double[2];

    @JsonProperty("growth_effect")
    private double growthEffect;

    @JsonProperty("cost_amount")
    private long costAmount;

    @JsonProperty("affects_all")
    private boolean affectsAll;

    public EventDefinition() {
    }

    public EventType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getEffectDescription() {
        return effectDescription;
    }

    public double getProbability() {
        return probability;
    }

    public String getSectorId() {
        return sectorId;
    }

    /**
     * EBITDA change as a [min, max] fraction; equal bounds mean a fixed change.
     */
    public double[] getEbitdaEffect() {
        return ebitdaEffect;
    }

    public double getGrowthEffect() {
        return growthEffect;
    }

    public long getCostAmount() {
        return costAmount;
    }

    /** True when the event hits every business in the sector rather than one. */
    public boolean isAffectsAll() {
        return affectsAll;
    }

    public void setType(EventType type) {
        this.type = type;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public void setProbability(double probability) {
        this.probability = probability;
    }

    public void setSectorId(String sectorId) {
        this.sectorId = sectorId;
    }

    @Override
    public String toString() {
        return String.format("EventDefinition[%s %s p=%.3f]", type.getJsonValue(), title, probability);
    }
}
