package com.holdco.tycoon.sector;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Static economics of one industry sector. Money ranges are in thousands.
 */
public class SectorDefinition {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("price_tier")
    private PriceTier priceTier = PriceTier.MID;

    @JsonProperty("base_ebitda")
    private double[] baseEbitda = new double[2];

    @JsonProperty("acquisition_multiple")
    private double[] acquisitionMultiple = new double[2];

    @JsonProperty("volatility")
    private double volatility;

    @JsonProperty("capex_rate")
    private double capexRate;

    @JsonProperty("organic_growth")
    private double[] organicGrowth = new double[2];

    @JsonProperty("client_concentration")
    private ConcentrationLevel clientConcentration = ConcentrationLevel.MEDIUM;

    @JsonProperty("talent_dependency")
    private ConcentrationLevel talentDependency = ConcentrationLevel.MEDIUM;

    @JsonProperty("recession_sensitivity")
    private double recessionSensitivity = 1.0;

    @JsonProperty("focus_group")
    private String focusGroup;

    @JsonProperty("sub_types")
    private List<String> subTypes = new ArrayList<>();

    @JsonProperty("base_margin")
    private double[] baseMargin = new double[2];

    @JsonProperty("margin_drift")
    private double[] marginDrift = new double[2];

    @JsonProperty("margin_volatility")
    private double marginVolatility;

    public SectorDefinition() {
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public PriceTier getPriceTier() {
        return priceTier;
    }

    public double[] getBaseEbitda() {
        return baseEbitda;
    }

    public double[] getAcquisitionMultiple() {
        return acquisitionMultiple;
    }

    /**
     * Midpoint of the acquisition multiple range.
     */
    public double averageMultiple() {
        return (acquisitionMultiple[0] + acquisitionMultiple[1]) / 2;
    }

    public double getVolatility() {
        return volatility;
    }

    public double getCapexRate() {
        return capexRate;
    }

    public double[] getOrganicGrowth() {
        return organicGrowth;
    }

    public ConcentrationLevel getClientConcentration() {
        return clientConcentration;
    }

    public ConcentrationLevel getTalentDependency() {
        return talentDependency;
    }

    public double getRecessionSensitivity() {
        return recessionSensitivity;
    }

    /**
     * Focus group used for sector-focus bonuses; defaults to the sector ID.
     */
    public String getFocusGroup() {
        return focusGroup != null ? focusGroup : id;
    }

    public List<String> getSubTypes() {
        return subTypes;
    }

    public double[] getBaseMargin() {
        return baseMargin;
    }

    public double[] getMarginDrift() {
        return marginDrift;
    }

    public double getMarginVolatility() {
        return marginVolatility;
    }

    public void setId(String id) {
        this.id = id;
    }

    public void setName(String name) {
        this.name = name;
    }

    public void setCapexRate(double capexRate) {
        this.capexRate = capexRate;
    }

    public void setVolatility(double volatility) {
        this.volatility = volatility;
    }
}
