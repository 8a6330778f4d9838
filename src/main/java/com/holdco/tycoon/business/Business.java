package com.holdco.tycoon.business;

import com.holdco.tycoon.deal.AcquisitionType;
import com.holdco.tycoon.deal.SellerArchetype;

import java.util.ArrayList;
import java.util.List;

/**
 * An operating company, owned or for sale. Money amounts are in thousands.
 * Only the round manager and player actions mutate owned businesses, always on a copy of the game state.
 */
public class Business {
    // Identity
    private String id;
    private String name;
    private String sectorId;
    private String subType;

    // Operating profile
    private long revenue;
    private double ebitdaMargin;
    private long ebitda;
    private long peakEbitda;
    private long peakRevenue;
    private double organicGrowthRate;
    private double marginDriftRate;
    private int qualityRating;
    private DueDiligence dueDiligence;
    private int integrationRoundsRemaining;
    private List<ImprovementType> improvements = new ArrayList<>();

    // Acquisition snapshot
    private long acquisitionEbitda;
    private long acquisitionRevenue;
    private double acquisitionMargin;
    private long acquisitionPrice;
    private double acquisitionMultiple;
    private int acquisitionRound;
    private long totalAcquisitionCost;
    private AcquisitionType acquisitionType = AcquisitionType.STANDALONE;
    private SellerArchetype sellerArchetype;

    // Debt instruments
    private long sellerNoteBalance;
    private double sellerNoteRate;
    private int sellerNoteRoundsRemaining;
    private long bankDebtBalance;
    private double bankDebtRate;
    private int bankDebtRoundsRemaining;
    private long earnoutRemaining;
    private double earnoutTarget;
    private int earnoutRoundsRemaining;
    private double rolloverEquityPct;

    // Lifecycle
    private BusinessStatus status = BusinessStatus.ACTIVE;
    private Long exitPrice;
    private Integer exitRound;

    // Platform
    private boolean platform;
    private int platformScale;
    private List<String> boltOnIds = new ArrayList<>();
    private String parentPlatformId;
    private IntegrationOutcome integrationOutcome;
    private long synergiesRealized;

    public Business() {
    }

    /**
     * Copy constructor. Lists are copied; records are immutable and shared.
     */
    public Business(Business other) {
        this.id = other.id;
        this.name = other.name;
        this.sectorId = other.sectorId;
        this.subType = other.subType;
        this.revenue = other.revenue;
        this.ebitdaMargin = other.ebitdaMargin;
        this.ebitda = other.ebitda;
        this.peakEbitda = other.peakEbitda;
        this.peakRevenue = other.peakRevenue;
        this.organicGrowthRate = other.organicGrowthRate;
        this.marginDriftRate = other.marginDriftRate;
        this.qualityRating = other.qualityRating;
        this.dueDiligence = other.dueDiligence;
        this.integrationRoundsRemaining = other.integrationRoundsRemaining;
        this.improvements = new ArrayList<>(other.improvements);
        this.acquisitionEbitda = other.acquisitionEbitda;
        this.acquisitionRevenue = other.acquisitionRevenue;
        this.acquisitionMargin = other.acquisitionMargin;
        this.acquisitionPrice = other.acquisitionPrice;
        this.acquisitionMultiple = other.acquisitionMultiple;
        this.acquisitionRound = other.acquisitionRound;
        this.totalAcquisitionCost = other.totalAcquisitionCost;
        this.acquisitionType = other.acquisitionType;
        this.sellerArchetype = other.sellerArchetype;
        this.sellerNoteBalance = other.sellerNoteBalance;
        this.sellerNoteRate = other.sellerNoteRate;
        this.sellerNoteRoundsRemaining = other.sellerNoteRoundsRemaining;
        this.bankDebtBalance = other.bankDebtBalance;
        this.bankDebtRate = other.bankDebtRate;
        this.bankDebtRoundsRemaining = other.bankDebtRoundsRemaining;
        this.earnoutRemaining = other.earnoutRemaining;
        this.earnoutTarget = other.earnoutTarget;
        this.earnoutRoundsRemaining = other.earnoutRoundsRemaining;
        this.rolloverEquityPct = other.rolloverEquityPct;
        this.status = other.status;
        this.exitPrice = other.exitPrice;
        this.exitRound = other.exitRound;
        this.platform = other.platform;
        this.platformScale = other.platformScale;
        this.boltOnIds = new ArrayList<>(other.boltOnIds);
        this.parentPlatformId = other.parentPlatformId;
        this.integrationOutcome = other.integrationOutcome;
        this.synergiesRealized = other.synergiesRealized;
    }

    public Business copy() {
        return new Business(this);
    }

    // ---- Derived values ----

    public boolean isActive() {
        return status == BusinessStatus.ACTIVE;
    }

    /**
     * Opco-level debt plus contingent earn-out, everything a buyer's proceeds must clear.
     */
    public long totalObligations() {
        return sellerNoteBalance + bankDebtBalance + earnoutRemaining;
    }

    /**
     * EBITDA growth since acquisition, or 0 when the acquisition EBITDA was not positive.
     */
    public double ebitdaGrowthSinceAcquisition() {
        if (acquisitionEbitda <= 0) {
            return 0;
        }
        return (double) (ebitda - acquisitionEbitda) / acquisitionEbitda;
    }

    public boolean hasImprovement(ImprovementType type) {
        return improvements.contains(type);
    }

    /**
     * Re-derive EBITDA from revenue and margin.
     */
    public void recomputeEbitda() {
        this.ebitda = Math.round(revenue * ebitdaMargin);
        this.peakEbitda = Math.max(peakEbitda, ebitda);
        this.peakRevenue = Math.max(peakRevenue, revenue);
    }

    public static double clampMargin(double margin) {
        return Math.max(0.03, Math.min(0.80, margin));
    }

    // ---- Identity ----

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSectorId() {
        return sectorId;
    }

    public void setSectorId(String sectorId) {
        this.sectorId = sectorId;
    }

    public String getSubType() {
        return subType;
    }

    public void setSubType(String subType) {
        this.subType = subType;
    }

    // ---- Operating profile ----

    public long getRevenue() {
        return revenue;
    }

    public void setRevenue(long revenue) {
        this.revenue = revenue;
    }

    public double getEbitdaMargin() {
        return ebitdaMargin;
    }

    public void setEbitdaMargin(double ebitdaMargin) {
        this.ebitdaMargin = ebitdaMargin;
    }

    public long getEbitda() {
        return ebitda;
    }

    public void setEbitda(long ebitda) {
        this.ebitda = ebitda;
    }

    public long getPeakEbitda() {
        return peakEbitda;
    }

    public void setPeakEbitda(long peakEbitda) {
        this.peakEbitda = peakEbitda;
    }

    public long getPeakRevenue() {
        return peakRevenue;
    }

    public void setPeakRevenue(long peakRevenue) {
        this.peakRevenue = peakRevenue;
    }

    public double getOrganicGrowthRate() {
        return organicGrowthRate;
    }

    public void setOrganicGrowthRate(double organicGrowthRate) {
        this.organicGrowthRate = organicGrowthRate;
    }

    public double getMarginDriftRate() {
        return marginDriftRate;
    }

    public void setMarginDriftRate(double marginDriftRate) {
        this.marginDriftRate = marginDriftRate;
    }

    public int getQualityRating() {
        return qualityRating;
    }

    public void setQualityRating(int qualityRating) {
        this.qualityRating = Math.max(1, Math.min(5, qualityRating));
    }

    public DueDiligence getDueDiligence() {
        return dueDiligence;
    }

    public void setDueDiligence(DueDiligence dueDiligence) {
        this.dueDiligence = dueDiligence;
    }

    public int getIntegrationRoundsRemaining() {
        return integrationRoundsRemaining;
    }

    public void setIntegrationRoundsRemaining(int integrationRoundsRemaining) {
        this.integrationRoundsRemaining = integrationRoundsRemaining;
    }

    public List<ImprovementType> getImprovements() {
        return improvements;
    }

    // ---- Acquisition snapshot ----

    public long getAcquisitionEbitda() {
        return acquisitionEbitda;
    }

    public void setAcquisitionEbitda(long acquisitionEbitda) {
        this.acquisitionEbitda = acquisitionEbitda;
    }

    public long getAcquisitionRevenue() {
        return acquisitionRevenue;
    }

    public void setAcquisitionRevenue(long acquisitionRevenue) {
        this.acquisitionRevenue = acquisitionRevenue;
    }

    public double getAcquisitionMargin() {
        return acquisitionMargin;
    }

    public void setAcquisitionMargin(double acquisitionMargin) {
        this.acquisitionMargin = acquisitionMargin;
    }

    public long getAcquisitionPrice() {
        return acquisitionPrice;
    }

    public void setAcquisitionPrice(long acquisitionPrice) {
        this.acquisitionPrice = acquisitionPrice;
    }

    public double getAcquisitionMultiple() {
        return acquisitionMultiple;
    }

    public void setAcquisitionMultiple(double acquisitionMultiple) {
        this.acquisitionMultiple = acquisitionMultiple;
    }

    public int getAcquisitionRound() {
        return acquisitionRound;
    }

    public void setAcquisitionRound(int acquisitionRound) {
        this.acquisitionRound = acquisitionRound;
    }

    public long getTotalAcquisitionCost() {
        return totalAcquisitionCost;
    }

    public void setTotalAcquisitionCost(long totalAcquisitionCost) {
        this.totalAcquisitionCost = totalAcquisitionCost;
    }

    public AcquisitionType getAcquisitionType() {
        return acquisitionType;
    }

    public void setAcquisitionType(AcquisitionType acquisitionType) {
        this.acquisitionType = acquisitionType;
    }

    public SellerArchetype getSellerArchetype() {
        return sellerArchetype;
    }

    public void setSellerArchetype(SellerArchetype sellerArchetype) {
        this.sellerArchetype = sellerArchetype;
    }

    // ---- Debt instruments ----

    public long getSellerNoteBalance() {
        return sellerNoteBalance;
    }

    public void setSellerNoteBalance(long sellerNoteBalance) {
        this.sellerNoteBalance = sellerNoteBalance;
    }

    public double getSellerNoteRate() {
        return sellerNoteRate;
    }

    public void setSellerNoteRate(double sellerNoteRate) {
        this.sellerNoteRate = sellerNoteRate;
    }

    public int getSellerNoteRoundsRemaining() {
        return sellerNoteRoundsRemaining;
    }

    public void setSellerNoteRoundsRemaining(int sellerNoteRoundsRemaining) {
        this.sellerNoteRoundsRemaining = sellerNoteRoundsRemaining;
    }

    public long getBankDebtBalance() {
        return bankDebtBalance;
    }

    public void setBankDebtBalance(long bankDebtBalance) {
        this.bankDebtBalance = bankDebtBalance;
    }

    public double getBankDebtRate() {
        return bankDebtRate;
    }

    public void setBankDebtRate(double bankDebtRate) {
        this.bankDebtRate = bankDebtRate;
    }

    public int getBankDebtRoundsRemaining() {
        return bankDebtRoundsRemaining;
    }

    public void setBankDebtRoundsRemaining(int bankDebtRoundsRemaining) {
        this.bankDebtRoundsRemaining = bankDebtRoundsRemaining;
    }

    public long getEarnoutRemaining() {
        return earnoutRemaining;
    }

    public void setEarnoutRemaining(long earnoutRemaining) {
        this.earnoutRemaining = earnoutRemaining;
    }

    public double getEarnoutTarget() {
        return earnoutTarget;
    }

    public void setEarnoutTarget(double earnoutTarget) {
        this.earnoutTarget = earnoutTarget;
    }

    public int getEarnoutRoundsRemaining() {
        return earnoutRoundsRemaining;
    }

    public void setEarnoutRoundsRemaining(int earnoutRoundsRemaining) {
        this.earnoutRoundsRemaining = earnoutRoundsRemaining;
    }

    public double getRolloverEquityPct() {
        return rolloverEquityPct;
    }

    public void setRolloverEquityPct(double rolloverEquityPct) {
        this.rolloverEquityPct = rolloverEquityPct;
    }

    // ---- Lifecycle ----

    public BusinessStatus getStatus() {
        return status;
    }

    public void setStatus(BusinessStatus status) {
        this.status = status;
    }

    public Long getExitPrice() {
        return exitPrice;
    }

    public void setExitPrice(Long exitPrice) {
        this.exitPrice = exitPrice;
    }

    public Integer getExitRound() {
        return exitRound;
    }

    public void setExitRound(Integer exitRound) {
        this.exitRound = exitRound;
    }

    // ---- Platform ----

    public boolean isPlatform() {
        return platform;
    }

    public void setPlatform(boolean platform) {
        this.platform = platform;
    }

    public int getPlatformScale() {
        return platformScale;
    }

    public void setPlatformScale(int platformScale) {
        this.platformScale = platformScale;
    }

    public List<String> getBoltOnIds() {
        return boltOnIds;
    }

    public String getParentPlatformId() {
        return parentPlatformId;
    }

    public void setParentPlatformId(String parentPlatformId) {
        this.parentPlatformId = parentPlatformId;
    }

    public IntegrationOutcome getIntegrationOutcome() {
        return integrationOutcome;
    }

    public void setIntegrationOutcome(IntegrationOutcome integrationOutcome) {
        this.integrationOutcome = integrationOutcome;
    }

    public long getSynergiesRealized() {
        return synergiesRealized;
    }

    public void setSynergiesRealized(long synergiesRealized) {
        this.synergiesRealized = synergiesRealized;
    }

    @Override
    public String toString() {
        return name + " [" + id + ", " + sectorId + ", Q" + qualityRating + ", EBITDA " + ebitda + ", " + status.getJsonValue() + "]";
    }
}
