package com.holdco.tycoon.business;

import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.rng.SeededRng;
import com.holdco.tycoon.sector.ConcentrationLevel;
import com.holdco.tycoon.sector.SectorCatalog;
import com.holdco.tycoon.sector.SectorDefinition;

import java.util.List;

/**
 * Generates business profiles from sector data and a private random stream.
 * Every draw comes from the stream passed in, in a fixed order.
 */
public final class BusinessGenerator {

    public static final String STARTING_SECTOR = "agency";
    public static final String STARTING_BUSINESS_ID = "biz-start";

    private static final List<String> NAME_PREFIXES = List.of(
        "Summit", "Keystone", "Harbor", "Pinnacle", "Cornerstone", "Northwind", "Bluegrass",
        "Ironwood", "Lakeshore", "Redline", "Evergreen", "Granite", "Meridian", "Sterling",
        "Crescent", "Frontier", "Beacon", "Oakridge", "Silverline", "Trident");

    private BusinessGenerator() {
        // Utility class - prevent instantiation
    }

    /**
     * Weighted quality: mostly 3s, few 1s and 5s.
     */
    public static int generateQualityRating(SeededRng rng) {
        double roll = rng.next();
        if (roll < 0.05) return 1;
        if (roll < 0.20) return 2;
        if (roll < 0.60) return 3;
        if (roll < 0.85) return 4;
        return 5;
    }

    public static DueDiligence generateDueDiligence(int quality, SectorDefinition sector, SeededRng rng) {
        ConcentrationLevel concentration = switch (sector.getClientConcentration()) {
            case HIGH -> quality >= 4 ? ConcentrationLevel.MEDIUM : ConcentrationLevel.HIGH;
            case MEDIUM -> quality >= 4 ? ConcentrationLevel.LOW
                : quality >= 2 ? ConcentrationLevel.MEDIUM : ConcentrationLevel.HIGH;
            case LOW -> quality >= 3 ? ConcentrationLevel.LOW : ConcentrationLevel.MEDIUM;
        };

        OperatorQuality operator;
        if (quality >= 4) operator = OperatorQuality.STRONG;
        else if (quality >= 2) operator = OperatorQuality.MODERATE;
        else operator = OperatorQuality.WEAK;

        DueDiligence.Trend trend;
        if (quality >= 4) {
            trend = DueDiligence.Trend.GROWING;
        } else if (quality >= 2) {
            trend = rng.next() > 0.3 ? DueDiligence.Trend.FLAT : DueDiligence.Trend.GROWING;
        } else {
            trend = rng.next() > 0.5 ? DueDiligence.Trend.DECLINING : DueDiligence.Trend.FLAT;
        }

        int retention;
        if (quality >= 4) retention = rng.nextInt(90, 98);
        else if (quality >= 3) retention = rng.nextInt(82, 92);
        else if (quality >= 2) retention = rng.nextInt(75, 85);
        else retention = rng.nextInt(65, 78);

        DueDiligence.CompetitivePosition position;
        if (quality >= 4) {
            position = rng.next() > 0.3 ? DueDiligence.CompetitivePosition.LEADER
                : DueDiligence.CompetitivePosition.COMPETITIVE;
        } else if (quality >= 2) {
            position = rng.next() > 0.5 ? DueDiligence.CompetitivePosition.COMPETITIVE
                : DueDiligence.CompetitivePosition.COMMODITIZED;
        } else {
            position = DueDiligence.CompetitivePosition.COMMODITIZED;
        }

        return new DueDiligence(concentration, operator, trend, retention, position);
    }

    /**
     * Generate an unowned business.
     *
     * @param forceQuality  quality to use instead of rolling, or null
     * @param forceSubType  sub-type to use when valid for the sector, or null
     * @param ebitdaRange   EBITDA range to draw from instead of the sector's, or null
     */
    public static Business generateBusiness(String id, SectorDefinition sector, int round,
                                            Integer forceQuality, String forceSubType,
                                            double[] ebitdaRange, SeededRng rng) {
        int quality = forceQuality != null ? forceQuality : generateQualityRating(rng);
        DueDiligence dueDiligence = generateDueDiligence(quality, sector, rng);

        double qualityModifier = 0.8 + (quality - 1) * 0.1;
        double margin = Business.clampMargin(
            rng.nextInRange(sector.getBaseMargin()[0], sector.getBaseMargin()[1]) + (quality - 3) * 0.015);

        long ebitda;
        if (ebitdaRange != null) {
            ebitda = Math.round(rng.nextInRange(ebitdaRange[0], ebitdaRange[1]));
        } else {
            ebitda = Math.round(rng.nextInRange(sector.getBaseEbitda()[0], sector.getBaseEbitda()[1]) * qualityModifier);
        }
        ebitda = Math.max(100, ebitda);
        long revenue = Math.round(ebitda / margin);

        double growth = rng.nextInRange(sector.getOrganicGrowth()[0], sector.getOrganicGrowth()[1]);
        growth += (quality - 3) * 0.005;
        if (dueDiligence.trend() == DueDiligence.Trend.GROWING) growth += 0.02;
        else if (dueDiligence.trend() == DueDiligence.Trend.DECLINING) growth -= 0.03;

        double drift = rng.nextInRange(sector.getMarginDrift()[0], sector.getMarginDrift()[1]);

        double multiple = rng.nextInRange(sector.getAcquisitionMultiple()[0], sector.getAcquisitionMultiple()[1]);
        multiple += (quality - 3) * 0.35;
        if (dueDiligence.competitivePosition() == DueDiligence.CompetitivePosition.LEADER) multiple += 0.3;
        else if (dueDiligence.competitivePosition() == DueDiligence.CompetitivePosition.COMMODITIZED) multiple -= 0.3;
        multiple = Math.max(1.0, Math.round(multiple * 10) / 10.0);

        String subType = forceSubType != null && sector.getSubTypes().contains(forceSubType)
            ? forceSubType
            : rng.pick(sector.getSubTypes());
        String prefix = rng.pick(NAME_PREFIXES);

        Business business = new Business();
        business.setId(id);
        business.setName(prefix + " " + (subType != null ? subType : sector.getName()));
        business.setSectorId(sector.getId());
        business.setSubType(subType);
        business.setQualityRating(quality);
        business.setDueDiligence(dueDiligence);
        business.setRevenue(revenue);
        business.setEbitdaMargin(margin);
        business.setEbitda(ebitda);
        business.setPeakEbitda(ebitda);
        business.setPeakRevenue(revenue);
        business.setOrganicGrowthRate(growth);
        business.setMarginDriftRate(drift);
        business.setAcquisitionEbitda(ebitda);
        business.setAcquisitionRevenue(revenue);
        business.setAcquisitionMargin(margin);
        business.setAcquisitionMultiple(multiple);
        business.setAcquisitionPrice(Math.round(ebitda * multiple));
        business.setTotalAcquisitionCost(business.getAcquisitionPrice());
        business.setAcquisitionRound(round);
        business.setIntegrationRoundsRemaining(2);
        return business;
    }

    /**
     * The business every holdco starts the game owning: a fair-quality agency.
     */
    public static Business createStartingBusiness(SectorCatalog sectors, Difficulty difficulty, SeededRng rng) {
        SectorDefinition sector = sectors.getSector(STARTING_SECTOR);
        Business business = generateBusiness(STARTING_BUSINESS_ID, sector, 0, 3, null, null, rng);

        long ebitda = difficulty.getStartingEbitda();
        double multiple = sector.averageMultiple();
        if (difficulty.getStartingMultipleCap() != null) {
            multiple = Math.min(difficulty.getStartingMultipleCap(), multiple);
        }
        long price = Math.round(ebitda * multiple);
        long revenue = Math.round(ebitda / business.getEbitdaMargin());

        business.setEbitda(ebitda);
        business.setPeakEbitda(ebitda);
        business.setAcquisitionEbitda(ebitda);
        business.setRevenue(revenue);
        business.setPeakRevenue(revenue);
        business.setAcquisitionRevenue(revenue);
        business.setAcquisitionMultiple(multiple);
        business.setAcquisitionPrice(price);
        business.setTotalAcquisitionCost(price);
        business.setIntegrationRoundsRemaining(0);
        business.setStatus(BusinessStatus.ACTIVE);
        return business;
    }
}
