package com.holdco.tycoon.business;

import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.rng.SeededRng;
import com.holdco.tycoon.sector.SectorCatalog;
import com.holdco.tycoon.sector.SectorDefinition;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BusinessGeneratorTest {

    private static SectorCatalog sectors;

    @BeforeAll
    static void loadSectors() throws Exception {
        sectors = SectorCatalog.loadDefault();
    }

    @Test
    void testQualityRatingDistribution() {
        SeededRng rng = new SeededRng(12345);
        int[] counts = new int[6];
        for (int i = 0; i < 10_000; i++) {
            int quality = BusinessGenerator.generateQualityRating(rng);
            assertTrue(quality >= 1 && quality <= 5);
            counts[quality]++;
        }
        assertTrue(counts[3] > counts[1], "Threes should dominate ones");
        assertTrue(counts[3] > counts[5], "Threes should dominate fives");
        assertTrue(counts[1] > 0 && counts[5] > 0);
    }

    @Test
    void testGenerateBusiness() {
        SectorDefinition sector = sectors.getSector("agency");

        Business business = BusinessGenerator.generateBusiness("biz-test", sector, 3, null, null, null,
            new SeededRng(99));

        assertEquals("biz-test", business.getId());
        assertEquals("agency", business.getSectorId());
        assertEquals(3, business.getAcquisitionRound());
        assertTrue(business.getEbitda() >= 100);
        assertTrue(business.getAcquisitionMultiple() >= 1.0);
        assertEquals(Math.round(business.getEbitda() * business.getAcquisitionMultiple()),
            business.getAcquisitionPrice());
        assertEquals(business.getEbitda(), business.getAcquisitionEbitda());
        assertTrue(sector.getSubTypes().contains(business.getSubType()));
        assertNotNull(business.getDueDiligence());
    }

    @Test
    void testGenerationIsDeterministic() {
        SectorDefinition sector = sectors.getSector("agency");
        Business a = BusinessGenerator.generateBusiness("biz-a", sector, 1, null, null, null, new SeededRng(5));
        Business b = BusinessGenerator.generateBusiness("biz-a", sector, 1, null, null, null, new SeededRng(5));

        assertEquals(a.getName(), b.getName());
        assertEquals(a.getEbitda(), b.getEbitda());
        assertEquals(a.getQualityRating(), b.getQualityRating());
        assertEquals(a.getAcquisitionMultiple(), b.getAcquisitionMultiple(), 1e-12);
    }

    @Test
    void testForcedQualityAndRange() {
        SectorDefinition sector = sectors.getSector("agency");

        Business business = BusinessGenerator.generateBusiness("biz-q", sector, 1, 5, null,
            new double[] {2000, 2500}, new SeededRng(1));

        assertEquals(5, business.getQualityRating());
        assertTrue(business.getEbitda() >= 2000 && business.getEbitda() <= 2500);
        assertEquals(OperatorQuality.STRONG, business.getDueDiligence().operatorQuality());
    }

    @Test
    void testStartingBusiness() {
        Business normal = BusinessGenerator.createStartingBusiness(sectors, Difficulty.NORMAL, new SeededRng(1));
        Business easy = BusinessGenerator.createStartingBusiness(sectors, Difficulty.EASY, new SeededRng(1));

        assertEquals(BusinessGenerator.STARTING_BUSINESS_ID, normal.getId());
        assertEquals(3, normal.getQualityRating());
        assertEquals(800, normal.getEbitda());
        assertEquals(1000, easy.getEbitda());
        assertTrue(normal.getAcquisitionMultiple() <= 4.0);
        assertEquals(0, normal.getIntegrationRoundsRemaining());
        assertTrue(normal.isActive());
    }
}
