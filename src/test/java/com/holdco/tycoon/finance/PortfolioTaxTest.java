package com.holdco.tycoon.finance;

import com.holdco.tycoon.business.Business;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for consolidated portfolio tax.
 */
class PortfolioTaxTest {

    private static Business business(String id, long ebitda) {
        Business business = new Business();
        business.setId(id);
        business.setSectorId("agency");
        business.setEbitda(ebitda);
        return business;
    }

    @Test
    void testPlainTax() {
        PortfolioTax tax = PortfolioTax.calculate(List.of(business("a", 1000)), 0, 0.07, 0);
        assertEquals(1000, tax.taxableIncome());
        assertEquals(300, tax.taxAmount());
        assertEquals(0.30, tax.effectiveTaxRate(), 1e-9);
        assertEquals(0, tax.totalTaxSavings());
    }

    @Test
    void testLossesOffsetGains() {
        PortfolioTax tax = PortfolioTax.calculate(List.of(business("a", 1000), business("b", -400)), 0, 0.07, 0);
        assertEquals(1000, tax.grossEbitda());
        assertEquals(400, tax.lossOffset());
        assertEquals(600, tax.taxableIncome());
        assertEquals(180, tax.taxAmount());
        assertEquals(120, tax.lossOffsetTaxShield());
    }

    @Test
    void testInterestAndServicesShieldIncome() {
        Business opco = business("a", 1000);
        opco.setBankDebtBalance(1000);
        opco.setBankDebtRate(0.08);

        PortfolioTax tax = PortfolioTax.calculate(List.of(opco), 2000, 0.07, 100);
        assertEquals(140, tax.holdcoInterest());
        assertEquals(80, tax.opcoInterest());
        assertEquals(1000 - 220 - 100, tax.taxableIncome());
        assertEquals(Math.round(220 * 0.30), tax.interestTaxShield());
        assertEquals(30, tax.sharedServicesTaxShield());
    }

    @Test
    void testTaxableIncomeNeverNegative() {
        PortfolioTax tax = PortfolioTax.calculate(List.of(business("a", 200), business("b", -900)), 5000, 0.10, 400);
        assertEquals(0, tax.taxableIncome());
        assertEquals(0, tax.taxAmount());
        assertEquals(0.0, tax.effectiveTaxRate(), 1e-9);
    }

    @Test
    void testEmptyPortfolio() {
        PortfolioTax tax = PortfolioTax.calculate(List.of(), 0, 0.07, 0);
        assertEquals(0, tax.taxAmount());
        assertEquals(0.0, tax.effectiveTaxRate());
    }
}
