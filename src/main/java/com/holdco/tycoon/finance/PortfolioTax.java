package com.holdco.tycoon.finance;

import com.holdco.tycoon.business.Business;

import java.util.List;

/**
 * Consolidated portfolio tax with loss offsets, interest and shared-service deductions.
 *
 * @param grossEbitda             sum of non-negative EBITDA
 * @param lossOffset              absolute sum of negative EBITDA
 * @param taxableIncome           never negative
 * @param totalTaxSavings         naive tax on gross EBITDA minus actual tax
 */
public record PortfolioTax(
    long grossEbitda,
    long lossOffset,
    long netEbitda,
    long holdcoInterest,
    long opcoInterest,
    long totalInterest,
    long sharedServicesCost,
    long taxableIncome,
    long taxAmount,
    double effectiveTaxRate,
    long lossOffsetTaxShield,
    long interestTaxShield,
    long sharedServicesTaxShield,
    long totalTaxSavings
) {
    public static final double TAX_RATE = 0.30;

    public static PortfolioTax calculate(List<Business> businesses, long holdcoDebt,
                                         double holdcoInterestRate, long sharedServicesCost) {
        long gross = 0;
        long losses = 0;
        long opcoInterest = 0;
        for (Business business : businesses) {
            if (!business.isActive()) {
                continue;
            }
            if (business.getEbitda() >= 0) {
                gross += business.getEbitda();
            } else {
                losses += Math.abs(business.getEbitda());
            }
            opcoInterest += Math.round(business.getSellerNoteBalance() * business.getSellerNoteRate());
            opcoInterest += Math.round(business.getBankDebtBalance() * business.getBankDebtRate());
        }
        long net = gross - losses;
        long holdcoInterest = Math.round(holdcoDebt * holdcoInterestRate);
        long totalInterest = holdcoInterest + opcoInterest;

        long taxable = Math.max(0, net - totalInterest - sharedServicesCost);
        long tax = Math.round(taxable * TAX_RATE);
        long naiveTax = Math.round(Math.max(0, gross) * TAX_RATE);
        double effectiveRate = gross > 0 ? (double) tax / gross : 0;

        // Shields are attributed in order: losses, interest, shared services
        long remaining = Math.max(0, gross);
        long lossDeduction = Math.min(remaining, losses);
        remaining -= lossDeduction;
        long interestDeduction = Math.min(remaining, totalInterest);
        remaining -= interestDeduction;
        long servicesDeduction = Math.min(remaining, sharedServicesCost);

        return new PortfolioTax(gross, losses, net, holdcoInterest, opcoInterest, totalInterest,
            sharedServicesCost, taxable, tax, effectiveRate,
            Math.round(lossDeduction * TAX_RATE),
            Math.round(interestDeduction * TAX_RATE),
            Math.round(servicesDeduction * TAX_RATE),
            naiveTax - tax);
    }
}
