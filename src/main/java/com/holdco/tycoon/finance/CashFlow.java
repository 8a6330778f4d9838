package com.holdco.tycoon.finance;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.sector.SectorCatalog;
import com.holdco.tycoon.sector.SectorDefinition;

import java.util.List;

/**
 * Pre-tax free cash flow. Tax is computed at portfolio level by {@link PortfolioTax}.
 */
public final class CashFlow {

    private CashFlow() {
        // Utility class - prevent instantiation
    }

    /**
     * EBITDA less sector capex, scaled by any cash conversion bonus.
     */
    public static long annualFcf(Business business, SectorDefinition sector,
                                 double capexReduction, double cashConversionBonus) {
        double effectiveCapexRate = sector.getCapexRate() * (1 - capexReduction);
        double capex = business.getEbitda() * effectiveCapexRate;
        double fcf = (business.getEbitda() - capex) * (1 + cashConversionBonus);
        return Math.round(fcf);
    }

    public static long annualFcf(Business business, SectorDefinition sector) {
        return annualFcf(business, sector, 0, 0);
    }

    /**
     * Sum of pre-tax FCF over active businesses. Integrated bolt-ons are already inside their platform.
     */
    public static long portfolioPreTaxFcf(List<Business> businesses, SectorCatalog sectors,
                                          SharedServiceBenefits benefits) {
        long total = 0;
        for (Business business : businesses) {
            if (business.isActive()) {
                total += annualFcf(business, sectors.getSector(business.getSectorId()),
                    benefits.capexReduction(), benefits.cashConversionBonus());
            }
        }
        return total;
    }
}
