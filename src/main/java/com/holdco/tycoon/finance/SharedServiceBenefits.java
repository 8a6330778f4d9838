package com.holdco.tycoon.finance;

import java.util.Collection;

/**
 * Combined effect of the active shared services, scaled by portfolio size.
 */
public record SharedServiceBenefits(
    double capexReduction,
    double cashConversionBonus,
    double growthBonus,
    double reinvestmentBonus,
    double talentRetentionBonus,
    double talentGainBonus
) {
    public static final SharedServiceBenefits NONE = new SharedServiceBenefits(0, 0, 0, 0, 0, 0);

    /**
     * 1-2 opcos: 1.0x, then +0.05x per opco up to 1.2x at six or more.
     */
    public static double scaleMultiplier(int opcoCount) {
        if (opcoCount >= 6) {
            return 1.2;
        }
        return opcoCount >= 3 ? 1.0 + (opcoCount - 2) * 0.05 : 1.0;
    }

    public static SharedServiceBenefits calculate(Collection<SharedServiceType> active, int opcoCount) {
        double scale = scaleMultiplier(opcoCount);
        double capex = 0;
        double cashConversion = 0;
        double growth = 0;
        double reinvestment = 0;
        double retention = 0;
        double gain = 0;
        for (SharedServiceType service : active) {
            switch (service) {
                case FINANCE_REPORTING -> cashConversion += 0.05 * scale;
                case RECRUITING_HR -> {
                    retention += 0.5 * scale;
                    gain += 0.3 * scale;
                }
                case PROCUREMENT -> capex += 0.15 * scale;
                case MARKETING_BRAND -> growth += 0.015 * scale;
                case TECHNOLOGY_SYSTEMS -> reinvestment += 0.2 * scale;
            }
        }
        return new SharedServiceBenefits(capex, cashConversion, growth, reinvestment, retention, gain);
    }
}
