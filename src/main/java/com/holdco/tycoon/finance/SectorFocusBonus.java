package com.holdco.tycoon.finance;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.sector.SectorCatalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bonus for concentrating the portfolio in one focus group.
 *
 * @param focusGroup group with the most active opcos
 * @param tier       1 at two opcos, 2 at three, 3 at four or more
 * @param opcoCount  active opcos in the group
 */
public record SectorFocusBonus(String focusGroup, int tier, int opcoCount) {

    /**
     * Find the strongest focus group, or null when no group has two active opcos.
     */
    public static SectorFocusBonus calculate(List<Business> businesses, SectorCatalog sectors) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Business business : businesses) {
            if (!business.isActive()) {
                continue;
            }
            String group = sectors.getSector(business.getSectorId()).getFocusGroup();
            counts.merge(group, 1, Integer::sum);
        }

        String maxGroup = null;
        int maxCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > maxCount) {
                maxCount = entry.getValue();
                maxGroup = entry.getKey();
            }
        }
        if (maxCount < 2) {
            return null;
        }
        int tier = maxCount >= 4 ? 3 : maxCount >= 3 ? 2 : 1;
        return new SectorFocusBonus(maxGroup, tier, maxCount);
    }

    /**
     * Annual growth bonus for this tier.
     */
    public double ebitdaBonus() {
        return switch (tier) {
            case 1 -> 0.02;
            case 2 -> 0.04;
            case 3 -> 0.07;
            default -> 0;
        };
    }

    /**
     * Growth bonus from a possibly-null focus result.
     */
    public static double ebitdaBonusOf(SectorFocusBonus bonus) {
        return bonus == null ? 0 : bonus.ebitdaBonus();
    }
}
