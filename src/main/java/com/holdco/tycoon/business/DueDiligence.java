package com.holdco.tycoon.business;

import com.holdco.tycoon.sector.ConcentrationLevel;

/**
 * Diligence findings attached to a business when it is generated.
 *
 * @param revenueConcentration share of revenue held by the top customers
 * @param operatorQuality      management strength
 * @param trend                recent EBITDA trajectory
 * @param customerRetention    annual retention in percent
 * @param competitivePosition  standing in its niche
 */
public record DueDiligence(
    ConcentrationLevel revenueConcentration,
    OperatorQuality operatorQuality,
    Trend trend,
    int customerRetention,
    CompetitivePosition competitivePosition
) {

    public enum Trend {
        GROWING,
        FLAT,
        DECLINING
    }

    public enum CompetitivePosition {
        LEADER,
        COMPETITIVE,
        COMMODITIZED
    }

    public DueDiligence withOperatorQuality(OperatorQuality quality) {
        return new DueDiligence(revenueConcentration, quality, trend, customerRetention, competitivePosition);
    }
}
