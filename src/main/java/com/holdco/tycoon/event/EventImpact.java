package com.holdco.tycoon.event;

/**
 * A before/after change an event made to the portfolio or the holdco.
 *
 * @param businessId   affected business, or null for holdco-level metrics
 * @param deltaPercent fractional change; 0 when the before value was 0
 */
public record EventImpact(String businessId, String businessName, Metric metric,
                          double before, double after, double delta, double deltaPercent) {

    public enum Metric {
        EBITDA,
        REVENUE,
        MARGIN,
        GROWTH_RATE,
        QUALITY,
        INTEREST_RATE,
        CASH,
        SHARES
    }

    public static EventImpact holdco(Metric metric, double before, double after) {
        return new EventImpact(null, null, metric, before, after, after - before, percent(before, after));
    }

    public static EventImpact business(String businessId, String businessName, Metric metric,
                                       double before, double after) {
        return new EventImpact(businessId, businessName, metric, before, after, after - before,
            percent(before, after));
    }

    private static double percent(double before, double after) {
        return before != 0 ? (after - before) / Math.abs(before) : 0;
    }
}
