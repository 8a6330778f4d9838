package com.holdco.tycoon.scoring;

/**
 * Patterns recognised in a finished game, each with the lesson it teaches.
 * Declaration order is the order insights are reported in.
 */
public enum PostGameInsight {
    NEVER_ACQUIRED("Never acquired anything",
        "Cash is optionality, but perpetual hoarding means your capital isn't compounding."),
    OVER_LEVERAGED("Over-leveraged (>3x)",
        "Tyco collapsed when debt outran cash. Push debt to the opco level and avoid parent guarantees."),
    SINGLE_SECTOR("Single-sector portfolio",
        "Concentration builds expertise but inherits cyclicality."),
    HIGH_ROIIC_MOIC("High ROIIC + high MOIC",
        "You deployed capital with discipline and patience, focused on returns over growth."),
    IGNORED_REINVESTMENT("Ignored reinvestment",
        "Operational improvement is a form of reinvestment. Even organic growth needs fuel."),
    STRONG_CONVERSION("Strong cash conversion",
        "Your portfolio converts earnings to cash reliably, which shows the earnings are real."),
    SMART_EXITS("Smart exits (sold at >2x MOIC)",
        "You recycled capital effectively: bought low, improved operations and exited higher."),
    HELD_LOSERS("Held losers too long",
        "Cut losses when the economics no longer justify the capital. A wind-down is discipline, not failure."),
    GOOD_SHARED_SERVICES("Good shared services ROI",
        "You built an operating system, not just a portfolio."),
    EQUITY_WELL_DEPLOYED("Equity raised and well deployed",
        "You raised capital wisely and deployed it at high returns. The dilution was worth it."),
    EQUITY_POORLY_DEPLOYED("Equity raised with poor returns",
        "Every share you issue must earn its keep through higher FCF per share."),
    WELL_TIMED_BUYBACKS("Well-timed buybacks",
        "Buying back stock when capital had nowhere better to go follows the distribution hierarchy."),
    SMART_DISTRIBUTIONS("Disciplined capital return",
        "You returned capital when reinvestment returns declined."),
    HOARDED_CASH("Excess idle cash",
        "Cash earning nothing drags on returns. Without deals above the hurdle rate, return it to owners.");

    private final String pattern;
    private final String insight;

    PostGameInsight(String pattern, String insight) {
        this.pattern = pattern;
        this.insight = insight;
    }

    public String getPattern() {
        return pattern;
    }

    public String getInsight() {
        return insight;
    }
}
