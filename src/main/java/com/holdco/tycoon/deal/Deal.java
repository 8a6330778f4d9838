package com.holdco.tycoon.deal;

import com.holdco.tycoon.business.Business;

/**
 * An acquisition opportunity in the pipeline. The business is a snapshot and is never mutated;
 * acquiring a deal copies it.
 */
public final class Deal {
    public static final int BASE_FRESHNESS = 2;

    private final String id;
    private final Business business;
    private final long askingPrice;
    private final long effectivePrice;
    private final int freshness;
    private final int roundAppeared;
    private final DealSource source;
    private final AcquisitionType acquisitionType;
    private final double tuckInDiscount;
    private final DealHeat heat;
    private final SellerArchetype sellerArchetype;
    private final int termsSeed;

    public Deal(String id, Business business, long askingPrice, long effectivePrice, int freshness,
                int roundAppeared, DealSource source, AcquisitionType acquisitionType, double tuckInDiscount,
                DealHeat heat, SellerArchetype sellerArchetype, int termsSeed) {
        this.id = id;
        this.business = business;
        this.askingPrice = askingPrice;
        this.effectivePrice = effectivePrice;
        this.freshness = freshness;
        this.roundAppeared = roundAppeared;
        this.source = source;
        this.acquisitionType = acquisitionType;
        this.tuckInDiscount = tuckInDiscount;
        this.heat = heat;
        this.sellerArchetype = sellerArchetype;
        this.termsSeed = termsSeed;
    }

    /**
     * One round older.
     */
    public Deal aged() {
        return new Deal(id, business, askingPrice, effectivePrice, freshness - 1, roundAppeared, source,
            acquisitionType, tuckInDiscount, heat, sellerArchetype, termsSeed);
    }

    public boolean isExpired() {
        return freshness <= 0;
    }

    public String getId() {
        return id;
    }

    public Business getBusiness() {
        return business;
    }

    public long getAskingPrice() {
        return askingPrice;
    }

    /** Asking price after the heat premium; what the buyer actually pays. */
    public long getEffectivePrice() {
        return effectivePrice;
    }

    public int getFreshness() {
        return freshness;
    }

    public int getRoundAppeared() {
        return roundAppeared;
    }

    public DealSource getSource() {
        return source;
    }

    public AcquisitionType getAcquisitionType() {
        return acquisitionType;
    }

    public double getTuckInDiscount() {
        return tuckInDiscount;
    }

    public DealHeat getHeat() {
        return heat;
    }

    public SellerArchetype getSellerArchetype() {
        return sellerArchetype;
    }

    /**
     * Seed for structure terms. Fixed at generation so the offered terms never change.
     */
    public int getTermsSeed() {
        return termsSeed;
    }

    @Override
    public String toString() {
        return String.format("Deal[%s %s ebitda=%d price=%d heat=%s source=%s]",
            id, business.getSectorId(), business.getEbitda(), effectivePrice,
            heat.getJsonValue(), source.getJsonValue());
    }
}
