package com.holdco.tycoon.deal;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessGenerator;
import com.holdco.tycoon.business.OperatorQuality;
import com.holdco.tycoon.rng.SeededRng;
import com.holdco.tycoon.sector.PriceTier;
import com.holdco.tycoon.sector.SectorCatalog;
import com.holdco.tycoon.sector.SectorDefinition;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Generates acquisition opportunities.
 *
 * Each deal owns three private streams forked from the caller's stream by deal ID: one for the
 * business profile, one for heat and one for structure terms. The caller's stream is only drawn
 * for choices between deals (sector picks, shuffles), so two deals never share randomness.
 */
public final class DealGenerator {

    public static final int MAX_PIPELINE = 8;
    public static final int TARGET_NEW_DEALS = 5;
    public static final int MIN_PIPELINE = 4;

    public static final int SOURCED_BATCH_SIZE = 3;
    public static final int OUTREACH_BATCH_SIZE = 2;
    public static final long SOURCING_COST = 500;
    public static final long SOURCING_COST_WITH_TIER = 300;
    public static final long OUTREACH_COST = 400;

    private DealGenerator() {
        // Utility class - prevent instantiation
    }

    // ---- Single deal ----

    /**
     * Generate one deal. Draws from the parent stream only through forks keyed by the deal ID.
     */
    public static Deal generateDeal(String id, SectorDefinition sector, DealOptions options,
                                    DealFlowContext context, SeededRng parent) {
        SeededRng rng = parent.fork(id);
        SeededRng heatRng = parent.fork(id + ":heat");
        int termsSeed = (int) parent.fork(id + ":terms").getState();
        int round = context.round();

        int quality = BusinessGenerator.generateQualityRating(rng);
        if (options.qualityFloor() != null) {
            quality = Math.max(quality, options.qualityFloor());
        }
        Business business = BusinessGenerator.generateBusiness("biz-" + id, sector, round, quality,
            options.subType(), null, rng);

        long ebitda;
        double scaler = SizePreference.portfolioScaler(context.portfolioEbitda());
        SizePreference size = options.size();
        if (size == SizePreference.ANY) {
            ebitda = Math.round(business.getEbitda() * scaler);
        } else {
            double target = rng.nextInRange(size.getMinEbitda(), size.getMaxEbitda());
            if (size == SizePreference.LARGE) {
                target *= scaler;
            }
            ebitda = Math.round(target);
        }
        resize(business, ebitda);

        AcquisitionType acquisitionType = determineAcquisitionType(ebitda, quality);
        double tuckInDiscount = acquisitionType == AcquisitionType.TUCK_IN ? tuckInDiscount(quality) : 0;

        SellerArchetype archetype = SellerArchetype.assign(quality, rng);
        OperatorQuality operator = archetype.rollOperatorQuality(rng);
        business.setDueDiligence(business.getDueDiligence().withOperatorQuality(operator));
        business.setSellerArchetype(archetype);
        double priceModifier = archetype.rollPriceModifier(rng);

        DealSource source = options.source() != null
            ? options.source()
            : rng.next() > 0.4 ? DealSource.INBOUND : DealSource.BROKERED;

        long basePrice = business.getAcquisitionPrice();
        double discount = Math.max(tuckInDiscount, Math.max(options.multipleDiscount(), Math.max(0, -priceModifier)));
        long askingPrice = discount > 0 ? Math.round(basePrice * (1 - discount)) : basePrice;
        if (priceModifier > 0) {
            askingPrice = Math.round(askingPrice * (1 + priceModifier));
        }
        long distressedCap = Long.MAX_VALUE;
        if (archetype == SellerArchetype.DISTRESSED_SELLER && ebitda > 0) {
            double capMultiple = quality <= 2
                ? sector.getAcquisitionMultiple()[0] + 0.5
                : sector.averageMultiple();
            distressedCap = Math.round(ebitda * capMultiple);
            askingPrice = Math.min(askingPrice, distressedCap);
        }

        if (archetype == SellerArchetype.FRANCHISE_BREAKAWAY) {
            business.setOrganicGrowthRate(business.getOrganicGrowthRate() + 0.02);
        }

        DealHeat heat = options.forcedHeat() != null
            ? options.forcedHeat()
            : DealHeatCalculator.calculateHeat(quality, source, round, context.maxRounds(),
                context.lastEventType(), archetype, context.creditTightening(),
                context.activeSourcingLevel(), heatRng);
        long effectivePrice = Math.min(distressedCap,
            Math.round(askingPrice * DealHeatCalculator.heatPremium(heat, heatRng)));

        business.setAcquisitionType(acquisitionType);
        return new Deal(id, business, askingPrice, effectivePrice,
            Deal.BASE_FRESHNESS + options.freshnessBonus(), round, source, acquisitionType,
            tuckInDiscount, heat, archetype, termsSeed);
    }

    /**
     * Under 500 EBITDA is a tuck-in; quality 4+ at 2M+ is a platform.
     */
    public static AcquisitionType determineAcquisitionType(long ebitda, int quality) {
        if (ebitda < 500) {
            return AcquisitionType.TUCK_IN;
        }
        if (quality >= 4 && ebitda >= 2000) {
            return AcquisitionType.PLATFORM;
        }
        return AcquisitionType.STANDALONE;
    }

    /**
     * 15% at quality 3, five points more per quality step down, within [5%, 25%].
     */
    public static double tuckInDiscount(int quality) {
        return Math.max(0.05, Math.min(0.25, 0.15 + (3 - quality) * 0.05));
    }

    private static void resize(Business business, long ebitda) {
        long revenue = Math.round(ebitda / business.getEbitdaMargin());
        long price = Math.round(ebitda * business.getAcquisitionMultiple());
        business.setEbitda(ebitda);
        business.setPeakEbitda(ebitda);
        business.setAcquisitionEbitda(ebitda);
        business.setRevenue(revenue);
        business.setPeakRevenue(revenue);
        business.setAcquisitionRevenue(revenue);
        business.setAcquisitionPrice(price);
        business.setTotalAcquisitionCost(price);
    }

    // ---- Sector weighting ----

    /**
     * Weighted sector pick: each price tier's share for the round is split evenly across its sectors.
     * Consumes one draw.
     */
    public static SectorDefinition pickWeightedSector(int round, int maxRounds, SectorCatalog sectors,
                                                      SeededRng rng) {
        Map<PriceTier, Integer> tierCounts = new EnumMap<>(PriceTier.class);
        for (SectorDefinition sector : sectors.all()) {
            tierCounts.merge(sector.getPriceTier(), 1, Integer::sum);
        }
        double total = 0;
        for (SectorDefinition sector : sectors.all()) {
            total += weight(sector, round, maxRounds, tierCounts);
        }
        double roll = rng.next() * total;
        for (SectorDefinition sector : sectors.all()) {
            roll -= weight(sector, round, maxRounds, tierCounts);
            if (roll <= 0) {
                return sector;
            }
        }
        return sectors.all().get(0);
    }

    private static double weight(SectorDefinition sector, int round, int maxRounds,
                                 Map<PriceTier, Integer> tierCounts) {
        return sector.getPriceTier().weightForRound(round, maxRounds) / tierCounts.get(sector.getPriceTier());
    }

    private static SectorDefinition pickFromFocusGroup(String focusGroup, SectorCatalog sectors, SeededRng rng) {
        List<SectorDefinition> members = new ArrayList<>();
        for (SectorDefinition sector : sectors.all()) {
            if (sector.getFocusGroup().equals(focusGroup)) {
                members.add(sector);
            }
        }
        return rng.pick(members);
    }

    // ---- Pipeline ----

    /**
     * Age the current pipeline, drop expired deals, and top it up for the allocation phase.
     */
    public static List<Deal> generatePipeline(List<Deal> current, DealFlowContext context,
                                              SectorCatalog sectors, SeededRng rng) {
        List<Deal> pipeline = new ArrayList<>();
        for (Deal deal : current) {
            Deal aged = deal.aged();
            if (!aged.isExpired()) {
                pipeline.add(aged);
            }
        }
        int targetNew = Math.max(0, TARGET_NEW_DEALS - pipeline.size());
        int round = context.round();
        int[] counter = {0};
        MAFocus focus = context.maFocus();
        SizePreference focusSize = focus.sizePreference();
        int sourcingLevel = context.activeSourcingLevel();

        if (focus.hasSector() && sectors.hasSector(focus.sectorId()) && pipeline.size() < MAX_PIPELINE) {
            DealOptions options = DealOptions.of(focusSize)
                .withSubType(sourcingLevel >= 2 ? focus.subType() : null);
            pipeline.add(generateDeal(pipelineId(round, counter), sectors.getSector(focus.sectorId()),
                options, context, rng));
        }

        if (sourcingLevel >= 1 && pipeline.size() < MAX_PIPELINE) {
            SectorDefinition sector = focus.hasSector() && sectors.hasSector(focus.sectorId())
                ? sectors.getSector(focus.sectorId())
                : pickWeightedSector(round, context.maxRounds(), sectors, rng);
            DealOptions options = sourcedOptions(focusSize, focus, sourcingLevel).withFreshnessBonus(1);
            pipeline.add(generateDeal(pipelineId(round, counter), sector, options, context, rng));
        }

        if (context.focusGroup() != null && context.focusTier() >= 1 && pipeline.size() < MAX_PIPELINE) {
            SectorDefinition sector = pickFromFocusGroup(context.focusGroup(), sectors, rng);
            if (sector != null) {
                pipeline.add(generateDeal(pipelineId(round, counter), sector, DealOptions.of(focusSize),
                    context, rng));
            }
        }

        int target = Math.max(MIN_PIPELINE, Math.min(MAX_PIPELINE, pipeline.size() + targetNew));
        int fillIndex = 0;
        while (pipeline.size() < target) {
            SectorDefinition sector = pickWeightedSector(round, context.maxRounds(), sectors, rng);
            DealOptions options = DealOptions.of(earlyRoundSize(round, fillIndex++, focusSize));
            pipeline.add(generateDeal(pipelineId(round, counter), sector, options, context, rng));
        }
        return pipeline;
    }

    /**
     * Round 1 and 2 lean toward small and medium deals so a first acquisition is affordable.
     */
    static SizePreference earlyRoundSize(int round, int index, SizePreference preferred) {
        if (round == 1) {
            return index < 2 ? SizePreference.MEDIUM : SizePreference.SMALL;
        }
        if (round == 2) {
            return index < 3 ? SizePreference.MEDIUM : SizePreference.SMALL;
        }
        return preferred;
    }

    private static String pipelineId(int round, int[] counter) {
        return "r" + round + "-p" + counter[0]++;
    }

    private static DealOptions sourcedOptions(SizePreference size, MAFocus focus, int sourcingLevel) {
        DealOptions options = DealOptions.of(size).withSource(DealSource.SOURCED);
        if (sourcingLevel >= 2) {
            options = options.withQualityFloor(2).withSubType(focus.subType());
        }
        if (sourcingLevel >= 3) {
            options = options.withQualityFloor(3);
        }
        return options;
    }

    // ---- Paid sourcing ----

    /**
     * A paid batch of three sourced deals. The occurrence number keeps repeated batches in
     * one round distinct.
     */
    public static List<Deal> generateSourcedDeals(DealFlowContext context, SectorCatalog sectors,
                                                  int occurrence, SeededRng deals) {
        SeededRng rng = deals.fork("source-" + occurrence);
        int round = context.round();
        MAFocus focus = context.maFocus();
        int sourcingLevel = context.activeSourcingLevel();
        DealOptions options = sourcedOptions(focus.sizePreference(), focus, sourcingLevel);

        List<SectorDefinition> picks = new ArrayList<>();
        if (focus.hasSector() && sectors.hasSector(focus.sectorId())) {
            SectorDefinition focusSector = sectors.getSector(focus.sectorId());
            picks.add(focusSector);
            picks.add(focusSector);
            SectorDefinition groupSector = context.focusGroup() != null
                && !context.focusGroup().equals(focusSector.getFocusGroup())
                ? pickFromFocusGroup(context.focusGroup(), sectors, rng)
                : null;
            picks.add(groupSector != null ? groupSector : pickWeightedSector(round, context.maxRounds(), sectors, rng));
        } else if (context.focusGroup() != null) {
            picks.add(pickFromFocusGroup(context.focusGroup(), sectors, rng));
            picks.add(pickFromFocusGroup(context.focusGroup(), sectors, rng));
            picks.add(pickWeightedSector(round, context.maxRounds(), sectors, rng));
        } else {
            List<SectorDefinition> shuffled = new ArrayList<>(sectors.all());
            rng.shuffle(shuffled);
            picks.addAll(shuffled.subList(0, Math.min(SOURCED_BATCH_SIZE, shuffled.size())));
        }

        List<Deal> batch = new ArrayList<>();
        for (int k = 0; k < picks.size(); k++) {
            String id = "r" + round + "-s" + occurrence + "-" + k;
            batch.add(generateDeal(id, picks.get(k), options, context, rng));
        }
        return batch;
    }

    /**
     * Two off-market proprietary deals of quality 3 or better.
     */
    public static List<Deal> generateOutreachDeals(DealFlowContext context, SectorCatalog sectors,
                                                   int occurrence, SeededRng deals) {
        SeededRng rng = deals.fork("outreach-" + occurrence);
        int round = context.round();
        MAFocus focus = context.maFocus();
        SectorDefinition sector = focus.hasSector() && sectors.hasSector(focus.sectorId())
            ? sectors.getSector(focus.sectorId())
            : pickWeightedSector(round, context.maxRounds(), sectors, rng);
        DealOptions options = DealOptions.of(focus.sizePreference())
            .withSource(DealSource.PROPRIETARY)
            .withQualityFloor(3)
            .withSubType(focus.subType());

        List<Deal> batch = new ArrayList<>();
        for (int k = 0; k < OUTREACH_BATCH_SIZE; k++) {
            String id = "r" + round + "-o" + occurrence + "-" + k;
            batch.add(generateDeal(id, sector, options, context, rng));
        }
        return batch;
    }

    /**
     * A cold, quality 3+ deal introduced by a portfolio company.
     */
    public static Deal generateReferralDeal(DealFlowContext context, SectorCatalog sectors, SeededRng deals) {
        SeededRng rng = deals.fork("referral");
        SectorDefinition sector = pickWeightedSector(context.round(), context.maxRounds(), sectors, rng);
        DealOptions options = DealOptions.of(SizePreference.ANY)
            .withSource(DealSource.SOURCED)
            .withQualityFloor(3)
            .withForcedHeat(DealHeat.COLD);
        return generateDeal("r" + context.round() + "-ref", sector, options, context, rng);
    }
}
