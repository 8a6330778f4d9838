package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessStatus;
import com.holdco.tycoon.business.DueDiligence;
import com.holdco.tycoon.business.ImprovementType;
import com.holdco.tycoon.business.IntegrationOutcome;
import com.holdco.tycoon.business.OperatorQuality;
import com.holdco.tycoon.deal.AcquisitionType;
import com.holdco.tycoon.deal.Deal;
import com.holdco.tycoon.deal.DealGenerator;
import com.holdco.tycoon.deal.DealHeat;
import com.holdco.tycoon.deal.DealStructure;
import com.holdco.tycoon.deal.DealStructureType;
import com.holdco.tycoon.deal.DealStructurer;
import com.holdco.tycoon.deal.MAFocus;
import com.holdco.tycoon.deal.MASourcingTier;
import com.holdco.tycoon.deal.SizePreference;
import com.holdco.tycoon.finance.DistressLevel;
import com.holdco.tycoon.finance.ExitValuation;
import com.holdco.tycoon.finance.SharedServiceType;
import com.holdco.tycoon.finance.Valuation;
import com.holdco.tycoon.rng.ActionRoll;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Capital allocation decisions taken during the allocate phase.
 *
 * Every action is validated against the state before anything changes. A rejected action returns
 * the very instance it was given, so callers can detect a no-op with {@code ==}. Accepted actions
 * return a new state with refreshed metrics.
 */
public final class PlayerActions {
    private static final Logger logger = LoggerFactory.getLogger(PlayerActions.class);

    public static final double BASE_INTEGRATION_PROBABILITY = 0.6;
    public static final double FAILED_INTEGRATION_COST_RATE = 0.07;
    public static final double FAILED_INTEGRATION_GROWTH_DRAG = 0.01;
    public static final int TUCK_IN_INTEGRATION_ROUNDS = 1;
    public static final int MERGER_INTEGRATION_ROUNDS = 2;

    public static final long PLATFORM_COST_FLOOR = 50;
    public static final double PLATFORM_COST_RATE = 0.05;
    public static final long MERGE_COST_FLOOR = 100;
    public static final double MERGE_COST_RATE = 0.15;
    public static final double WIND_DOWN_COST_RATE = 0.10;

    public static final double MIN_FOUNDER_OWNERSHIP = 0.51;
    public static final double EQUITY_DILUTION_STEP = 0.10;
    public static final double MAX_EQUITY_DISCOUNT = 0.50;

    /** Acquisitions per round without an active sourcing team. */
    public static final int BASE_MAX_ACQUISITIONS = 2;

    private PlayerActions() {
        // Utility class - prevent instantiation
    }

    // ==================== ACQUISITIONS ====================

    /**
     * Buy a pipeline deal as a standalone opco.
     */
    public static GameState acquire(GameState state, String dealId, DealStructureType structureType) {
        if (!canAcquire(state)) {
            return state;
        }
        Deal deal = state.findDeal(dealId);
        DealStructure structure = deal != null ? offeredStructure(state, deal, structureType) : null;
        if (structure == null) {
            return state;
        }

        GameState next = state.copy();
        next.setAcquisitionsThisRound(next.getAcquisitionsThisRound() + 1);
        next.getDealPipeline().remove(deal);
        if (snatched(next, deal)) {
            return MetricsCalculator.refresh(next);
        }

        Business business = acquiredBusiness(next, deal, structure);
        business.setIntegrationRoundsRemaining(operatorQuality(business).getIntegrationRounds());
        next.getBusinesses().add(business);
        next.addCash(-structure.cashRequired());
        next.setTotalInvestedCapital(next.getTotalInvestedCapital() + deal.getEffectivePrice());

        logger.debug("Round {}: acquired {} for {} ({})", next.getRound(), business.getName(),
            deal.getEffectivePrice(), structureType);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Buy a pipeline deal and fold it into an existing platform of the same sector.
     *
     * The bolt-on keeps its own debt but its EBITDA moves into the platform together with any
     * synergies; the platform's multiple expands with its scale.
     */
    public static GameState acquireTuckIn(GameState state, String dealId, DealStructureType structureType,
                                          String platformId) {
        if (!canAcquire(state)) {
            return state;
        }
        Deal deal = state.findDeal(dealId);
        Business target = state.findBusiness(platformId);
        if (deal == null || target == null || !target.isActive() || !target.isPlatform()
            || !target.getSectorId().equals(deal.getBusiness().getSectorId())) {
            return state;
        }
        DealStructure structure = offeredStructure(state, deal, structureType);
        if (structure == null) {
            return state;
        }

        GameState next = state.copy();
        next.setAcquisitionsThisRound(next.getAcquisitionsThisRound() + 1);
        next.getDealPipeline().remove(deal);
        if (snatched(next, deal)) {
            return MetricsCalculator.refresh(next);
        }

        Business platform = next.findBusiness(platformId);
        Business boltOn = acquiredBusiness(next, deal, structure);
        IntegrationOutcome outcome = rollIntegration(next, boltOn);
        long synergies = Math.round(boltOn.getEbitda() * synergyRate(outcome, deal.getAcquisitionType()));

        boltOn.setStatus(BusinessStatus.INTEGRATED);
        boltOn.setParentPlatformId(platformId);
        boltOn.setIntegrationOutcome(outcome);
        boltOn.setSynergiesRealized(synergies);
        boltOn.setIntegrationRoundsRemaining(TUCK_IN_INTEGRATION_ROUNDS);

        int oldScale = platform.getPlatformScale();
        long oldEbitda = platform.getEbitda();
        long combinedEbitda = oldEbitda + boltOn.getEbitda() + synergies;
        long combinedRevenue = platform.getRevenue() + boltOn.getRevenue();
        platform.setPlatformScale(oldScale + 1);
        platform.getBoltOnIds().add(boltOn.getId());
        platform.setAcquisitionMultiple(platform.getAcquisitionMultiple()
            + multipleExpansion(oldScale + 1, combinedEbitda) - multipleExpansion(oldScale, oldEbitda));
        platform.setEbitda(combinedEbitda);
        platform.setRevenue(combinedRevenue);
        if (combinedRevenue > 0) {
            platform.setEbitdaMargin(Business.clampMargin((double) combinedEbitda / combinedRevenue));
        }
        platform.setPeakEbitda(Math.max(platform.getPeakEbitda(), combinedEbitda));
        platform.setPeakRevenue(Math.max(platform.getPeakRevenue(), combinedRevenue));
        platform.setSynergiesRealized(platform.getSynergiesRealized() + synergies);
        platform.setTotalAcquisitionCost(platform.getTotalAcquisitionCost() + deal.getEffectivePrice());

        long restructuringCost = 0;
        if (outcome == IntegrationOutcome.FAILURE) {
            restructuringCost = Math.round(Math.abs(boltOn.getEbitda()) * FAILED_INTEGRATION_COST_RATE);
            platform.setOrganicGrowthRate(
                OrganicGrowth.capGrowthRate(platform.getOrganicGrowthRate() - FAILED_INTEGRATION_GROWTH_DRAG));
        }

        next.getBusinesses().add(boltOn);
        next.setCash(Math.max(0, next.getCash() - structure.cashRequired() - restructuringCost));
        next.setTotalInvestedCapital(next.getTotalInvestedCapital() + deal.getEffectivePrice() + restructuringCost);

        logger.debug("Round {}: tucked {} into {} ({}, synergies {})", next.getRound(), boltOn.getName(),
            platform.getName(), outcome, synergies);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Make an active business a platform that can take tuck-ins.
     */
    public static GameState designatePlatform(GameState state, String businessId) {
        if (!inAllocate(state)) {
            return state;
        }
        Business business = state.findBusiness(businessId);
        if (business == null || !business.isActive() || business.isPlatform()) {
            return state;
        }
        long cost = platformCost(business);
        if (state.getCash() < cost) {
            return state;
        }

        GameState next = state.copy();
        Business platform = next.findBusiness(businessId);
        platform.setPlatform(true);
        platform.setPlatformScale(1);
        next.addCash(-cost);
        next.setTotalInvestedCapital(next.getTotalInvestedCapital() + cost);
        return MetricsCalculator.refresh(next);
    }

    public static long platformCost(Business business) {
        return Math.max(PLATFORM_COST_FLOOR, Math.round(Math.abs(business.getEbitda()) * PLATFORM_COST_RATE));
    }

    /**
     * Combine two active businesses of the same sector, named after the first.
     */
    public static GameState merge(GameState state, String firstId, String secondId) {
        Business first = state.findBusiness(firstId);
        return merge(state, firstId, secondId, first != null ? first.getName() + " Group" : null);
    }

    /**
     * Combine two active businesses of the same sector into a new platform. The originals are
     * marked merged and their bolt-ons move to the new business.
     */
    public static GameState merge(GameState state, String firstId, String secondId, String newName) {
        if (!inAllocate(state) || firstId == null || firstId.equals(secondId) || newName == null) {
            return state;
        }
        Business a = state.findBusiness(firstId);
        Business b = state.findBusiness(secondId);
        if (a == null || b == null || !a.isActive() || !b.isActive() || !a.getSectorId().equals(b.getSectorId())) {
            return state;
        }
        long smallerEbitda = Math.min(Math.abs(a.getEbitda()), Math.abs(b.getEbitda()));
        long mergeCost = Math.max(MERGE_COST_FLOOR, Math.round(smallerEbitda * MERGE_COST_RATE));
        if (state.getCash() < mergeCost) {
            return state;
        }

        GameState next = state.copy();
        a = next.findBusiness(firstId);
        b = next.findBusiness(secondId);
        IntegrationOutcome outcome = rollIntegration(next, b);
        long synergies = Math.round(smallerEbitda * mergerSynergyRate(outcome));
        long restructuringCost = outcome == IntegrationOutcome.FAILURE
            ? Math.round(smallerEbitda * FAILED_INTEGRATION_COST_RATE)
            : 0;
        long totalCost = mergeCost + restructuringCost;
        if (next.getCash() < totalCost) {
            return state;
        }

        Business merged = mergedBusiness(a, b, newName, outcome, synergies, totalCost);
        for (String boltOnId : merged.getBoltOnIds()) {
            Business boltOn = next.findBusiness(boltOnId);
            if (boltOn != null) {
                boltOn.setParentPlatformId(merged.getId());
            }
        }
        for (Business original : List.of(a, b)) {
            original.setStatus(BusinessStatus.MERGED);
            original.setExitRound(next.getRound());
            original.getBoltOnIds().clear();
        }
        next.getBusinesses().add(merged);
        next.addCash(-totalCost);
        next.setTotalInvestedCapital(next.getTotalInvestedCapital() + totalCost);

        logger.debug("Round {}: merged {} and {} into {} ({})", next.getRound(), a.getName(), b.getName(),
            merged.getName(), outcome);
        return MetricsCalculator.refresh(next);
    }

    private static Business mergedBusiness(Business a, Business b, String name,
                                           IntegrationOutcome outcome, long synergies, long totalCost) {
        long combinedEbitda = a.getEbitda() + b.getEbitda() + synergies;
        long combinedRevenue = a.getRevenue() + b.getRevenue();
        int previousScale = Math.max(a.getPlatformScale(), b.getPlatformScale());
        long previousEbitda = Math.max(a.getEbitda(), b.getEbitda());
        double expansion = multipleExpansion(previousScale + 1, combinedEbitda)
            - multipleExpansion(previousScale, previousEbitda);
        double growth = (a.getOrganicGrowthRate() + b.getOrganicGrowthRate()) / 2;
        if (outcome == IntegrationOutcome.FAILURE) {
            growth -= FAILED_INTEGRATION_GROWTH_DRAG;
        }

        Business merged = new Business();
        merged.setId("m-" + a.getId() + "-" + b.getId());
        merged.setName(name);
        merged.setSectorId(a.getSectorId());
        merged.setSubType(a.getSubType());
        merged.setRevenue(combinedRevenue);
        merged.setEbitda(combinedEbitda);
        merged.setEbitdaMargin(combinedRevenue > 0
            ? Business.clampMargin((double) combinedEbitda / combinedRevenue)
            : (a.getEbitdaMargin() + b.getEbitdaMargin()) / 2);
        merged.setPeakEbitda(combinedEbitda);
        merged.setPeakRevenue(combinedRevenue);
        merged.setOrganicGrowthRate(OrganicGrowth.capGrowthRate(growth));
        merged.setMarginDriftRate((a.getMarginDriftRate() + b.getMarginDriftRate()) / 2);
        merged.setQualityRating(Math.max(a.getQualityRating(), b.getQualityRating()));
        merged.setDueDiligence(a.getDueDiligence());
        merged.setIntegrationRoundsRemaining(MERGER_INTEGRATION_ROUNDS);
        Set<ImprovementType> improvements = new LinkedHashSet<>(a.getImprovements());
        improvements.addAll(b.getImprovements());
        merged.getImprovements().addAll(improvements);

        long acquisitionEbitda = a.getAcquisitionEbitda() + b.getAcquisitionEbitda();
        long acquisitionRevenue = a.getAcquisitionRevenue() + b.getAcquisitionRevenue();
        long combinedCost = a.getTotalAcquisitionCost() + b.getTotalAcquisitionCost() + totalCost;
        merged.setAcquisitionEbitda(acquisitionEbitda);
        merged.setAcquisitionRevenue(acquisitionRevenue);
        merged.setAcquisitionMargin(acquisitionRevenue > 0
            ? (double) acquisitionEbitda / acquisitionRevenue
            : merged.getEbitdaMargin());
        merged.setAcquisitionPrice(combinedCost);
        merged.setTotalAcquisitionCost(combinedCost);
        merged.setAcquisitionMultiple((a.getAcquisitionMultiple() + b.getAcquisitionMultiple()) / 2 + expansion);
        merged.setAcquisitionRound(Math.max(a.getAcquisitionRound(), b.getAcquisitionRound()));
        merged.setAcquisitionType(a.getAcquisitionType());
        merged.setSellerArchetype(a.getSellerArchetype());

        long noteBalance = a.getSellerNoteBalance() + b.getSellerNoteBalance();
        merged.setSellerNoteBalance(noteBalance);
        merged.setSellerNoteRate(weighted(a.getSellerNoteBalance(), a.getSellerNoteRate(),
            b.getSellerNoteBalance(), b.getSellerNoteRate()));
        merged.setSellerNoteRoundsRemaining((int) Math.ceil(weighted(a.getSellerNoteBalance(),
            a.getSellerNoteRoundsRemaining(), b.getSellerNoteBalance(), b.getSellerNoteRoundsRemaining())));
        long bankBalance = a.getBankDebtBalance() + b.getBankDebtBalance();
        merged.setBankDebtBalance(bankBalance);
        merged.setBankDebtRate(weighted(a.getBankDebtBalance(), a.getBankDebtRate(),
            b.getBankDebtBalance(), b.getBankDebtRate()));
        merged.setBankDebtRoundsRemaining((int) Math.ceil(weighted(a.getBankDebtBalance(),
            a.getBankDebtRoundsRemaining(), b.getBankDebtBalance(), b.getBankDebtRoundsRemaining())));
        merged.setEarnoutRemaining(a.getEarnoutRemaining() + b.getEarnoutRemaining());
        merged.setEarnoutTarget(Math.max(a.getEarnoutTarget(), b.getEarnoutTarget()));
        merged.setEarnoutRoundsRemaining(Math.max(a.getEarnoutRoundsRemaining(), b.getEarnoutRoundsRemaining()));
        merged.setRolloverEquityPct(Math.max(a.getRolloverEquityPct(), b.getRolloverEquityPct()));

        merged.setStatus(BusinessStatus.ACTIVE);
        merged.setPlatform(true);
        merged.setPlatformScale(previousScale + 1);
        merged.getBoltOnIds().addAll(a.getBoltOnIds());
        merged.getBoltOnIds().addAll(b.getBoltOnIds());
        merged.setIntegrationOutcome(outcome);
        merged.setSynergiesRealized(a.getSynergiesRealized() + b.getSynergiesRealized() + synergies);
        return merged;
    }

    // ==================== OPERATIONS ====================

    /**
     * Fund an operational improvement. Each type can be applied once per business, and each carries
     * a chance of lifting quality by one.
     */
    public static GameState improve(GameState state, String businessId, ImprovementType type) {
        if (!inAllocate(state) || type == null) {
            return state;
        }
        Business business = state.findBusiness(businessId);
        if (business == null || !business.isActive() || business.hasImprovement(type)) {
            return state;
        }
        long cost = type.costFor(business.getEbitda());
        if (state.getCash() < cost) {
            return state;
        }

        GameState next = state.copy();
        Business target = next.findBusiness(businessId);
        double qualityMultiplier = ImprovementType.qualityMultiplier(target.getQualityRating());
        double marginBoost = type.getMarginBoost();
        if (type == ImprovementType.DIGITAL_TRANSFORMATION && target.getEbitdaMargin() > 0.30) {
            marginBoost /= 2;
        }
        marginBoost = boosted(marginBoost, qualityMultiplier);
        double revenueBoost = boosted(type.getRevenueBoost(), qualityMultiplier);
        double growthBoost = boosted(type.getGrowthBoost(), qualityMultiplier);

        target.setRevenue(Math.round(target.getRevenue() * (1 + revenueBoost)));
        target.setEbitdaMargin(Business.clampMargin(target.getEbitdaMargin() + marginBoost));
        target.recomputeEbitda();
        target.setOrganicGrowthRate(OrganicGrowth.capGrowthRate(target.getOrganicGrowthRate() + growthBoost));
        if (type == ImprovementType.MANAGEMENT_PROFESSIONALIZATION && target.getDueDiligence() != null) {
            DueDiligence dd = target.getDueDiligence();
            target.setDueDiligence(dd.withOperatorQuality(dd.operatorQuality().upgraded()));
        }
        if (type == ImprovementType.DIGITAL_TRANSFORMATION) {
            target.setMarginDriftRate(target.getMarginDriftRate() + 0.002);
        }
        target.getImprovements().add(type);
        target.setTotalAcquisitionCost(target.getTotalAcquisitionCost() + cost);

        double qualityRoll = next.nextActionRoll(ActionRoll.QUALITY_IMPROVEMENT);
        if (target.getQualityRating() < 5 && qualityRoll < qualityImprovementChance(type)) {
            target.setQualityRating(target.getQualityRating() + 1);
            logger.debug("Round {}: {} improved to Q{}", next.getRound(), target.getName(),
                target.getQualityRating());
        }

        next.addCash(-cost);
        next.setTotalInvestedCapital(next.getTotalInvestedCapital() + cost);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Chance an improvement lifts quality: management and turnaround work 30%, the rest 15%.
     */
    public static double qualityImprovementChance(ImprovementType type) {
        return switch (type) {
            case MANAGEMENT_PROFESSIONALIZATION, FIX_UNDERPERFORMANCE -> 0.30;
            case OPERATING_PLAYBOOK, PRICING_MODEL, SERVICE_EXPANSION, RECURRING_REVENUE_CONVERSION,
                DIGITAL_TRANSFORMATION -> 0.15;
        };
    }

    // ==================== EXITS ====================

    /**
     * Sell an active business at its exit valuation, moved by this round's sell variance.
     * Bolt-ons go with their platform.
     */
    public static GameState sell(GameState state, String businessId) {
        if (!inAllocate(state)) {
            return state;
        }
        Business business = state.findBusiness(businessId);
        if (business == null || !business.isActive()) {
            return state;
        }

        GameState next = state.copy();
        Business target = next.findBusiness(businessId);
        ExitValuation valuation = Valuation.calculateExitValuation(target, next.getRound(), next.getLastEventType());
        double variance = 0.9 + next.nextActionRoll(ActionRoll.SELL_VARIANCE) * 0.2;
        double multiple = Math.max(Valuation.MULTIPLE_FLOOR, valuation.totalMultiple() * variance);
        long exitPrice = Math.round(Math.max(0, target.getEbitda()) * multiple);
        long net = Exits.completeSale(next, target, exitPrice);

        logger.debug("Round {}: sold {} for {} (net {})", next.getRound(), target.getName(), exitPrice, net);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Close a business down. Costs a tenth of its EBITDA plus its remaining debt, capped at cash.
     */
    public static GameState windDown(GameState state, String businessId) {
        if (!inAllocate(state)) {
            return state;
        }
        Business business = state.findBusiness(businessId);
        if (business == null || !business.isActive()) {
            return state;
        }

        GameState next = state.copy();
        Business target = next.findBusiness(businessId);
        long debt = target.getSellerNoteBalance() + target.getBankDebtBalance();
        for (String boltOnId : target.getBoltOnIds()) {
            Business boltOn = next.findBusiness(boltOnId);
            if (boltOn != null && boltOn.getStatus().isOwned()) {
                debt += boltOn.getSellerNoteBalance() + boltOn.getBankDebtBalance();
                Exits.close(boltOn, BusinessStatus.WOUND_DOWN, null, next.getRound());
            }
        }
        long cost = Math.min(Math.max(0, next.getCash()),
            Math.round(Math.abs(target.getEbitda()) * WIND_DOWN_COST_RATE) + debt);
        Exits.close(target, BusinessStatus.WOUND_DOWN, null, next.getRound());
        next.addCash(-cost);
        Exits.dropSharedServicesIfUnderstaffed(next);
        return MetricsCalculator.refresh(next);
    }

    // ==================== CAPITAL STRUCTURE ====================

    public static GameState payDownHoldcoDebt(GameState state, long amount) {
        if (!inAllocate(state)) {
            return state;
        }
        long payment = Math.min(amount, Math.min(state.getHoldcoLoanBalance(), state.getCash()));
        if (payment <= 0) {
            return state;
        }
        GameState next = state.copy();
        next.addCash(-payment);
        next.setHoldcoLoanBalance(next.getHoldcoLoanBalance() - payment);
        if (next.getHoldcoLoanBalance() == 0) {
            next.setHoldcoLoanRoundsRemaining(0);
        }
        return MetricsCalculator.refresh(next);
    }

    public static GameState payDownBankDebt(GameState state, String businessId, long amount) {
        if (!inAllocate(state)) {
            return state;
        }
        Business business = state.findBusiness(businessId);
        if (business == null || !business.getStatus().isOwned()) {
            return state;
        }
        long payment = Math.min(amount, Math.min(business.getBankDebtBalance(), state.getCash()));
        if (payment <= 0) {
            return state;
        }
        GameState next = state.copy();
        Business target = next.findBusiness(businessId);
        target.setBankDebtBalance(target.getBankDebtBalance() - payment);
        if (target.getBankDebtBalance() == 0) {
            target.setBankDebtRoundsRemaining(0);
        }
        next.addCash(-payment);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Raise equity at intrinsic value per share, discounted 10% more for each earlier raise (at most
     * 50%). The founder must keep a majority.
     */
    public static GameState issueEquity(GameState state, long amount) {
        if (!inAllocate(state) || amount <= 0 || state.isRequiresRestructuring()) {
            return state;
        }
        double valuePerShare = MetricsCalculator.intrinsicValuePerShare(state);
        if (valuePerShare <= 0) {
            return state;
        }
        double discount = Math.min(MAX_EQUITY_DISCOUNT, EQUITY_DILUTION_STEP * state.getEquityRaisesUsed());
        double price = valuePerShare * (1 - discount);
        double newShares = Math.round(amount / price * 1000) / 1000.0;
        double totalShares = state.getSharesOutstanding() + newShares;
        if (state.getFounderShares() / totalShares < MIN_FOUNDER_OWNERSHIP) {
            return state;
        }

        GameState next = state.copy();
        next.addCash(amount);
        next.setSharesOutstanding(totalShares);
        next.setEquityRaisesUsed(next.getEquityRaisesUsed() + 1);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Buy back outside shares at intrinsic value per share. Founder shares are never repurchased.
     */
    public static GameState buyback(GameState state, long amount) {
        if (!inAllocate(state) || amount <= 0 || state.getCash() < amount || state.activeBusinessCount() == 0) {
            return state;
        }
        if (!MetricsCalculator.distressLevel(state).canBuyback()) {
            return state;
        }
        double valuePerShare = MetricsCalculator.intrinsicValuePerShare(state);
        double outsideShares = state.getSharesOutstanding() - state.getFounderShares();
        if (valuePerShare <= 0 || outsideShares <= 0) {
            return state;
        }
        double repurchased = Math.min(Math.round(amount / valuePerShare * 1000) / 1000.0, outsideShares);
        long cost = Math.min(amount, Math.round(repurchased * valuePerShare));
        double remaining = state.getSharesOutstanding() - repurchased;
        if (Math.abs(remaining - state.getFounderShares()) < 0.01) {
            remaining = state.getFounderShares();
        }

        GameState next = state.copy();
        next.addCash(-cost);
        next.setSharesOutstanding(remaining);
        next.setTotalBuybacks(next.getTotalBuybacks() + cost);
        return MetricsCalculator.refresh(next);
    }

    public static GameState distribute(GameState state, long amount) {
        if (!inAllocate(state) || amount <= 0 || state.getCash() < amount) {
            return state;
        }
        if (!MetricsCalculator.distressLevel(state).canDistribute()) {
            return state;
        }
        GameState next = state.copy();
        next.addCash(-amount);
        next.setTotalDistributions(next.getTotalDistributions() + amount);
        return MetricsCalculator.refresh(next);
    }

    // ==================== SHARED SERVICES ====================

    public static GameState unlockSharedService(GameState state, SharedServiceType type) {
        if (!inAllocate(state) || type == null) {
            return state;
        }
        List<SharedServiceType> active = state.getActiveSharedServices();
        if (active.contains(type) || active.size() >= SharedServiceType.MAX_ACTIVE
            || state.activeBusinessCount() < SharedServiceType.MIN_OPCOS
            || state.getCash() < type.getUnlockCost()) {
            return state;
        }
        GameState next = state.copy();
        next.getActiveSharedServices().add(type);
        next.addCash(-type.getUnlockCost());
        next.setTotalInvestedCapital(next.getTotalInvestedCapital() + type.getUnlockCost());
        return MetricsCalculator.refresh(next);
    }

    public static GameState deactivateSharedService(GameState state, SharedServiceType type) {
        if (!inAllocate(state) || !state.getActiveSharedServices().contains(type)) {
            return state;
        }
        GameState next = state.copy();
        next.getActiveSharedServices().remove(type);
        return MetricsCalculator.refresh(next);
    }

    // ==================== M&A SOURCING ====================

    /**
     * Move up one sourcing tier. Upgrading also switches sourcing on.
     */
    public static GameState upgradeMASourcing(GameState state) {
        if (!inAllocate(state)) {
            return state;
        }
        MASourcingTier target = state.getMaSourcingTier().next();
        if (target == null || state.activeBusinessCount() < target.getRequiredOpcos()
            || state.getCash() < target.getUpgradeCost()) {
            return state;
        }
        GameState next = state.copy();
        next.setMaSourcingTier(target);
        next.setMaSourcingActive(true);
        next.addCash(-target.getUpgradeCost());
        return MetricsCalculator.refresh(next);
    }

    /**
     * Switch an acquired sourcing tier on or off; it costs nothing while off.
     */
    public static GameState toggleMASourcing(GameState state) {
        if (!inAllocate(state) || state.getMaSourcingTier() == MASourcingTier.NONE) {
            return state;
        }
        GameState next = state.copy();
        next.setMaSourcingActive(!next.isMaSourcingActive());
        return MetricsCalculator.refresh(next);
    }

    /**
     * Declare an acquisition focus. The sub-type is kept only for the same sector with sourcing at
     * tier 2 or higher switched on.
     */
    public static GameState setMAFocus(GameState state, String sectorId, SizePreference size, String subType) {
        if (!inAllocate(state) || (sectorId != null && !state.getSectors().hasSector(sectorId))) {
            return state;
        }
        boolean keepSubType = sectorId != null && subType != null && state.activeSourcingLevel() >= 2
            && state.getSectors().getSector(sectorId).getSubTypes().contains(subType);
        GameState next = state.copy();
        next.setMaFocus(new MAFocus(sectorId, size, keepSubType ? subType : null));
        return MetricsCalculator.refresh(next);
    }

    /**
     * Pay for a batch of sourced deals. Cheaper with an active sourcing team.
     */
    public static GameState sourceDeals(GameState state) {
        if (!inAllocate(state)) {
            return state;
        }
        long cost = state.activeSourcingLevel() >= 1 ? DealGenerator.SOURCING_COST_WITH_TIER : DealGenerator.SOURCING_COST;
        if (state.getCash() < cost) {
            return state;
        }
        GameState next = state.copy();
        List<Deal> batch = DealGenerator.generateSourcedDeals(RoundManager.dealFlowContext(next), next.getSectors(),
            next.getSourcingCount(), next.streams().deals());
        next.setSourcingCount(next.getSourcingCount() + 1);
        next.getDealPipeline().addAll(batch);
        next.addCash(-cost);
        return MetricsCalculator.refresh(next);
    }

    /**
     * Off-market outreach for proprietary deals. Needs sourcing at tier 3.
     */
    public static GameState proactiveOutreach(GameState state) {
        if (!inAllocate(state) || state.activeSourcingLevel() < 3 || state.getCash() < DealGenerator.OUTREACH_COST) {
            return state;
        }
        GameState next = state.copy();
        List<Deal> batch = DealGenerator.generateOutreachDeals(RoundManager.dealFlowContext(next), next.getSectors(),
            next.getOutreachCount(), next.streams().deals());
        next.setOutreachCount(next.getOutreachCount() + 1);
        next.getDealPipeline().addAll(batch);
        next.addCash(-DealGenerator.OUTREACH_COST);
        return MetricsCalculator.refresh(next);
    }

    // ==================== QUERIES ====================

    /**
     * Structures the player could use for a deal right now.
     */
    public static List<DealStructure> availableStructures(GameState state, Deal deal) {
        if (deal == null) {
            return new ArrayList<>();
        }
        DistressLevel distress = MetricsCalculator.distressLevel(state);
        return DealStructurer.generate(deal, state.getCash(), state.getInterestRate(), state.isCreditTightening(),
            state.getMaxRounds(), !distress.canTakeDebt(), state.activeSourcingLevel());
    }

    public static int maxAcquisitionsPerRound(GameState state) {
        return state.isMaSourcingActive() ? state.getMaSourcingTier().getMaxAcquisitions() : BASE_MAX_ACQUISITIONS;
    }

    public static boolean canAcquire(GameState state) {
        return inAllocate(state)
            && !state.isRequiresRestructuring()
            && MetricsCalculator.distressLevel(state).canAcquire()
            && state.getAcquisitionsThisRound() < maxAcquisitionsPerRound(state);
    }

    /**
     * Multiple expansion a platform earns from its scale, plus a bonus once combined EBITDA is large.
     */
    public static double multipleExpansion(int platformScale, long totalEbitda) {
        double scaleBonus = platformScale > 0
            ? Math.min(2.0, Math.log(platformScale + 1) / Math.log(2) * 0.5)
            : 0;
        double sizeBonus = totalEbitda > 5000 ? 0.3 : totalEbitda > 3000 ? 0.15 : 0;
        return scaleBonus + sizeBonus;
    }

    public static double synergyRate(IntegrationOutcome outcome, AcquisitionType type) {
        boolean tuckIn = type == AcquisitionType.TUCK_IN;
        return switch (outcome) {
            case SUCCESS -> tuckIn ? 0.20 : 0.10;
            case PARTIAL -> tuckIn ? 0.08 : 0.03;
            case FAILURE -> tuckIn ? -0.05 : -0.10;
        };
    }

    public static double mergerSynergyRate(IntegrationOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> 0.15;
            case PARTIAL -> 0.05;
            case FAILURE -> -0.07;
        };
    }

    /**
     * Chance the integration of a business goes well, before the success/partial split.
     */
    static double integrationProbability(Business business, boolean sharedServicesActive) {
        double probability = BASE_INTEGRATION_PROBABILITY;
        OperatorQuality operator = operatorQuality(business);
        if (operator == OperatorQuality.STRONG) {
            probability += 0.15;
        } else if (operator == OperatorQuality.WEAK) {
            probability -= 0.15;
        }
        if (business.getQualityRating() >= 4) {
            probability += 0.1;
        }
        if (sharedServicesActive) {
            probability += 0.1;
        }
        return probability;
    }

    // ==================== HELPERS ====================

    static boolean inAllocate(GameState state) {
        return !state.isGameOver() && state.getPhase() == Phase.ALLOCATE;
    }

    private static DealStructure offeredStructure(GameState state, Deal deal, DealStructureType type) {
        if (type == null) {
            return null;
        }
        DealStructure structure = DealStructurer.find(availableStructures(state, deal), type);
        return structure != null && state.getCash() >= structure.cashRequired() ? structure : null;
    }

    /**
     * A contested deal can be lost to another bidder. The roll comes from the deal's own fork of the
     * market stream, so it does not depend on what else happened this round.
     */
    private static boolean snatched(GameState state, Deal deal) {
        if (deal.getHeat() != DealHeat.CONTESTED) {
            return false;
        }
        boolean lost = state.streams().market().fork(deal.getId()).next() < DealHeat.CONTESTED_SNATCH_PROBABILITY;
        if (lost) {
            logger.debug("Round {}: contested deal {} lost to another bidder", state.getRound(), deal.getId());
        }
        return lost;
    }

    private static Business acquiredBusiness(GameState state, Deal deal, DealStructure structure) {
        Business business = deal.getBusiness().copy();
        business.setId("biz-" + deal.getId());
        business.setStatus(BusinessStatus.ACTIVE);
        business.setAcquisitionRound(state.getRound());
        business.setAcquisitionPrice(deal.getEffectivePrice());
        business.setTotalAcquisitionCost(deal.getEffectivePrice());
        business.setAcquisitionType(deal.getAcquisitionType());
        business.setSellerArchetype(deal.getSellerArchetype());
        business.setPlatform(false);
        business.setPlatformScale(0);
        structure.applyTo(business);
        return business;
    }

    private static IntegrationOutcome rollIntegration(GameState state, Business business) {
        double p = integrationProbability(business, !state.getActiveSharedServices().isEmpty());
        double roll = state.nextActionRoll(ActionRoll.INTEGRATION);
        if (roll < p * 0.6) {
            return IntegrationOutcome.SUCCESS;
        }
        return roll < p * 1.2 ? IntegrationOutcome.PARTIAL : IntegrationOutcome.FAILURE;
    }

    private static OperatorQuality operatorQuality(Business business) {
        return business.getDueDiligence() != null
            ? business.getDueDiligence().operatorQuality()
            : OperatorQuality.MODERATE;
    }

    private static double boosted(double boost, double qualityMultiplier) {
        return boost > 0 ? boost * qualityMultiplier : boost;
    }

    private static double weighted(long weightA, double valueA, long weightB, double valueB) {
        long total = weightA + weightB;
        return total > 0 ? (weightA * valueA + weightB * valueB) / total : 0;
    }
}
