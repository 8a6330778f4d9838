package com.holdco.tycoon.game;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.business.BusinessStatus;
import com.holdco.tycoon.finance.SharedServiceType;

/**
 * Bookkeeping shared by every way a business leaves the portfolio.
 */
final class Exits {

    private Exits() {
        // Utility class - prevent instantiation
    }

    /**
     * Close a sale in place: the business and its bolt-ons are marked sold, their obligations are
     * settled out of the price and what is left goes to the holdco.
     *
     * @return net proceeds credited to cash
     */
    static long completeSale(GameState working, Business business, long exitPrice) {
        long price = Math.max(0, exitPrice);
        long rolloverShare = Math.round(price * business.getRolloverEquityPct());
        long obligations = business.totalObligations();
        for (String boltOnId : business.getBoltOnIds()) {
            Business boltOn = working.findBusiness(boltOnId);
            if (boltOn != null && boltOn.getStatus().isOwned()) {
                obligations += boltOn.totalObligations();
                close(boltOn, BusinessStatus.SOLD, 0L, working.getRound());
            }
        }
        long netProceeds = Math.max(0, price - rolloverShare - obligations);
        close(business, BusinessStatus.SOLD, price, working.getRound());

        working.addCash(netProceeds);
        working.setTotalExitProceeds(working.getTotalExitProceeds() + netProceeds);
        dropSharedServicesIfUnderstaffed(working);
        return netProceeds;
    }

    /**
     * Retire a business: status and exit round set, every instrument cleared.
     */
    static void close(Business business, BusinessStatus status, Long exitPrice, int round) {
        business.setStatus(status);
        business.setExitPrice(exitPrice);
        business.setExitRound(round);
        business.setSellerNoteBalance(0);
        business.setSellerNoteRoundsRemaining(0);
        business.setBankDebtBalance(0);
        business.setBankDebtRoundsRemaining(0);
        business.setEarnoutRemaining(0);
        business.setEarnoutRoundsRemaining(0);
    }

    /**
     * Shared services switch off when fewer than the minimum opcos remain.
     */
    static void dropSharedServicesIfUnderstaffed(GameState working) {
        if (working.activeBusinessCount() < SharedServiceType.MIN_OPCOS) {
            working.getActiveSharedServices().clear();
        }
    }
}
