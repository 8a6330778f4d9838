package com.holdco.tycoon.deal;

import com.holdco.tycoon.rng.SeededRng;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the financing structures offered for a deal.
 *
 * Every random term is drawn up front from the deal's terms seed, in a fixed order, so the same
 * deal always shows the same terms whatever the player's cash or the order structures are viewed in.
 */
public final class DealStructurer {

    public static final double SELLER_NOTE_CASH_SHARE = 0.40;
    public static final double BANK_DEBT_CASH_SHARE = 0.35;
    public static final double EARNOUT_UPFRONT_SHARE = 0.55;
    public static final double LBO_CASH_SHARE = 0.25;
    public static final double LBO_NOTE_SHARE = 0.35;
    public static final double ROLLOVER_NOTE_SHARE = 0.10;
    public static final double ROLLOVER_PCT_STANDARD = 0.25;
    public static final double ROLLOVER_PCT_QUICK = 0.20;

    /** Earn-outs are only offered when the seller-side gate roll reaches this. */
    static final double EARNOUT_GATE = 0.4;

    private DealStructurer() {
        // Utility class - prevent instantiation
    }

    /**
     * Pre-drawn terms for one deal.
     */
    record Terms(double noteRate, double bankSpread, boolean earnoutOffered, double earnoutTarget,
                 double lboNoteRate) {

        static Terms draw(int termsSeed) {
            SeededRng rng = new SeededRng(termsSeed);
            double noteRate = rng.nextInRange(0.05, 0.06);
            double bankSpread = rng.nextInRange(0.0, 0.01);
            boolean earnoutOffered = rng.next() >= EARNOUT_GATE;
            double earnoutTarget = rng.nextInRange(0.07, 0.12);
            double lboNoteRate = rng.nextInRange(0.05, 0.06);
            return new Terms(noteRate, bankSpread, earnoutOffered, earnoutTarget, lboNoteRate);
        }
    }

    public static int sellerNoteTerm(int maxRounds) {
        return Math.max(4, (int) Math.ceil(maxRounds * 0.25));
    }

    public static int bankDebtTerm(int maxRounds) {
        return Math.max(4, (int) Math.ceil(maxRounds * 0.5));
    }

    /**
     * All structures the player can afford and is allowed to use for this deal, in offer order.
     *
     * @param noNewDebt        distress forbids new seller notes and bank debt
     * @param maSourcingLevel  active M&A sourcing tier, 0 when inactive
     */
    public static List<DealStructure> generate(Deal deal, long cash, double interestRate,
                                               boolean creditTightening, int maxRounds,
                                               boolean noNewDebt, int maSourcingLevel) {
        List<DealStructure> structures = new ArrayList<>();
        long price = deal.getEffectivePrice();
        if (price <= 0) {
            return structures;
        }
        Terms terms = Terms.draw(deal.getTermsSeed());
        int quality = deal.getBusiness().getQualityRating();
        int noteTerm = sellerNoteTerm(maxRounds);
        int bankTerm = bankDebtTerm(maxRounds);
        boolean bankAvailable = !creditTightening && !noNewDebt;

        if (cash >= price) {
            structures.add(new DealStructure.AllCash(price));
        }

        long noteCash = Math.round(price * SELLER_NOTE_CASH_SHARE);
        if (cash >= noteCash && !noNewDebt) {
            structures.add(new DealStructure.SellerNote(noteCash,
                new DebtTerms(price - noteCash, terms.noteRate(), noteTerm)));
        }

        long bankCash = Math.round(price * BANK_DEBT_CASH_SHARE);
        if (bankAvailable && cash >= bankCash) {
            structures.add(new DealStructure.BankDebt(bankCash,
                new DebtTerms(price - bankCash, interestRate + terms.bankSpread(), bankTerm)));
        }

        long earnoutCash = Math.round(price * EARNOUT_UPFRONT_SHARE);
        if (quality >= 3 && terms.earnoutOffered() && cash >= earnoutCash) {
            structures.add(new DealStructure.Earnout(earnoutCash, price - earnoutCash, terms.earnoutTarget()));
        }

        long lboCash = Math.round(price * LBO_CASH_SHARE);
        if (bankAvailable && cash >= lboCash) {
            long noteAmount = Math.round(price * LBO_NOTE_SHARE);
            long bankAmount = price - lboCash - noteAmount;
            structures.add(new DealStructure.Lbo(lboCash,
                new DebtTerms(noteAmount, terms.lboNoteRate(), noteTerm),
                new DebtTerms(bankAmount, interestRate + terms.bankSpread(), bankTerm)));
        }

        if (quality >= 3 && maSourcingLevel >= 2 && !noNewDebt) {
            double rolloverPct = maxRounds <= 10 ? ROLLOVER_PCT_QUICK : ROLLOVER_PCT_STANDARD;
            long rolled = Math.round(price * rolloverPct);
            long noteAmount = Math.round(price * ROLLOVER_NOTE_SHARE);
            long rolloverCash = price - rolled - noteAmount;
            if (cash >= rolloverCash) {
                structures.add(new DealStructure.RolloverEquity(rolloverCash, rolloverPct, rolled,
                    new DebtTerms(noteAmount, terms.noteRate(), noteTerm)));
            }
        }
        return structures;
    }

    /**
     * The offered structure of the given type, or null when it is not on offer.
     */
    public static DealStructure find(List<DealStructure> structures, DealStructureType type) {
        for (DealStructure structure : structures) {
            if (structure.type() == type) {
                return structure;
            }
        }
        return null;
    }
}
