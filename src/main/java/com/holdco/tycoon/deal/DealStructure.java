package com.holdco.tycoon.deal;

import com.holdco.tycoon.business.Business;

/**
 * A way to finance an acquisition - a sealed interface with one record per shape.
 * Switch on {@link #type()} to handle every shape; adding a shape breaks those switches until handled.
 */
public sealed interface DealStructure permits DealStructure.AllCash, DealStructure.SellerNote,
    DealStructure.BankDebt, DealStructure.Earnout, DealStructure.Lbo, DealStructure.RolloverEquity {

    DealStructureType type();

    /** Cash the holdco pays at close. */
    long cashRequired();

    RiskLevel risk();

    /** Interest-bearing debt created by the structure. */
    long debtAmount();

    /**
     * Record the structure's instruments on the newly acquired business.
     */
    void applyTo(Business business);

    /**
     * Debt / EBITDA to one decimal, 0 for non-positive EBITDA.
     */
    default double leverage(long ebitda) {
        if (ebitda <= 0) {
            return 0;
        }
        return Math.round((double) debtAmount() / ebitda * 10) / 10.0;
    }

    /**
     * Pay the full price in cash.
     */
    record AllCash(long cashRequired) implements DealStructure {
        @Override
        public DealStructureType type() {
            return DealStructureType.ALL_CASH;
        }

        @Override
        public RiskLevel risk() {
            return RiskLevel.LOW;
        }

        @Override
        public long debtAmount() {
            return 0;
        }

        @Override
        public void applyTo(Business business) {
            // nothing owed
        }
    }

    /**
     * Cash plus a note to the seller.
     */
    record SellerNote(long cashRequired, DebtTerms note) implements DealStructure {
        @Override
        public DealStructureType type() {
            return DealStructureType.SELLER_NOTE;
        }

        @Override
        public RiskLevel risk() {
            return RiskLevel.MEDIUM;
        }

        @Override
        public long debtAmount() {
            return note.amount();
        }

        @Override
        public void applyTo(Business business) {
            applySellerNote(business, note);
        }
    }

    /**
     * Cash plus a bank loan recourse to the holdco.
     */
    record BankDebt(long cashRequired, DebtTerms bank) implements DealStructure {
        @Override
        public DealStructureType type() {
            return DealStructureType.BANK_DEBT;
        }

        @Override
        public RiskLevel risk() {
            return RiskLevel.MEDIUM;
        }

        @Override
        public long debtAmount() {
            return bank.amount();
        }

        @Override
        public void applyTo(Business business) {
            applyBankDebt(business, bank);
        }
    }

    /**
     * Upfront cash, the rest contingent on EBITDA growth within the earn-out window.
     */
    record Earnout(long cashRequired, long earnoutAmount, double targetGrowth) implements DealStructure {
        public static final int WINDOW_ROUNDS = 4;

        @Override
        public DealStructureType type() {
            return DealStructureType.EARNOUT;
        }

        @Override
        public RiskLevel risk() {
            return RiskLevel.LOW;
        }

        @Override
        public long debtAmount() {
            return 0;
        }

        @Override
        public void applyTo(Business business) {
            business.setEarnoutRemaining(earnoutAmount);
            business.setEarnoutTarget(targetGrowth);
            business.setEarnoutRoundsRemaining(WINDOW_ROUNDS);
        }
    }

    /**
     * Cash, seller note and bank debt together.
     */
    record Lbo(long cashRequired, DebtTerms note, DebtTerms bank) implements DealStructure {
        @Override
        public DealStructureType type() {
            return DealStructureType.LBO;
        }

        @Override
        public RiskLevel risk() {
            return RiskLevel.HIGH;
        }

        @Override
        public long debtAmount() {
            return note.amount() + bank.amount();
        }

        @Override
        public void applyTo(Business business) {
            applySellerNote(business, note);
            applyBankDebt(business, bank);
        }
    }

    /**
     * The seller keeps a slice of the opco; a small note covers the gap.
     */
    record RolloverEquity(long cashRequired, double rolloverPct, long rolledAmount, DebtTerms note)
        implements DealStructure {
        @Override
        public DealStructureType type() {
            return DealStructureType.ROLLOVER_EQUITY;
        }

        @Override
        public RiskLevel risk() {
            return RiskLevel.LOW;
        }

        @Override
        public long debtAmount() {
            return note.amount();
        }

        @Override
        public void applyTo(Business business) {
            business.setRolloverEquityPct(rolloverPct);
            applySellerNote(business, note);
        }
    }

    private static void applySellerNote(Business business, DebtTerms note) {
        business.setSellerNoteBalance(note.amount());
        business.setSellerNoteRate(note.rate());
        business.setSellerNoteRoundsRemaining(note.termRounds());
    }

    private static void applyBankDebt(Business business, DebtTerms bank) {
        business.setBankDebtBalance(bank.amount());
        business.setBankDebtRate(bank.rate());
        business.setBankDebtRoundsRemaining(bank.termRounds());
    }
}
