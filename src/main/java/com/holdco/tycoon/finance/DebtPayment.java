package com.holdco.tycoon.finance;

/**
 * One period's principal-and-interest on a straight-line amortizing instrument,
 * settled against whatever cash is available. Interest is paid before principal.
 */
public record DebtPayment(long interestDue, long principalDue, long interestPaid, long principalPaid) {

    public static final DebtPayment NONE = new DebtPayment(0, 0, 0, 0);

    /**
     * Settle this period's payment.
     *
     * @param balance          outstanding principal
     * @param rate             annual rate including any penalty
     * @param roundsRemaining  remaining term; zero or less means the whole balance is due
     * @param availableCash    cash that may be used; negative is treated as zero
     */
    public static DebtPayment settle(long balance, double rate, int roundsRemaining, long availableCash) {
        if (balance <= 0) {
            return NONE;
        }
        long interestDue = Math.round(balance * rate);
        long principalDue = principalDue(balance, roundsRemaining);
        long available = Math.max(0, availableCash);
        long interestPaid = Math.min(interestDue, available);
        long principalPaid = Math.min(principalDue, available - interestPaid);
        return new DebtPayment(interestDue, principalDue, interestPaid, principalPaid);
    }

    /**
     * Full scheduled payment for the period, ignoring cash.
     */
    public static long scheduled(long balance, double rate, int roundsRemaining) {
        if (balance <= 0) {
            return 0;
        }
        return Math.round(balance * rate) + principalDue(balance, roundsRemaining);
    }

    private static long principalDue(long balance, int roundsRemaining) {
        return roundsRemaining > 1 ? Math.min(balance, Math.round((double) balance / roundsRemaining)) : balance;
    }

    public long totalPaid() {
        return interestPaid + principalPaid;
    }

    public long shortfall() {
        return (interestDue + principalDue) - totalPaid();
    }

    public boolean isFull() {
        return shortfall() == 0;
    }
}
