package com.holdco.tycoon.deal;

/**
 * Terms of a seller note or bank loan created at acquisition.
 */
public record DebtTerms(long amount, double rate, int termRounds) {
}
