package com.holdco.tycoon.finance;

/**
 * Kind of buyer a business of a given size attracts at exit.
 */
public enum BuyerPoolTier {
    INDIVIDUAL,
    SMALL_PE,
    LOWER_MIDDLE_PE,
    INSTITUTIONAL_PE,
    LARGE_PE
}
