package com.snuffles.journal.service;

/**
 * What a snapshot does when the price source has no price for a held ticker.
 */
public enum UnpricedPolicy {
    /** Write the row tagged {@code NO PRICE} with no valuation; it does not count towards TOTAL. */
    SKIP_VALUATION,
    /** Write nothing for the date and fail with {@code PriceUnavailableException}. */
    DEFER
}
