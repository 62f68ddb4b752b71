package com.snuffles.journal.service.analysis;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A stored cash figure that disagrees with the replayed end-of-day balance.
 *
 * @param source     {@code snapshot} for a TOTAL row's cash_balance, {@code ledger} for the live balance
 * @param difference {@code recorded - expected}
 */
public record CashDrift(LocalDate date, String source, BigDecimal recorded, BigDecimal expected, BigDecimal difference) {
}
