package com.snuffles.journal.service;

import com.snuffles.journal.domain.Position;

import java.math.BigDecimal;
import java.util.List;

/**
 * Committed ledger state read in one transaction.
 *
 * @param firstTime true for a freshly initialized ledger: no positions, trades or cash movements
 */
public record LedgerState(List<Position> positions, BigDecimal cash, boolean firstTime) {
}
