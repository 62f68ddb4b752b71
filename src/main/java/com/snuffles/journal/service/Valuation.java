package com.snuffles.journal.service;

import com.snuffles.journal.domain.PortfolioHistoryRow;

import java.util.List;

/**
 * A computed, not yet persisted, snapshot row set. The TOTAL row is always last.
 */
public record Valuation(List<PortfolioHistoryRow> rows, List<String> unpricedTickers) {

    public PortfolioHistoryRow total() {
        return rows.get(rows.size() - 1);
    }

    public boolean fullyPriced() {
        return unpricedTickers.isEmpty();
    }
}
