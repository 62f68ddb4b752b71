package com.snuffles.journal.service;

import com.snuffles.journal.domain.PortfolioHistoryRow;

import java.time.LocalDate;
import java.util.List;

public record SnapshotResult(LocalDate date,
                             Status status,
                             List<PortfolioHistoryRow> rows,
                             boolean replacedExisting,
                             List<String> unpricedTickers) {

    public enum Status {
        WRITTEN,
        SKIPPED_NON_TRADING_DAY
    }

    public static SnapshotResult written(LocalDate date, Valuation valuation, boolean replacedExisting) {
        return new SnapshotResult(date, Status.WRITTEN, valuation.rows(), replacedExisting, valuation.unpricedTickers());
    }

    public static SnapshotResult skipped(LocalDate date) {
        return new SnapshotResult(date, Status.SKIPPED_NON_TRADING_DAY, List.of(), false, List.of());
    }

    public boolean isWritten() {
        return status == Status.WRITTEN;
    }
}
