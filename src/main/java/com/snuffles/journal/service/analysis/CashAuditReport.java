package com.snuffles.journal.service.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/**
 * Outcome of a cash audit. {@code drifts} are stored figures no replayed balance explains.
 * {@code superseded} are TOTAL rows whose cash matches a balance held earlier on their date,
 * i.e. snapshots taken before a later movement that day.
 */
public record CashAuditReport(BigDecimal liveBalance,
                              BigDecimal replayedBalance,
                              SortedMap<LocalDate, BigDecimal> replayedByDate,
                              int snapshotsChecked,
                              List<CashDrift> drifts,
                              List<CashDrift> superseded) {

    @JsonProperty("consistent")
    public boolean isConsistent() {
        return drifts.isEmpty();
    }
}
