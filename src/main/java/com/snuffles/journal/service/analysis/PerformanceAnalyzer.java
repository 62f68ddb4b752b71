package com.snuffles.journal.service.analysis;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class PerformanceAnalyzer {

    private static final int PCT_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Daily and cumulative return of {@code total_equity}. Only TOTAL rows are considered; other
     * rows in the input are ignored.
     */
    public List<DailyPerformance> dailyPerformance(List<PortfolioHistoryRow> totalRows) {
        List<PortfolioHistoryRow> totals = totalRows.stream()
            .filter(PortfolioHistoryRow::isTotal)
            .filter(row -> row.getTotalEquity() != null)
            .sorted(Comparator.comparing(PortfolioHistoryRow::getSnapshotDate))
            .toList();
        if (totals.isEmpty()) {
            return List.of();
        }

        BigDecimal initial = totals.get(0).getTotalEquity();
        List<DailyPerformance> series = new ArrayList<>(totals.size());
        BigDecimal previous = null;
        for (PortfolioHistoryRow row : totals) {
            BigDecimal equity = row.getTotalEquity();
            series.add(new DailyPerformance(row.getSnapshotDate(), equity, change(previous, equity), change(initial, equity)));
            previous = equity;
        }
        return series;
    }

    private static BigDecimal change(BigDecimal from, BigDecimal to) {
        if (from == null || from.signum() == 0) {
            return null;
        }
        return to.subtract(from).multiply(HUNDRED).divide(from, PCT_SCALE, RoundingMode.HALF_UP);
    }
}
