package com.snuffles.journal.service.analysis;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Peak-to-trough decline of {@code total_value} over a valuation history. Rows without a
 * valuation ({@code NO PRICE}) are left out.
 */
@Component
public class DrawdownAnalyzer {

    private static final int PCT_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public List<DrawdownPoint> computeDrawdown(List<PortfolioHistoryRow> tickerHistory) {
        List<PortfolioHistoryRow> ordered = tickerHistory.stream()
            .filter(PortfolioHistoryRow::isPriced)
            .sorted(Comparator.comparing(PortfolioHistoryRow::getSnapshotDate))
            .toList();

        List<DrawdownPoint> points = new ArrayList<>(ordered.size());
        BigDecimal peak = null;
        for (PortfolioHistoryRow row : ordered) {
            BigDecimal value = row.getTotalValue();
            peak = peak == null || value.compareTo(peak) > 0 ? value : peak;
            BigDecimal drawdownAbs = value.subtract(peak);
            points.add(new DrawdownPoint(row.getSnapshotDate(), value, peak, drawdownAbs, percentOf(drawdownAbs, peak)));
        }
        return points;
    }

    /**
     * Maximum drawdown per ticker, TOTAL included, keyed and ordered by ticker.
     */
    public Map<String, DrawdownSummary> computeAllDrawdowns(List<PortfolioHistoryRow> rows) {
        Map<String, List<PortfolioHistoryRow>> byTicker = rows.stream()
            .collect(Collectors.groupingBy(PortfolioHistoryRow::getTicker, TreeMap::new, Collectors.toList()));

        Map<String, DrawdownSummary> summaries = new TreeMap<>();
        byTicker.forEach((ticker, history) -> {
            List<DrawdownPoint> points = computeDrawdown(history);
            if (points.isEmpty()) {
                return;
            }
            DrawdownPoint worst = points.stream()
                .min(Comparator.comparing(DrawdownPoint::drawdownPct))
                .orElseThrow();
            BigDecimal worstAbs = points.stream()
                .map(DrawdownPoint::drawdownAbs)
                .min(Comparator.naturalOrder())
                .orElseThrow();
            summaries.put(ticker, new DrawdownSummary(ticker, worst.drawdownPct(), worstAbs, worst.date()));
        });
        return summaries;
    }

    private static BigDecimal percentOf(BigDecimal drawdownAbs, BigDecimal peak) {
        if (peak.signum() == 0) {
            return BigDecimal.ZERO.setScale(PCT_SCALE);
        }
        return drawdownAbs.multiply(HUNDRED).divide(peak, PCT_SCALE, RoundingMode.HALF_UP);
    }
}
