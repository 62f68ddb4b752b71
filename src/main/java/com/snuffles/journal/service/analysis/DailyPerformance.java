package com.snuffles.journal.service.analysis;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * @param dailyReturnPct      change against the previous snapshot; null on the first day
 * @param cumulativeReturnPct change against the first snapshot in the series
 */
public record DailyPerformance(LocalDate date, BigDecimal totalEquity, BigDecimal dailyReturnPct, BigDecimal cumulativeReturnPct) {
}
