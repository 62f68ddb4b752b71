package com.snuffles.journal.service.analysis;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Worst decline observed for one ticker. Both figures are zero or negative.
 */
public record DrawdownSummary(String ticker, BigDecimal maxDrawdownPct, BigDecimal maxDrawdownAbs, LocalDate troughDate) {
}
