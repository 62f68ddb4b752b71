package com.snuffles.journal.service.analysis;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DrawdownPoint(LocalDate date, BigDecimal value, BigDecimal peak, BigDecimal drawdownAbs, BigDecimal drawdownPct) {
}
