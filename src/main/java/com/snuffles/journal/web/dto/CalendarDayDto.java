package com.snuffles.journal.web.dto;

import java.time.LocalDate;

public record CalendarDayDto(LocalDate date, boolean tradingDay, boolean holiday, LocalDate nextTradingDay) {
}
