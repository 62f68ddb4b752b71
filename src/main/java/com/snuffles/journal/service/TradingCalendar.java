package com.snuffles.journal.service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Set;

/**
 * Weekday calendar with a configured holiday set. Stateless apart from its inputs.
 */
public class TradingCalendar {

    private final Set<LocalDate> holidays;
    private final Clock clock;

    public TradingCalendar(Collection<LocalDate> holidays, Clock clock) {
        this.holidays = Set.copyOf(holidays);
        this.clock = clock;
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        return !holidays.contains(date);
    }

    public LocalDate nextTradingDay(LocalDate date) {
        LocalDate next = date.plusDays(1);
        while (!isTradingDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public Set<LocalDate> getHolidays() {
        return holidays;
    }
}
