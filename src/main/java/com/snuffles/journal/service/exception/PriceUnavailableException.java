package com.snuffles.journal.service.exception;

import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

/**
 * Raised when a snapshot is deferred because some held tickers have no price for the date.
 */
@Getter
public class PriceUnavailableException extends JournalException {

    private final LocalDate date;
    private final List<String> tickers;

    public PriceUnavailableException(LocalDate date, List<String> tickers) {
        super("No price available on " + date + " for " + String.join(", ", tickers));
        this.date = date;
        this.tickers = List.copyOf(tickers);
    }
}
