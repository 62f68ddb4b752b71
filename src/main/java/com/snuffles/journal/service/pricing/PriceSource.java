package com.snuffles.journal.service.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Market price lookup used for valuations. An empty result means the price is unavailable for
 * that date; implementations never substitute zero.
 */
public interface PriceSource {

    Optional<BigDecimal> getPrice(String ticker, LocalDate date);
}
