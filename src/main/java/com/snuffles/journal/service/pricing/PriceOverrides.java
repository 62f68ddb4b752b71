package com.snuffles.journal.service.pricing;

import com.snuffles.journal.service.TradeValidator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Manually entered prices supplied by one caller for one valuation, consulted before the
 * configured {@link PriceSource}. Instances are immutable and owned by whoever created them.
 */
public final class PriceOverrides {

    private static final PriceOverrides NONE = new PriceOverrides(Map.of());

    private final Map<String, BigDecimal> prices;

    private PriceOverrides(Map<String, BigDecimal> prices) {
        this.prices = Collections.unmodifiableMap(prices);
    }

    public static PriceOverrides none() {
        return NONE;
    }

    public static PriceOverrides of(Map<String, BigDecimal> prices) {
        if (prices == null || prices.isEmpty()) {
            return NONE;
        }
        Map<String, BigDecimal> normalized = new HashMap<>();
        prices.forEach((ticker, price) -> {
            String symbol = TradeValidator.normalizeTicker(ticker);
            TradeValidator.requirePositivePrice(price, "Override price for " + symbol);
            normalized.put(symbol, price);
        });
        return new PriceOverrides(normalized);
    }

    public Optional<BigDecimal> get(String ticker) {
        return Optional.ofNullable(prices.get(ticker));
    }

    public boolean covers(String ticker) {
        return prices.containsKey(ticker);
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }

    /**
     * Layers these overrides over {@code fallback}. A null fallback means only overridden
     * tickers have prices.
     */
    public PriceSource over(PriceSource fallback) {
        return (ticker, date) -> {
            Optional<BigDecimal> manual = get(ticker);
            if (manual.isPresent() || fallback == null) {
                return manual;
            }
            return fallback.getPrice(ticker, date);
        };
    }

    @Override
    public String toString() {
        return "PriceOverrides" + prices;
    }
}
