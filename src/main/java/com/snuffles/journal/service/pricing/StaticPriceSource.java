package com.snuffles.journal.service.pricing;

import com.snuffles.journal.config.JournalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fixed prices from {@code journal.price-source.prices}, the same for every date. Meant for
 * development and tests where no market data feed is wired in.
 */
@Component
@ConditionalOnProperty(prefix = "journal.price-source", name = "type", havingValue = "static")
@Slf4j
public class StaticPriceSource implements PriceSource {

    private final Map<String, BigDecimal> prices;

    public StaticPriceSource(JournalProperties properties) {
        this.prices = properties.getPriceSource().getPrices().entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(e -> e.getKey().trim().toUpperCase(Locale.ROOT), Map.Entry::getValue));
        log.info("Static price source configured for {} ticker(s)", prices.size());
    }

    @Override
    public Optional<BigDecimal> getPrice(String ticker, LocalDate date) {
        BigDecimal price = prices.get(ticker);
        if (price == null) {
            log.debug("No static price for {} on {}", ticker, date);
        }
        return Optional.ofNullable(price);
    }
}
