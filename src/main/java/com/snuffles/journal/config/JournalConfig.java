package com.snuffles.journal.config;

import com.snuffles.journal.service.TradingCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(JournalProperties.class)
@Slf4j
public class JournalConfig {

    @Bean
    public Clock journalClock(JournalProperties properties) {
        log.info("Journal calendar dates resolved in zone {}", properties.getZone());
        return Clock.system(properties.getZone());
    }

    @Bean
    public TradingCalendar tradingCalendar(JournalProperties properties, Clock journalClock) {
        log.info("Trading calendar configured with {} holiday(s)", properties.getHolidays().size());
        return new TradingCalendar(properties.getHolidays(), journalClock);
    }

    /**
     * Retries a whole ledger transaction when the write lock could not be acquired
     * (lock timeout, deadlock, serialization failure).
     */
    @Bean
    public RetryTemplate ledgerRetryTemplate(JournalProperties properties) {
        JournalProperties.Lock lock = properties.getLock();
        return RetryTemplate.builder()
            .maxAttempts(lock.getMaxAttempts())
            .exponentialBackoff(lock.getInitialBackoff().toMillis(), lock.getMultiplier(), lock.getMaxBackoff().toMillis())
            .retryOn(ConcurrencyFailureException.class)
            .traversingCauses()
            .build();
    }
}
