package com.snuffles.journal.service;

import com.snuffles.journal.config.CorrelationScope;
import com.snuffles.journal.service.exception.JournalException;
import com.snuffles.journal.service.pricing.PriceOverrides;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "journal.snapshot.schedule", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SnapshotScheduler {

    private final SnapshotService snapshotService;

    @Scheduled(cron = "${journal.snapshot.schedule.cron}", zone = "${journal.zone}")
    public void snapshotToday() {
        try (CorrelationScope scope = CorrelationScope.open()) {
            log.info("Scheduled snapshot starting");
            try {
                SnapshotResult result = snapshotService.takeSnapshot(null, false, PriceOverrides.none());
                log.info("Scheduled snapshot for {} finished: {}", result.date(), result.status());
            } catch (JournalException ex) {
                // next run retries; the failure itself is already rolled back
                log.error("Scheduled snapshot failed: {}", ex.getMessage(), ex);
            }
        }
    }
}
