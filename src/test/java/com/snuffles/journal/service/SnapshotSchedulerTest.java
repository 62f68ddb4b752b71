package com.snuffles.journal.service;

import com.snuffles.journal.service.exception.PriceUnavailableException;
import com.snuffles.journal.service.pricing.PriceOverrides;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SnapshotSchedulerTest {

    @Mock
    private SnapshotService snapshotService;

    @InjectMocks
    private SnapshotScheduler scheduler;

    @Test
    void snapshotsTodayWithoutForcing() {
        given(snapshotService.takeSnapshot(null, false, PriceOverrides.none()))
            .willReturn(SnapshotResult.skipped(LocalDate.of(2024, 3, 2)));

        scheduler.snapshotToday();

        verify(snapshotService).takeSnapshot(null, false, PriceOverrides.none());
    }

    @Test
    void journalFailureDoesNotEscapeTheScheduler() {
        given(snapshotService.takeSnapshot(null, false, PriceOverrides.none()))
            .willThrow(new PriceUnavailableException(LocalDate.of(2024, 3, 4), List.of("ABC")));

        assertThatCode(scheduler::snapshotToday).doesNotThrowAnyException();
    }
}
