package com.snuffles.journal.repository;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class PortfolioHistoryRepositoryTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 8);

    @Autowired
    private PortfolioHistoryRepository historyRepository;

    @Test
    void deleteBySnapshotDateRemovesOnlyThatDate() {
        historyRepository.saveAllAndFlush(List.of(
            row(TODAY, "ABC"), row(TODAY, "TOTAL"),
            row(TODAY.minusDays(1), "ABC"), row(TODAY.minusDays(1), "TOTAL")));

        int removed = historyRepository.deleteBySnapshotDate(TODAY);

        assertThat(removed).isEqualTo(2);
        assertThat(historyRepository.findBySnapshotDateOrderByTickerAsc(TODAY)).isEmpty();
        assertThat(historyRepository.findBySnapshotDateOrderByTickerAsc(TODAY.minusDays(1)))
            .extracting(PortfolioHistoryRow::getTicker)
            .containsExactly("ABC", "TOTAL");
    }

    @Test
    void countHistoricalDatesIgnoresTodayAndTotalOnlyDates() {
        historyRepository.saveAllAndFlush(List.of(
            row(TODAY, "ABC"),
            row(TODAY.minusDays(1), "ABC"), row(TODAY.minusDays(1), "XYZ"), row(TODAY.minusDays(1), "TOTAL"),
            row(TODAY.minusDays(2), "ABC"),
            row(TODAY.minusDays(3), "TOTAL")));

        assertThat(historyRepository.countHistoricalDates(TODAY)).isEqualTo(2);
    }

    @Test
    void deleteAllExceptDateKeepsToday() {
        historyRepository.saveAllAndFlush(List.of(
            row(TODAY, "ABC"), row(TODAY.minusDays(4), "ABC"), row(TODAY.minusDays(5), "TOTAL")));

        historyRepository.deleteAllExceptDate(TODAY);

        assertThat(historyRepository.findAllByOrderBySnapshotDateAscTickerAsc())
            .extracting(PortfolioHistoryRow::getSnapshotDate)
            .containsExactly(TODAY);
    }

    @Test
    void rangeAndTickerQueriesAreOrdered() {
        historyRepository.saveAllAndFlush(List.of(
            row(TODAY, "XYZ"), row(TODAY, "ABC"), row(TODAY.minusDays(1), "ABC"), row(TODAY.minusDays(10), "ABC")));

        assertThat(historyRepository.findBySnapshotDateBetweenOrderBySnapshotDateAscTickerAsc(TODAY.minusDays(1), TODAY))
            .extracting(PortfolioHistoryRow::getTicker)
            .containsExactly("ABC", "ABC", "XYZ");
        assertThat(historyRepository.findByTickerOrderBySnapshotDateAsc("ABC"))
            .extracting(PortfolioHistoryRow::getSnapshotDate)
            .containsExactly(TODAY.minusDays(10), TODAY.minusDays(1), TODAY);
    }

    private static PortfolioHistoryRow row(LocalDate date, String ticker) {
        return PortfolioHistoryRow.builder()
            .snapshotDate(date)
            .ticker(ticker)
            .shares(PortfolioHistoryRow.TOTAL_TICKER.equals(ticker) ? null : 10L)
            .totalValue(new BigDecimal("100.00"))
            .pnl(BigDecimal.ZERO)
            .action(PortfolioHistoryRow.TOTAL_TICKER.equals(ticker) ? null : "HOLD")
            .build();
    }
}
