package com.snuffles.journal.seeding;

import com.snuffles.journal.config.JournalProperties;
import com.snuffles.journal.domain.CashAccount;
import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.domain.Position;
import com.snuffles.journal.repository.CashAccountRepository;
import com.snuffles.journal.repository.PortfolioHistoryRepository;
import com.snuffles.journal.service.AuditLogger;
import com.snuffles.journal.service.LedgerTransactions;
import com.snuffles.journal.service.Money;
import com.snuffles.journal.service.SnapshotEngine;
import com.snuffles.journal.service.TradingCalendar;
import com.snuffles.journal.service.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SyntheticHistoryGeneratorTest {

    // Monday; the week before holds 2024-03-04..08 as trading days
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 11);

    @Mock
    private PortfolioHistoryRepository historyRepository;

    @Mock
    private CashAccountRepository cashAccountRepository;

    @Mock
    private LedgerTransactions transactions;

    @Mock
    private AuditLogger auditLogger;

    @Captor
    private ArgumentCaptor<List<PortfolioHistoryRow>> rowsCaptor;

    private final JournalProperties properties = new JournalProperties();

    private SyntheticHistoryGenerator generator;

    @BeforeEach
    void setUp() {
        TradingCalendar calendar = new TradingCalendar(Set.of(),
            Clock.fixed(Instant.parse("2024-03-11T15:00:00Z"), ZoneId.of("UTC")));
        generator = new SyntheticHistoryGenerator(historyRepository, cashAccountRepository, new SnapshotEngine(),
            calendar, transactions, auditLogger, properties);

        lenient().when(transactions.execute(anyString(), any()))
            .thenAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(1).doInTransaction(null));
        CashAccount account = new CashAccount();
        account.setId(CashAccount.LEDGER_ID);
        account.setBalance(BigDecimal.ZERO);
        lenient().when(cashAccountRepository.lockById(CashAccount.LEDGER_ID)).thenReturn(Optional.of(account));
    }

    @Test
    void skipsWhenEnoughHistoryExists() {
        given(historyRepository.countHistoricalDates(TODAY)).willReturn(7L);

        BackfillResult result = generator.backfillSynthetic(7, List.of(position("ABC", "10.00")), Map.of("ABC", new BigDecimal("10.00")));

        assertThat(result.skipped()).isTrue();
        assertThat(result.existingDates()).isEqualTo(7L);
        verify(historyRepository, never()).deleteAllExceptDate(any());
        verify(historyRepository, never()).saveAllAndFlush(anyList());
        verify(auditLogger).record(eq(AuditLogger.BACKFILL), anyMap());
    }

    @Test
    void secondIdenticalCallOverShortWindowIsSkipped() {
        // 2024-03-01 plus 2024-03-04..08: six trading days in the ten calendar days before today
        given(historyRepository.countHistoricalDates(TODAY)).willReturn(0L, 6L);
        List<Position> positions = List.of(position("ABC", "10.00"));
        Map<String, BigDecimal> basePrices = Map.of("ABC", new BigDecimal("10.00"));

        BackfillResult first = generator.backfillSynthetic(10, positions, basePrices);
        BackfillResult second = generator.backfillSynthetic(10, positions, basePrices);

        assertThat(first.generatedDates()).hasSize(6);
        assertThat(second.skipped()).isTrue();
        assertThat(second.existingDates()).isEqualTo(6L);
        verify(historyRepository, times(1)).deleteAllExceptDate(TODAY);
        verify(historyRepository, times(1)).saveAllAndFlush(anyList());
    }

    @Test
    void generatesRowsForTradingDaysOnly() {
        given(historyRepository.countHistoricalDates(TODAY)).willReturn(2L);

        BackfillResult result = generator.backfillSynthetic(7,
            List.of(position("XYZ", "20.00"), position("ABC", "10.00")),
            Map.of("ABC", new BigDecimal("10.00"), "XYZ", new BigDecimal("20.00")));

        assertThat(result.skipped()).isFalse();
        assertThat(result.generatedDates()).containsExactly(
            LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 5), LocalDate.of(2024, 3, 6),
            LocalDate.of(2024, 3, 7), LocalDate.of(2024, 3, 8));
        verify(historyRepository).deleteAllExceptDate(TODAY);
        verify(historyRepository).saveAllAndFlush(rowsCaptor.capture());

        List<PortfolioHistoryRow> rows = rowsCaptor.getValue();
        assertThat(rows).hasSize(15);
        assertThat(rows).extracting(PortfolioHistoryRow::getSnapshotDate).doesNotContain(TODAY);
        assertThat(rows).filteredOn(PortfolioHistoryRow::isTotal)
            .allSatisfy(total -> assertThat(total.getCashBalance()).isEqualByComparingTo("10000.00"));
    }

    @Test
    void pricesTrendWithinVolatilityBand() {
        given(historyRepository.countHistoricalDates(TODAY)).willReturn(0L);

        generator.backfillSynthetic(7, List.of(position("ABC", "10.00")), Map.of("ABC", new BigDecimal("10.00")));

        verify(historyRepository).saveAllAndFlush(rowsCaptor.capture());
        List<PortfolioHistoryRow> abc = rowsCaptor.getValue().stream()
            .filter(row -> "ABC".equals(row.getTicker()))
            .toList();
        assertThat(abc).hasSize(5);
        for (int dayIndex = 0; dayIndex < abc.size(); dayIndex++) {
            double trend = 10.0 * (1 + 0.02 * dayIndex);
            assertThat(abc.get(dayIndex).getCurrentPrice().doubleValue())
                .isBetween(trend * 0.85 - 0.0001, trend * 1.15 + 0.0001);
        }
    }

    @Test
    void priceNeverFallsBelowHalfTheBuyPrice() {
        given(historyRepository.countHistoricalDates(TODAY)).willReturn(0L);

        generator.backfillSynthetic(3, List.of(position("ABC", "10.00")), Map.of("ABC", new BigDecimal("0.01")));

        verify(historyRepository).saveAllAndFlush(rowsCaptor.capture());
        assertThat(rowsCaptor.getValue()).filteredOn(row -> "ABC".equals(row.getTicker()))
            .isNotEmpty()
            .allSatisfy(row -> assertThat(row.getCurrentPrice()).isEqualByComparingTo("5.00"));
    }

    @Test
    void sameSeedProducesSameHistory() {
        given(historyRepository.countHistoricalDates(TODAY)).willReturn(0L);
        List<Position> positions = List.of(position("ABC", "10.00"));
        Map<String, BigDecimal> basePrices = Map.of("ABC", new BigDecimal("10.00"));

        generator.backfillSynthetic(7, positions, basePrices);
        generator.backfillSynthetic(7, positions, basePrices);

        verify(historyRepository, times(2)).saveAllAndFlush(rowsCaptor.capture());
        List<List<PortfolioHistoryRow>> runs = rowsCaptor.getAllValues();
        assertThat(runs.get(1)).extracting(PortfolioHistoryRow::getCurrentPrice)
            .containsExactlyElementsOf(runs.get(0).stream().map(PortfolioHistoryRow::getCurrentPrice).toList());
    }

    @Test
    void missingBasePriceIsRejected() {
        assertThatThrownBy(() -> generator.backfillSynthetic(5, List.of(position("ABC", "10.00")), Map.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("ABC");
    }

    private static Position position(String ticker, String buyPrice) {
        BigDecimal price = new BigDecimal(buyPrice);
        return Position.open(ticker, 10, price, null, Money.times(price, 10));
    }
}
