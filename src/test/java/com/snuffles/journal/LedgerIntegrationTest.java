package com.snuffles.journal;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.domain.TradeLogEntry;
import com.snuffles.journal.service.CashAuditService;
import com.snuffles.journal.service.LedgerService;
import com.snuffles.journal.service.LedgerState;
import com.snuffles.journal.service.SnapshotResult;
import com.snuffles.journal.service.SnapshotService;
import com.snuffles.journal.service.TradingCalendar;
import com.snuffles.journal.service.analysis.CashAuditReport;
import com.snuffles.journal.service.exception.ResourceNotFoundException;
import com.snuffles.journal.service.exception.ValidationException;
import com.snuffles.journal.service.pricing.PriceOverrides;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@ActiveProfiles("test")
class LedgerIntegrationTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private SnapshotService snapshotService;

    @Autowired
    private CashAuditService cashAuditService;

    @Autowired
    private TradingCalendar tradingCalendar;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetLedger() {
        jdbcTemplate.update("DELETE FROM portfolio_history");
        jdbcTemplate.update("DELETE FROM trade_log");
        jdbcTemplate.update("DELETE FROM cash_adjustments");
        jdbcTemplate.update("DELETE FROM positions");
        jdbcTemplate.update("UPDATE cash SET balance = 0 WHERE id = 0");
    }

    @Test
    void freshLedgerIsFirstTime() {
        LedgerState state = ledgerService.loadState();

        assertThat(state.firstTime()).isTrue();
        assertThat(state.positions()).isEmpty();
        assertThat(state.cash()).isEqualByComparingTo("0");
    }

    @Test
    void buyMergeSnapshotAndSellScenario() {
        ledgerService.adjustCash(new BigDecimal("10000.00"), "INITIAL CASH");
        ledgerService.applyBuy("ABC", 100, new BigDecimal("50.00"), new BigDecimal("45.00"));
        ledgerService.applyBuy("ABC", 50, new BigDecimal("60.00"), new BigDecimal("55.00"));

        LedgerState afterBuys = ledgerService.loadState();
        assertThat(afterBuys.cash()).isEqualByComparingTo("2000.00");
        assertThat(afterBuys.positions()).singleElement().satisfies(position -> {
            assertThat(position.getShares()).isEqualTo(150);
            assertThat(position.getBuyPrice()).isEqualByComparingTo("53.3333");
            assertThat(position.getCostBasis()).isEqualByComparingTo("8000.00");
            assertThat(position.getStopLoss()).isEqualByComparingTo("55.00");
        });

        SnapshotResult snapshot = snapshotService.takeSnapshot(tradingCalendar.today(), true, PriceOverrides.none());
        PortfolioHistoryRow abc = snapshot.rows().get(0);
        PortfolioHistoryRow total = snapshot.rows().get(1);
        assertThat(abc.getTotalValue()).isEqualByComparingTo("9000.00");
        assertThat(abc.getAction()).isEqualTo("BUY");
        assertThat(total.getTotalEquity()).isEqualByComparingTo("11000.00");

        TradeLogEntry sell = ledgerService.applySell("ABC", 150, new BigDecimal("70.00"));
        assertThat(sell.getPnl()).isEqualByComparingTo("2500.01");

        LedgerState afterSell = ledgerService.loadState();
        assertThat(afterSell.positions()).isEmpty();
        assertThat(afterSell.cash()).isEqualByComparingTo("12500.00");

        CashAuditReport audit = cashAuditService.audit();
        assertThat(audit.isConsistent()).isTrue();
        assertThat(audit.superseded()).singleElement()
            .satisfies(drift -> assertThat(drift.recorded()).isEqualByComparingTo("2000.00"));
        assertThat(afterSell.firstTime()).isFalse();
        assertThat(ledgerService.getTradeLog())
            .extracting(TradeLogEntry::getSharesBought, TradeLogEntry::getSharesSold)
            .containsExactly(
                tuple(100L, 0L),
                tuple(50L, 0L),
                tuple(0L, 150L));
    }

    @Test
    void failedMutationLeavesNoTrace() {
        ledgerService.adjustCash(new BigDecimal("100.00"), null);

        assertThatThrownBy(() -> ledgerService.applyBuy("ABC", 10, new BigDecimal("50.00"), null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledgerService.applySell("ABC", 1, new BigDecimal("50.00")))
            .isInstanceOf(ResourceNotFoundException.class);

        LedgerState state = ledgerService.loadState();
        assertThat(state.positions()).isEmpty();
        assertThat(state.cash()).isEqualByComparingTo("100.00");
        assertThat(ledgerService.getTradeLog()).isEmpty();
    }

    @Test
    void repeatedSnapshotReplacesRowsForTheDate() {
        LocalDate today = tradingCalendar.today();
        ledgerService.adjustCash(new BigDecimal("1000.00"), null);
        ledgerService.applyBuy("ABC", 5, new BigDecimal("50.00"), null);
        ledgerService.applyBuy("XYZ", 10, new BigDecimal("10.00"), null);

        snapshotService.takeSnapshot(today, true, PriceOverrides.none());
        SnapshotResult second = snapshotService.takeSnapshot(today, true,
            PriceOverrides.of(Map.of("XYZ", new BigDecimal("11.00"))));

        List<PortfolioHistoryRow> stored = snapshotService.getSnapshot(today);
        assertThat(second.replacedExisting()).isTrue();
        assertThat(stored).extracting(PortfolioHistoryRow::getTicker).containsExactly("ABC", "TOTAL", "XYZ");

        PortfolioHistoryRow total = stored.stream().filter(PortfolioHistoryRow::isTotal).findFirst().orElseThrow();
        BigDecimal sum = stored.stream().filter(row -> !row.isTotal())
            .map(PortfolioHistoryRow::getTotalValue)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(total.getTotalValue()).isEqualByComparingTo(sum).isEqualByComparingTo("410.00");
        assertThat(total.getCashBalance()).isEqualByComparingTo("650.00");
        assertThat(total.getTotalEquity()).isEqualByComparingTo(total.getTotalValue().add(total.getCashBalance()));
    }

    @Test
    void cashAuditAgreesWithLedger() {
        ledgerService.adjustCash(new BigDecimal("5000.00"), null);
        ledgerService.applyBuy("ABC", 30, new BigDecimal("33.33"), null);
        ledgerService.applySell("ABC", 10, new BigDecimal("40.01"));
        snapshotService.takeSnapshot(tradingCalendar.today(), true, PriceOverrides.none());

        assertThat(cashAuditService.audit().isConsistent()).isTrue();
    }

    @Test
    void subCentPriceIsRejectedAndReplayStaysExact() {
        ledgerService.adjustCash(new BigDecimal("10000.00"), "INITIAL CASH");

        assertThatThrownBy(() -> ledgerService.applyBuy("ABC", 1000, new BigDecimal("1.00005"), null))
            .isInstanceOf(ValidationException.class);
        ledgerService.applyBuy("ABC", 1000, new BigDecimal("1.0001"), null);

        CashAuditReport audit = cashAuditService.audit();
        assertThat(audit.liveBalance()).isEqualByComparingTo("8999.90");
        assertThat(audit.replayedBalance()).isEqualByComparingTo("8999.90");
        assertThat(audit.isConsistent()).isTrue();
    }

    @Test
    void overlongReasonIsRejectedAsValidation() {
        ledgerService.adjustCash(new BigDecimal("100.00"), null);

        assertThatThrownBy(() -> ledgerService.applyBuy("ABC", 1, new BigDecimal("1.00"), null, "x".repeat(300)))
            .isInstanceOf(ValidationException.class);
        assertThat(ledgerService.getTradeLog()).isEmpty();
    }

    @Test
    void concurrentBuysAreSerialized() throws Exception {
        ledgerService.adjustCash(new BigDecimal("100000.00"), null);
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Callable<TradeLogEntry>> buys = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                buys.add(() -> ledgerService.applyBuy("ABC", 10, new BigDecimal("10.00"), null));
            }
            for (Future<TradeLogEntry> result : pool.invokeAll(buys)) {
                assertThat(result.get(30, TimeUnit.SECONDS).getId()).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }

        LedgerState state = ledgerService.loadState();
        assertThat(state.positions()).singleElement().satisfies(position -> {
            assertThat(position.getShares()).isEqualTo(80);
            assertThat(position.getCostBasis()).isEqualByComparingTo("800.00");
        });
        assertThat(state.cash()).isEqualByComparingTo("99200.00");
        assertThat(ledgerService.getTradeLog()).hasSize(writers);
    }
}
