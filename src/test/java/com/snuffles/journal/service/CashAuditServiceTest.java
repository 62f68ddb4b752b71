package com.snuffles.journal.service;

import com.snuffles.journal.domain.CashAdjustment;
import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.domain.TradeLogEntry;
import com.snuffles.journal.repository.CashAccountRepository;
import com.snuffles.journal.repository.CashAdjustmentRepository;
import com.snuffles.journal.repository.PortfolioHistoryRepository;
import com.snuffles.journal.repository.TradeLogRepository;
import com.snuffles.journal.service.analysis.CashAuditReport;
import com.snuffles.journal.service.analysis.CashDrift;
import com.snuffles.journal.service.analysis.CashReconstructionAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class CashAuditServiceTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 3, 4);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 3, 5);

    @Mock
    private TradeLogRepository tradeLogRepository;

    @Mock
    private CashAdjustmentRepository cashAdjustmentRepository;

    @Mock
    private CashAccountRepository cashAccountRepository;

    @Mock
    private PortfolioHistoryRepository historyRepository;

    @Mock
    private LedgerTransactions transactions;

    @Mock
    private AuditLogger auditLogger;

    private CashAuditService auditService;

    private final List<CashAdjustment> deposits = List.of(
        CashAdjustment.builder().id(1L).adjustmentDate(DAY_1).amount(new BigDecimal("1000.00")).reason("DEPOSIT").build());

    private final List<TradeLogEntry> trades = List.of(
        TradeLogEntry.builder().id(1L).tradeDate(DAY_1).ticker("ABC").sharesBought(10).buyPrice(new BigDecimal("20")).build(),
        TradeLogEntry.builder().id(2L).tradeDate(DAY_2).ticker("ABC").sharesSold(5).sellPrice(new BigDecimal("30")).build());

    @BeforeEach
    void setUp() {
        auditService = new CashAuditService(tradeLogRepository, cashAdjustmentRepository, cashAccountRepository,
            historyRepository, new CashReconstructionAnalyzer(), transactions, auditLogger);
    }

    @Test
    void consistentHistoryHasNoDrift() {
        List<PortfolioHistoryRow> totals = List.of(total(DAY_1, "800.00"), total(DAY_2, "950.00"));

        CashAuditReport report = auditService.compare(trades, deposits, totals, new BigDecimal("950.00"));

        assertThat(report.isConsistent()).isTrue();
        assertThat(report.snapshotsChecked()).isEqualTo(2);
        assertThat(report.replayedBalance()).isEqualByComparingTo("950.00");
        assertThat(report.replayedByDate()).containsKeys(DAY_1, DAY_2);
    }

    @Test
    void reportsSnapshotAndLedgerDrift() {
        List<PortfolioHistoryRow> totals = List.of(total(DAY_1, "800.00"), total(DAY_2, "900.00"));

        CashAuditReport report = auditService.compare(trades, deposits, totals, new BigDecimal("940.00"));

        assertThat(report.isConsistent()).isFalse();
        assertThat(report.superseded()).isEmpty();
        assertThat(report.drifts()).extracting(CashDrift::source).containsExactly("snapshot", "ledger");
        assertThat(report.drifts().get(0).date()).isEqualTo(DAY_2);
        assertThat(report.drifts().get(0).difference()).isEqualByComparingTo("-50.00");
        assertThat(report.drifts().get(1).difference()).isEqualByComparingTo("-10.00");
    }

    @Test
    void snapshotTakenBeforeALaterSameDayMovementIsSuperseded() {
        List<PortfolioHistoryRow> totals = List.of(total(DAY_1, "1000.00"), total(DAY_2, "800.00"));

        CashAuditReport report = auditService.compare(trades, deposits, totals, new BigDecimal("950.00"));

        assertThat(report.isConsistent()).isTrue();
        assertThat(report.drifts()).isEmpty();
        assertThat(report.superseded()).extracting(CashDrift::date).containsExactly(DAY_1, DAY_2);
        assertThat(report.superseded().get(1).expected()).isEqualByComparingTo("950.00");
    }

    @Test
    void snapshotBeforeAnyMovementExpectsZeroCash() {
        List<PortfolioHistoryRow> totals = List.of(total(DAY_1.minusDays(3), "0"));

        CashAuditReport report = auditService.compare(List.of(), List.of(), totals, BigDecimal.ZERO);

        assertThat(report.isConsistent()).isTrue();
    }

    private static PortfolioHistoryRow total(LocalDate date, String cash) {
        return PortfolioHistoryRow.builder()
            .snapshotDate(date)
            .ticker(PortfolioHistoryRow.TOTAL_TICKER)
            .totalValue(BigDecimal.ZERO)
            .cashBalance(new BigDecimal(cash))
            .totalEquity(new BigDecimal(cash))
            .build();
    }
}
