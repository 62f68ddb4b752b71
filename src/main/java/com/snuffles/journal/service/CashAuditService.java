package com.snuffles.journal.service;

import com.snuffles.journal.domain.CashAccount;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Cross-checks stored cash figures against a replay of every trade and cash adjustment. The
 * ledger starts from zero cash, so the replay needs no opening balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashAuditService {

    private final TradeLogRepository tradeLogRepository;
    private final CashAdjustmentRepository cashAdjustmentRepository;
    private final CashAccountRepository cashAccountRepository;
    private final PortfolioHistoryRepository historyRepository;
    private final CashReconstructionAnalyzer analyzer;
    private final LedgerTransactions transactions;
    private final AuditLogger auditLogger;

    public CashAuditReport audit() {
        CashAuditReport report = transactions.read("cash audit", status -> {
            List<TradeLogEntry> trades = tradeLogRepository.findAllByOrderByTradeDateAscIdAsc();
            List<CashAdjustment> adjustments = cashAdjustmentRepository.findAllByOrderByAdjustmentDateAscIdAsc();
            List<PortfolioHistoryRow> totals = historyRepository.findByTickerOrderBySnapshotDateAsc(PortfolioHistoryRow.TOTAL_TICKER);
            BigDecimal live = cashAccountRepository.findById(CashAccount.LEDGER_ID)
                .map(CashAccount::getBalance)
                .map(Money::amount)
                .orElse(Money.amount(BigDecimal.ZERO));
            return compare(trades, adjustments, totals, live);
        });

        if (report.isConsistent()) {
            log.info("Cash audit passed: balance {} matches {} movement date(s), {} snapshot(s) superseded by later movements",
                report.liveBalance(), report.replayedByDate().size(), report.superseded().size());
        } else {
            log.warn("Cash audit found {} drift(s); live balance {}, replayed {}",
                report.drifts().size(), report.liveBalance(), report.replayedBalance());
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("live_balance", report.liveBalance());
        fields.put("replayed_balance", report.replayedBalance());
        fields.put("snapshots_checked", report.snapshotsChecked());
        fields.put("drifts", report.drifts().size());
        fields.put("superseded_snapshots", report.superseded().size());
        auditLogger.record(AuditLogger.CASH_AUDIT, fields);
        return report;
    }

    CashAuditReport compare(List<TradeLogEntry> trades, List<CashAdjustment> adjustments,
                            List<PortfolioHistoryRow> totals, BigDecimal live) {
        BigDecimal opening = BigDecimal.ZERO;
        NavigableMap<LocalDate, BigDecimal> replayed = analyzer.reconstructCash(trades, adjustments, opening);
        NavigableMap<LocalDate, List<BigDecimal>> intraday = analyzer.intradayBalances(trades, adjustments, opening);
        BigDecimal replayedBalance = replayed.isEmpty() ? Money.amount(opening) : replayed.lastEntry().getValue();

        List<CashDrift> drifts = new ArrayList<>();
        List<CashDrift> superseded = new ArrayList<>();
        int checked = 0;
        for (PortfolioHistoryRow total : totals) {
            if (total.getCashBalance() == null) {
                continue;
            }
            checked++;
            BigDecimal expected = CashReconstructionAnalyzer.balanceAsOf(replayed, total.getSnapshotDate(), opening);
            BigDecimal recorded = Money.amount(total.getCashBalance());
            if (recorded.compareTo(expected) != 0) {
                CashDrift drift = new CashDrift(total.getSnapshotDate(), "snapshot", recorded, expected, recorded.subtract(expected));
                if (heldDuring(intraday.get(total.getSnapshotDate()), recorded)) {
                    superseded.add(drift);
                } else {
                    drifts.add(drift);
                }
            }
        }
        if (live.compareTo(replayedBalance) != 0) {
            LocalDate asOf = replayed.isEmpty() ? null : replayed.lastKey();
            drifts.add(new CashDrift(asOf, "ledger", live, replayedBalance, live.subtract(replayedBalance)));
        }
        return new CashAuditReport(live, replayedBalance, replayed, checked, drifts, superseded);
    }

    private static boolean heldDuring(List<BigDecimal> dayBalances, BigDecimal recorded) {
        return dayBalances != null && dayBalances.stream().anyMatch(balance -> balance.compareTo(recorded) == 0);
    }
}
