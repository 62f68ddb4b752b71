package com.snuffles.journal.service;

import com.snuffles.journal.config.JournalProperties;
import com.snuffles.journal.domain.CashAccount;
import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.domain.Position;
import com.snuffles.journal.repository.CashAccountRepository;
import com.snuffles.journal.repository.PortfolioHistoryRepository;
import com.snuffles.journal.repository.PositionRepository;
import com.snuffles.journal.repository.TradeLogRepository;
import com.snuffles.journal.service.exception.ConfigException;
import com.snuffles.journal.service.exception.PriceUnavailableException;
import com.snuffles.journal.service.exception.RepositoryException;
import com.snuffles.journal.service.exception.ValidationException;
import com.snuffles.journal.service.pricing.PriceOverrides;
import com.snuffles.journal.service.pricing.PriceSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Writes daily valuations. A date's row set is replaced as a whole inside one ledger-locked
 * transaction, so readers see either the previous snapshot or the new one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotService {

    private final PositionRepository positionRepository;
    private final CashAccountRepository cashAccountRepository;
    private final TradeLogRepository tradeLogRepository;
    private final PortfolioHistoryRepository historyRepository;
    private final SnapshotEngine snapshotEngine;
    private final TradingCalendar tradingCalendar;
    private final LedgerTransactions transactions;
    private final AuditLogger auditLogger;
    private final JournalProperties properties;
    private final ObjectProvider<PriceSource> priceSources;

    /**
     * Values the live ledger for {@code date} (today when null).
     *
     * @param force     write even when {@code date} is not a trading day
     * @param overrides caller-supplied prices consulted before the configured source
     */
    public SnapshotResult takeSnapshot(LocalDate date, boolean force, PriceOverrides overrides) {
        LocalDate day = date != null ? date : tradingCalendar.today();
        if (!force && !tradingCalendar.isTradingDay(day)) {
            return skip(day);
        }

        List<String> held = heldTickers();
        PriceSource source = resolvePriceSource(overrides, held);
        Map<String, Optional<BigDecimal>> quotes = new HashMap<>();
        // price lookups may be slow; resolve them before taking the ledger lock
        held.forEach(ticker -> quotes.put(ticker, source.getPrice(ticker, day)));
        log.debug("Prefetched {} quote(s) for {}", quotes.size(), day);

        SnapshotResult result = transactions.execute("snapshot " + day, status -> {
            CashAccount cash = lockLedger();
            List<Position> positions = positionRepository.findAllByOrderByTickerAsc();
            return write(day, positions, cash.getBalance(),
                ticker -> quotes.computeIfAbsent(ticker, t -> source.getPrice(t, day)));
        });
        auditWritten(result);
        return result;
    }

    /**
     * Values a caller-provided portfolio state for {@code date} and stores it in place of any
     * existing snapshot for that date.
     */
    public SnapshotResult createSnapshot(LocalDate date, List<Position> positions, BigDecimal cash,
                                         PriceSource priceSource, boolean force) {
        if (date == null || positions == null || cash == null || priceSource == null) {
            throw new ValidationException("Snapshot date, positions, cash and price source are required.");
        }
        if (!force && !tradingCalendar.isTradingDay(date)) {
            return skip(date);
        }

        SnapshotResult result = transactions.execute("snapshot " + date, status -> {
            lockLedger();
            return write(date, positions, cash, ticker -> priceSource.getPrice(ticker, date));
        });
        auditWritten(result);
        return result;
    }

    public List<PortfolioHistoryRow> getSnapshot(LocalDate date) {
        return transactions.read("read snapshot", status -> historyRepository.findBySnapshotDateOrderByTickerAsc(date));
    }

    public List<PortfolioHistoryRow> getHistory(LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return transactions.read("read history", status -> historyRepository.findAllByOrderBySnapshotDateAscTickerAsc());
        }
        LocalDate start = from != null ? from : LedgerService.EARLIEST;
        LocalDate end = to != null ? to : LedgerService.LATEST;
        if (start.isAfter(end)) {
            throw new ValidationException("Range start " + from + " is after end " + to + ".");
        }
        return transactions.read("read history",
            status -> historyRepository.findBySnapshotDateBetweenOrderBySnapshotDateAscTickerAsc(start, end));
    }

    public List<PortfolioHistoryRow> getTickerHistory(String ticker) {
        String symbol = PortfolioHistoryRow.TOTAL_TICKER.equalsIgnoreCase(ticker)
            ? PortfolioHistoryRow.TOTAL_TICKER
            : TradeValidator.normalizeTicker(ticker);
        return transactions.read("read ticker history", status -> historyRepository.findByTickerOrderBySnapshotDateAsc(symbol));
    }

    private SnapshotResult write(LocalDate date, List<Position> positions, BigDecimal cash,
                                 Function<String, Optional<BigDecimal>> prices) {
        Map<String, String> actions = SnapshotEngine.sameDayActions(tradeLogRepository.findByTradeDateOrderByIdAsc(date));
        Valuation valuation = snapshotEngine.value(date, positions, cash, prices, actions);

        if (!valuation.fullyPriced()) {
            if (properties.getSnapshot().getUnpricedPolicy() == UnpricedPolicy.DEFER) {
                throw new PriceUnavailableException(date, valuation.unpricedTickers());
            }
            log.warn("Snapshot {} written without valuation for {}", date, valuation.unpricedTickers());
        }

        int replaced = historyRepository.deleteBySnapshotDate(date);
        historyRepository.saveAllAndFlush(valuation.rows());
        log.debug("Snapshot {}: replaced {} row(s) with {}", date, replaced, valuation.rows().size());
        return SnapshotResult.written(date, valuation, replaced > 0);
    }

    private PriceSource resolvePriceSource(PriceOverrides overrides, List<String> tickers) {
        PriceOverrides manual = overrides != null ? overrides : PriceOverrides.none();
        PriceSource configured = priceSources.getIfAvailable();
        if (configured == null) {
            List<String> uncovered = tickers.stream().filter(t -> !manual.covers(t)).toList();
            if (!uncovered.isEmpty()) {
                throw new ConfigException("No price source is configured (journal.price-source.type) and no price "
                    + "was supplied for " + String.join(", ", uncovered));
            }
        }
        return manual.over(configured);
    }

    private List<String> heldTickers() {
        return transactions.read("read held tickers",
            status -> positionRepository.findAllByOrderByTickerAsc().stream().map(Position::getTicker).toList());
    }

    private CashAccount lockLedger() {
        return cashAccountRepository.lockById(CashAccount.LEDGER_ID)
            .orElseThrow(() -> new RepositoryException("Cash account row is missing; the schema was not initialized"));
    }

    private SnapshotResult skip(LocalDate day) {
        log.info("Skipping snapshot for {}: not a trading day", day);
        auditLogger.record(AuditLogger.SNAPSHOT_SKIPPED, Map.of("date", day.toString(), "reason", "non-trading day"));
        return SnapshotResult.skipped(day);
    }

    private void auditWritten(SnapshotResult result) {
        PortfolioHistoryRow total = result.rows().get(result.rows().size() - 1);
        log.info("Snapshot {} written: {} position row(s), equity {}",
            result.date(), result.rows().size() - 1, total.getTotalEquity());

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("date", result.date().toString());
        fields.put("rows", result.rows().size());
        fields.put("total_value", total.getTotalValue());
        fields.put("cash_balance", total.getCashBalance());
        fields.put("total_equity", total.getTotalEquity());
        fields.put("replaced", result.replacedExisting());
        fields.put("unpriced", result.unpricedTickers());
        auditLogger.record(AuditLogger.SNAPSHOT_CREATED, fields);
    }
}
