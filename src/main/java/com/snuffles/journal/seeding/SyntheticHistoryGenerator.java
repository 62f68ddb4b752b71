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
import com.snuffles.journal.service.Valuation;
import com.snuffles.journal.service.exception.RepositoryException;
import com.snuffles.journal.service.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Fills {@code portfolio_history} with a deterministic, upward-trending price history for
 * non-production environments. Today's row set is never touched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyntheticHistoryGenerator {

    private static final double DAILY_TREND = 0.02;
    private static final double VOLATILITY_LOW = 0.85;
    private static final double VOLATILITY_HIGH = 1.15;
    private static final BigDecimal FLOOR_RATIO = new BigDecimal("0.5");

    private final PortfolioHistoryRepository historyRepository;
    private final CashAccountRepository cashAccountRepository;
    private final SnapshotEngine snapshotEngine;
    private final TradingCalendar tradingCalendar;
    private final LedgerTransactions transactions;
    private final AuditLogger auditLogger;
    private final JournalProperties properties;

    /**
     * @param daysBack      calendar days before today to cover; only trading days get rows
     * @param basePositions holdings valued on every generated date
     * @param basePrices    day-zero price per ticker
     */
    public BackfillResult backfillSynthetic(int daysBack, List<Position> basePositions, Map<String, BigDecimal> basePrices) {
        if (daysBack < 1) {
            throw new ValidationException("daysBack must be at least 1.");
        }
        for (Position position : basePositions) {
            if (!basePrices.containsKey(position.getTicker())) {
                throw new ValidationException("No base price for " + position.getTicker() + ".");
            }
        }

        JournalProperties.Backfill config = properties.getBackfill();
        LocalDate today = tradingCalendar.today();
        LocalDate start = today.minusDays(daysBack);
        List<LocalDate> tradingDays = tradingDaysBetween(start, today);
        long required = Math.min(config.getRequiredExistingDays(), tradingDays.size());
        List<Position> ordered = basePositions.stream().sorted(Comparator.comparing(Position::getTicker)).toList();

        BackfillResult result = transactions.execute("synthetic backfill", status -> {
            cashAccountRepository.lockById(CashAccount.LEDGER_ID)
                .orElseThrow(() -> new RepositoryException("Cash account row is missing; the schema was not initialized"));

            long existing = historyRepository.countHistoricalDates(today);
            if (existing >= required) {
                return new BackfillResult(true, existing, List.of());
            }

            int removed = historyRepository.deleteAllExceptDate(today);
            log.debug("Cleared {} historical row(s) before backfill", removed);

            Random random = new Random(config.getSeed());
            List<LocalDate> written = new ArrayList<>();
            List<PortfolioHistoryRow> rows = new ArrayList<>();
            for (LocalDate date : tradingDays) {
                int dayIndex = (int) ChronoUnit.DAYS.between(start, date);
                Map<String, BigDecimal> prices = pricesFor(dayIndex, ordered, basePrices, random);
                Valuation valuation = snapshotEngine.value(date, ordered, config.getInitialCash(),
                    ticker -> Optional.ofNullable(prices.get(ticker)), Map.of());
                rows.addAll(valuation.rows());
                written.add(date);
            }
            historyRepository.saveAllAndFlush(rows);
            return new BackfillResult(false, existing, written);
        });

        if (result.skipped()) {
            log.info("Historical data already exists ({} days), skipping backfill", result.existingDates());
        } else {
            log.info("Generated {} day(s) of synthetic history", result.generatedDates().size());
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("skipped", result.skipped());
        fields.put("existing_dates", result.existingDates());
        fields.put("generated_dates", result.generatedDates().size());
        auditLogger.record(AuditLogger.BACKFILL, fields);
        return result;
    }

    /** Trading days in {@code [from, until)}. */
    private List<LocalDate> tradingDaysBetween(LocalDate from, LocalDate until) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate date = from; date.isBefore(until); date = date.plusDays(1)) {
            if (tradingCalendar.isTradingDay(date)) {
                days.add(date);
            }
        }
        return days;
    }

    private Map<String, BigDecimal> pricesFor(int dayIndex, List<Position> positions,
                                              Map<String, BigDecimal> basePrices, Random random) {
        Map<String, BigDecimal> prices = new HashMap<>();
        BigDecimal trend = BigDecimal.valueOf(1 + dayIndex * DAILY_TREND);
        for (Position position : positions) {
            BigDecimal volatility = BigDecimal.valueOf(VOLATILITY_LOW + (VOLATILITY_HIGH - VOLATILITY_LOW) * random.nextDouble());
            BigDecimal price = basePrices.get(position.getTicker()).multiply(trend).multiply(volatility);
            BigDecimal floor = position.getBuyPrice().multiply(FLOOR_RATIO);
            prices.put(position.getTicker(), Money.price(price.max(floor)));
        }
        return prices;
    }
}
