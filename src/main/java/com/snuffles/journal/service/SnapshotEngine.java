package com.snuffles.journal.service;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.domain.Position;
import com.snuffles.journal.domain.TradeLogEntry;
import com.snuffles.journal.service.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes a day's valuation rows from positions, cash and prices. No I/O.
 * <p>
 * Each priced row is rounded to cents on its own; the TOTAL row sums those rounded figures, so
 * {@code TOTAL.total_value} equals the sum of the per-ticker values exactly and
 * {@code TOTAL.total_equity = TOTAL.total_value + cash}.
 */
@Component
public class SnapshotEngine {

    public static final String HOLD = "HOLD";
    public static final String BUY = "BUY";
    public static final String SELL = "SELL";
    public static final String NO_PRICE = "NO PRICE";

    public Valuation value(LocalDate date,
                           List<Position> positions,
                           BigDecimal cash,
                           Function<String, Optional<BigDecimal>> priceLookup,
                           Map<String, String> sameDayActions) {
        if (date == null) {
            throw new ValidationException("Snapshot date is required.");
        }
        if (cash == null) {
            throw new ValidationException("Cash balance is required.");
        }

        List<Position> ordered = new ArrayList<>(positions);
        ordered.sort(Comparator.comparing(Position::getTicker));
        checkPositions(ordered);

        List<PortfolioHistoryRow> rows = new ArrayList<>(ordered.size() + 1);
        List<String> unpriced = new ArrayList<>();
        BigDecimal totalValue = Money.amount(BigDecimal.ZERO);
        BigDecimal totalPnl = Money.amount(BigDecimal.ZERO);

        for (Position position : ordered) {
            String ticker = position.getTicker();
            Optional<BigDecimal> price = priceLookup.apply(ticker).filter(p -> p.signum() > 0);
            PortfolioHistoryRow.PortfolioHistoryRowBuilder row = PortfolioHistoryRow.builder()
                .snapshotDate(date)
                .ticker(ticker)
                .shares(position.getShares())
                .costBasis(position.getCostBasis())
                .stopLoss(position.getStopLoss());

            if (price.isEmpty()) {
                unpriced.add(ticker);
                rows.add(row.action(NO_PRICE).build());
                continue;
            }

            BigDecimal current = Money.price(price.get());
            BigDecimal value = Money.times(current, position.getShares());
            BigDecimal pnl = Money.times(current.subtract(position.getBuyPrice()), position.getShares());
            totalValue = totalValue.add(value);
            totalPnl = totalPnl.add(pnl);

            rows.add(row
                .currentPrice(current)
                .totalValue(value)
                .pnl(pnl)
                .action(sameDayActions.getOrDefault(ticker, HOLD))
                .build());
        }

        BigDecimal cashBalance = Money.amount(cash);
        rows.add(PortfolioHistoryRow.builder()
            .snapshotDate(date)
            .ticker(PortfolioHistoryRow.TOTAL_TICKER)
            .totalValue(totalValue)
            .pnl(totalPnl)
            .cashBalance(cashBalance)
            .totalEquity(totalValue.add(cashBalance))
            .build());

        return new Valuation(rows, unpriced);
    }

    /**
     * Action implied by the last trade of each ticker on the day.
     */
    public static Map<String, String> sameDayActions(List<TradeLogEntry> tradesOnDate) {
        Map<String, String> actions = new HashMap<>();
        tradesOnDate.stream()
            .sorted(Comparator.comparing(TradeLogEntry::getId, Comparator.nullsFirst(Comparator.naturalOrder())))
            .forEach(trade -> actions.put(trade.getTicker(), trade.isBuy() ? BUY : SELL));
        return actions;
    }

    private void checkPositions(List<Position> positions) {
        Set<String> seen = new HashSet<>();
        for (Position position : positions) {
            if (PortfolioHistoryRow.TOTAL_TICKER.equals(position.getTicker())) {
                throw new ValidationException("TOTAL is reserved and cannot be held as a ticker.");
            }
            if (!seen.add(position.getTicker())) {
                throw new ValidationException("Duplicate position for " + position.getTicker() + ".");
            }
            if (position.getShares() <= 0) {
                throw new ValidationException("Position " + position.getTicker() + " has no shares.");
            }
        }
    }
}
