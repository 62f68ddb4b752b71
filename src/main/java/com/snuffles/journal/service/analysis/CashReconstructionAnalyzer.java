package com.snuffles.journal.service.analysis;

import com.snuffles.journal.domain.CashAdjustment;
import com.snuffles.journal.domain.TradeLogEntry;
import com.snuffles.journal.service.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Replays cash movements independently of the stored balance. Buys cost
 * {@code shares_bought * buy_price} and sells return {@code shares_sold * sell_price}, each rounded
 * to cents the same way the ledger books them.
 */
@Component
public class CashReconstructionAnalyzer {

    /**
     * @return end-of-day cash balance for every date that has at least one trade
     */
    public NavigableMap<LocalDate, BigDecimal> reconstructCash(List<TradeLogEntry> tradeLog, BigDecimal initialCash) {
        return reconstructCash(tradeLog, List.of(), initialCash);
    }

    /**
     * Same as {@link #reconstructCash(List, BigDecimal)} with deposits and withdrawals folded in.
     * On a shared date, adjustments are applied before trades.
     */
    public NavigableMap<LocalDate, BigDecimal> reconstructCash(List<TradeLogEntry> tradeLog,
                                                               List<CashAdjustment> adjustments,
                                                               BigDecimal initialCash) {
        NavigableMap<LocalDate, BigDecimal> balances = new TreeMap<>();
        BigDecimal cash = Money.amount(initialCash);
        for (Movement movement : orderedMovements(tradeLog, adjustments)) {
            cash = cash.add(movement.amount());
            balances.put(movement.date(), cash);
        }
        return balances;
    }

    /**
     * Every balance the ledger held during each movement date, in replay order: the opening balance
     * of the day followed by the balance after each movement. The last element equals the
     * end-of-day balance from {@link #reconstructCash(List, List, BigDecimal)}.
     */
    public NavigableMap<LocalDate, List<BigDecimal>> intradayBalances(List<TradeLogEntry> tradeLog,
                                                                      List<CashAdjustment> adjustments,
                                                                      BigDecimal initialCash) {
        NavigableMap<LocalDate, List<BigDecimal>> balances = new TreeMap<>();
        BigDecimal cash = Money.amount(initialCash);
        for (Movement movement : orderedMovements(tradeLog, adjustments)) {
            List<BigDecimal> day = balances.get(movement.date());
            if (day == null) {
                day = new ArrayList<>();
                day.add(cash);
                balances.put(movement.date(), day);
            }
            cash = cash.add(movement.amount());
            day.add(cash);
        }
        return balances;
    }

    /**
     * Balance in effect at the end of {@code date}: the latest replayed balance on or before it.
     */
    public static BigDecimal balanceAsOf(NavigableMap<LocalDate, BigDecimal> balances, LocalDate date, BigDecimal initialCash) {
        Map.Entry<LocalDate, BigDecimal> entry = balances.floorEntry(date);
        return entry != null ? entry.getValue() : Money.amount(initialCash);
    }

    private static List<Movement> orderedMovements(List<TradeLogEntry> tradeLog, List<CashAdjustment> adjustments) {
        List<Movement> movements = new ArrayList<>();
        for (CashAdjustment adjustment : adjustments) {
            movements.add(new Movement(adjustment.getAdjustmentDate(), 0, seq(adjustment.getId()), adjustment.getAmount()));
        }
        for (TradeLogEntry trade : tradeLog) {
            movements.add(new Movement(trade.getTradeDate(), 1, seq(trade.getId()), delta(trade)));
        }
        movements.sort(Comparator.comparing(Movement::date)
            .thenComparingInt(Movement::kind)
            .thenComparingLong(Movement::sequence));
        return movements;
    }

    private static BigDecimal delta(TradeLogEntry trade) {
        BigDecimal delta = BigDecimal.ZERO;
        if (trade.getSharesBought() > 0 && trade.getBuyPrice() != null) {
            delta = delta.subtract(Money.times(trade.getBuyPrice(), trade.getSharesBought()));
        }
        if (trade.getSharesSold() > 0 && trade.getSellPrice() != null) {
            delta = delta.add(Money.times(trade.getSellPrice(), trade.getSharesSold()));
        }
        return delta;
    }

    private static long seq(Long id) {
        return id != null ? id : Long.MAX_VALUE;
    }

    private record Movement(LocalDate date, int kind, long sequence, BigDecimal amount) {
    }
}
