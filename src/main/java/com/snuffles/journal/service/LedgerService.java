package com.snuffles.journal.service;

import com.snuffles.journal.domain.CashAccount;
import com.snuffles.journal.domain.CashAdjustment;
import com.snuffles.journal.domain.Position;
import com.snuffles.journal.domain.TradeLogEntry;
import com.snuffles.journal.repository.CashAccountRepository;
import com.snuffles.journal.repository.CashAdjustmentRepository;
import com.snuffles.journal.repository.PositionRepository;
import com.snuffles.journal.repository.TradeLogRepository;
import com.snuffles.journal.service.exception.RepositoryException;
import com.snuffles.journal.service.exception.ResourceNotFoundException;
import com.snuffles.journal.service.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owner of positions, cash and the trade log. Each mutation locks the ledger, applies the
 * position, cash and log effects, and commits them together or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    static final String BUY_NEW_REASON = "MANUAL BUY - New position";
    static final String BUY_ADD_REASON = "MANUAL BUY - Add to position";
    static final String SELL_REASON = "MANUAL SELL - User";

    static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final PositionRepository positionRepository;
    private final CashAccountRepository cashAccountRepository;
    private final TradeLogRepository tradeLogRepository;
    private final CashAdjustmentRepository cashAdjustmentRepository;
    private final LedgerTransactions transactions;
    private final TradingCalendar tradingCalendar;
    private final AuditLogger auditLogger;

    public TradeLogEntry applyBuy(String ticker, long shares, BigDecimal price, BigDecimal stopLoss) {
        return applyBuy(ticker, shares, price, stopLoss, null);
    }

    public TradeLogEntry applyBuy(String ticker, long shares, BigDecimal price, BigDecimal stopLoss, String reason) {
        try {
            String symbol = TradeValidator.normalizeTicker(ticker);
            TradeValidator.requirePositiveShares(shares);
            TradeValidator.requirePositivePrice(price, "Price");
            TradeValidator.requireValidStopLoss(stopLoss);
            TradeValidator.requireReasonLength(reason);
            BigDecimal cost = Money.times(price, shares);
            TradeValidator.requireNonZeroValue(cost);
            log.debug("Applying buy of {} {} @ {} (stopLoss={})", shares, symbol, price, stopLoss);

            TradeLogEntry entry = transactions.execute("buy " + symbol, status -> {
                CashAccount cash = lockLedger();
                if (cost.compareTo(cash.getBalance()) > 0) {
                    throw new ValidationException("Insufficient cash for this trade: cost " + cost
                        + " exceeds balance " + Money.amount(cash.getBalance()) + ".");
                }

                Optional<Position> existing = positionRepository.findById(symbol);
                Position position = existing
                    .map(held -> mergeBuy(held, shares, price, stopLoss))
                    .orElseGet(() -> Position.open(symbol, shares, Money.price(price), stopLoss, cost));
                positionRepository.save(position);

                cash.setBalance(cash.getBalance().subtract(cost));
                cashAccountRepository.save(cash);

                return tradeLogRepository.saveAndFlush(TradeLogEntry.builder()
                    .tradeDate(tradingCalendar.today())
                    .ticker(symbol)
                    .sharesBought(shares)
                    .buyPrice(price)
                    .costBasis(cost)
                    .pnl(BigDecimal.ZERO)
                    .reason(reason != null ? reason : existing.isPresent() ? BUY_ADD_REASON : BUY_NEW_REASON)
                    .sharesSold(0)
                    .build());
            });

            log.info("Bought {} {} @ {} (trade {})", shares, symbol, price, entry.getId());
            auditTrade(entry);
            return entry;
        } catch (ValidationException ex) {
            auditRejected("buy", ticker, ex);
            throw ex;
        }
    }

    public TradeLogEntry applySell(String ticker, long shares, BigDecimal price) {
        return applySell(ticker, shares, price, null);
    }

    public TradeLogEntry applySell(String ticker, long shares, BigDecimal price, String reason) {
        try {
            String symbol = TradeValidator.normalizeTicker(ticker);
            TradeValidator.requirePositiveShares(shares);
            TradeValidator.requirePositivePrice(price, "Price");
            TradeValidator.requireReasonLength(reason);
            BigDecimal proceeds = Money.times(price, shares);
            TradeValidator.requireNonZeroValue(proceeds);
            log.debug("Applying sell of {} {} @ {}", shares, symbol, price);

            TradeLogEntry entry = transactions.execute("sell " + symbol, status -> {
                CashAccount cash = lockLedger();
                Position position = positionRepository.findById(symbol)
                    .orElseThrow(() -> new ResourceNotFoundException("No open position for " + symbol));
                if (position.getShares() < shares) {
                    throw new ResourceNotFoundException("Cannot sell " + shares + " shares of " + symbol
                        + "; only " + position.getShares() + " held");
                }

                BigDecimal buyPrice = position.getBuyPrice();
                BigDecimal costOut = Money.times(buyPrice, shares);
                BigDecimal pnl = Money.times(price.subtract(buyPrice), shares);

                long remaining = position.getShares() - shares;
                if (remaining == 0) {
                    positionRepository.delete(position);
                    log.debug("Position {} fully liquidated", symbol);
                } else {
                    position.setShares(remaining);
                    position.setCostBasis(Money.times(buyPrice, remaining));
                    positionRepository.save(position);
                }

                cash.setBalance(cash.getBalance().add(proceeds));
                cashAccountRepository.save(cash);

                return tradeLogRepository.saveAndFlush(TradeLogEntry.builder()
                    .tradeDate(tradingCalendar.today())
                    .ticker(symbol)
                    .sharesBought(0)
                    .costBasis(costOut)
                    .pnl(pnl)
                    .reason(reason != null ? reason : SELL_REASON)
                    .sharesSold(shares)
                    .sellPrice(price)
                    .build());
            });

            log.info("Sold {} {} @ {} for pnl {} (trade {})", shares, symbol, price, entry.getPnl(), entry.getId());
            auditTrade(entry);
            return entry;
        } catch (ValidationException | ResourceNotFoundException ex) {
            auditRejected("sell", ticker, ex);
            throw ex;
        }
    }

    /**
     * Deposits (positive) or withdraws (negative) cash outside of trading.
     *
     * @return the new balance
     */
    public BigDecimal adjustCash(BigDecimal amount, String reason) {
        try {
            if (amount == null || Money.amount(amount).signum() == 0) {
                throw new ValidationException("Cash adjustment must be a non-zero amount.");
            }
            TradeValidator.requireReasonLength(reason);
            BigDecimal delta = Money.amount(amount);
            String note = (reason == null || reason.isBlank()) ? (delta.signum() > 0 ? "DEPOSIT" : "WITHDRAWAL") : reason;

            BigDecimal balance = transactions.execute("cash adjustment", status -> {
                CashAccount cash = lockLedger();
                BigDecimal updated = cash.getBalance().add(delta);
                if (updated.signum() < 0) {
                    throw new ValidationException("Withdrawal of " + delta.negate() + " exceeds cash balance "
                        + Money.amount(cash.getBalance()) + ".");
                }
                cash.setBalance(updated);
                cashAccountRepository.save(cash);
                cashAdjustmentRepository.saveAndFlush(CashAdjustment.builder()
                    .adjustmentDate(tradingCalendar.today())
                    .amount(delta)
                    .reason(note)
                    .build());
                return Money.amount(updated);
            });

            log.info("Cash adjusted by {} ({}); balance now {}", delta, note, balance);
            auditLogger.record(AuditLogger.CASH_ADJUSTED, Map.of("amount", delta, "reason", note, "balance", balance));
            return balance;
        } catch (ValidationException ex) {
            auditRejected("cash", null, ex);
            throw ex;
        }
    }

    public LedgerState loadState() {
        return transactions.read("load state", status -> {
            List<Position> positions = positionRepository.findAllByOrderByTickerAsc();
            BigDecimal cash = cashAccountRepository.findById(CashAccount.LEDGER_ID)
                .map(CashAccount::getBalance)
                .map(Money::amount)
                .orElse(Money.amount(BigDecimal.ZERO));
            boolean firstTime = positions.isEmpty()
                && tradeLogRepository.count() == 0
                && cashAdjustmentRepository.count() == 0;
            log.debug("Loaded ledger state: {} position(s), cash {}, firstTime={}", positions.size(), cash, firstTime);
            return new LedgerState(positions, cash, firstTime);
        });
    }

    public List<TradeLogEntry> getTradeLog() {
        return transactions.read("read trade log", status -> tradeLogRepository.findAllByOrderByTradeDateAscIdAsc());
    }

    /**
     * Trades dated within {@code [from, to]}; a null bound leaves that side open.
     */
    public List<TradeLogEntry> getTradeLog(LocalDate from, LocalDate to) {
        LocalDate start = from != null ? from : EARLIEST;
        LocalDate end = to != null ? to : LATEST;
        if (start.isAfter(end)) {
            throw new ValidationException("Range start " + from + " is after end " + to + ".");
        }
        return transactions.read("read trade log",
            status -> tradeLogRepository.findByTradeDateBetweenOrderByTradeDateAscIdAsc(start, end));
    }

    /**
     * Acquires the ledger write lock for the current transaction.
     */
    CashAccount lockLedger() {
        return cashAccountRepository.lockById(CashAccount.LEDGER_ID)
            .orElseThrow(() -> new RepositoryException("Cash account row is missing; the schema was not initialized"));
    }

    private Position mergeBuy(Position held, long shares, BigDecimal price, BigDecimal stopLoss) {
        long totalShares = held.getShares() + shares;
        BigDecimal weighted = held.getBuyPrice().multiply(BigDecimal.valueOf(held.getShares()))
            .add(price.multiply(BigDecimal.valueOf(shares)));
        BigDecimal averagePrice = weighted.divide(BigDecimal.valueOf(totalShares), Money.PRICE_SCALE, RoundingMode.HALF_UP);

        held.setShares(totalShares);
        held.setBuyPrice(averagePrice);
        held.setCostBasis(Money.times(averagePrice, totalShares));
        held.setStopLoss(stopLoss);
        log.trace("Merged buy into {}: shares={}, avgPrice={}", held.getTicker(), totalShares, averagePrice);
        return held;
    }

    private void auditTrade(TradeLogEntry entry) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("trade_id", entry.getId());
        fields.put("side", entry.isBuy() ? "BUY" : "SELL");
        fields.put("ticker", entry.getTicker());
        fields.put("shares", entry.isBuy() ? entry.getSharesBought() : entry.getSharesSold());
        fields.put("price", entry.isBuy() ? entry.getBuyPrice() : entry.getSellPrice());
        fields.put("pnl", entry.getPnl());
        fields.put("date", entry.getTradeDate().toString());
        auditLogger.record(AuditLogger.TRADE_APPLIED, fields);
    }

    private void auditRejected(String operation, String ticker, RuntimeException ex) {
        log.warn("Rejected {} for {}: {}", operation, ticker, ex.getMessage());
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("operation", operation);
        fields.put("ticker", ticker);
        fields.put("reason", ex.getMessage());
        auditLogger.record(AuditLogger.VALIDATION_FAILED, fields);
    }
}
