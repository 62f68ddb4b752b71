package com.snuffles.journal.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding rules for ledger arithmetic. Amounts (cash, cost basis, value, pnl) are kept to cents;
 * per-share prices, including weighted averages, to four places.
 */
public final class Money {

    public static final int AMOUNT_SCALE = 2;
    public static final int PRICE_SCALE = 4;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private Money() {
    }

    public static BigDecimal amount(BigDecimal value) {
        return value.setScale(AMOUNT_SCALE, ROUNDING);
    }

    public static BigDecimal price(BigDecimal value) {
        return value.setScale(PRICE_SCALE, ROUNDING);
    }

    public static BigDecimal times(BigDecimal price, long shares) {
        return amount(price.multiply(BigDecimal.valueOf(shares)));
    }
}
