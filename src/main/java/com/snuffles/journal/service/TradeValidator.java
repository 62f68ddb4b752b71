package com.snuffles.journal.service;

import com.snuffles.journal.service.exception.ValidationException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input checks shared by the ledger operations.
 */
public final class TradeValidator {

    private static final Pattern TICKER = Pattern.compile("^[A-Z][A-Z0-9.]{0,9}$");

    /** Width of the {@code reason} columns. */
    public static final int MAX_REASON_LENGTH = 255;

    private TradeValidator() {
    }

    /** Trims and upper-cases the ticker, then checks its shape. */
    public static String normalizeTicker(String ticker) {
        if (ticker == null) {
            throw new ValidationException("Ticker is required.");
        }
        String normalized = ticker.trim().toUpperCase(Locale.ROOT);
        if (!TICKER.matcher(normalized).matches()) {
            throw new ValidationException("Invalid ticker format: '" + ticker + "'.");
        }
        return normalized;
    }

    public static void requirePositiveShares(long shares) {
        if (shares <= 0) {
            throw new ValidationException("Shares must be a positive whole number.");
        }
    }

    public static void requirePositivePrice(BigDecimal price, String field) {
        if (price == null) {
            throw new ValidationException(field + " is required.");
        }
        if (price.signum() <= 0) {
            throw new ValidationException(field + " must be positive.");
        }
        requirePriceScale(price, field);
    }

    public static void requireValidStopLoss(BigDecimal stopLoss) {
        if (stopLoss == null) {
            return;
        }
        if (stopLoss.signum() <= 0) {
            throw new ValidationException("Stop loss must be positive when set.");
        }
        requirePriceScale(stopLoss, "Stop loss");
    }

    /** Rejects a trade whose value rounds to zero cents. */
    public static void requireNonZeroValue(BigDecimal value) {
        if (value.signum() == 0) {
            throw new ValidationException("Trade value " + value + " rounds to zero; increase shares or price.");
        }
    }

    public static void requireReasonLength(String reason) {
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new ValidationException("Reason must be at most " + MAX_REASON_LENGTH + " characters.");
        }
    }

    // prices are stored as DECIMAL(19,4); anything finer would be rounded on write
    private static void requirePriceScale(BigDecimal price, String field) {
        if (price.stripTrailingZeros().scale() > Money.PRICE_SCALE) {
            throw new ValidationException(field + " must have at most " + Money.PRICE_SCALE + " decimal places.");
        }
    }
}
