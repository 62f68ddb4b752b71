package com.snuffles.journal.web.dto;

import com.snuffles.journal.service.TradeValidator;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Positive amounts deposit, negative amounts withdraw.
 */
@Data
public class CashAdjustmentRequest {

    @NotNull
    private BigDecimal amount;

    @Size(max = TradeValidator.MAX_REASON_LENGTH)
    private String reason;
}
