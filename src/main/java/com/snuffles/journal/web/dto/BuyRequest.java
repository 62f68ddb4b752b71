package com.snuffles.journal.web.dto;

import com.snuffles.journal.service.TradeValidator;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class BuyRequest {

    @NotBlank
    private String ticker;

    @NotNull
    @Positive
    private Long shares;

    @NotNull
    @Positive
    @Digits(integer = 15, fraction = 4)
    private BigDecimal price;

    @Positive
    @Digits(integer = 15, fraction = 4)
    private BigDecimal stopLoss;

    @Size(max = TradeValidator.MAX_REASON_LENGTH)
    private String reason;
}
