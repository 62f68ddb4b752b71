package com.snuffles.journal.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
public class PositionDto {
    private String ticker;
    private long shares;
    private BigDecimal buyPrice;
    private BigDecimal stopLoss;
    private BigDecimal costBasis;
    private Instant updatedAt;
}
