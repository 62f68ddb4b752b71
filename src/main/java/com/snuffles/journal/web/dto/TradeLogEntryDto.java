package com.snuffles.journal.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
public class TradeLogEntryDto {
    private Long id;
    private LocalDate tradeDate;
    private String ticker;
    private long sharesBought;
    private BigDecimal buyPrice;
    private BigDecimal costBasis;
    private BigDecimal pnl;
    private String reason;
    private long sharesSold;
    private BigDecimal sellPrice;
    private Instant recordedAt;
}
