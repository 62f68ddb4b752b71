package com.snuffles.journal.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class HistoryRowDto {
    private LocalDate date;
    private String ticker;
    private Long shares;
    private BigDecimal costBasis;
    private BigDecimal stopLoss;
    private BigDecimal currentPrice;
    private BigDecimal totalValue;
    private BigDecimal pnl;
    private String action;
    private BigDecimal cashBalance;
    private BigDecimal totalEquity;
}
