package com.snuffles.journal.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One valuation row of a daily snapshot. Per-ticker rows carry the position fields; the
 * {@value #TOTAL_TICKER} row carries the aggregate value, cash and equity for the date.
 */
@Getter
@Setter
@Entity
@IdClass(PortfolioHistoryRowId.class)
@Table(name = "portfolio_history")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioHistoryRow {

    public static final String TOTAL_TICKER = "TOTAL";

    @Id
    @Column(name = "snapshot_date", nullable = false)
    private LocalDate snapshotDate;

    @Id
    @Column(nullable = false, length = 10)
    private String ticker;

    private Long shares;

    @Column(name = "cost_basis", precision = 19, scale = 4)
    private BigDecimal costBasis;

    @Column(name = "stop_loss", precision = 19, scale = 4)
    private BigDecimal stopLoss;

    @Column(name = "current_price", precision = 19, scale = 4)
    private BigDecimal currentPrice;

    @Column(name = "total_value", precision = 19, scale = 4)
    private BigDecimal totalValue;

    @Column(precision = 19, scale = 4)
    private BigDecimal pnl;

    @Column(length = 16)
    private String action;

    @Column(name = "cash_balance", precision = 19, scale = 4)
    private BigDecimal cashBalance;

    @Column(name = "total_equity", precision = 19, scale = 4)
    private BigDecimal totalEquity;

    public boolean isTotal() {
        return TOTAL_TICKER.equals(ticker);
    }

    public boolean isPriced() {
        return totalValue != null;
    }
}
