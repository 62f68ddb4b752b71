package com.snuffles.journal.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Append-only record of a buy or a sell. Buys carry {@code sharesBought}/{@code buyPrice},
 * sells carry {@code sharesSold}/{@code sellPrice}; the other pair is zero/null.
 */
@Getter
@Entity
@Immutable
@Table(name = "trade_log")
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TradeLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(nullable = false, length = 10)
    private String ticker;

    @Column(name = "shares_bought", nullable = false)
    private long sharesBought;

    @Column(name = "buy_price", precision = 19, scale = 4)
    private BigDecimal buyPrice;

    @Column(name = "cost_basis", nullable = false, precision = 19, scale = 4)
    private BigDecimal costBasis;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal pnl;

    @Column(nullable = false)
    private String reason;

    @Column(name = "shares_sold", nullable = false)
    private long sharesSold;

    @Column(name = "sell_price", precision = 19, scale = 4)
    private BigDecimal sellPrice;

    @CreationTimestamp
    @Column(name = "recorded_at", updatable = false)
    private Instant recordedAt;

    public boolean isBuy() {
        return sharesBought > 0;
    }

    public boolean isSell() {
        return sharesSold > 0;
    }
}
