package com.snuffles.journal.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A currently held ticker. One row per ticker; the row is deleted once the last share is sold.
 */
@Getter
@Setter
@Entity
@Table(name = "positions")
public class Position {

    @Id
    @Column(nullable = false, length = 10)
    private String ticker;

    @Column(nullable = false)
    private long shares;

    /** Weighted-average cost per share. */
    @Column(name = "buy_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal buyPrice;

    @Column(name = "stop_loss", precision = 19, scale = 4)
    private BigDecimal stopLoss;

    @Column(name = "cost_basis", nullable = false, precision = 19, scale = 4)
    private BigDecimal costBasis;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public static Position open(String ticker, long shares, BigDecimal buyPrice, BigDecimal stopLoss, BigDecimal costBasis) {
        Position position = new Position();
        position.setTicker(ticker);
        position.setShares(shares);
        position.setBuyPrice(buyPrice);
        position.setStopLoss(stopLoss);
        position.setCostBasis(costBasis);
        return position;
    }
}
