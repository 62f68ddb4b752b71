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
 * Single-row cash balance. The row is also the ledger's write lock: every mutation and
 * snapshot write locks it before touching positions, the trade log or history.
 */
@Getter
@Setter
@Entity
@Table(name = "cash")
public class CashAccount {

    public static final int LEDGER_ID = 0;

    @Id
    private Integer id;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
