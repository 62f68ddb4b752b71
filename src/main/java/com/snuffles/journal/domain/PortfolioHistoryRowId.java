package com.snuffles.journal.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioHistoryRowId implements Serializable {
    private LocalDate snapshotDate;
    private String ticker;
}
