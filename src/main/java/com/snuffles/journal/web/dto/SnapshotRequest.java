package com.snuffles.journal.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

@Data
public class SnapshotRequest {

    /** Defaults to today in the journal zone. */
    private LocalDate date;

    /** Write even on weekends and holidays. */
    private boolean force;

    /** Manual prices for this snapshot only, keyed by ticker. */
    private Map<String, BigDecimal> priceOverrides = new HashMap<>();
}
