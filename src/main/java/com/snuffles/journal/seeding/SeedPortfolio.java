package com.snuffles.journal.seeding;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record SeedPortfolio(
    @JsonProperty("initial_cash") BigDecimal initialCash,
    List<SeedPosition> positions
) {
    public SeedPortfolio {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
