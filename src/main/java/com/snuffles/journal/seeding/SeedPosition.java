package com.snuffles.journal.seeding;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record SeedPosition(
    String ticker,
    long shares,
    @JsonProperty("buy_price") BigDecimal buyPrice,
    @JsonProperty("stop_loss") BigDecimal stopLoss
) {
}
