package com.snuffles.journal.web.dto;

import java.math.BigDecimal;

public record CashBalanceDto(BigDecimal balance) {
}
