package com.snuffles.journal.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class LedgerStateDto {
    private List<PositionDto> positions;
    private BigDecimal cash;
    private boolean firstTime;
}
