package com.snuffles.journal.web.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
public class SnapshotResultDto {
    private LocalDate date;
    private String status;
    private boolean replacedExisting;
    private List<String> unpricedTickers;
    private List<HistoryRowDto> rows;
}
