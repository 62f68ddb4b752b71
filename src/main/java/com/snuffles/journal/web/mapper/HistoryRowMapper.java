package com.snuffles.journal.web.mapper;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.service.SnapshotResult;
import com.snuffles.journal.web.dto.HistoryRowDto;
import com.snuffles.journal.web.dto.SnapshotResultDto;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface HistoryRowMapper {

    @Mapping(source = "snapshotDate", target = "date")
    HistoryRowDto toDto(PortfolioHistoryRow row);

    List<HistoryRowDto> toDtos(List<PortfolioHistoryRow> rows);

    SnapshotResultDto toDto(SnapshotResult result);
}
