package com.snuffles.journal.web.mapper;

import com.snuffles.journal.domain.TradeLogEntry;
import com.snuffles.journal.web.dto.TradeLogEntryDto;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface TradeLogEntryMapper {

    TradeLogEntryDto toDto(TradeLogEntry entry);

    List<TradeLogEntryDto> toDtos(List<TradeLogEntry> entries);
}
