package com.snuffles.journal.web.mapper;

import com.snuffles.journal.domain.Position;
import com.snuffles.journal.service.LedgerState;
import com.snuffles.journal.web.dto.LedgerStateDto;
import com.snuffles.journal.web.dto.PositionDto;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface PositionMapper {

    PositionDto toDto(Position position);

    List<PositionDto> toDtos(List<Position> positions);

    LedgerStateDto toDto(LedgerState state);
}
