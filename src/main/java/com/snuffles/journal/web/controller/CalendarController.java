package com.snuffles.journal.web.controller;

import com.snuffles.journal.service.TradingCalendar;
import com.snuffles.journal.web.dto.CalendarDayDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/calendar")
@RequiredArgsConstructor
@Tag(name = "Calendar", description = "Trading-day lookups")
public class CalendarController {

    private final TradingCalendar tradingCalendar;

    @GetMapping("/{date}")
    @Operation(summary = "Describe a date", description = "Whether the date is a trading day and which trading day follows it.")
    @ApiResponse(responseCode = "200", description = "Date described", content = @Content(schema = @Schema(implementation = CalendarDayDto.class)))
    public ResponseEntity<CalendarDayDto> describe(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(new CalendarDayDto(date, tradingCalendar.isTradingDay(date),
            tradingCalendar.getHolidays().contains(date), tradingCalendar.nextTradingDay(date)));
    }
}
