package com.snuffles.journal.web.controller;

import com.snuffles.journal.domain.TradeLogEntry;
import com.snuffles.journal.service.LedgerService;
import com.snuffles.journal.web.dto.BuyRequest;
import com.snuffles.journal.web.dto.CashAdjustmentRequest;
import com.snuffles.journal.web.dto.CashBalanceDto;
import com.snuffles.journal.web.dto.LedgerStateDto;
import com.snuffles.journal.web.dto.SellRequest;
import com.snuffles.journal.web.dto.TradeLogEntryDto;
import com.snuffles.journal.web.mapper.PositionMapper;
import com.snuffles.journal.web.mapper.TradeLogEntryMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Positions, cash and the trade log")
public class LedgerController {

    private final LedgerService ledgerService;
    private final PositionMapper positionMapper;
    private final TradeLogEntryMapper tradeLogEntryMapper;

    @GetMapping("/state")
    @Operation(summary = "Current ledger state", description = "Returns open positions, the cash balance and whether the ledger is still empty.")
    @ApiResponse(responseCode = "200", description = "State fetched", content = @Content(schema = @Schema(implementation = LedgerStateDto.class)))
    public ResponseEntity<LedgerStateDto> getState() {
        return ResponseEntity.ok(positionMapper.toDto(ledgerService.loadState()));
    }

    @PostMapping("/trades/buy")
    @Operation(summary = "Record a buy", description = "Opens or adds to a position, debits cash and appends to the trade log in one transaction.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Buy recorded", content = @Content(schema = @Schema(implementation = TradeLogEntryDto.class))),
        @ApiResponse(responseCode = "400", description = "Validation error or insufficient cash", content = @Content),
        @ApiResponse(responseCode = "503", description = "Ledger busy or storage failure", content = @Content)
    })
    public ResponseEntity<TradeLogEntryDto> buy(@Valid @RequestBody BuyRequest request) {
        TradeLogEntry entry = ledgerService.applyBuy(request.getTicker(), request.getShares(), request.getPrice(),
            request.getStopLoss(), request.getReason());
        return new ResponseEntity<>(tradeLogEntryMapper.toDto(entry), HttpStatus.CREATED);
    }

    @PostMapping("/trades/sell")
    @Operation(summary = "Record a sell", description = "Reduces or closes a position, credits cash and appends to the trade log in one transaction.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Sell recorded", content = @Content(schema = @Schema(implementation = TradeLogEntryDto.class))),
        @ApiResponse(responseCode = "400", description = "Validation error", content = @Content),
        @ApiResponse(responseCode = "404", description = "No position large enough", content = @Content),
        @ApiResponse(responseCode = "503", description = "Ledger busy or storage failure", content = @Content)
    })
    public ResponseEntity<TradeLogEntryDto> sell(@Valid @RequestBody SellRequest request) {
        TradeLogEntry entry = ledgerService.applySell(request.getTicker(), request.getShares(), request.getPrice(),
            request.getReason());
        return new ResponseEntity<>(tradeLogEntryMapper.toDto(entry), HttpStatus.CREATED);
    }

    @GetMapping("/trades")
    @Operation(summary = "List trades", description = "Returns the trade log in date order, optionally limited to an inclusive date range.")
    @ApiResponse(responseCode = "200", description = "Trades fetched", content = @Content(schema = @Schema(implementation = TradeLogEntryDto.class)))
    public ResponseEntity<List<TradeLogEntryDto>> getTrades(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        List<TradeLogEntry> entries = (from == null && to == null)
            ? ledgerService.getTradeLog()
            : ledgerService.getTradeLog(from, to);
        return ResponseEntity.ok(tradeLogEntryMapper.toDtos(entries));
    }

    @PostMapping("/cash")
    @Operation(summary = "Adjust cash", description = "Deposits a positive amount or withdraws a negative one.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Cash adjusted", content = @Content(schema = @Schema(implementation = CashBalanceDto.class))),
        @ApiResponse(responseCode = "400", description = "Zero amount or overdraft", content = @Content)
    })
    public ResponseEntity<CashBalanceDto> adjustCash(@Valid @RequestBody CashAdjustmentRequest request) {
        return ResponseEntity.ok(new CashBalanceDto(ledgerService.adjustCash(request.getAmount(), request.getReason())));
    }
}
