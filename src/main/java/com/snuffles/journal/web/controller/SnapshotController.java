package com.snuffles.journal.web.controller;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.service.HistoryCsvExporter;
import com.snuffles.journal.service.SnapshotResult;
import com.snuffles.journal.service.SnapshotService;
import com.snuffles.journal.service.exception.ResourceNotFoundException;
import com.snuffles.journal.service.pricing.PriceOverrides;
import com.snuffles.journal.web.dto.HistoryRowDto;
import com.snuffles.journal.web.dto.SnapshotRequest;
import com.snuffles.journal.web.dto.SnapshotResultDto;
import com.snuffles.journal.web.mapper.HistoryRowMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/snapshots")
@RequiredArgsConstructor
@Tag(name = "Snapshots", description = "Daily valuations and their history")
public class SnapshotController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private final SnapshotService snapshotService;
    private final HistoryRowMapper historyRowMapper;
    private final HistoryCsvExporter csvExporter;

    @PostMapping
    @Operation(summary = "Take a snapshot", description = "Values the current ledger for a date, replacing any snapshot already stored for it. "
        + "Non-trading days are skipped unless forced.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Snapshot written", content = @Content(schema = @Schema(implementation = SnapshotResultDto.class))),
        @ApiResponse(responseCode = "200", description = "Skipped: not a trading day", content = @Content(schema = @Schema(implementation = SnapshotResultDto.class))),
        @ApiResponse(responseCode = "409", description = "Prices unavailable and the policy is to defer", content = @Content),
        @ApiResponse(responseCode = "500", description = "No price source configured", content = @Content)
    })
    public ResponseEntity<SnapshotResultDto> takeSnapshot(@RequestBody(required = false) SnapshotRequest request) {
        SnapshotRequest body = request != null ? request : new SnapshotRequest();
        SnapshotResult result = snapshotService.takeSnapshot(body.getDate(), body.isForce(),
            PriceOverrides.of(body.getPriceOverrides()));
        HttpStatus status = result.isWritten() ? HttpStatus.CREATED : HttpStatus.OK;
        return new ResponseEntity<>(historyRowMapper.toDto(result), status);
    }

    @GetMapping
    @Operation(summary = "Snapshot history", description = "Returns stored rows for an inclusive date range, ordered by date then ticker.")
    @ApiResponse(responseCode = "200", description = "History fetched", content = @Content(schema = @Schema(implementation = HistoryRowDto.class)))
    public ResponseEntity<List<HistoryRowDto>> getHistory(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(historyRowMapper.toDtos(snapshotService.getHistory(from, to)));
    }

    @GetMapping("/{date}")
    @Operation(summary = "Snapshot for a date", description = "Returns every row stored for the date, the TOTAL row included.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Snapshot fetched", content = @Content(schema = @Schema(implementation = HistoryRowDto.class))),
        @ApiResponse(responseCode = "404", description = "No snapshot for the date", content = @Content)
    })
    public ResponseEntity<List<HistoryRowDto>> getSnapshot(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<PortfolioHistoryRow> rows = snapshotService.getSnapshot(date);
        if (rows.isEmpty()) {
            throw new ResourceNotFoundException("No snapshot stored for " + date);
        }
        return ResponseEntity.ok(historyRowMapper.toDtos(rows));
    }

    @GetMapping(value = "/export.csv", produces = "text/csv")
    @Operation(summary = "Export history as CSV", description = "Same rows as the history listing, one line per row.")
    @ApiResponse(responseCode = "200", description = "CSV produced", content = @Content(mediaType = "text/csv"))
    public ResponseEntity<String> exportCsv(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        String csv = csvExporter.toCsv(snapshotService.getHistory(from, to));
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"portfolio_history.csv\"")
            .body(csv);
    }
}
