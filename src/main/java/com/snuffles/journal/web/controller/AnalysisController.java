package com.snuffles.journal.web.controller;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import com.snuffles.journal.service.CashAuditService;
import com.snuffles.journal.service.SnapshotService;
import com.snuffles.journal.service.analysis.CashAuditReport;
import com.snuffles.journal.service.analysis.DailyPerformance;
import com.snuffles.journal.service.analysis.DrawdownAnalyzer;
import com.snuffles.journal.service.analysis.DrawdownPoint;
import com.snuffles.journal.service.analysis.DrawdownSummary;
import com.snuffles.journal.service.analysis.PerformanceAnalyzer;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Tag(name = "Analysis", description = "Read-only checks and metrics over stored history")
public class AnalysisController {

    private final CashAuditService cashAuditService;
    private final SnapshotService snapshotService;
    private final DrawdownAnalyzer drawdownAnalyzer;
    private final PerformanceAnalyzer performanceAnalyzer;

    @GetMapping("/cash-audit")
    @Operation(summary = "Cash audit", description = "Replays every trade and cash adjustment and reports where stored cash figures disagree.")
    @ApiResponse(responseCode = "200", description = "Audit completed", content = @Content(schema = @Schema(implementation = CashAuditReport.class)))
    public ResponseEntity<CashAuditReport> cashAudit() {
        return ResponseEntity.ok(cashAuditService.audit());
    }

    @GetMapping("/drawdowns")
    @Operation(summary = "Maximum drawdowns", description = "Worst peak-to-trough decline per ticker, TOTAL included.")
    @ApiResponse(responseCode = "200", description = "Drawdowns computed")
    public ResponseEntity<Map<String, DrawdownSummary>> drawdowns(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(drawdownAnalyzer.computeAllDrawdowns(snapshotService.getHistory(from, to)));
    }

    @GetMapping("/drawdowns/{ticker}")
    @Operation(summary = "Drawdown series", description = "Running peak and drawdown of one ticker's value per snapshot date.")
    @ApiResponse(responseCode = "200", description = "Series computed")
    public ResponseEntity<List<DrawdownPoint>> drawdownSeries(@PathVariable String ticker) {
        return ResponseEntity.ok(drawdownAnalyzer.computeDrawdown(snapshotService.getTickerHistory(ticker)));
    }

    @GetMapping("/performance")
    @Operation(summary = "Daily performance", description = "Daily and cumulative return of total equity.")
    @ApiResponse(responseCode = "200", description = "Performance computed")
    public ResponseEntity<List<DailyPerformance>> performance() {
        List<PortfolioHistoryRow> totals = snapshotService.getTickerHistory(PortfolioHistoryRow.TOTAL_TICKER);
        return ResponseEntity.ok(performanceAnalyzer.dailyPerformance(totals));
    }
}
