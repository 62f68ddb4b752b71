package com.snuffles.journal.service;

import com.snuffles.journal.domain.PortfolioHistoryRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders history rows in the column order of the {@code portfolio_history} table.
 */
@Component
public class HistoryCsvExporter {

    static final String HEADER = "date,ticker,shares,cost_basis,stop_loss,current_price,total_value,pnl,action,cash_balance,total_equity";

    public String toCsv(List<PortfolioHistoryRow> rows) {
        StringBuilder csv = new StringBuilder(HEADER).append('\n');
        for (PortfolioHistoryRow row : rows) {
            StringJoiner line = new StringJoiner(",");
            line.add(row.getSnapshotDate().toString())
                .add(row.getTicker())
                .add(row.getShares() == null ? "" : row.getShares().toString())
                .add(plain(row.getCostBasis()))
                .add(plain(row.getStopLoss()))
                .add(plain(row.getCurrentPrice()))
                .add(plain(row.getTotalValue()))
                .add(plain(row.getPnl()))
                .add(row.getAction() == null ? "" : row.getAction())
                .add(plain(row.getCashBalance()))
                .add(plain(row.getTotalEquity()));
            csv.append(line).append('\n');
        }
        return csv.toString();
    }

    private static String plain(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }
}
