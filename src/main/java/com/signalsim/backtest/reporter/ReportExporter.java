package com.signalsim.backtest.reporter;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.signalsim.backtest.model.BacktestReport;
import com.signalsim.backtest.model.CompletedTrade;
import com.signalsim.backtest.model.Metrics;
import com.signalsim.backtest.model.ResultRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a backtest report to disk: per-bar results, completed trades and
 * metrics as CSV, plus a JSON summary.
 */
@Slf4j
public class ReportExporter {

    private static final DateTimeFormatter DATE_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.of("UTC"));

    static final String[] RESULT_HEADERS = {
        "timestamp", "datetime_utc", "close", "signal", "position", "entry_price", "entry_date",
        "exit_price", "exit_date", "holding_periods", "exit_reason", "capital", "equity",
        "returns", "trade_profit", "commission", "shares", "trade_value"
    };

    static final String[] TRADE_HEADERS = {
        "entry_date", "entry_price", "direction", "shares", "trade_value", "entry_commission",
        "exit_date", "exit_price", "exit_reason", "exit_commission", "profit", "return_pct",
        "holding_periods"
    };

    static final String[] METRIC_HEADERS = {
        "total_return", "annualized_return", "annualized_volatility", "sharpe_ratio",
        "max_drawdown", "calmar_ratio", "total_trades", "winning_trades", "losing_trades",
        "win_rate", "avg_win", "avg_loss", "profit_factor", "avg_holding_period",
        "max_consecutive_wins", "max_consecutive_losses"
    };

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Export all report files
     * @param report backtest report
     * @param outputDir directory to write into
     * @param prefix file name prefix
     * @return written files
     */
    public List<Path> export(BacktestReport report, Path outputDir, String prefix) throws IOException {
        Files.createDirectories(outputDir);

        List<Path> written = new ArrayList<>();
        written.add(writeResults(report.getResult().getRows(), outputDir.resolve(prefix + "_results.csv")));

        List<CompletedTrade> trades = report.getResult().getCompletedTrades();
        if (!trades.isEmpty()) {
            written.add(writeTrades(trades, outputDir.resolve(prefix + "_trades.csv")));
        }

        written.add(writeMetrics(report.getMetrics(), outputDir.resolve(prefix + "_metrics.csv")));
        written.add(writeSummary(report, outputDir.resolve(prefix + "_summary.json")));

        log.info("Report for {} saved to {}", report.getSymbol(), outputDir.toAbsolutePath());
        return written;
    }

    Path writeResults(List<ResultRow> rows, Path path) throws IOException {
        try (CSVPrinter printer = newPrinter(path, RESULT_HEADERS)) {
            for (ResultRow row : rows) {
                printer.printRecord(
                    row.getTimestamp(),
                    formatDate(row.getTimestamp()),
                    row.getClose(),
                    row.getSignal(),
                    row.getPosition(),
                    row.getEntryPrice(),
                    row.getEntryDate() != null ? formatDate(row.getEntryDate()) : "",
                    row.getExitPrice(),
                    row.getExitDate() != null ? formatDate(row.getExitDate()) : "",
                    row.getHoldingPeriods(),
                    row.getExitReason() != null ? row.getExitReason().getLabel() : "",
                    row.getCapital(),
                    row.getEquity(),
                    row.getReturns(),
                    row.getTradeProfit(),
                    row.getCommission(),
                    row.getShares(),
                    row.getTradeValue());
            }
        }
        return path;
    }

    Path writeTrades(List<CompletedTrade> trades, Path path) throws IOException {
        try (CSVPrinter printer = newPrinter(path, TRADE_HEADERS)) {
            for (CompletedTrade trade : trades) {
                printer.printRecord(
                    formatDate(trade.getEntryDate()),
                    trade.getEntryPrice(),
                    trade.getDirection(),
                    trade.getShares(),
                    trade.getTradeValue(),
                    trade.getEntryCommission(),
                    formatDate(trade.getExitDate()),
                    trade.getExitPrice(),
                    trade.getExitReason().getLabel(),
                    trade.getExitCommission(),
                    trade.getProfit(),
                    trade.getReturnPct(),
                    trade.getHoldingPeriods());
            }
        }
        return path;
    }

    Path writeMetrics(Metrics metrics, Path path) throws IOException {
        try (CSVPrinter printer = newPrinter(path, METRIC_HEADERS)) {
            printer.printRecord(
                metrics.getTotalReturn(),
                metrics.getAnnualizedReturn(),
                metrics.getAnnualizedVolatility(),
                metrics.getSharpeRatio(),
                metrics.getMaxDrawdown(),
                metrics.getCalmarRatio(),
                metrics.getTotalTrades(),
                metrics.getWinningTrades(),
                metrics.getLosingTrades(),
                metrics.getWinRate(),
                metrics.getAvgWin(),
                metrics.getAvgLoss(),
                metrics.getProfitFactor(),
                metrics.getAvgHoldingPeriod(),
                metrics.getMaxConsecutiveWins(),
                metrics.getMaxConsecutiveLosses());
        }
        return path;
    }

    Path writeSummary(BacktestReport report, Path path) throws IOException {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("symbol", report.getSymbol());
        summary.put("bars", report.getResult().getRows().size());
        summary.put("finalEquity", report.getResult().getFinalEquity());
        summary.put("config", report.getResult().getConfig());
        summary.put("metrics", report.getMetrics());
        summary.put("warnings", report.getWarnings());
        summary.put("trades", report.getResult().getCompletedTrades());
        report.getResult().getOpenTrade().ifPresent(open -> summary.put("openTrade", open));

        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(summary, writer);
        }
        return path;
    }

    private CSVPrinter newPrinter(Path path, String[] headers) throws IOException {
        return new CSVPrinter(Files.newBufferedWriter(path, StandardCharsets.UTF_8),
            CSVFormat.DEFAULT.builder().setHeader(headers).build());
    }

    private static String formatDate(long timestamp) {
        return DATE_FORMATTER.format(Instant.ofEpochMilli(timestamp));
    }
}
