package com.signalsim.backtest;

import com.signalsim.backtest.config.Config;
import com.signalsim.backtest.engine.Backtester;
import com.signalsim.backtest.engine.BatchBacktestRunner;
import com.signalsim.backtest.engine.BatchBacktestRunner.BacktestJob;
import com.signalsim.backtest.engine.BatchBacktestRunner.BatchOutcome;
import com.signalsim.backtest.model.Bar;
import com.signalsim.backtest.model.Metrics;
import com.signalsim.backtest.reporter.ReportExporter;
import com.signalsim.backtest.util.BarSeriesValidator;
import com.signalsim.backtest.util.CsvBarLoader;
import com.signalsim.backtest.util.DataFileScanner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for the signal backtest simulator.
 * Discovers bar files, backtests each one in parallel and writes reports.
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        log.info("========================================");
        log.info("  SIGNAL BACKTEST SIMULATOR");
        log.info("========================================");

        try {
            Config config = Config.getInstance();
            Path dataDir = Paths.get(args.length > 0 ? args[0] : config.getDataDir());

            List<DataFileScanner.DataFileInfo> dataFiles = new DataFileScanner().scanDataDirectory(dataDir);
            if (dataFiles.isEmpty()) {
                log.error("No data available to process in {}", dataDir);
                log.info("Expected file pattern: bars_SYMBOL_TIMEFRAME.csv, e.g. bars_AAPL_1d.csv");
                return;
            }

            log.info("Found {} data file(s) to process", dataFiles.size());

            CsvBarLoader loader = new CsvBarLoader();
            BarSeriesValidator validator = new BarSeriesValidator();
            List<BacktestJob> jobs = new ArrayList<>();

            for (DataFileScanner.DataFileInfo fileInfo : dataFiles) {
                try {
                    List<Bar> bars = validator.clean(loader.loadBars(fileInfo.getFilePath()));
                    if (bars.isEmpty()) {
                        log.warn("No usable bars in: {}", fileInfo.getFilePath());
                        continue;
                    }
                    jobs.add(BacktestJob.builder()
                        .name(fileInfo.getLabel())
                        .bars(bars)
                        .config(config.getSimulationConfig())
                        .build());
                } catch (IOException e) {
                    log.error("Failed to load file: {}", fileInfo.getFilePath(), e);
                }
            }

            BatchBacktestRunner runner = new BatchBacktestRunner(new Backtester(), config.getParallelism());
            List<BatchOutcome> outcomes = runner.runAll(jobs, config.getAnalysisSettings());

            ReportExporter exporter = new ReportExporter();
            Path reportsDir = Paths.get(config.getReportsDir());

            printHeader();
            for (BatchOutcome outcome : outcomes) {
                if (!outcome.isSuccess()) {
                    System.out.printf("║ %-14s ║ %-71s ║%n",
                        truncate(outcome.getJob().getName(), 14), "ERROR: " + truncate(outcome.getError().getMessage(), 64));
                    continue;
                }
                printResultRow(outcome.getJob().getName(), outcome.getReport().getMetrics());
                try {
                    exporter.export(outcome.getReport(), reportsDir, outcome.getJob().getName());
                } catch (IOException e) {
                    log.warn("Failed to save report for {}: {}", outcome.getJob().getName(), e.getMessage());
                }
            }
            System.out.println("╚════════════════╩═══════════╩═══════════╩═════════╩═════════╩════════╩════════╩══════════╝");

            log.info("========================================");
            log.info("  ALL BACKTESTS COMPLETED");
            log.info("========================================");
            log.info("Reports directory: {}", reportsDir.toAbsolutePath());

        } catch (Exception e) {
            log.error("Fatal error in main execution", e);
            System.exit(1);
        }
    }

    private static void printHeader() {
        System.out.println("\n╔════════════════╦═══════════╦═══════════╦═════════╦═════════╦════════╦════════╦══════════╗");
        System.out.println("║ Instrument     ║  Return % ║  Annual % ║  Sharpe ║  Max DD ║ Calmar ║ Trades ║    Win % ║");
        System.out.println("╠════════════════╬═══════════╬═══════════╬═════════╬═════════╬════════╬════════╬══════════╣");
    }

    /**
     * Print result row in table format
     */
    private static void printResultRow(String name, Metrics metrics) {
        String pnlColor = metrics.getTotalReturn() >= 0 ? "\u001B[32m" : "\u001B[31m";
        String resetColor = "\u001B[0m";

        System.out.printf("║ %-14s ║ %s%9s%s ║ %9s ║ %7s ║ %7s ║ %6s ║ %6d ║ %8s ║%n",
            truncate(name, 14),
            pnlColor, String.format("%+.2f%%", metrics.getTotalReturn() * 100), resetColor,
            String.format("%+.2f%%", metrics.getAnnualizedReturn() * 100),
            String.format("%.2f", metrics.getSharpeRatio()),
            String.format("%.2f%%", metrics.getMaxDrawdown() * 100),
            String.format("%.2f", metrics.getCalmarRatio()),
            metrics.getTotalTrades(),
            String.format("%.1f%%", metrics.getWinRate() * 100));
    }

    /**
     * Truncate string to max length
     */
    private static String truncate(String str, int maxLen) {
        if (str == null) return "";
        if (str.length() <= maxLen) return str;
        return str.substring(0, maxLen);
    }
}
