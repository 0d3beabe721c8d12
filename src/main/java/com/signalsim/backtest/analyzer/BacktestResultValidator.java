package com.signalsim.backtest.analyzer;

import com.signalsim.backtest.config.AnalysisSettings;
import com.signalsim.backtest.model.Metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plausibility checks on a finished backtest. Findings are warnings only;
 * they never fail the run.
 */
public class BacktestResultValidator {

    /**
     * Check metrics against the thresholds in the settings
     * @param metrics computed metrics
     * @param settings thresholds
     * @return human-readable warnings, empty when nothing looks suspicious
     */
    public List<String> check(Metrics metrics, AnalysisSettings settings) {
        List<String> warnings = new ArrayList<>();

        if (metrics.getTotalTrades() < settings.getMinTrades()) {
            warnings.add(String.format(Locale.ROOT, "Too few trades: %d, at least %d recommended",
                metrics.getTotalTrades(), settings.getMinTrades()));
        }

        double drawdown = Math.abs(metrics.getMaxDrawdown());
        if (drawdown > settings.getMaxDrawdownThreshold()) {
            warnings.add(String.format(Locale.ROOT, "Max drawdown too large: %.2f%% (threshold %.2f%%)",
                drawdown * 100, settings.getMaxDrawdownThreshold() * 100));
        }

        if (metrics.getAnnualizedVolatility() > settings.getMaxVolatilityThreshold()) {
            warnings.add(String.format(Locale.ROOT, "Volatility too high: %.2f%% (threshold %.2f%%)",
                metrics.getAnnualizedVolatility() * 100, settings.getMaxVolatilityThreshold() * 100));
        }

        return warnings;
    }
}
