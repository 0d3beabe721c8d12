package com.signalsim.backtest.analyzer;

import com.signalsim.backtest.config.AnalysisSettings;
import com.signalsim.backtest.model.CompletedTrade;
import com.signalsim.backtest.model.Metrics;
import com.signalsim.backtest.model.SimulationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Derives return, risk and trade-quality statistics from a simulation result.
 * Every ratio with a zero or degenerate denominator resolves to 0.
 */
@Slf4j
public class PerformanceAnalyzer {

    public Metrics summarize(SimulationResult result, AnalysisSettings settings) {
        return summarize(result, settings.getRiskFreeRate(), settings.getTradingPeriodsPerYear());
    }

    /**
     * Compute the metrics summary
     * @param result completed simulation
     * @param riskFreeRate annual risk-free rate
     * @param tradingPeriodsPerYear bars per year
     * @return metrics
     */
    public Metrics summarize(SimulationResult result, double riskFreeRate, int tradingPeriodsPerYear) {
        AnalysisSettings.builder()
            .riskFreeRate(riskFreeRate)
            .tradingPeriodsPerYear(tradingPeriodsPerYear)
            .build()
            .validate();

        double initialCapital = result.getInitialCapital();
        double[] returns = result.getReturns();
        double[] equity = result.getEquityCurve();
        int n = returns.length;

        double totalReturn = n == 0 ? 0.0 : finiteOrZero(equity[n - 1] / initialCapital - 1);

        double years = (double) n / tradingPeriodsPerYear;
        double annualizedReturn = years > 0
            ? finiteOrZero(Math.pow(1 + totalReturn, 1 / years) - 1)
            : 0.0;

        double mean = mean(returns);
        double stdDev = sampleStdDev(returns, mean);
        double annualizationFactor = Math.sqrt(tradingPeriodsPerYear);

        double annualizedVolatility = n > 1 ? finiteOrZero(stdDev * annualizationFactor) : 0.0;

        double sharpeRatio = 0.0;
        if (annualizedVolatility > 0) {
            double periodicRiskFree = Math.pow(1 + riskFreeRate, 1.0 / tradingPeriodsPerYear) - 1;
            sharpeRatio = finiteOrZero((mean - periodicRiskFree) / stdDev * annualizationFactor);
        }

        double maxDrawdown = 0.0;
        for (double drawdown : drawdownSeries(result)) {
            maxDrawdown = Math.min(maxDrawdown, drawdown);
        }

        double calmarRatio = maxDrawdown != 0 ? finiteOrZero(annualizedReturn / Math.abs(maxDrawdown)) : 0.0;

        Metrics metrics = Metrics.builder()
            .totalReturn(totalReturn)
            .annualizedReturn(annualizedReturn)
            .annualizedVolatility(annualizedVolatility)
            .sharpeRatio(sharpeRatio)
            .maxDrawdown(maxDrawdown)
            .calmarRatio(calmarRatio)
            .periods(n)
            .build();

        applyTradeStatistics(metrics, result.getCompletedTrades());

        log.debug("Metrics: totalReturn={}, sharpe={}, maxDrawdown={}, trades={}",
            totalReturn, sharpeRatio, maxDrawdown, metrics.getTotalTrades());

        return metrics;
    }

    /**
     * Per-bar drawdown from the running equity peak, as non-positive fractions.
     * While the running peak of {@code equity / initialCapital} is not positive
     * the ratio has no meaning and the bar is reported as 0.
     * @param result completed simulation
     * @return drawdown for each bar
     */
    public double[] drawdownSeries(SimulationResult result) {
        double[] equity = result.getEquityCurve();
        double[] drawdowns = new double[equity.length];
        double runningMax = Double.NEGATIVE_INFINITY;

        for (int i = 0; i < equity.length; i++) {
            double cumulative = equity[i] / result.getInitialCapital();
            runningMax = Math.max(runningMax, cumulative);
            drawdowns[i] = runningMax > 0 ? finiteOrZero(cumulative / runningMax - 1) : 0.0;
        }
        return drawdowns;
    }

    /**
     * Fill win/loss statistics; profit > 0 is a win, anything else a loss
     */
    private void applyTradeStatistics(Metrics metrics, List<CompletedTrade> trades) {
        int total = trades.size();
        if (total == 0) {
            return;
        }

        int wins = 0;
        int losses = 0;
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        long holdingSum = 0;

        int currentWins = 0;
        int currentLosses = 0;
        int maxWins = 0;
        int maxLosses = 0;

        for (CompletedTrade trade : trades) {
            holdingSum += trade.getHoldingPeriods();
            if (trade.isWinner()) {
                wins++;
                grossProfit += trade.getProfit();
                currentWins++;
                currentLosses = 0;
                maxWins = Math.max(maxWins, currentWins);
            } else {
                losses++;
                grossLoss += trade.getProfit();
                currentLosses++;
                currentWins = 0;
                maxLosses = Math.max(maxLosses, currentLosses);
            }
        }

        metrics.setTotalTrades(total);
        metrics.setWinningTrades(wins);
        metrics.setLosingTrades(losses);
        metrics.setWinRate((double) wins / total);
        metrics.setAvgWin(wins > 0 ? grossProfit / wins : 0.0);
        metrics.setAvgLoss(losses > 0 ? grossLoss / losses : 0.0);
        metrics.setProfitFactor(grossLoss != 0 ? finiteOrZero(grossProfit / Math.abs(grossLoss)) : 0.0);
        metrics.setAvgHoldingPeriod((double) holdingSum / total);
        metrics.setMaxConsecutiveWins(maxWins);
        metrics.setMaxConsecutiveLosses(maxLosses);
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n - 1), 0 below two observations
     */
    private static double sampleStdDev(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double variance = 0;
        for (double v : values) {
            variance += Math.pow(v - mean, 2);
        }
        variance /= values.length - 1;
        return Math.sqrt(variance);
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
