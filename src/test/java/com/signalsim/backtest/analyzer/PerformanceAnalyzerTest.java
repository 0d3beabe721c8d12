package com.signalsim.backtest.analyzer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.signalsim.backtest.BarFixtures;
import com.signalsim.backtest.config.AnalysisSettings;
import com.signalsim.backtest.config.SimulationConfig;
import com.signalsim.backtest.engine.ConfigException;
import com.signalsim.backtest.engine.PositionSimulator;
import com.signalsim.backtest.model.CompletedTrade;
import com.signalsim.backtest.model.Direction;
import com.signalsim.backtest.model.ExitReason;
import com.signalsim.backtest.model.Metrics;
import com.signalsim.backtest.model.OpenTrade;
import com.signalsim.backtest.model.ResultRow;
import com.signalsim.backtest.model.SimulationResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class PerformanceAnalyzerTest {

    private static final double EPS = 1e-9;

    private final PerformanceAnalyzer analyzer = new PerformanceAnalyzer();

    private static SimulationResult.SimulationResultBuilder equityPath(double initialCapital, double... equities) {
        SimulationResult.SimulationResultBuilder builder = SimulationResult.builder()
                .config(SimulationConfig.builder().initialCapital(initialCapital).build());
        double previous = initialCapital;
        for (int i = 0; i < equities.length; i++) {
            double returns = i == 0 || previous <= 0 ? 0.0 : equities[i] / previous - 1;
            builder.row(ResultRow.builder()
                    .timestamp(BarFixtures.START + i * BarFixtures.DAY)
                    .close(100)
                    .capital(equities[i])
                    .equity(equities[i])
                    .returns(returns)
                    .build());
            previous = equities[i];
        }
        return builder;
    }

    private static CompletedTrade trade(double profit, int holdingPeriods) {
        return CompletedTrade.builder()
                .entryDate(BarFixtures.START)
                .entryPrice(100)
                .direction(Direction.LONG)
                .shares(10)
                .tradeValue(1_000)
                .exitDate(BarFixtures.START + holdingPeriods * BarFixtures.DAY)
                .exitPrice(100 + profit / 10)
                .exitReason(ExitReason.SIGNAL)
                .profit(profit)
                .returnPct(profit / 1_000)
                .holdingPeriods(holdingPeriods)
                .build();
    }

    @Test
    void summarize_computesReturnAndRiskFromEquityPath() {
        SimulationResult result = equityPath(100, 100, 110, 99, 121).build();

        Metrics metrics = analyzer.summarize(result, 0.02, 4);

        double[] returns = {0.0, 0.1, -0.1, 121.0 / 99 - 1};
        double mean = (returns[0] + returns[1] + returns[2] + returns[3]) / 4;
        double variance = 0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        double stdDev = Math.sqrt(variance / 3);
        double periodicRiskFree = Math.pow(1.02, 1.0 / 4) - 1;

        assertThat(metrics.getPeriods()).isEqualTo(4);
        assertThat(metrics.getTotalReturn()).isCloseTo(0.21, within(EPS));
        assertThat(metrics.getAnnualizedReturn()).isCloseTo(0.21, within(EPS));
        assertThat(metrics.getAnnualizedVolatility()).isCloseTo(stdDev * 2, within(EPS));
        assertThat(metrics.getSharpeRatio()).isCloseTo((mean - periodicRiskFree) / stdDev * 2, within(EPS));
        assertThat(metrics.getMaxDrawdown()).isCloseTo(-0.1, within(EPS));
        assertThat(metrics.getCalmarRatio()).isCloseTo(2.1, within(EPS));
        assertThat(metrics.getTotalTrades()).isZero();
    }

    @Test
    void summarize_derivesTradeStatisticsFromCompletedTradesOnly() {
        double[] profits = {10, -5, 20, 30, 40, -10, 0};
        SimulationResult.SimulationResultBuilder builder = equityPath(1_000, 1_000, 1_085);
        for (int i = 0; i < profits.length; i++) {
            builder.trade(trade(profits[i], i + 1));
        }
        builder.trade(OpenTrade.builder()
                .entryDate(BarFixtures.START + 20 * BarFixtures.DAY)
                .entryPrice(100)
                .direction(Direction.SHORT)
                .shares(10)
                .tradeValue(1_000)
                .build());

        Metrics metrics = analyzer.summarize(builder.build(), AnalysisSettings.defaults());

        assertThat(metrics.getTotalTrades()).isEqualTo(7);
        assertThat(metrics.getWinningTrades()).isEqualTo(4);
        assertThat(metrics.getLosingTrades()).isEqualTo(3);
        assertThat(metrics.getWinRate()).isCloseTo(4.0 / 7, within(EPS));
        assertThat(metrics.getAvgWin()).isCloseTo(25, within(EPS));
        assertThat(metrics.getAvgLoss()).isCloseTo(-5, within(EPS));
        assertThat(metrics.getProfitFactor()).isCloseTo(100.0 / 15, within(EPS));
        assertThat(metrics.getMaxConsecutiveWins()).isEqualTo(3);
        assertThat(metrics.getMaxConsecutiveLosses()).isEqualTo(2);
        assertThat(metrics.getAvgHoldingPeriod()).isCloseTo(4, within(EPS));
    }

    @Test
    void summarize_reportsZeroProfitFactorWithoutLosses() {
        SimulationResult result = equityPath(1_000, 1_000, 1_030)
                .trade(trade(10, 1))
                .trade(trade(20, 2))
                .build();

        Metrics metrics = analyzer.summarize(result, AnalysisSettings.defaults());

        assertThat(metrics.getWinRate()).isEqualTo(1.0);
        assertThat(metrics.getProfitFactor()).isZero();
        assertThat(metrics.getAvgLoss()).isZero();
        assertThat(metrics.getMaxConsecutiveLosses()).isZero();
    }

    @Test
    void summarize_resolvesDegenerateSingleBarToZero() {
        SimulationResult result = equityPath(100_000, 100_000).build();

        Metrics metrics = analyzer.summarize(result, AnalysisSettings.defaults());

        assertThat(metrics.getPeriods()).isEqualTo(1);
        assertThat(metrics.getTotalReturn()).isZero();
        assertThat(metrics.getAnnualizedReturn()).isZero();
        assertThat(metrics.getAnnualizedVolatility()).isZero();
        assertThat(metrics.getSharpeRatio()).isZero();
        assertThat(metrics.getMaxDrawdown()).isZero();
        assertThat(metrics.getCalmarRatio()).isZero();
        assertThat(metrics.getTotalTrades()).isZero();
        assertThat(metrics.getWinRate()).isZero();
    }

    @Test
    void summarize_zeroesAnnualizedReturnWhenEquityTurnsNegative() {
        SimulationResult result = equityPath(100, 100, -20).build();

        Metrics metrics = analyzer.summarize(result, 0.0, 3);

        assertThat(metrics.getTotalReturn()).isCloseTo(-1.2, within(EPS));
        assertThat(metrics.getAnnualizedReturn()).isZero();
        assertThat(metrics.getCalmarRatio()).isZero();
        assertThat(metrics.getMaxDrawdown()).isCloseTo(-1.2, within(EPS));
    }

    @Test
    void summarize_flatEquityHasNoVolatilityOrSharpe() {
        SimulationResult result = equityPath(500, 500, 500, 500, 500).build();

        Metrics metrics = analyzer.summarize(result, AnalysisSettings.defaults());

        assertThat(metrics.getAnnualizedVolatility()).isZero();
        assertThat(metrics.getSharpeRatio()).isZero();
        assertThat(metrics.getMaxDrawdown()).isZero();
    }

    @Test
    void summarize_rejectsInvalidAnalysisInputs() {
        SimulationResult result = equityPath(100, 100, 101).build();

        assertThatThrownBy(() -> analyzer.summarize(result, 0.02, 0))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("tradingPeriodsPerYear");
        assertThatThrownBy(() -> analyzer.summarize(result, Double.NaN, 252))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("riskFreeRate");
    }

    @Test
    void drawdownSeries_tracksRunningPeak() {
        SimulationResult result = equityPath(100, 100, 120, 90, 130, 117).build();

        double[] drawdowns = analyzer.drawdownSeries(result);

        assertThat(drawdowns).hasSize(5);
        assertThat(drawdowns[0]).isZero();
        assertThat(drawdowns[1]).isZero();
        assertThat(drawdowns[2]).isCloseTo(-0.25, within(EPS));
        assertThat(drawdowns[3]).isZero();
        assertThat(drawdowns[4]).isCloseTo(-0.1, within(EPS));
        for (double drawdown : drawdowns) {
            assertThat(drawdown).isLessThanOrEqualTo(0.0);
        }
    }

    @Test
    void drawdownSeries_reportsZeroWhilePeakIsNotPositive() {
        SimulationResult result = equityPath(100, -10, -5, 5, 4).build();

        double[] drawdowns = analyzer.drawdownSeries(result);

        assertThat(drawdowns[0]).isZero();
        assertThat(drawdowns[1]).isZero();
        assertThat(drawdowns[2]).isZero();
        assertThat(drawdowns[3]).isCloseTo(-0.2, within(EPS));
    }

    @Test
    void summarize_agreesWithSimulatedTrades() {
        SimulationResult result = new PositionSimulator().run(
                BarFixtures.series(new double[]{100, 110, 100, 90, 95}, new int[]{1, 0, -1, 0, 0}),
                SimulationConfig.builder().commissionPct(0).slippagePct(0).minCommission(0).build());

        Metrics metrics = analyzer.summarize(result, AnalysisSettings.defaults());

        assertThat(metrics.getTotalTrades()).isEqualTo(2);
        assertThat(metrics.getWinningTrades()).isEqualTo(2);
        assertThat(metrics.getTotalReturn())
                .isCloseTo(result.getFinalEquity() / 100_000 - 1, within(EPS));
    }
}
