package com.signalsim.backtest.engine;

import com.signalsim.backtest.analyzer.OptimizationMetric;
import com.signalsim.backtest.config.AnalysisSettings;
import com.signalsim.backtest.config.SimulationConfig;
import com.signalsim.backtest.engine.BatchBacktestRunner.BacktestJob;
import com.signalsim.backtest.engine.BatchBacktestRunner.BatchOutcome;
import com.signalsim.backtest.engine.ParameterGrid.ParameterSet;
import com.signalsim.backtest.model.Bar;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Grid search over simulation parameters.
 * <p>
 * Every combination is backtested on each rolling window of the series and
 * scored by the mean of its window scores. Windows are two folds long and
 * advance one fold at a time, so {@code folds} folds give {@code folds - 1}
 * windows. With a single fold the whole series is one window.
 */
@Slf4j
public class ParameterOptimizer {

    private static final Comparator<ScoredParameters> BEST_FIRST =
        Comparator.comparingDouble((ScoredParameters scored) -> rankValue(scored.getScore())).reversed();

    private final BatchBacktestRunner runner;

    public ParameterOptimizer(BatchBacktestRunner runner) {
        this.runner = runner;
    }

    public OptimizationResult optimize(String name, List<Bar> bars, SimulationConfig base,
                                       ParameterGrid grid, OptimizationMetric metric) {
        return optimize(name, bars, base, grid, metric, 1, AnalysisSettings.defaults());
    }

    /**
     * Run the search
     * @param name base name for the backtest jobs
     * @param bars validated bars
     * @param base config the grid is applied to
     * @param grid parameter grid
     * @param metric score to maximize
     * @param folds number of folds for rolling windows, 1 for the whole series
     * @param settings metric settings
     * @return scored combinations, best first
     */
    public OptimizationResult optimize(String name, List<Bar> bars, SimulationConfig base, ParameterGrid grid,
                                       OptimizationMetric metric, int folds, AnalysisSettings settings) {
        if (bars == null || bars.isEmpty()) {
            throw new ConfigException("bar series must not be empty");
        }
        List<List<Bar>> windows = rollingWindows(bars, folds);
        List<ParameterSet> candidates = grid.combinations(base);

        log.info("Optimizing {} by {}: {} combination(s) x {} window(s)",
            name, metric, candidates.size(), windows.size());

        List<BacktestJob> jobs = new ArrayList<>(candidates.size() * windows.size());
        for (int c = 0; c < candidates.size(); c++) {
            for (int w = 0; w < windows.size(); w++) {
                jobs.add(BacktestJob.builder()
                    .name(name + "#" + c + "/" + w)
                    .bars(windows.get(w))
                    .config(candidates.get(c).getConfig())
                    .build());
            }
        }

        List<BatchOutcome> outcomes = runner.runAll(jobs, settings);

        List<ScoredParameters> scored = new ArrayList<>(candidates.size());
        for (int c = 0; c < candidates.size(); c++) {
            ParameterSet candidate = candidates.get(c);
            List<Double> windowScores = new ArrayList<>(windows.size());
            for (int w = 0; w < windows.size(); w++) {
                BatchOutcome outcome = outcomes.get(c * windows.size() + w);
                if (outcome.isSuccess()) {
                    windowScores.add(metric.score(outcome.getReport().getMetrics()));
                } else {
                    log.warn("Parameters {} failed on window {}: {}",
                        candidate.getParams(), w, outcome.getError().getMessage());
                }
            }
            if (windowScores.isEmpty()) {
                log.warn("Parameters {} produced no score and are excluded", candidate.getParams());
                continue;
            }
            scored.add(ScoredParameters.of(candidate, windowScores));
        }

        scored.sort(BEST_FIRST);

        OptimizationResult result = OptimizationResult.builder()
            .metric(metric)
            .results(scored)
            .build();

        result.getBest().ifPresent(best ->
            log.info("Best {} for {}: {} with {}", metric, name, String.format("%.4f", best.getScore()), best.getParams()));

        return result;
    }

    /**
     * Split a series into overlapping windows of two folds each
     * @param bars full series
     * @param folds number of folds, at least 1
     * @return windows in time order
     */
    static List<List<Bar>> rollingWindows(List<Bar> bars, int folds) {
        if (folds < 1) {
            throw new ConfigException("folds must be at least 1, got " + folds);
        }
        if (folds == 1) {
            return List.of(bars);
        }
        int foldSize = bars.size() / folds;
        if (foldSize == 0) {
            throw new ConfigException(bars.size() + " bars are too few for " + folds + " folds");
        }

        List<List<Bar>> windows = new ArrayList<>(folds - 1);
        for (int fold = 0; fold < folds; fold++) {
            int start = fold * foldSize;
            int end = start + 2 * foldSize;
            if (end > bars.size()) {
                break;
            }
            windows.add(List.copyOf(bars.subList(start, end)));
        }
        return windows;
    }

    private static double rankValue(double value) {
        return Double.isFinite(value) ? value : Double.NEGATIVE_INFINITY;
    }

    /**
     * One grid combination with its scores
     */
    @Value
    public static class ScoredParameters {
        Map<String, Object> params;
        SimulationConfig config;
        List<Double> windowScores;

        /**
         * Mean of the window scores
         */
        double score;

        /**
         * Population standard deviation of the window scores
         */
        double scoreStd;

        static ScoredParameters of(ParameterSet candidate, List<Double> windowScores) {
            double mean = 0.0;
            for (double s : windowScores) {
                mean += s;
            }
            mean /= windowScores.size();

            double variance = 0.0;
            for (double s : windowScores) {
                variance += (s - mean) * (s - mean);
            }
            variance /= windowScores.size();

            return new ScoredParameters(candidate.getParams(), candidate.getConfig(),
                List.copyOf(windowScores), mean, Math.sqrt(variance));
        }
    }

    /**
     * Outcome of a search
     */
    @Value
    @Builder
    public static class OptimizationResult {
        OptimizationMetric metric;

        /**
         * Every scored combination, best first; ties keep grid order
         */
        @Singular
        List<ScoredParameters> results;

        public Optional<ScoredParameters> getBest() {
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        }

        public Optional<SimulationConfig> getBestConfig() {
            return getBest().map(ScoredParameters::getConfig);
        }
    }
}
