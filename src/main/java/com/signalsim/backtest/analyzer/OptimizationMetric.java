package com.signalsim.backtest.analyzer;

import com.signalsim.backtest.model.Metrics;

import java.util.function.ToDoubleFunction;

/**
 * Metric a parameter search maximizes. Higher scores are always better;
 * {@link #MAX_DRAWDOWN} scores the non-positive drawdown itself, so the
 * shallowest drawdown ranks first.
 */
public enum OptimizationMetric {
    SHARPE_RATIO(Metrics::getSharpeRatio),
    TOTAL_RETURN(Metrics::getTotalReturn),
    MAX_DRAWDOWN(Metrics::getMaxDrawdown),
    CALMAR_RATIO(Metrics::getCalmarRatio);

    private final ToDoubleFunction<Metrics> extractor;

    OptimizationMetric(ToDoubleFunction<Metrics> extractor) {
        this.extractor = extractor;
    }

    public double score(Metrics metrics) {
        return extractor.applyAsDouble(metrics);
    }
}
