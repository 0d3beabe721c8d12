package com.signalsim.backtest.config;

import com.signalsim.backtest.engine.ConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs to the metrics calculation that are not part of the simulation itself.
 */
@Value
@Builder
public class AnalysisSettings {

    public static final double DEFAULT_RISK_FREE_RATE = 0.02;
    public static final int DEFAULT_TRADING_PERIODS_PER_YEAR = 252;
    public static final int DEFAULT_MIN_TRADES = 10;
    public static final double DEFAULT_MAX_DRAWDOWN_THRESHOLD = 0.5;
    public static final double DEFAULT_MAX_VOLATILITY_THRESHOLD = 1.0;

    /**
     * Annual risk-free rate
     */
    @Builder.Default
    double riskFreeRate = DEFAULT_RISK_FREE_RATE;

    /**
     * Bars per year, used to annualize
     */
    @Builder.Default
    int tradingPeriodsPerYear = DEFAULT_TRADING_PERIODS_PER_YEAR;

    /**
     * Completed trades below this count produce a result warning
     */
    @Builder.Default
    int minTrades = DEFAULT_MIN_TRADES;

    /**
     * Warn when |maxDrawdown| exceeds this fraction
     */
    @Builder.Default
    double maxDrawdownThreshold = DEFAULT_MAX_DRAWDOWN_THRESHOLD;

    /**
     * Warn when annualized volatility exceeds this fraction
     */
    @Builder.Default
    double maxVolatilityThreshold = DEFAULT_MAX_VOLATILITY_THRESHOLD;

    public static AnalysisSettings defaults() {
        return AnalysisSettings.builder().build();
    }

    public void validate() {
        if (tradingPeriodsPerYear <= 0) {
            throw new ConfigException("tradingPeriodsPerYear must be positive, got " + tradingPeriodsPerYear);
        }
        if (!Double.isFinite(riskFreeRate) || riskFreeRate <= -1) {
            throw new ConfigException("riskFreeRate must be finite and greater than -1, got " + riskFreeRate);
        }
        if (minTrades < 0) {
            throw new ConfigException("minTrades must not be negative, got " + minTrades);
        }
        if (!(maxDrawdownThreshold > 0 && Double.isFinite(maxDrawdownThreshold))) {
            throw new ConfigException("maxDrawdownThreshold must be positive, got " + maxDrawdownThreshold);
        }
        if (!(maxVolatilityThreshold > 0 && Double.isFinite(maxVolatilityThreshold))) {
            throw new ConfigException("maxVolatilityThreshold must be positive, got " + maxVolatilityThreshold);
        }
    }
}
