package com.signalsim.backtest.config;

import com.signalsim.backtest.engine.ConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable simulation settings. Safe to share between concurrent runs.
 * Optional exit thresholds are {@code null} when not configured.
 */
@Value
@Builder(toBuilder = true)
public class SimulationConfig {

    public static final double DEFAULT_INITIAL_CAPITAL = 100000.0;
    public static final double DEFAULT_POSITION_SIZE = 1.0;
    public static final double DEFAULT_COMMISSION_PCT = 0.001;
    public static final double DEFAULT_SLIPPAGE_PCT = 0.001;
    public static final double DEFAULT_MIN_COMMISSION = 5.0;

    @Builder.Default
    double initialCapital = DEFAULT_INITIAL_CAPITAL;

    /**
     * Fraction of capital committed per trade, in (0, 1]
     */
    @Builder.Default
    double positionSize = DEFAULT_POSITION_SIZE;

    @Builder.Default
    double commissionPct = DEFAULT_COMMISSION_PCT;

    /**
     * Absolute floor applied to every commission charge
     */
    @Builder.Default
    double minCommission = DEFAULT_MIN_COMMISSION;

    @Builder.Default
    double slippagePct = DEFAULT_SLIPPAGE_PCT;

    Double stopLossPct;

    Double takeProfitPct;

    /**
     * Bars a position may be held before it is force-closed
     */
    Integer maxHoldingPeriods;

    /**
     * Size positions from current capital (true) or from initial capital (false)
     */
    @Builder.Default
    boolean enableCompound = true;

    /**
     * @return config with every option at its default
     */
    public static SimulationConfig defaults() {
        return SimulationConfig.builder().build();
    }

    /**
     * Reject settings the simulator cannot run with.
     * @throws ConfigException on the first invalid option
     */
    public void validate() {
        if (!Double.isFinite(initialCapital) || initialCapital <= 0) {
            throw new ConfigException("initialCapital must be positive, got " + initialCapital);
        }
        if (!(positionSize > 0 && positionSize <= 1)) {
            throw new ConfigException("positionSize must be in (0, 1], got " + positionSize);
        }
        if (!Double.isFinite(commissionPct) || commissionPct < 0) {
            throw new ConfigException("commissionPct must be non-negative, got " + commissionPct);
        }
        if (!Double.isFinite(slippagePct) || slippagePct < 0) {
            throw new ConfigException("slippagePct must be non-negative, got " + slippagePct);
        }
        if (!Double.isFinite(minCommission) || minCommission < 0) {
            throw new ConfigException("minCommission must be non-negative, got " + minCommission);
        }
        if (stopLossPct != null && !(stopLossPct > 0 && Double.isFinite(stopLossPct))) {
            throw new ConfigException("stopLossPct must be positive when set, got " + stopLossPct);
        }
        if (takeProfitPct != null && !(takeProfitPct > 0 && Double.isFinite(takeProfitPct))) {
            throw new ConfigException("takeProfitPct must be positive when set, got " + takeProfitPct);
        }
        if (maxHoldingPeriods != null && maxHoldingPeriods <= 0) {
            throw new ConfigException("maxHoldingPeriods must be positive when set, got " + maxHoldingPeriods);
        }
    }
}
