package com.signalsim.backtest.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Simulation output and its metrics for one instrument.
 */
@Value
@Builder
public class BacktestReport {

    String symbol;
    SimulationResult result;
    Metrics metrics;

    /**
     * Result plausibility warnings; the run itself succeeded
     */
    @Singular
    List<String> warnings;
}
