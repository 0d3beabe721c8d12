package com.signalsim.backtest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Performance summary of a simulation run.
 * Ratios that cannot be computed are reported as 0; {@link #periods} and
 * {@link #totalTrades} tell whether a zero came from a degenerate sample.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Metrics {

    private double totalReturn;
    private double annualizedReturn;
    private double annualizedVolatility;
    private double sharpeRatio;

    /**
     * Largest peak-to-trough decline, as a non-positive fraction
     */
    private double maxDrawdown;

    private double calmarRatio;

    /**
     * Completed trades only
     */
    private int totalTrades;

    private int winningTrades;
    private int losingTrades;
    private double winRate;
    private double avgWin;
    private double avgLoss;
    private double profitFactor;
    private double avgHoldingPeriod;
    private int maxConsecutiveWins;
    private int maxConsecutiveLosses;

    /**
     * Number of return observations the ratios were computed from
     */
    private int periods;
}
