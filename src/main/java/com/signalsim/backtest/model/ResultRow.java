package com.signalsim.backtest.model;

import lombok.Builder;
import lombok.Value;

/**
 * Account and trade state recorded for one input bar.
 * <p>
 * Entry fields ({@code entryPrice}, {@code entryDate}, {@code shares},
 * {@code tradeValue}) are set only on the bar that opens a position; exit
 * fields ({@code exitPrice}, {@code exitDate}, {@code exitReason},
 * {@code tradeProfit}) only on the bar that closes one. {@code position} and
 * {@code holdingPeriods} describe the position held at the end of the bar.
 */
@Value
@Builder
public class ResultRow {

    long timestamp;
    double close;
    int signal;

    /**
     * Position held after processing the bar: -1, 0 or 1
     */
    int position;

    double entryPrice;
    Long entryDate;
    double exitPrice;
    Long exitDate;
    int holdingPeriods;
    ExitReason exitReason;

    /**
     * Cash after this bar's trade flows
     */
    double capital;

    /**
     * Capital plus unrealized profit at the bar close
     */
    double equity;

    double returns;
    double tradeProfit;

    /**
     * Total commission charged on this bar (exit and entry on a reversal bar)
     */
    double commission;

    long shares;
    double tradeValue;

    /**
     * @return equity minus capital
     */
    public double getUnrealizedProfit() {
        return equity - capital;
    }
}
