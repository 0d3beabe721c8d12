package com.signalsim.backtest.model;

/**
 * A trade opened by the simulator. Either still open ({@link OpenTrade}) or
 * closed with its exit fields filled in ({@link CompletedTrade}).
 */
public interface Trade {

    /**
     * Entry timestamp in milliseconds since epoch
     */
    long getEntryDate();

    /**
     * Entry fill price, slippage included
     */
    double getEntryPrice();

    Direction getDirection();

    /**
     * Whole shares held
     */
    long getShares();

    /**
     * Capital committed at entry (shares x entry price)
     */
    double getTradeValue();

    /**
     * Commission charged when the position was opened
     */
    double getEntryCommission();

    boolean isCompleted();
}
