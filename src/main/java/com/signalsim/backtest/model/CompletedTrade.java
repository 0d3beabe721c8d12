package com.signalsim.backtest.model;

import lombok.Builder;
import lombok.Value;

/**
 * Represents a closed trade with entry, exit, and PnL information.
 */
@Value
@Builder
public class CompletedTrade implements Trade {

    long entryDate;
    double entryPrice;
    Direction direction;
    long shares;
    double tradeValue;
    double entryCommission;

    /**
     * Exit timestamp
     */
    long exitDate;

    /**
     * Exit fill price, slippage included
     */
    double exitPrice;

    ExitReason exitReason;

    double exitCommission;

    /**
     * Realized profit: exit commission is deducted here, entry commission is not
     * (it already left capital on the entry bar)
     */
    double profit;

    /**
     * Profit relative to the entry value, 0 when nothing was committed
     */
    double returnPct;

    /**
     * Bars elapsed between entry and exit
     */
    int holdingPeriods;

    @Override
    public boolean isCompleted() {
        return true;
    }

    /**
     * Check if this trade was profitable
     * @return true if profit > 0
     */
    public boolean isWinner() {
        return profit > 0;
    }
}
