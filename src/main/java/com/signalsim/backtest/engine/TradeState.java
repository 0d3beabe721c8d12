package com.signalsim.backtest.engine;

import com.signalsim.backtest.model.OpenTrade;
import lombok.Data;

/**
 * Mutable account and position state of a single simulation run.
 * Never shared between runs.
 */
@Data
class TradeState {

    /**
     * Current position: -1 short, 0 flat, 1 long
     */
    private int position;

    /**
     * Entry fill price, slippage included
     */
    private double entryPrice;

    /**
     * Bars elapsed since entry
     */
    private int holdingPeriods;

    private long shares;

    /**
     * Capital committed at entry (shares x entry price)
     */
    private double entryValue;

    private double currentCapital;
    private double currentEquity;

    /**
     * Trade record of the open position, null when flat
     */
    private OpenTrade openTrade;

    static TradeState flat(double initialCapital) {
        TradeState state = new TradeState();
        state.setCurrentCapital(initialCapital);
        state.setCurrentEquity(initialCapital);
        return state;
    }

    boolean isInPosition() {
        return position != 0;
    }

    void incrementHoldingPeriods() {
        holdingPeriods++;
    }

    /**
     * Check if stop loss is hit at the given close
     * @param close bar close
     * @param stopLossPct configured stop distance
     * @return true if SL hit
     */
    boolean isStopLossHit(double close, double stopLossPct) {
        if (position == 1) {
            return close <= entryPrice * (1 - stopLossPct);
        }
        return position == -1 && close >= entryPrice * (1 + stopLossPct);
    }

    /**
     * Check if take profit is hit at the given close
     * @param close bar close
     * @param takeProfitPct configured profit target
     * @return true if TP hit
     */
    boolean isTakeProfitHit(double close, double takeProfitPct) {
        if (position == 1) {
            return close >= entryPrice * (1 + takeProfitPct);
        }
        return position == -1 && close <= entryPrice * (1 - takeProfitPct);
    }

    /**
     * Calculate unrealized profit, 0 when flat
     * @param currentPrice current market price
     * @return unrealized profit
     */
    double getUnrealizedProfit(double currentPrice) {
        if (position == 1) {
            return shares * currentPrice - entryValue;
        }
        if (position == -1) {
            return entryValue - shares * currentPrice;
        }
        return 0.0;
    }

    void open(OpenTrade trade) {
        this.position = trade.getDirection().getSign();
        this.entryPrice = trade.getEntryPrice();
        this.holdingPeriods = 0;
        this.shares = trade.getShares();
        this.entryValue = trade.getTradeValue();
        this.openTrade = trade;
    }

    void reset() {
        this.position = 0;
        this.entryPrice = 0.0;
        this.holdingPeriods = 0;
        this.shares = 0;
        this.entryValue = 0.0;
        this.openTrade = null;
    }
}
