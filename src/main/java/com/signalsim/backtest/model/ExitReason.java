package com.signalsim.backtest.model;

/**
 * Why a position was closed. Declaration order of the first three is the
 * priority in which the exit rules are checked.
 */
public enum ExitReason {
    STOP_LOSS("Stop Loss"),
    TAKE_PROFIT("Take Profit"),
    MAX_HOLDING_PERIOD("Max Holding Period"),
    SIGNAL("Signal");

    private final String label;

    ExitReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
