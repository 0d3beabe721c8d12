package com.signalsim.backtest.engine;

/**
 * A bar that breaks the input contract (non-finite value, inconsistent OHLC,
 * unknown signal or out-of-order timestamp).
 */
public class DataException extends BacktestException {

    private final int barIndex;

    public DataException(int barIndex, String message) {
        super(ErrorCode.INVALID_DATA, "Bar " + barIndex + ": " + message);
        this.barIndex = barIndex;
    }

    /**
     * @return index of the offending bar in the input sequence
     */
    public int getBarIndex() {
        return barIndex;
    }
}
