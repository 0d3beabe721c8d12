package com.signalsim.backtest.model;

import lombok.Builder;
import lombok.Value;

/**
 * Represents a single OHLCV bar together with the precomputed trading signal.
 * Immutable value object for price data at a specific timestamp.
 */
@Value
@Builder
public class Bar {

    /**
     * Timestamp in milliseconds since epoch
     */
    long timestamp;

    /**
     * Opening price
     */
    double open;

    /**
     * Highest price
     */
    double high;

    /**
     * Lowest price
     */
    double low;

    /**
     * Closing price
     */
    double close;

    /**
     * Trading volume
     */
    double volume;

    /**
     * Signal: -1 short entry/flip, 0 flat/close, 1 long entry/flip
     */
    int signal;

    /**
     * Check that all values are finite, prices positive and volume non-negative
     * @return true if every numeric field is usable
     */
    public boolean isFinite() {
        return Double.isFinite(open) && Double.isFinite(high) && Double.isFinite(low)
            && Double.isFinite(close) && Double.isFinite(volume)
            && open > 0 && high > 0 && low > 0 && close > 0 && volume >= 0;
    }

    /**
     * Check the OHLC consistency invariant
     * @return true if high and low bound both open and close
     */
    public boolean isConsistent() {
        return high >= low
            && high >= Math.max(open, close)
            && low <= Math.min(open, close);
    }

    /**
     * Check if the signal is one of -1, 0, 1
     * @return true if the signal is in the supported domain
     */
    public boolean hasValidSignal() {
        return signal >= -1 && signal <= 1;
    }

    /**
     * Full bar contract: finite, consistent, valid signal
     * @return true if the bar may be fed to the simulator
     */
    public boolean isValid() {
        return isFinite() && isConsistent() && hasValidSignal();
    }
}
