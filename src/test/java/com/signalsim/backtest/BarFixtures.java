package com.signalsim.backtest;

import com.signalsim.backtest.model.Bar;

import java.util.ArrayList;
import java.util.List;

/**
 * Bar fixtures shared by tests.
 */
public final class BarFixtures {

    public static final long START = 1_704_067_200_000L; // 2024-01-01T00:00:00Z
    public static final long DAY = 86_400_000L;

    private BarFixtures() {
    }

    /**
     * Flat bar whose open, high, low and close are all {@code close}
     */
    public static Bar bar(int index, double close, int signal) {
        return Bar.builder()
                .timestamp(START + index * DAY)
                .open(close)
                .high(close)
                .low(close)
                .close(close)
                .volume(1_000)
                .signal(signal)
                .build();
    }

    /**
     * Consecutive daily bars from parallel close and signal arrays
     */
    public static List<Bar> series(double[] closes, int[] signals) {
        List<Bar> bars = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            bars.add(bar(i, closes[i], signals[i]));
        }
        return bars;
    }
}
