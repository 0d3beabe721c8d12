package com.signalsim.backtest.model;

/**
 * Trade direction
 */
public enum Direction {
    LONG(1),
    SHORT(-1);

    private final int sign;

    Direction(int sign) {
        this.sign = sign;
    }

    /**
     * Position value used in result rows (+1 long, -1 short)
     * @return sign of the position
     */
    public int getSign() {
        return sign;
    }

    /**
     * Map a non-zero signal to a direction
     * @param signal 1 or -1
     * @return matching direction
     */
    public static Direction fromSignal(int signal) {
        if (signal == 1) {
            return LONG;
        }
        if (signal == -1) {
            return SHORT;
        }
        throw new IllegalArgumentException("No direction for signal: " + signal);
    }
}
