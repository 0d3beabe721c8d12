package com.signalsim.backtest.engine;

/**
 * Invalid simulation or analysis configuration. Raised before any bar is processed.
 */
public class ConfigException extends BacktestException {

    public ConfigException(String message) {
        super(ErrorCode.INVALID_CONFIG, message);
    }
}
