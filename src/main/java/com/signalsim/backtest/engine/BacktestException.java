package com.signalsim.backtest.engine;

/**
 * Exception for backtest-specific errors.
 * Carries a structured error code so callers can tell configuration problems
 * from data problems without parsing messages.
 */
public class BacktestException extends RuntimeException {

    public enum ErrorCode {
        INVALID_CONFIG,
        INVALID_DATA,
        EXECUTION_FAILED
    }

    private final ErrorCode errorCode;

    public BacktestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BacktestException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
