package com.causalbacktest.backtester.domain;

/**
 * Raised while loading or validating historical bars, before any simulation starts.
 */
public class DataValidationException extends BacktestException {

    public DataValidationException(String field, String message) {
        super(ErrorCategory.DATA, field, message);
    }

    public DataValidationException(String field, String message, Throwable cause) {
        super(ErrorCategory.DATA, field, message, cause);
    }
}
