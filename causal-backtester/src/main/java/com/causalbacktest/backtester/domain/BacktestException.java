package com.causalbacktest.backtester.domain;

import lombok.Getter;

/**
 * Base class for fatal backtest errors. Carries the error category and,
 * where one can be named, the offending field.
 */
@Getter
public class BacktestException extends RuntimeException {

    private final ErrorCategory category;
    private final String field;

    public BacktestException(ErrorCategory category, String field, String message) {
        super(message);
        this.category = category;
        this.field = field;
    }

    public BacktestException(ErrorCategory category, String field, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.field = field;
    }
}
