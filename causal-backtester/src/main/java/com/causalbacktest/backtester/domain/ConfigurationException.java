package com.causalbacktest.backtester.domain;

/**
 * Raised for invalid run, sweep or walk-forward settings. Sweeps raise it before
 * any worker is started.
 */
public class ConfigurationException extends BacktestException {

    public ConfigurationException(String field, String message) {
        super(ErrorCategory.CONFIGURATION, field, message);
    }
}
