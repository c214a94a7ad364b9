package com.causalbacktest.backtester.optimizer;

public enum RunStatus {
    COMPLETED,
    FAILED
}
