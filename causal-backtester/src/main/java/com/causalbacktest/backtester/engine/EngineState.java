package com.causalbacktest.backtester.engine;

/**
 * Lifecycle of a {@link BacktestEngine}. An engine runs exactly once.
 */
public enum EngineState {
    INITIALIZED,
    RUNNING,
    FINISHED
}
