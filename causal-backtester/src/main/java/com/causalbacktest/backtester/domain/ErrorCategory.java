package com.causalbacktest.backtester.domain;

/**
 * Error taxonomy shared by fatal exceptions and non-fatal ledger annotations.
 */
public enum ErrorCategory {
    /** Load-time data problems. Always fatal. */
    DATA,
    /** Orders a decision policy should not have submitted. */
    POLICY,
    /** Orders rejected or expired during matching. */
    EXECUTION,
    /** Degenerate inputs to summary statistics. */
    NUMERIC,
    /** Invalid sweep, walk-forward or execution settings. Always fatal. */
    CONFIGURATION
}
