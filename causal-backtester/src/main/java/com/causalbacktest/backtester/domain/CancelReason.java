package com.causalbacktest.backtester.domain;

/**
 * Why an order left the book without filling.
 */
public enum CancelReason {
    EXPIRED,
    INSUFFICIENT_CASH,
    SHORT_NOT_ALLOWED,
    CANCELLED_BY_POLICY,
    END_OF_DATA
}
