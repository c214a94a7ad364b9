package com.causalbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Non-fatal event recorded next to the trade ledger: a rejected submission,
 * a rejected fill, or an expired order. {@code orderId} is null when the
 * submission never became an order.
 */
@Value
@Builder
public class LedgerAnnotation {

    int barIndex;
    LocalDateTime timestamp;
    Long orderId;
    ErrorCategory category;
    CancelReason cancelReason;
    String message;
}
