package com.causalbacktest.backtester.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Result of offering a fill to the portfolio: either applied (possibly closing
 * trades) or rejected with a reason.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FillOutcome {

    boolean accepted;
    CancelReason rejectionReason;
    String message;
    List<Trade> closedTrades;

    public static FillOutcome accepted(List<Trade> closedTrades) {
        return new FillOutcome(true, null, null, List.copyOf(closedTrades));
    }

    public static FillOutcome rejected(CancelReason reason, String message) {
        return new FillOutcome(false, reason, message, List.of());
    }
}
