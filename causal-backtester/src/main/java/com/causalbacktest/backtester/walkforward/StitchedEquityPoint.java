package com.causalbacktest.backtester.walkforward;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One bar of the stitched out-of-sample curve. {@code barIndex} is the index in the full
 * feed; {@code segmentEquity} is the window's own equity and {@code equity} the value
 * after chaining onto the previous segments.
 */
@Value
public class StitchedEquityPoint {

    int window;
    int barIndex;
    LocalDateTime timestamp;
    BigDecimal segmentEquity;
    BigDecimal equity;
}
