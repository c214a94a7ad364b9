package com.causalbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single OHLCV record for one fixed time interval.
 * Bars are validated when a {@link BarFeed} is built and are immutable afterwards.
 */
@Value
@Builder
@AllArgsConstructor
public class Bar {

    LocalDateTime timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    Long volume;
}
