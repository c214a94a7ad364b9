package com.causalbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Account state at the close of one bar. {@code drawdown} is a non-positive
 * fraction of the running equity peak.
 */
@Value
@Builder
public class EquitySnapshot {

    int barIndex;
    LocalDateTime timestamp;
    BigDecimal equity;
    BigDecimal cash;
    BigDecimal marketValue;
    BigDecimal drawdown;
}
