package com.causalbacktest.backtester.execution;

import com.causalbacktest.backtester.domain.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Transaction-cost and order-handling settings for one run.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionSettings {

    @Builder.Default
    BigDecimal commissionPerFill = new BigDecimal("1.00");

    /** Percent of gross notional, e.g. 0.1 for 0.1%. */
    @Builder.Default
    BigDecimal commissionPct = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal slippageBps = BigDecimal.ONE;

    /** Fixed slippage per unit, in price terms. */
    @Builder.Default
    BigDecimal slippageFixed = BigDecimal.ZERO;

    @Builder.Default
    int orderExpiryBars = 10;

    /** Market orders fill at the next bar's open when set, otherwise at its close. */
    @Builder.Default
    boolean fillAtNextOpen = true;

    boolean allowShort;

    boolean marginEnabled;

    public static ExecutionSettings defaults() {
        return ExecutionSettings.builder().build();
    }

    public static ExecutionSettings frictionless() {
        return ExecutionSettings.builder()
                .commissionPerFill(BigDecimal.ZERO)
                .slippageBps(BigDecimal.ZERO)
                .build();
    }

    /**
     * @throws ConfigurationException for a missing or negative cost, or a non-positive expiry
     */
    public ExecutionSettings validate() {
        requireNonNegative("commissionPerFill", commissionPerFill);
        requireNonNegative("commissionPct", commissionPct);
        requireNonNegative("slippageBps", slippageBps);
        requireNonNegative("slippageFixed", slippageFixed);
        if (orderExpiryBars < 1) {
            throw new ConfigurationException("orderExpiryBars",
                    "Order expiry must be at least 1 bar, got " + orderExpiryBars);
        }
        return this;
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new ConfigurationException(field, field + " must be non-negative, got " + value);
        }
    }
}
