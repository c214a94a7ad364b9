package com.causalbacktest.backtester.controller.dto;

import com.causalbacktest.backtester.execution.ExecutionSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Optional per-request changes to the configured execution settings. Null fields keep
 * the configured value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionOverrides {

    @PositiveOrZero(message = "Commission per fill must not be negative")
    private BigDecimal commissionPerFill;

    @PositiveOrZero(message = "Commission percent must not be negative")
    private BigDecimal commissionPct;

    @PositiveOrZero(message = "Slippage bps must not be negative")
    private BigDecimal slippageBps;

    @PositiveOrZero(message = "Fixed slippage must not be negative")
    private BigDecimal slippageFixed;

    @Min(value = 1, message = "Order expiry must be at least 1 bar")
    private Integer orderExpiryBars;

    private Boolean fillAtNextOpen;

    private Boolean allowShort;

    private Boolean marginEnabled;

    public static ExecutionSettings resolve(ExecutionOverrides overrides, ExecutionSettings base) {
        return overrides == null ? base : overrides.applyTo(base);
    }

    public ExecutionSettings applyTo(ExecutionSettings base) {
        ExecutionSettings.ExecutionSettingsBuilder builder = base.toBuilder();
        if (commissionPerFill != null) {
            builder.commissionPerFill(commissionPerFill);
        }
        if (commissionPct != null) {
            builder.commissionPct(commissionPct);
        }
        if (slippageBps != null) {
            builder.slippageBps(slippageBps);
        }
        if (slippageFixed != null) {
            builder.slippageFixed(slippageFixed);
        }
        if (orderExpiryBars != null) {
            builder.orderExpiryBars(orderExpiryBars);
        }
        if (fillAtNextOpen != null) {
            builder.fillAtNextOpen(fillAtNextOpen);
        }
        if (allowShort != null) {
            builder.allowShort(allowShort);
        }
        if (marginEnabled != null) {
            builder.marginEnabled(marginEnabled);
        }
        return builder.build();
    }
}
