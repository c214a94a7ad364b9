package com.causalbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * The execution of an order on one bar.
 *
 * <p>{@code marketPrice} comes from the matching bar's OHLC. {@code fillPrice} is that
 * price moved against the trader by the per-unit slippage, so
 * {@code slippageCost = |fillPrice - marketPrice| * quantity}.
 */
@Value
@Builder
public class Fill {

    long id;
    long orderId;
    OrderSide side;
    OrderType orderType;
    int quantity;
    BigDecimal marketPrice;
    BigDecimal fillPrice;
    BigDecimal commission;
    BigDecimal slippageCost;
    int barIndex;
    LocalDateTime timestamp;

    /**
     * Quantity times the bar-derived price, before any costs.
     */
    public BigDecimal getGrossNotional() {
        return marketPrice.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * Signed change in cash: negative for buys, positive for sells.
     */
    public BigDecimal getCashDelta() {
        BigDecimal notional = fillPrice.multiply(BigDecimal.valueOf(quantity));
        return side == OrderSide.BUY
                ? notional.add(commission).negate()
                : notional.subtract(commission);
    }
}
