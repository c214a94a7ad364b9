package com.causalbacktest.backtester.execution;

import com.causalbacktest.backtester.domain.Bar;
import com.causalbacktest.backtester.domain.Fill;
import com.causalbacktest.backtester.domain.Order;
import com.causalbacktest.backtester.domain.OrderSide;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Matches a single pending order against one bar and prices the resulting fill.
 *
 * <p>Market orders fill at the open, or at the close when
 * {@link ExecutionSettings#isFillAtNextOpen()} is off. Limit orders fill when the bar trades through
 * the limit, at the limit or a better open. Stop orders trigger when the bar reaches
 * the stop, at the stop or a worse open when the bar gaps through it.
 */
public class ExecutionModel {

    private static final int PRICE_SCALE = 8;
    private static final BigDecimal BPS_DIVISOR = BigDecimal.valueOf(10_000);

    private final ExecutionSettings settings;

    public ExecutionModel(ExecutionSettings settings) {
        this.settings = settings.validate();
    }

    public ExecutionSettings getSettings() {
        return settings;
    }

    /**
     * Try to fill {@code order} on {@code bar}. Returns empty when the order's price
     * condition is not met on this bar. Does not change the order.
     */
    public Optional<Fill> tryFill(Order order, Bar bar, int barIndex, long fillId) {
        if (barIndex <= order.getSubmittedAtBarIndex()) {
            throw new IllegalStateException("Order " + order.getId() + " submitted at bar "
                    + order.getSubmittedAtBarIndex() + " cannot be matched against bar " + barIndex);
        }

        Optional<BigDecimal> marketPrice = matchPrice(order, bar);
        return marketPrice.map(price -> {
            BigDecimal slip = slippagePerUnit(price);
            BigDecimal fillPrice = order.getSide() == OrderSide.BUY ? price.add(slip) : price.subtract(slip);
            BigDecimal quantity = BigDecimal.valueOf(order.getQuantity());

            return Fill.builder()
                    .id(fillId)
                    .orderId(order.getId())
                    .side(order.getSide())
                    .orderType(order.getType())
                    .quantity(order.getQuantity())
                    .marketPrice(price)
                    .fillPrice(fillPrice)
                    .commission(commission(price.multiply(quantity)))
                    .slippageCost(slip.multiply(quantity))
                    .barIndex(barIndex)
                    .timestamp(bar.getTimestamp())
                    .build();
        });
    }

    /**
     * Per-fill commission plus the percentage commission on gross notional.
     */
    public BigDecimal commission(BigDecimal grossNotional) {
        BigDecimal pct = grossNotional.multiply(settings.getCommissionPct()).movePointLeft(2);
        return settings.getCommissionPerFill().add(pct);
    }

    /**
     * Adverse price move per unit for a fill at {@code price}.
     */
    public BigDecimal slippagePerUnit(BigDecimal price) {
        BigDecimal bps = price.multiply(settings.getSlippageBps()).divide(BPS_DIVISOR, PRICE_SCALE, RoundingMode.HALF_UP);
        return bps.add(settings.getSlippageFixed()).stripTrailingZeros();
    }

    private Optional<BigDecimal> matchPrice(Order order, Bar bar) {
        boolean buy = order.getSide() == OrderSide.BUY;
        switch (order.getType()) {
            case MARKET:
                return Optional.of(settings.isFillAtNextOpen() ? bar.getOpen() : bar.getClose());
            case LIMIT: {
                BigDecimal limit = order.getLimitPrice();
                if (buy) {
                    return bar.getLow().compareTo(limit) <= 0 ? Optional.of(limit.min(bar.getOpen())) : Optional.empty();
                }
                return bar.getHigh().compareTo(limit) >= 0 ? Optional.of(limit.max(bar.getOpen())) : Optional.empty();
            }
            case STOP: {
                BigDecimal stop = order.getStopPrice();
                if (buy) {
                    return bar.getHigh().compareTo(stop) >= 0 ? Optional.of(stop.max(bar.getOpen())) : Optional.empty();
                }
                return bar.getLow().compareTo(stop) <= 0 ? Optional.of(stop.min(bar.getOpen())) : Optional.empty();
            }
            default:
                throw new IllegalArgumentException("Unsupported order type " + order.getType());
        }
    }
}
