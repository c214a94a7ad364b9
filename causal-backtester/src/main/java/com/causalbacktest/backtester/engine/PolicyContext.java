package com.causalbacktest.backtester.engine;

import com.causalbacktest.backtester.domain.Bar;
import com.causalbacktest.backtester.domain.BarHistory;
import com.causalbacktest.backtester.domain.CancelReason;
import com.causalbacktest.backtester.domain.ErrorCategory;
import com.causalbacktest.backtester.domain.Order;
import com.causalbacktest.backtester.domain.OrderSide;
import com.causalbacktest.backtester.domain.OrderType;
import com.causalbacktest.backtester.domain.Portfolio;
import com.causalbacktest.backtester.domain.Position;
import com.causalbacktest.backtester.execution.Broker;
import com.causalbacktest.backtester.indicator.IndicatorSet;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * What a policy may see and do while handling one bar.
 *
 * <p>Reads are limited to the current bar and earlier. Submissions are queued with the
 * broker and become eligible to fill from the next bar on. A submission is refused, and
 * annotated, when its quantity resolves to zero or less, or when an indicator read
 * earlier in the same bar was not available. The context is unusable once the engine
 * moves on.
 */
@Slf4j
public final class PolicyContext {

    private final int barIndex;
    private final BarHistory history;
    private final IndicatorSet indicators;
    private final Portfolio portfolio;
    private final Broker broker;

    private String unavailableIndicator;
    private boolean closed;

    PolicyContext(int barIndex, BarHistory history, IndicatorSet indicators, Portfolio portfolio, Broker broker) {
        this.barIndex = barIndex;
        this.history = history;
        this.indicators = indicators;
        this.portfolio = portfolio;
        this.broker = broker;
    }

    public int getBarIndex() {
        return barIndex;
    }

    public Bar getBar() {
        return history.current();
    }

    public LocalDateTime getTimestamp() {
        return getBar().getTimestamp();
    }

    public BigDecimal getClose() {
        return getBar().getClose();
    }

    public BarHistory getHistory() {
        return history;
    }

    /**
     * Latest value of a named indicator. Reading an empty value blocks order submission
     * for the rest of this bar.
     */
    public Optional<BigDecimal> indicator(String name) {
        Optional<BigDecimal> value = indicators.value(name);
        if (value.isEmpty() && unavailableIndicator == null) {
            unavailableIndicator = name;
        }
        return value;
    }

    public int getPositionQuantity() {
        return portfolio.getPosition().getQuantity();
    }

    public BigDecimal getAverageCost() {
        return portfolio.getPosition().getAverageCost();
    }

    public boolean isFlat() {
        return portfolio.getPosition().isFlat();
    }

    public BigDecimal getCash() {
        return portfolio.getCash();
    }

    /**
     * Equity marked at the current bar's close.
     */
    public BigDecimal getEquity() {
        return portfolio.getEquity(getClose());
    }

    public int getPendingOrderCount() {
        return broker.getPendingCount();
    }

    public Optional<Order> submitBuy(OrderSizing sizing) {
        return submit(OrderSide.BUY, OrderType.MARKET, sizing, null, null, getClose());
    }

    public Optional<Order> submitSell(OrderSizing sizing) {
        return submit(OrderSide.SELL, OrderType.MARKET, sizing, null, null, getClose());
    }

    public Optional<Order> submitBuyLimit(OrderSizing sizing, BigDecimal limitPrice) {
        return submit(OrderSide.BUY, OrderType.LIMIT, sizing, limitPrice, null, limitPrice);
    }

    public Optional<Order> submitSellLimit(OrderSizing sizing, BigDecimal limitPrice) {
        return submit(OrderSide.SELL, OrderType.LIMIT, sizing, limitPrice, null, limitPrice);
    }

    public Optional<Order> submitBuyStop(OrderSizing sizing, BigDecimal stopPrice) {
        return submit(OrderSide.BUY, OrderType.STOP, sizing, null, stopPrice, stopPrice);
    }

    public Optional<Order> submitSellStop(OrderSizing sizing, BigDecimal stopPrice) {
        return submit(OrderSide.SELL, OrderType.STOP, sizing, null, stopPrice, stopPrice);
    }

    /**
     * Market order that flattens the current position; empty when already flat.
     */
    public Optional<Order> closePosition() {
        Position position = portfolio.getPosition();
        if (position.isFlat()) {
            return Optional.empty();
        }
        OrderSide side = position.isLong() ? OrderSide.SELL : OrderSide.BUY;
        return submit(side, OrderType.MARKET, OrderSizing.shares(Math.abs(position.getQuantity())),
                null, null, getClose());
    }

    /**
     * @return number of pending orders cancelled
     */
    public int cancelPendingOrders() {
        requireOpen();
        return broker.cancelAll(CancelReason.CANCELLED_BY_POLICY, ErrorCategory.POLICY, barIndex, getTimestamp());
    }

    void close() {
        closed = true;
    }

    private Optional<Order> submit(OrderSide side, OrderType type, OrderSizing sizing,
                                   BigDecimal limitPrice, BigDecimal stopPrice, BigDecimal referencePrice) {
        requireOpen();
        if (unavailableIndicator != null) {
            return reject("Order refused: indicator '" + unavailableIndicator + "' was not available on this bar");
        }
        if ((type == OrderType.LIMIT && (limitPrice == null || limitPrice.signum() <= 0))
                || (type == OrderType.STOP && (stopPrice == null || stopPrice.signum() <= 0))) {
            return reject("Order refused: " + type + " order needs a positive price");
        }

        int quantity = sizing.resolve(getEquity(), referencePrice);
        if (quantity <= 0) {
            return reject("Order refused: " + side + " quantity resolved to " + quantity + " from " + sizing);
        }
        return Optional.of(broker.submit(side, type, quantity, limitPrice, stopPrice, barIndex, getTimestamp()));
    }

    private Optional<Order> reject(String message) {
        log.warn("Bar {}: {}", barIndex, message);
        broker.annotate(barIndex, getTimestamp(), null, ErrorCategory.POLICY, null, message);
        return Optional.empty();
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Policy context for bar " + barIndex + " is no longer active");
        }
    }
}
