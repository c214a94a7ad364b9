package com.causalbacktest.backtester.execution;

import com.causalbacktest.backtester.domain.Bar;
import com.causalbacktest.backtester.domain.CancelReason;
import com.causalbacktest.backtester.domain.ErrorCategory;
import com.causalbacktest.backtester.domain.Fill;
import com.causalbacktest.backtester.domain.FillOutcome;
import com.causalbacktest.backtester.domain.LedgerAnnotation;
import com.causalbacktest.backtester.domain.Order;
import com.causalbacktest.backtester.domain.OrderSide;
import com.causalbacktest.backtester.domain.OrderType;
import com.causalbacktest.backtester.domain.Portfolio;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Pending-order book for one run. Assigns order and fill ids, matches pending orders
 * through the {@link ExecutionModel}, applies fills to the {@link Portfolio} and keeps
 * the annotation stream for everything that did not fill.
 */
@Slf4j
public class Broker {

    private final ExecutionModel executionModel;
    private final Portfolio portfolio;

    private final List<Order> pending = new ArrayList<>();
    private final List<Order> orders = new ArrayList<>();
    private final List<Fill> fills = new ArrayList<>();
    private final List<LedgerAnnotation> annotations = new ArrayList<>();

    private long nextOrderId = 1;
    private long nextFillId = 1;

    public Broker(ExecutionModel executionModel, Portfolio portfolio) {
        this.executionModel = executionModel;
        this.portfolio = portfolio;
    }

    /**
     * Accept a new order. It becomes eligible for matching from bar {@code barIndex + 1}.
     */
    public Order submit(OrderSide side, OrderType type, int quantity, BigDecimal limitPrice,
                        BigDecimal stopPrice, int barIndex, LocalDateTime timestamp) {
        Order order = Order.builder()
                .id(nextOrderId++)
                .side(side)
                .type(type)
                .quantity(quantity)
                .limitPrice(limitPrice)
                .stopPrice(stopPrice)
                .submittedAtBarIndex(barIndex)
                .submittedAt(timestamp)
                .build();
        pending.add(order);
        orders.add(order);
        log.debug("Order {} submitted at bar {}: {} {} x{} limit={} stop={}",
                order.getId(), barIndex, side, type, quantity, limitPrice, stopPrice);
        return order;
    }

    /**
     * Match every pending order, in submission order, against {@code bar}.
     *
     * @return the fills applied on this bar
     */
    public List<Fill> processPendingOrders(Bar bar, int barIndex) {
        List<Fill> applied = new ArrayList<>();
        Iterator<Order> iterator = pending.iterator();
        while (iterator.hasNext()) {
            Order order = iterator.next();
            if (order.getSubmittedAtBarIndex() >= barIndex) {
                throw new IllegalStateException("Order " + order.getId() + " submitted at bar "
                        + order.getSubmittedAtBarIndex() + " reached matching on bar " + barIndex);
            }

            Fill fill = executionModel.tryFill(order, bar, barIndex, nextFillId).orElse(null);
            if (fill != null) {
                FillOutcome outcome = portfolio.applyFill(fill);
                if (outcome.isAccepted()) {
                    nextFillId++;
                    order.markFilled(barIndex);
                    fills.add(fill);
                    applied.add(fill);
                    log.debug("Order {} filled on bar {}: {} x{} at {} (market {}, commission {})",
                            order.getId(), barIndex, fill.getSide(), fill.getQuantity(),
                            fill.getFillPrice(), fill.getMarketPrice(), fill.getCommission());
                } else {
                    order.cancel(outcome.getRejectionReason());
                    annotate(barIndex, bar.getTimestamp(), order.getId(), ErrorCategory.EXECUTION,
                            outcome.getRejectionReason(), outcome.getMessage());
                    log.warn("Order {} rejected on bar {}: {}", order.getId(), barIndex, outcome.getMessage());
                }
                iterator.remove();
                continue;
            }

            if (order.barsSinceSubmission(barIndex) >= executionModel.getSettings().getOrderExpiryBars()) {
                order.cancel(CancelReason.EXPIRED);
                annotate(barIndex, bar.getTimestamp(), order.getId(), ErrorCategory.EXECUTION, CancelReason.EXPIRED,
                        "Order expired unfilled after " + order.barsSinceSubmission(barIndex) + " bars");
                log.debug("Order {} expired on bar {}", order.getId(), barIndex);
                iterator.remove();
            }
        }
        return applied;
    }

    /**
     * Cancel every pending order with the same reason.
     *
     * @return number of orders cancelled
     */
    public int cancelAll(CancelReason reason, ErrorCategory category, int barIndex, LocalDateTime timestamp) {
        int cancelled = pending.size();
        for (Order order : pending) {
            order.cancel(reason);
            annotate(barIndex, timestamp, order.getId(), category, reason, "Order cancelled: " + reason);
        }
        pending.clear();
        if (cancelled > 0) {
            log.debug("Cancelled {} pending orders at bar {} ({})", cancelled, barIndex, reason);
        }
        return cancelled;
    }

    /**
     * Record a non-fatal event that is not tied to a matching attempt, such as a
     * submission refused before it became an order.
     */
    public void annotate(int barIndex, LocalDateTime timestamp, Long orderId, ErrorCategory category,
                         CancelReason reason, String message) {
        annotations.add(LedgerAnnotation.builder()
                .barIndex(barIndex)
                .timestamp(timestamp)
                .orderId(orderId)
                .category(category)
                .cancelReason(reason)
                .message(message)
                .build());
    }

    public int getPendingCount() {
        return pending.size();
    }

    public List<Order> getOrders() {
        return Collections.unmodifiableList(orders);
    }

    public List<Fill> getFills() {
        return Collections.unmodifiableList(fills);
    }

    public List<LedgerAnnotation> getAnnotations() {
        return Collections.unmodifiableList(annotations);
    }

    public Portfolio getPortfolio() {
        return portfolio;
    }
}
