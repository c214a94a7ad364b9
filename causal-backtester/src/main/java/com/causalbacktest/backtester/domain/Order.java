package com.causalbacktest.backtester.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * An order submitted by a decision policy while processing one bar.
 *
 * <p>Status moves once, from PENDING to FILLED or CANCELLED. A fill is only
 * accepted from a bar strictly after the submission bar.
 */
@Getter
@ToString
public class Order {

    private final long id;
    private final OrderSide side;
    private final OrderType type;
    private final int quantity;
    private final BigDecimal limitPrice;
    private final BigDecimal stopPrice;
    private final int submittedAtBarIndex;
    private final LocalDateTime submittedAt;

    private OrderStatus status = OrderStatus.PENDING;
    private CancelReason cancelReason;
    private Integer filledAtBarIndex;

    @Builder
    public Order(long id, OrderSide side, OrderType type, int quantity, BigDecimal limitPrice,
                 BigDecimal stopPrice, int submittedAtBarIndex, LocalDateTime submittedAt) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive, got " + quantity);
        }
        if (type == OrderType.LIMIT && limitPrice == null) {
            throw new IllegalArgumentException("Limit orders require a limit price");
        }
        if (type == OrderType.STOP && stopPrice == null) {
            throw new IllegalArgumentException("Stop orders require a stop price");
        }
        this.id = id;
        this.side = side;
        this.type = type;
        this.quantity = quantity;
        this.limitPrice = limitPrice;
        this.stopPrice = stopPrice;
        this.submittedAtBarIndex = submittedAtBarIndex;
        this.submittedAt = submittedAt;
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    /**
     * Number of bars since submission as seen from {@code barIndex}.
     */
    public int barsSinceSubmission(int barIndex) {
        return barIndex - submittedAtBarIndex;
    }

    public void markFilled(int barIndex) {
        requirePending();
        if (barIndex <= submittedAtBarIndex) {
            throw new IllegalStateException("Order " + id + " submitted at bar " + submittedAtBarIndex
                    + " cannot fill on bar " + barIndex);
        }
        this.status = OrderStatus.FILLED;
        this.filledAtBarIndex = barIndex;
    }

    public void cancel(CancelReason reason) {
        requirePending();
        this.status = OrderStatus.CANCELLED;
        this.cancelReason = reason;
    }

    private void requirePending() {
        if (status != OrderStatus.PENDING) {
            throw new IllegalStateException("Order " + id + " is already " + status);
        }
    }
}
