package com.causalbacktest.backtester.domain;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Net position in the traded symbol. The sign of {@code quantity} is the direction.
 * Only {@link Portfolio} mutates it.
 */
@Getter
@ToString
public class Position {

    private int quantity;
    private BigDecimal averageCost = BigDecimal.ZERO;
    private long entryFillId;
    private int openedAtBarIndex;
    private LocalDateTime openedAt;

    public boolean isFlat() {
        return quantity == 0;
    }

    public boolean isLong() {
        return quantity > 0;
    }

    public boolean isShort() {
        return quantity < 0;
    }

    public BigDecimal marketValue(BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    void open(int signedQuantity, BigDecimal unitCost, Fill fill) {
        this.quantity = signedQuantity;
        this.averageCost = unitCost;
        this.entryFillId = fill.getId();
        this.openedAtBarIndex = fill.getBarIndex();
        this.openedAt = fill.getTimestamp();
    }

    void resize(int signedQuantity, BigDecimal averageCost) {
        this.quantity = signedQuantity;
        this.averageCost = averageCost;
    }

    void reset() {
        this.quantity = 0;
        this.averageCost = BigDecimal.ZERO;
        this.entryFillId = 0L;
        this.openedAtBarIndex = 0;
        this.openedAt = null;
    }
}
