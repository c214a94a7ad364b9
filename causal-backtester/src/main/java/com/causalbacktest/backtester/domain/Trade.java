package com.causalbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A closed (or partially closed) round trip.
 *
 * <p>{@code entryPrice} is the position's average cost per unit including entry costs;
 * {@code exitPrice} is the slippage-adjusted fill price of the reducing fill.
 * {@code pnl} is net of all commissions and slippage.
 */
@Value
@Builder
@AllArgsConstructor
public class Trade {

    long entryFillId;
    long exitFillId;
    PositionSide side;
    int quantity;
    int entryBarIndex;
    LocalDateTime entryTimestamp;
    BigDecimal entryPrice;
    int exitBarIndex;
    LocalDateTime exitTimestamp;
    BigDecimal exitPrice;
    BigDecimal pnl;
    BigDecimal pnlPct;

    public int getDurationBars() {
        return exitBarIndex - entryBarIndex;
    }

    public Duration getDuration() {
        return Duration.between(entryTimestamp, exitTimestamp);
    }

    public boolean isWinner() {
        return pnl.signum() > 0;
    }

    public enum PositionSide {
        LONG, SHORT
    }
}
