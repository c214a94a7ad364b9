package com.causalbacktest.backtester.domain;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Authoritative cash, position and equity state for one run.
 *
 * <p>{@link #applyFill(Fill)} is the only way to change cash or position. Realized
 * P&amp;L uses average-cost accounting: a reducing fill is measured against the
 * position's blended cost, not against individual lots.
 */
@Getter
public class Portfolio {

    static final int COST_SCALE = 8;

    private final BigDecimal initialCash;
    private final boolean allowShort;
    private final boolean marginEnabled;

    private BigDecimal cash;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal peakEquity;
    private final Position position = new Position();

    @Getter(lombok.AccessLevel.NONE)
    private final List<Trade> trades = new ArrayList<>();

    @Getter(lombok.AccessLevel.NONE)
    private final List<EquitySnapshot> equityHistory = new ArrayList<>();

    @Builder
    public Portfolio(BigDecimal initialCash, boolean allowShort, boolean marginEnabled) {
        if (initialCash == null || initialCash.signum() <= 0) {
            throw new ConfigurationException("initialCash", "Initial cash must be positive, got " + initialCash);
        }
        this.initialCash = initialCash;
        this.cash = initialCash;
        this.allowShort = allowShort;
        this.marginEnabled = marginEnabled;
    }

    /**
     * Apply a fill. Rejections are returned, not thrown, and leave the portfolio untouched.
     */
    public FillOutcome applyFill(Fill fill) {
        int quantity = fill.getQuantity();
        int signed = fill.getSide().sign() * quantity;
        int current = position.getQuantity();

        if (!allowShort && current + signed < 0) {
            return FillOutcome.rejected(CancelReason.SHORT_NOT_ALLOWED,
                    "Sell of " + quantity + " exceeds long position of " + current);
        }
        if (fill.getSide() == OrderSide.BUY && !marginEnabled) {
            BigDecimal outflow = fill.getCashDelta().negate();
            if (outflow.compareTo(cash) > 0) {
                return FillOutcome.rejected(CancelReason.INSUFFICIENT_CASH,
                        "Buy of " + quantity + " needs " + outflow + " but only " + cash + " is available");
            }
        }

        cash = cash.add(fill.getCashDelta());

        List<Trade> closed = new ArrayList<>();
        if (current == 0 || Integer.signum(current) == Integer.signum(signed)) {
            addToPosition(fill, quantity, fill.getCommission());
        } else {
            int closeQuantity = Math.min(quantity, Math.abs(current));
            BigDecimal closeCommission = prorate(fill.getCommission(), closeQuantity, quantity);
            closed.add(closePortion(fill, closeQuantity, closeCommission));

            int remainder = quantity - closeQuantity;
            if (remainder > 0) {
                // crossed zero: the rest opens a position in the fill's direction
                addToPosition(fill, remainder, fill.getCommission().subtract(closeCommission));
            }
        }

        trades.addAll(closed);
        return FillOutcome.accepted(closed);
    }

    public BigDecimal getMarketValue(BigDecimal price) {
        return position.marketValue(price);
    }

    public BigDecimal getEquity(BigDecimal price) {
        return cash.add(getMarketValue(price));
    }

    /**
     * Record equity at the close of {@code bar} and update the running peak.
     */
    public EquitySnapshot snapshot(int barIndex, Bar bar) {
        BigDecimal marketValue = getMarketValue(bar.getClose());
        BigDecimal equity = cash.add(marketValue);

        if (peakEquity == null || equity.compareTo(peakEquity) > 0) {
            peakEquity = equity;
        }
        BigDecimal drawdown = peakEquity.signum() > 0
                ? equity.subtract(peakEquity).divide(peakEquity, COST_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        EquitySnapshot snapshot = EquitySnapshot.builder()
                .barIndex(barIndex)
                .timestamp(bar.getTimestamp())
                .equity(equity)
                .cash(cash)
                .marketValue(marketValue)
                .drawdown(drawdown)
                .build();
        equityHistory.add(snapshot);
        return snapshot;
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<EquitySnapshot> getEquityHistory() {
        return Collections.unmodifiableList(equityHistory);
    }

    private void addToPosition(Fill fill, int quantity, BigDecimal commission) {
        BigDecimal notional = fill.getFillPrice().multiply(BigDecimal.valueOf(quantity));
        // long basis includes costs; short basis is proceeds net of costs
        BigDecimal basis = fill.getSide() == OrderSide.BUY ? notional.add(commission) : notional.subtract(commission);
        int signedAdd = fill.getSide().sign() * quantity;

        if (position.isFlat()) {
            position.open(signedAdd, basis.divide(BigDecimal.valueOf(quantity), COST_SCALE, RoundingMode.HALF_UP), fill);
            return;
        }

        int currentSize = Math.abs(position.getQuantity());
        BigDecimal totalBasis = position.getAverageCost().multiply(BigDecimal.valueOf(currentSize)).add(basis);
        int newSize = currentSize + quantity;
        position.resize(position.getQuantity() + signedAdd,
                totalBasis.divide(BigDecimal.valueOf(newSize), COST_SCALE, RoundingMode.HALF_UP));
    }

    private Trade closePortion(Fill fill, int quantity, BigDecimal commission) {
        BigDecimal size = BigDecimal.valueOf(quantity);
        BigDecimal entryValue = position.getAverageCost().multiply(size);
        BigDecimal exitNotional = fill.getFillPrice().multiply(size);
        boolean wasLong = position.isLong();

        BigDecimal pnl = wasLong
                ? exitNotional.subtract(commission).subtract(entryValue)
                : entryValue.subtract(exitNotional.add(commission));
        BigDecimal pnlPct = entryValue.signum() == 0
                ? BigDecimal.ZERO
                : pnl.divide(entryValue, COST_SCALE, RoundingMode.HALF_UP)
                        .multiply(BigDecimal.valueOf(100))
                        .setScale(4, RoundingMode.HALF_UP);

        realizedPnl = realizedPnl.add(pnl);

        Trade trade = Trade.builder()
                .entryFillId(position.getEntryFillId())
                .exitFillId(fill.getId())
                .side(wasLong ? Trade.PositionSide.LONG : Trade.PositionSide.SHORT)
                .quantity(quantity)
                .entryBarIndex(position.getOpenedAtBarIndex())
                .entryTimestamp(position.getOpenedAt())
                .entryPrice(position.getAverageCost())
                .exitBarIndex(fill.getBarIndex())
                .exitTimestamp(fill.getTimestamp())
                .exitPrice(fill.getFillPrice())
                .pnl(pnl)
                .pnlPct(pnlPct)
                .build();

        int remaining = position.getQuantity() + fill.getSide().sign() * quantity;
        if (remaining == 0) {
            position.reset();
        } else {
            position.resize(remaining, position.getAverageCost());
        }
        return trade;
    }

    private static BigDecimal prorate(BigDecimal amount, int part, int whole) {
        if (part == whole) {
            return amount;
        }
        return amount.multiply(BigDecimal.valueOf(part))
                .divide(BigDecimal.valueOf(whole), COST_SCALE, RoundingMode.HALF_UP);
    }
}
