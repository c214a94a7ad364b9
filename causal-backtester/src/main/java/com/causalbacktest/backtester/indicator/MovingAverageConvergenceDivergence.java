package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * MACD line (fast EMA minus slow EMA). The main value is reported once the
 * signal EMA of the MACD line is seeded; signal and histogram are exposed separately.
 */
public class MovingAverageConvergenceDivergence extends AbstractIndicator {

    private final PriceSource source;
    private final ExponentialMovingAverage fast;
    private final ExponentialMovingAverage slow;
    private final ExponentialMovingAverage signalLine;
    private BigDecimal signal;
    private BigDecimal histogram;

    public MovingAverageConvergenceDivergence() {
        this(12, 26, 9);
    }

    public MovingAverageConvergenceDivergence(int fastPeriod, int slowPeriod, int signalPeriod) {
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("MACD fast period must be less than slow period");
        }
        this.source = PriceSource.CLOSE;
        this.fast = new ExponentialMovingAverage(fastPeriod);
        this.slow = new ExponentialMovingAverage(slowPeriod);
        this.signalLine = new ExponentialMovingAverage(signalPeriod);
    }

    @Override
    protected BigDecimal compute(Bar bar) {
        BigDecimal price = source.extract(bar);
        BigDecimal fastValue = fast.accept(price);
        BigDecimal slowValue = slow.accept(price);
        if (fastValue == null || slowValue == null) {
            return null;
        }

        BigDecimal macd = fastValue.subtract(slowValue, MC);
        signal = signalLine.accept(macd);
        if (signal == null) {
            return null;
        }
        histogram = macd.subtract(signal, MC);
        return macd;
    }

    public Optional<BigDecimal> signal() {
        return value().map(v -> signal);
    }

    public Optional<BigDecimal> histogram() {
        return value().map(v -> histogram);
    }
}
