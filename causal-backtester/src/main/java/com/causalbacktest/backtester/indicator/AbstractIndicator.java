package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Keeps the latest value and update count; subclasses only compute.
 */
public abstract class AbstractIndicator implements Indicator {

    protected static final MathContext MC = MathContext.DECIMAL64;

    private Optional<BigDecimal> current = Optional.empty();
    private int count;

    @Override
    public final Optional<BigDecimal> update(Bar bar) {
        count++;
        current = Optional.ofNullable(compute(bar));
        return current;
    }

    @Override
    public final Optional<BigDecimal> value() {
        return current;
    }

    @Override
    public final int count() {
        return count;
    }

    /**
     * @return the new value, or null while not enough bars have been seen
     */
    protected abstract BigDecimal compute(Bar bar);

    protected static int requirePeriod(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Indicator period must be at least 1, got " + period);
        }
        return period;
    }
}
