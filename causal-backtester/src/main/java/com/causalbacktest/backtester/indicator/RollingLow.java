package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;

import java.math.BigDecimal;

/**
 * Lowest price over the last {@code period} bars, current bar included.
 */
public class RollingLow extends AbstractIndicator {

    private final PriceSource source;
    private final RollingWindow window;

    public RollingLow(int period) {
        this(period, PriceSource.LOW);
    }

    public RollingLow(int period, PriceSource source) {
        this.source = source;
        this.window = new RollingWindow(requirePeriod(period));
    }

    public int getPeriod() {
        return window.capacity();
    }

    @Override
    protected BigDecimal compute(Bar bar) {
        window.add(source.extract(bar));
        return window.isFull() ? window.min() : null;
    }
}
