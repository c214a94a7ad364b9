package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;

import java.math.BigDecimal;

/**
 * Highest price over the last {@code period} bars, current bar included.
 */
public class RollingHigh extends AbstractIndicator {

    private final PriceSource source;
    private final RollingWindow window;

    public RollingHigh(int period) {
        this(period, PriceSource.HIGH);
    }

    public RollingHigh(int period, PriceSource source) {
        this.source = source;
        this.window = new RollingWindow(requirePeriod(period));
    }

    public int getPeriod() {
        return window.capacity();
    }

    @Override
    protected BigDecimal compute(Bar bar) {
        window.add(source.extract(bar));
        return window.isFull() ? window.max() : null;
    }
}
