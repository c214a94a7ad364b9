package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Arithmetic mean of the last {@code period} prices.
 */
public class SimpleMovingAverage extends AbstractIndicator {

    @Getter
    private final int period;
    private final PriceSource source;
    private final RollingWindow window;

    public SimpleMovingAverage(int period) {
        this(period, PriceSource.CLOSE);
    }

    public SimpleMovingAverage(int period, PriceSource source) {
        this.period = requirePeriod(period);
        this.source = source;
        this.window = new RollingWindow(period);
    }

    @Override
    protected BigDecimal compute(Bar bar) {
        window.add(source.extract(bar));
        if (!window.isFull()) {
            return null;
        }
        return window.sum().divide(BigDecimal.valueOf(period), MC);
    }
}
