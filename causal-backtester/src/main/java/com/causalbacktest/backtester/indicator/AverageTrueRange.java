package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Simple average of the true range over {@code period} bars. The first bar's
 * true range is its high-low span.
 */
public class AverageTrueRange extends AbstractIndicator {

    @Getter
    private final int period;
    private final RollingWindow trueRanges;
    private BigDecimal previousClose;

    public AverageTrueRange(int period) {
        this.period = requirePeriod(period);
        this.trueRanges = new RollingWindow(period);
    }

    @Override
    protected BigDecimal compute(Bar bar) {
        BigDecimal range = bar.getHigh().subtract(bar.getLow());
        if (previousClose != null) {
            range = range
                    .max(bar.getHigh().subtract(previousClose).abs())
                    .max(bar.getLow().subtract(previousClose).abs());
        }
        previousClose = bar.getClose();
        trueRanges.add(range);

        if (!trueRanges.isFull()) {
            return null;
        }
        return trueRanges.sum().divide(BigDecimal.valueOf(period), MC);
    }
}
