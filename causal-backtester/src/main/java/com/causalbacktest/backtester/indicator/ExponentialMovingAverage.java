package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Exponential moving average with {@code alpha = 2 / (period + 1)}, seeded with the
 * simple average of the first {@code period} prices.
 */
public class ExponentialMovingAverage extends AbstractIndicator {

    @Getter
    private final int period;
    private final PriceSource source;
    private final BigDecimal alpha;
    private final RollingWindow seed;
    private BigDecimal ema;

    public ExponentialMovingAverage(int period) {
        this(period, PriceSource.CLOSE);
    }

    public ExponentialMovingAverage(int period, PriceSource source) {
        this.period = requirePeriod(period);
        this.source = source;
        this.alpha = BigDecimal.valueOf(2).divide(BigDecimal.valueOf(period + 1L), MC);
        this.seed = new RollingWindow(period);
    }

    @Override
    protected BigDecimal compute(Bar bar) {
        return accept(source.extract(bar));
    }

    /**
     * Feed one raw value; used directly by composite indicators.
     */
    BigDecimal accept(BigDecimal value) {
        if (ema == null) {
            seed.add(value);
            if (!seed.isFull()) {
                return null;
            }
            ema = seed.sum().divide(BigDecimal.valueOf(period), MC);
            return ema;
        }
        ema = alpha.multiply(value, MC).add(BigDecimal.ONE.subtract(alpha).multiply(ema, MC), MC);
        return ema;
    }
}
