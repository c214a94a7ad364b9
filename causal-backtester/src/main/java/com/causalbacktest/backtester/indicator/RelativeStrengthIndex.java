package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * RSI over simple averages of the last {@code period} gains and losses.
 * Reads 100 when the window holds no losses.
 */
public class RelativeStrengthIndex extends AbstractIndicator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Getter
    private final int period;
    private final PriceSource source;
    private final RollingWindow gains;
    private final RollingWindow losses;
    private BigDecimal previous;

    public RelativeStrengthIndex(int period) {
        this(period, PriceSource.CLOSE);
    }

    public RelativeStrengthIndex(int period, PriceSource source) {
        this.period = requirePeriod(period);
        this.source = source;
        this.gains = new RollingWindow(period);
        this.losses = new RollingWindow(period);
    }

    @Override
    protected BigDecimal compute(Bar bar) {
        BigDecimal price = source.extract(bar);
        if (previous == null) {
            previous = price;
            return null;
        }

        BigDecimal change = price.subtract(previous);
        previous = price;
        gains.add(change.max(BigDecimal.ZERO));
        losses.add(change.negate().max(BigDecimal.ZERO));

        if (!gains.isFull()) {
            return null;
        }
        if (losses.sum().signum() == 0) {
            return HUNDRED;
        }
        // the period divisors cancel out in avgGain / avgLoss
        BigDecimal rs = gains.sum().divide(losses.sum(), MC);
        return HUNDRED.subtract(HUNDRED.divide(BigDecimal.ONE.add(rs), MC));
    }
}
