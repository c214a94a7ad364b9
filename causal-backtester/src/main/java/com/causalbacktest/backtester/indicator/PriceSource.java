package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Which price of a bar an indicator consumes.
 */
public enum PriceSource {
    OPEN, HIGH, LOW, CLOSE, TYPICAL;

    private static final BigDecimal THREE = BigDecimal.valueOf(3);

    public BigDecimal extract(Bar bar) {
        return switch (this) {
            case OPEN -> bar.getOpen();
            case HIGH -> bar.getHigh();
            case LOW -> bar.getLow();
            case CLOSE -> bar.getClose();
            case TYPICAL -> bar.getHigh().add(bar.getLow()).add(bar.getClose())
                    .divide(THREE, MathContext.DECIMAL64);
        };
    }
}
