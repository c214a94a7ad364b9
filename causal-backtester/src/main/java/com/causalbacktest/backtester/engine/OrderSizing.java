package com.causalbacktest.backtester.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How many units an order asks for. Resolved against equity and a reference price
 * at submission time, always rounded down to whole units.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderSizing {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public enum Mode {
        SHARES,
        PERCENT_OF_EQUITY,
        RISK
    }

    Mode mode;
    int shares;
    BigDecimal percent;
    BigDecimal stopDistance;

    public static OrderSizing shares(int quantity) {
        return new OrderSizing(Mode.SHARES, quantity, null, null);
    }

    public static OrderSizing percentOfEquity(BigDecimal percent) {
        return new OrderSizing(Mode.PERCENT_OF_EQUITY, 0, percent, null);
    }

    public static OrderSizing percentOfEquity(double percent) {
        return percentOfEquity(BigDecimal.valueOf(percent));
    }

    /**
     * Size so that a move of {@code stopDistance} against the position loses
     * {@code riskPercent} of equity.
     */
    public static OrderSizing risk(BigDecimal riskPercent, BigDecimal stopDistance) {
        return new OrderSizing(Mode.RISK, 0, riskPercent, stopDistance);
    }

    /**
     * @return the unit count; zero or negative when the sizing cannot produce an order,
     *         including a count too large for an int
     */
    public int resolve(BigDecimal equity, BigDecimal referencePrice) {
        switch (mode) {
            case SHARES:
                return shares;
            case PERCENT_OF_EQUITY:
                if (referencePrice == null || referencePrice.signum() <= 0 || percent.signum() <= 0) {
                    return 0;
                }
                return toUnits(equity.multiply(percent).divide(HUNDRED.multiply(referencePrice), 0, RoundingMode.FLOOR));
            case RISK:
                if (stopDistance == null || stopDistance.signum() <= 0 || percent.signum() <= 0) {
                    return 0;
                }
                return toUnits(equity.multiply(percent).divide(HUNDRED.multiply(stopDistance), 0, RoundingMode.FLOOR));
            default:
                throw new IllegalArgumentException("Unsupported sizing mode " + mode);
        }
    }

    // Oversized counts resolve to zero so the submission is refused instead of wrapping.
    private static int toUnits(BigDecimal units) {
        try {
            return units.intValueExact();
        } catch (ArithmeticException e) {
            return 0;
        }
    }
}
