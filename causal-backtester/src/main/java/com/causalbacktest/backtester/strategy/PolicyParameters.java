package com.causalbacktest.backtester.strategy;

import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.ParameterSet;

import java.math.BigDecimal;

/**
 * Shared parameter checks for the built-in policies. Defaults are merged in by the
 * engine, so a missing value here means the policy declared none.
 */
final class PolicyParameters {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PolicyParameters() {
    }

    static int period(ParameterSet parameters, String name) {
        int value = parameters.getInt(name, 0);
        if (value < 1) {
            throw new ConfigurationException(name, "Parameter " + name + " must be a positive integer, got "
                    + parameters.get(name));
        }
        return value;
    }

    static BigDecimal positive(ParameterSet parameters, String name) {
        BigDecimal value = parameters.getDecimal(name, null);
        if (value == null || value.signum() <= 0) {
            throw new ConfigurationException(name, "Parameter " + name + " must be positive, got " + value);
        }
        return value;
    }

    static BigDecimal nonNegative(ParameterSet parameters, String name) {
        BigDecimal value = parameters.getDecimal(name, null);
        if (value == null || value.signum() < 0) {
            throw new ConfigurationException(name, "Parameter " + name + " must be non-negative, got " + value);
        }
        return value;
    }

    /**
     * A percentage in {@code (0, 100]}.
     */
    static BigDecimal percent(ParameterSet parameters, String name) {
        BigDecimal value = positive(parameters, name);
        if (value.compareTo(HUNDRED) > 0) {
            throw new ConfigurationException(name, "Parameter " + name + " must be at most 100, got " + value);
        }
        return value;
    }
}
