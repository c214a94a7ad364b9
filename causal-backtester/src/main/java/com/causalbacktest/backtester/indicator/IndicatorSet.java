package com.causalbacktest.backtester.indicator;

import com.causalbacktest.backtester.domain.Bar;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named indicators updated together, once per bar, in insertion order.
 */
public class IndicatorSet {

    private final Map<String, Indicator> indicators = new LinkedHashMap<>();

    public static IndicatorSet empty() {
        return new IndicatorSet();
    }

    public IndicatorSet add(String name, Indicator indicator) {
        if (indicators.containsKey(name)) {
            throw new IllegalArgumentException("Indicator '" + name + "' is already registered");
        }
        indicators.put(name, indicator);
        return this;
    }

    public void update(Bar bar) {
        for (Indicator indicator : indicators.values()) {
            indicator.update(bar);
        }
    }

    /**
     * Latest value of the named indicator; empty while it is not available.
     *
     * @throws IllegalArgumentException if no indicator is registered under {@code name}
     */
    public Optional<BigDecimal> value(String name) {
        return get(name).value();
    }

    public Indicator get(String name) {
        Indicator indicator = indicators.get(name);
        if (indicator == null) {
            throw new IllegalArgumentException("Unknown indicator '" + name + "'");
        }
        return indicator;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(indicators.keySet());
    }

    public boolean isEmpty() {
        return indicators.isEmpty();
    }
}
