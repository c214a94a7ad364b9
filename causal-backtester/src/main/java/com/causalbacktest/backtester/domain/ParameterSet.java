package com.causalbacktest.backtester.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, ordered set of named policy parameters.
 */
@EqualsAndHashCode
public final class ParameterSet {

    private static final ParameterSet EMPTY = new ParameterSet(Map.of());

    private final Map<String, Object> values;

    private ParameterSet(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @JsonCreator
    public static ParameterSet of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ParameterSet(values);
    }

    public static ParameterSet empty() {
        return EMPTY;
    }

    public ParameterSet with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new ParameterSet(copy);
    }

    /**
     * This set with {@code overrides} applied on top; keys keep this set's order first.
     */
    public ParameterSet merge(ParameterSet overrides) {
        if (overrides == null || overrides.values.isEmpty()) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(overrides.values);
        return new ParameterSet(copy);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public int getInt(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            BigDecimal decimal = new BigDecimal(number.toString());
            try {
                return decimal.intValueExact();
            } catch (ArithmeticException e) {
                throw new ConfigurationException(name, "Parameter " + name + " must be an integer, got " + value);
            }
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name, "Parameter " + name + " must be an integer, got " + value);
        }
    }

    public BigDecimal getDecimal(String name, BigDecimal defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name, "Parameter " + name + " must be numeric, got " + value);
        }
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
