package com.causalbacktest.backtester.optimizer;

import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered mapping of parameter name to candidate values. Enumerates the full Cartesian
 * product with the last parameter varying fastest, so combination {@code i} is the same
 * on every run.
 */
public final class ParameterGrid {

    private final Map<String, List<Object>> values;

    private ParameterGrid(Map<String, List<Object>> values) {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        values.forEach((name, candidates) ->
                copy.put(name, candidates == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(candidates))));
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Accepts anything, including an empty grid; {@link #validate()} reports problems so
     * that they surface as configuration errors when a sweep starts.
     */
    @JsonCreator
    public static ParameterGrid of(Map<String, List<Object>> values) {
        return new ParameterGrid(values == null ? Map.of() : values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws ConfigurationException if the grid is empty or any parameter has no values
     */
    public ParameterGrid validate() {
        if (values.isEmpty()) {
            throw new ConfigurationException("grid", "Parameter grid must contain at least one parameter");
        }
        values.forEach((name, candidates) -> {
            if (candidates.isEmpty()) {
                throw new ConfigurationException(name, "Parameter " + name + " has no values to sweep");
            }
        });
        return this;
    }

    /**
     * Number of combinations: the product of the value counts.
     */
    public long size() {
        if (values.isEmpty()) {
            return 0;
        }
        long size = 1;
        for (List<Object> candidates : values.values()) {
            size *= candidates.size();
        }
        return size;
    }

    public List<ParameterSet> combinations() {
        validate();
        List<String> names = new ArrayList<>(values.keySet());
        List<ParameterSet> result = new ArrayList<>();
        int[] cursor = new int[names.size()];

        while (true) {
            Map<String, Object> combination = new LinkedHashMap<>();
            for (int p = 0; p < names.size(); p++) {
                combination.put(names.get(p), values.get(names.get(p)).get(cursor[p]));
            }
            result.add(ParameterSet.of(combination));

            int p = names.size() - 1;
            while (p >= 0) {
                cursor[p]++;
                if (cursor[p] < values.get(names.get(p)).size()) {
                    break;
                }
                cursor[p] = 0;
                p--;
            }
            if (p < 0) {
                return result;
            }
        }
    }

    public List<String> parameterNames() {
        return List.copyOf(values.keySet());
    }

    @JsonValue
    public Map<String, List<Object>> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final Map<String, List<Object>> values = new LinkedHashMap<>();

        public Builder add(String name, Object... candidates) {
            values.put(name, List.of(candidates));
            return this;
        }

        public Builder add(String name, List<?> candidates) {
            values.put(name, new ArrayList<>(candidates));
            return this;
        }

        public ParameterGrid build() {
            return new ParameterGrid(values);
        }
    }
}
