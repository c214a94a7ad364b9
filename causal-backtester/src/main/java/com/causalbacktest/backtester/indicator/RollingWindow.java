package com.causalbacktest.backtester.indicator;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-size FIFO of values with an exact running sum.
 */
final class RollingWindow {

    private final int capacity;
    private final Deque<BigDecimal> values;
    private BigDecimal sum = BigDecimal.ZERO;

    RollingWindow(int capacity) {
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    void add(BigDecimal value) {
        values.addLast(value);
        sum = sum.add(value);
        if (values.size() > capacity) {
            sum = sum.subtract(values.removeFirst());
        }
    }

    boolean isFull() {
        return values.size() == capacity;
    }

    BigDecimal sum() {
        return sum;
    }

    BigDecimal max() {
        return values.stream().reduce(BigDecimal::max).orElseThrow();
    }

    BigDecimal min() {
        return values.stream().reduce(BigDecimal::min).orElseThrow();
    }

    int capacity() {
        return capacity;
    }
}
