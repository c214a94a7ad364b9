package com.causalbacktest.backtester.domain;

import java.util.List;

/**
 * Bars up to and including the current bar. There is no way to read past the
 * current index through this view.
 */
public final class BarHistory {

    private final List<Bar> bars;
    private final int currentIndex;

    BarHistory(List<Bar> bars, int currentIndex) {
        this.bars = bars;
        this.currentIndex = currentIndex;
    }

    public int currentIndex() {
        return currentIndex;
    }

    public Bar current() {
        return bars.get(currentIndex);
    }

    public int size() {
        return currentIndex + 1;
    }

    public Bar bar(int index) {
        if (index > currentIndex) {
            throw new IllegalArgumentException(
                    "Bar " + index + " is not closed yet (current bar is " + currentIndex + ")");
        }
        if (index < 0) {
            throw new IndexOutOfBoundsException("Negative bar index " + index);
        }
        return bars.get(index);
    }

    /**
     * Bar {@code n} bars before the current one; {@code barsAgo(0)} is the current bar.
     */
    public Bar barsAgo(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("barsAgo must be non-negative, got " + n);
        }
        return bar(currentIndex - n);
    }

    /**
     * The last {@code count} bars ending with the current one, oldest first.
     */
    public List<Bar> lookback(int count) {
        if (count <= 0 || count > size()) {
            throw new IllegalArgumentException("Lookback of " + count + " bars not available at bar " + currentIndex);
        }
        return bars.subList(currentIndex - count + 1, currentIndex + 1);
    }
}
