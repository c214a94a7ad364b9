package com.causalbacktest.backtester.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, validated sequence of bars for one symbol.
 *
 * <p>The feed is the only source of truth for what is known at a given bar index.
 * The engine and decision policies never see the feed itself; they receive a
 * {@link BarHistory} bounded by the current bar.
 */
public final class BarFeed {

    private final String symbol;
    private final List<Bar> bars;

    public BarFeed(String symbol, List<Bar> bars) {
        if (bars == null || bars.isEmpty()) {
            throw new DataValidationException("bars", "Bar feed for " + symbol + " contains no bars");
        }
        validate(bars);
        this.symbol = symbol;
        this.bars = Collections.unmodifiableList(new ArrayList<>(bars));
    }

    public static BarFeed of(String symbol, List<Bar> bars) {
        return new BarFeed(symbol, bars);
    }

    public String getSymbol() {
        return symbol;
    }

    public int length() {
        return bars.size();
    }

    public Bar bar(int index) {
        checkIndex(index);
        return bars.get(index);
    }

    /**
     * Lookback window of bars {@code from..to}, both inclusive.
     */
    public List<Bar> slice(int from, int to) {
        checkIndex(from);
        checkIndex(to);
        if (from > to) {
            throw new IllegalArgumentException("slice start " + from + " is after end " + to);
        }
        return bars.subList(from, to + 1);
    }

    /**
     * Independent feed over {@code [from, toExclusive)}. Walk-forward windows are built
     * from these so that a train run cannot reach bars outside its own range.
     */
    public BarFeed subFeed(int from, int toExclusive) {
        if (from < 0 || toExclusive > bars.size() || from >= toExclusive) {
            throw new IllegalArgumentException(
                    "Invalid sub-feed range [" + from + ", " + toExclusive + ") for " + bars.size() + " bars");
        }
        return new BarFeed(symbol, bars.subList(from, toExclusive));
    }

    /**
     * Bars whose date lies within {@code [start, end]}. Either bound may be null.
     */
    public BarFeed between(LocalDate start, LocalDate end) {
        List<Bar> selected = new ArrayList<>();
        for (Bar bar : bars) {
            LocalDate date = bar.getTimestamp().toLocalDate();
            if ((start == null || !date.isBefore(start)) && (end == null || !date.isAfter(end))) {
                selected.add(bar);
            }
        }
        if (selected.isEmpty()) {
            throw new DataValidationException("dateRange",
                    "No data available for " + symbol + " between " + start + " and " + end);
        }
        return new BarFeed(symbol, selected);
    }

    /**
     * Read-only view that refuses any index after {@code currentIndex}.
     */
    public BarHistory historyUntil(int currentIndex) {
        checkIndex(currentIndex);
        return new BarHistory(bars, currentIndex);
    }

    public LocalDateTime firstTimestamp() {
        return bars.get(0).getTimestamp();
    }

    public LocalDateTime lastTimestamp() {
        return bars.get(bars.size() - 1).getTimestamp();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= bars.size()) {
            throw new IndexOutOfBoundsException("Bar index " + index + " outside feed of length " + bars.size());
        }
    }

    private static void validate(List<Bar> bars) {
        LocalDateTime previous = null;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null) {
                throw new DataValidationException("bar", "Row " + i + " is missing");
            }
            if (bar.getTimestamp() == null) {
                throw new DataValidationException("timestamp", "Row " + i + " has no timestamp");
            }
            requirePositive(bar.getOpen(), "open", i);
            requirePositive(bar.getHigh(), "high", i);
            requirePositive(bar.getLow(), "low", i);
            requirePositive(bar.getClose(), "close", i);
            if (bar.getVolume() == null) {
                throw new DataValidationException("volume", "Row " + i + " has no volume");
            }
            if (bar.getVolume() < 0) {
                throw new DataValidationException("volume", "Row " + i + " has negative volume " + bar.getVolume());
            }

            BigDecimal bodyHigh = bar.getOpen().max(bar.getClose());
            BigDecimal bodyLow = bar.getOpen().min(bar.getClose());
            if (bar.getHigh().compareTo(bodyHigh) < 0) {
                throw new DataValidationException("high",
                        "Row " + i + " high " + bar.getHigh() + " is below open/close " + bodyHigh);
            }
            if (bar.getLow().compareTo(bodyLow) > 0) {
                throw new DataValidationException("low",
                        "Row " + i + " low " + bar.getLow() + " is above open/close " + bodyLow);
            }

            if (previous != null && !bar.getTimestamp().isAfter(previous)) {
                String problem = bar.getTimestamp().isEqual(previous) ? "duplicates" : "precedes";
                throw new DataValidationException("timestamp",
                        "Row " + i + " timestamp " + bar.getTimestamp() + " " + problem + " previous " + previous);
            }
            previous = bar.getTimestamp();
        }
    }

    private static void requirePositive(BigDecimal value, String field, int row) {
        if (value == null) {
            throw new DataValidationException(field, "Row " + row + " is missing " + field);
        }
        if (value.signum() <= 0) {
            throw new DataValidationException(field, "Row " + row + " has non-positive " + field + " " + value);
        }
    }
}
