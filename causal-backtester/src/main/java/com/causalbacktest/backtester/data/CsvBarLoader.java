package com.causalbacktest.backtester.data;

import com.causalbacktest.backtester.domain.Bar;
import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.DataValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads OHLCV CSV into a validated {@link BarFeed}.
 *
 * <p>With a header row, columns are matched by name, case-insensitively, in any order;
 * {@code datetime}, {@code timestamp}, {@code date} or {@code time} names the time column.
 * Rows of a file with a {@code symbol} column are kept only when they belong to the
 * requested symbol. Without a header the order is {@code timestamp,open,high,low,close,volume}.
 * Rows must already be in ascending time order; malformed rows are fatal.
 */
@Slf4j
public class CsvBarLoader {

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    };

    private static final DateTimeFormatter[] DATE_TIME_FORMATTERS = {
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
    };

    private static final String TIMESTAMP = "timestamp";
    private static final String SYMBOL = "symbol";
    private static final Set<String> TIMESTAMP_ALIASES = Set.of("datetime", "timestamp", "date", "time");
    private static final List<String> REQUIRED_COLUMNS = List.of(TIMESTAMP, "open", "high", "low", "close", "volume");

    /**
     * Load a file. The reader is closed on success and on failure.
     *
     * @throws DataValidationException if the file cannot be read, the header lacks a
     *                                 required column, or a row is malformed
     */
    public BarFeed load(String symbol, Path path) {
        log.info("Loading bars for {} from {}", symbol, path);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(symbol, reader);
        } catch (IOException e) {
            throw new DataValidationException("file", "Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse CSV from a reader owned by the caller.
     */
    public BarFeed load(String symbol, Reader source) {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<Bar> bars = new ArrayList<>();
        ColumnLayout layout = null;
        int lineNumber = 0;
        int otherSymbolRows = 0;

        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                if (layout == null) {
                    if (isHeader(line)) {
                        layout = ColumnLayout.fromHeader(line);
                        continue;
                    }
                    layout = ColumnLayout.POSITIONAL;
                }
                String[] cells = line.split(",", -1);
                if (cells.length < layout.width()) {
                    throw new DataValidationException("row",
                            "Line " + lineNumber + " has " + cells.length + " columns, expected " + layout.width());
                }
                if (layout.symbol >= 0 && !cells[layout.symbol].trim().equalsIgnoreCase(symbol)) {
                    otherSymbolRows++;
                    continue;
                }
                bars.add(parseRow(cells, layout, lineNumber));
            }
        } catch (IOException e) {
            throw new DataValidationException("file", "Failed to read CSV for " + symbol + ": " + e.getMessage(), e);
        }

        if (otherSymbolRows > 0) {
            log.debug("Skipped {} rows belonging to other symbols than {}", otherSymbolRows, symbol);
        }
        BarFeed feed = BarFeed.of(symbol, bars);
        log.info("Loaded {} bars for {} ({} to {})", feed.length(), symbol, feed.firstTimestamp(), feed.lastTimestamp());
        return feed;
    }

    private static boolean isHeader(String line) {
        String[] cells = line.split(",", -1);
        String first = normalize(cells[0]);
        if (first.contains("date") || first.contains("time")) {
            return true;
        }
        for (String cell : cells) {
            String name = normalize(cell);
            if (REQUIRED_COLUMNS.contains(name) || TIMESTAMP_ALIASES.contains(name) || SYMBOL.equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String cell) {
        return cell.trim().toLowerCase(Locale.ROOT);
    }

    private Bar parseRow(String[] cells, ColumnLayout layout, int lineNumber) {
        return Bar.builder()
                .timestamp(parseTimestamp(cells[layout.timestamp].trim(), lineNumber))
                .open(parseDecimal(cells[layout.open], "open", lineNumber))
                .high(parseDecimal(cells[layout.high], "high", lineNumber))
                .low(parseDecimal(cells[layout.low], "low", lineNumber))
                .close(parseDecimal(cells[layout.close], "close", lineNumber))
                .volume(parseVolume(cells[layout.volume], lineNumber))
                .build();
    }

    /**
     * Column positions for one file; {@code symbol} is -1 when the file has none.
     */
    private static final class ColumnLayout {

        static final ColumnLayout POSITIONAL = new ColumnLayout(0, 1, 2, 3, 4, 5, -1);

        final int timestamp;
        final int open;
        final int high;
        final int low;
        final int close;
        final int volume;
        final int symbol;

        private ColumnLayout(int timestamp, int open, int high, int low, int close, int volume, int symbol) {
            this.timestamp = timestamp;
            this.open = open;
            this.high = high;
            this.low = low;
            this.close = close;
            this.volume = volume;
            this.symbol = symbol;
        }

        static ColumnLayout fromHeader(String header) {
            String[] names = header.split(",", -1);
            Map<String, Integer> index = new HashMap<>();
            for (int i = 0; i < names.length; i++) {
                String name = normalize(names[i]);
                index.putIfAbsent(TIMESTAMP_ALIASES.contains(name) ? TIMESTAMP : name, i);
            }
            List<String> missing = REQUIRED_COLUMNS.stream()
                    .filter(column -> !index.containsKey(column))
                    .toList();
            if (!missing.isEmpty()) {
                throw new DataValidationException("header", "Header is missing required columns " + missing);
            }
            return new ColumnLayout(index.get(TIMESTAMP), index.get("open"), index.get("high"), index.get("low"),
                    index.get("close"), index.get("volume"), index.getOrDefault(SYMBOL, -1));
        }

        int width() {
            int widest = Math.max(Math.max(timestamp, open), Math.max(high, low));
            widest = Math.max(widest, Math.max(Math.max(close, volume), symbol));
            return widest + 1;
        }
    }

    /**
     * Empty cells come back as null so the feed reports the missing field by name.
     */
    private static BigDecimal parseDecimal(String raw, String field, int lineNumber) {
        String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new DataValidationException(field, "Line " + lineNumber + " has non-numeric " + field + " '" + value + "'");
        }
    }

    private static Long parseVolume(String raw, int lineNumber) {
        String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(value).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new DataValidationException("volume", "Line " + lineNumber + " has invalid volume '" + value + "'");
        }
    }

    private static LocalDateTime parseTimestamp(String value, int lineNumber) {
        if (value.isEmpty()) {
            throw new DataValidationException("timestamp", "Line " + lineNumber + " has no timestamp");
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return LocalDateTime.parse(value, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Timestamp '{}' does not match {}", value, formatter);
            }
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(value, formatter).atStartOfDay();
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", value, formatter);
            }
        }
        throw new DataValidationException("timestamp", "Line " + lineNumber + " has unparseable timestamp '" + value + "'");
    }
}
