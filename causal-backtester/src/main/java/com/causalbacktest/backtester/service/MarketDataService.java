package com.causalbacktest.backtester.service;

import com.causalbacktest.backtester.config.BacktestProperties;
import com.causalbacktest.backtester.data.CsvBarLoader;
import com.causalbacktest.backtester.data.SyntheticBarGenerator;
import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.DataValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Service for loading market data.
 * Reads {@code SYMBOL.csv}, or {@code SYMBOL_sample.csv}, from the configured data
 * directory and falls back to synthetic data if neither exists and the fallback is
 * enabled. Symbols that would resolve outside the directory are rejected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService {

    private static final String SAMPLE_SUFFIX = "_sample";

    private final BacktestProperties properties;
    private final CsvBarLoader csvBarLoader;
    private final SyntheticBarGenerator syntheticBarGenerator;

    /**
     * Load bars for the given symbol restricted to {@code [startDate, endDate]}.
     *
     * @throws DataValidationException if the range is inverted, no data source exists,
     *                                 or the data is malformed
     */
    public BarFeed loadBars(String symbol, LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new DataValidationException("endDate", "End date " + endDate + " is before start date " + startDate);
        }
        log.info("Loading market data for {} from {} to {}", symbol, startDate, endDate);

        Optional<Path> file = findDataFile(symbol);
        if (file.isPresent()) {
            BarFeed feed = csvBarLoader.load(symbol, file.get()).between(startDate, endDate);
            log.info("Loaded {} bars for {} from {}", feed.length(), symbol, file.get());
            return feed;
        }

        if (!properties.getData().isSyntheticFallback()) {
            throw new DataValidationException("symbol", "No data file for " + symbol);
        }
        if (startDate == null || endDate == null) {
            throw new DataValidationException("startDate", "Synthetic data needs both a start and an end date");
        }

        log.warn("No data file found for {}. Generating synthetic data.", symbol);
        BarFeed synthetic = syntheticBarGenerator.generate(symbol, startDate, endDate);
        log.info("Generated {} synthetic bars for {}", synthetic.length(), symbol);
        return synthetic;
    }

    /**
     * {@code SYMBOL.csv}, then {@code SYMBOL_sample.csv}. Both must resolve inside the
     * data directory.
     */
    private Optional<Path> findDataFile(String symbol) {
        Path directory = Paths.get(properties.getData().getDirectory()).toAbsolutePath().normalize();
        String baseName = symbol.toUpperCase(Locale.ROOT);
        for (String fileName : List.of(baseName + ".csv", baseName + SAMPLE_SUFFIX + ".csv")) {
            Path file = resolveInside(directory, fileName, symbol);
            if (Files.isRegularFile(file)) {
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }

    private static Path resolveInside(Path directory, String fileName, String symbol) {
        Path file;
        try {
            file = directory.resolve(fileName).normalize();
        } catch (InvalidPathException e) {
            throw new DataValidationException("symbol", "Symbol " + symbol + " is not a valid file name", e);
        }
        if (!directory.equals(file.getParent())) {
            throw new DataValidationException("symbol", "Symbol " + symbol + " does not name a file in the data directory");
        }
        return file;
    }
}
