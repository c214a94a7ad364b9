package com.causalbacktest.backtester.data;

import com.causalbacktest.backtester.domain.Bar;
import com.causalbacktest.backtester.domain.BarFeed;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic random-walk daily bars for demos and tests. Weekends are skipped and
 * every bar satisfies {@code low <= min(open, close) <= max(open, close) <= high}.
 */
public class SyntheticBarGenerator {

    public static final long DEFAULT_SEED = 42L;

    private static final BigDecimal MIN_PRICE = BigDecimal.ONE;

    private final long seed;
    private final double dailyVolatility;
    private final double dailyDrift;

    public SyntheticBarGenerator() {
        this(DEFAULT_SEED, 0.02, 0.0003);
    }

    public SyntheticBarGenerator(long seed, double dailyVolatility, double dailyDrift) {
        this.seed = seed;
        this.dailyVolatility = dailyVolatility;
        this.dailyDrift = dailyDrift;
    }

    /**
     * Weekday bars from {@code startDate} through {@code endDate}, both inclusive.
     */
    public BarFeed generate(String symbol, LocalDate startDate, LocalDate endDate) {
        long days = endDate.toEpochDay() - startDate.toEpochDay() + 1;
        return BarFeed.of(symbol, bars(startDate, endDate, (int) Math.max(days, 0)));
    }

    /**
     * Exactly {@code count} weekday bars starting at {@code startDate}.
     */
    public BarFeed generate(String symbol, LocalDate startDate, int count) {
        return BarFeed.of(symbol, bars(startDate, null, count));
    }

    private List<Bar> bars(LocalDate startDate, LocalDate endDate, int limit) {
        Random random = new Random(seed);
        List<Bar> bars = new ArrayList<>();
        BigDecimal previousClose = new BigDecimal("100.00");
        LocalDate date = startDate;

        while (bars.size() < limit && (endDate == null || !date.isAfter(endDate))) {
            if (date.getDayOfWeek() != DayOfWeek.SATURDAY && date.getDayOfWeek() != DayOfWeek.SUNDAY) {
                BigDecimal open = previousClose.multiply(BigDecimal.valueOf(1 + random.nextGaussian() * 0.005))
                        .max(MIN_PRICE).setScale(2, RoundingMode.HALF_UP);
                double changePercent = random.nextGaussian() * dailyVolatility + dailyDrift;
                BigDecimal close = open.multiply(BigDecimal.valueOf(1 + changePercent))
                        .max(MIN_PRICE).setScale(2, RoundingMode.HALF_UP);

                BigDecimal high = open.max(close)
                        .multiply(BigDecimal.valueOf(1 + Math.abs(random.nextGaussian()) * 0.01))
                        .setScale(2, RoundingMode.CEILING);
                BigDecimal low = open.min(close)
                        .multiply(BigDecimal.valueOf(1 - Math.min(Math.abs(random.nextGaussian()) * 0.01, 0.5)))
                        .setScale(2, RoundingMode.FLOOR);

                bars.add(Bar.builder()
                        .timestamp(date.atStartOfDay())
                        .open(open)
                        .high(high)
                        .low(low)
                        .close(close)
                        .volume(1_000_000L + random.nextInt(500_000))
                        .build());
                previousClose = close;
            }
            date = date.plusDays(1);
        }
        return bars;
    }
}
