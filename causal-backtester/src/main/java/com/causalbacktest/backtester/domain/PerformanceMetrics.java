package com.causalbacktest.backtester.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Calculator for backtest performance metrics.
 *
 * <p>Degenerate inputs resolve to fixed values instead of throwing:
 * <ul>
 *   <li>Sharpe, Sortino and volatility are 0 with fewer than two returns or zero deviation.</li>
 *   <li>Sortino is 0 with fewer than two negative returns.</li>
 *   <li>Profit factor is 0 when there is no losing trade.</li>
 *   <li>Win rate is 0 with no trades.</li>
 *   <li>CAGR is 0 for a span shorter than one day.</li>
 * </ul>
 */
@Slf4j
public final class PerformanceMetrics {

    public static final int DEFAULT_PERIODS_PER_YEAR = 252;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final double DAYS_PER_YEAR = 365.25;

    private PerformanceMetrics() {
    }

    /**
     * Build the full summary for one equity curve.
     */
    public static PerformanceSummary summarize(BigDecimal initialCapital, List<EquitySnapshot> equityHistory,
                                               List<Trade> trades, int periodsPerYear) {
        List<BigDecimal> values = new ArrayList<>(equityHistory.size());
        for (EquitySnapshot snapshot : equityHistory) {
            values.add(snapshot.getEquity());
        }

        BigDecimal finalValue = values.isEmpty() ? initialCapital : values.get(values.size() - 1);
        LocalDateTime start = equityHistory.isEmpty() ? null : equityHistory.get(0).getTimestamp();
        LocalDateTime end = equityHistory.isEmpty() ? null : equityHistory.get(equityHistory.size() - 1).getTimestamp();

        List<Trade> wins = trades.stream().filter(t -> t.getPnl().signum() > 0).toList();
        List<Trade> losses = trades.stream().filter(t -> t.getPnl().signum() < 0).toList();

        return PerformanceSummary.builder()
                .initialEquity(initialCapital)
                .finalEquity(finalValue)
                .totalReturnPct(calculateTotalReturn(initialCapital, finalValue))
                .cagrPct(calculateCagr(initialCapital, finalValue, start, end))
                .maxDrawdownPct(calculateMaxDrawdown(values))
                .volatilityPct(calculateVolatility(values, periodsPerYear))
                .sharpeRatio(calculateSharpeRatio(values, periodsPerYear))
                .sortinoRatio(calculateSortinoRatio(values, periodsPerYear))
                .winRatePct(calculateWinRate(trades))
                .profitFactor(calculateProfitFactor(trades))
                .numTrades(trades.size())
                .numWins(wins.size())
                .numLosses(losses.size())
                .avgWin(average(wins, false))
                .avgWinPct(average(wins, true))
                .avgLoss(average(losses, false))
                .avgLossPct(average(losses, true))
                .exposurePct(calculateExposure(equityHistory))
                .startTimestamp(start)
                .endTimestamp(end)
                .durationDays(start == null ? 0 : Duration.between(start, end).toDays())
                .build();
    }

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }

        return finalValue.subtract(initialCapital)
                .divide(initialCapital, 6, RoundingMode.HALF_UP)
                .multiply(HUNDRED)
                .setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Compound annual growth rate in percent, using calendar time between the first
     * and last snapshot.
     */
    public static BigDecimal calculateCagr(BigDecimal initialCapital, BigDecimal finalValue,
                                           LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || initialCapital.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        long days = Duration.between(start, end).toDays();
        if (days <= 0) {
            return BigDecimal.ZERO;
        }
        if (finalValue.signum() <= 0) {
            return HUNDRED.negate().setScale(4, RoundingMode.HALF_UP);
        }

        double years = days / DAYS_PER_YEAR;
        double growth = finalValue.doubleValue() / initialCapital.doubleValue();
        double cagr = (Math.pow(growth, 1.0 / years) - 1.0) * 100.0;
        return toDecimal(cagr);
    }

    /**
     * Period-over-period simple returns. Periods starting from a non-positive value are skipped.
     */
    public static List<Double> calculateReturns(List<BigDecimal> portfolioValues) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < portfolioValues.size(); i++) {
            BigDecimal prevValue = portfolioValues.get(i - 1);
            BigDecimal currentValue = portfolioValues.get(i);

            if (prevValue.compareTo(BigDecimal.ZERO) > 0) {
                returns.add(currentValue.subtract(prevValue)
                        .divide(prevValue, 12, RoundingMode.HALF_UP)
                        .doubleValue());
            }
        }
        return returns;
    }

    /**
     * Annualized standard deviation of returns, in percent.
     */
    public static BigDecimal calculateVolatility(List<BigDecimal> portfolioValues, int periodsPerYear) {
        List<Double> returns = calculateReturns(portfolioValues);
        double stdDev = sampleStdDev(returns);
        if (Double.isNaN(stdDev)) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }
        return toDecimal(stdDev * Math.sqrt(periodsPerYear) * 100.0);
    }

    /**
     * Annualized Sharpe ratio with a zero risk-free rate.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> portfolioValues, int periodsPerYear) {
        List<Double> returns = calculateReturns(portfolioValues);
        double stdDev = sampleStdDev(returns);

        if (Double.isNaN(stdDev) || stdDev == 0) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }

        double sharpe = (mean(returns) / stdDev) * Math.sqrt(periodsPerYear);
        return toDecimal(sharpe);
    }

    /**
     * Annualized Sortino ratio: mean return over the deviation of negative returns.
     */
    public static BigDecimal calculateSortinoRatio(List<BigDecimal> portfolioValues, int periodsPerYear) {
        List<Double> returns = calculateReturns(portfolioValues);
        if (returns.isEmpty()) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }

        List<Double> downside = returns.stream().filter(r -> r < 0).toList();
        double downsideStdDev = sampleStdDev(downside);

        if (Double.isNaN(downsideStdDev) || downsideStdDev == 0) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }

        double sortino = (mean(returns) / downsideStdDev) * Math.sqrt(periodsPerYear);
        return toDecimal(sortino);
    }

    /**
     * Calculate maximum drawdown percentage.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> portfolioValues) {
        if (portfolioValues.isEmpty()) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }

        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal peak = portfolioValues.get(0);

        for (BigDecimal value : portfolioValues) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }

            if (peak.compareTo(BigDecimal.ZERO) > 0) {
                BigDecimal drawdown = peak.subtract(value)
                        .divide(peak, 8, RoundingMode.HALF_UP)
                        .multiply(HUNDRED);

                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }

        return maxDrawdown.setScale(4, RoundingMode.HALF_UP).negate(); // Return as negative percentage
    }

    /**
     * Calculate win rate (percentage of profitable trades).
     */
    public static BigDecimal calculateWinRate(List<Trade> trades) {
        if (trades.isEmpty()) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }

        long winningTrades = trades.stream().filter(Trade::isWinner).count();

        return BigDecimal.valueOf(winningTrades)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(trades.size()), 4, RoundingMode.HALF_UP);
    }

    /**
     * Gross profit over gross loss.
     */
    public static BigDecimal calculateProfitFactor(List<Trade> trades) {
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        for (Trade trade : trades) {
            if (trade.getPnl().signum() > 0) {
                grossProfit = grossProfit.add(trade.getPnl());
            } else {
                grossLoss = grossLoss.add(trade.getPnl().abs());
            }
        }

        if (grossLoss.signum() == 0) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }
        return grossProfit.divide(grossLoss, 4, RoundingMode.HALF_UP);
    }

    /**
     * Share of bars that ended with an open position, in percent.
     */
    public static BigDecimal calculateExposure(List<EquitySnapshot> equityHistory) {
        if (equityHistory.isEmpty()) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }
        long inMarket = equityHistory.stream()
                .filter(s -> s.getMarketValue().signum() != 0)
                .count();
        return BigDecimal.valueOf(inMarket)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(equityHistory.size()), 4, RoundingMode.HALF_UP);
    }

    private static BigDecimal average(List<Trade> trades, boolean percent) {
        if (trades.isEmpty()) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Trade trade : trades) {
            sum = sum.add(percent ? trade.getPnlPct() : trade.getPnl());
        }
        return sum.divide(BigDecimal.valueOf(trades.size()), 4, RoundingMode.HALF_UP);
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation; NaN for fewer than two values.
     */
    private static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double value : values) {
            sumSquaredDiff += (value - mean) * (value - mean);
        }
        return Math.sqrt(sumSquaredDiff / (values.size() - 1));
    }

    private static BigDecimal toDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            log.debug("Non-finite metric value {} replaced with 0", value);
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }
}
