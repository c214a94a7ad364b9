package com.causalbacktest.backtester.walkforward;

import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.EquitySnapshot;
import com.causalbacktest.backtester.domain.PerformanceMetrics;
import com.causalbacktest.backtester.domain.PerformanceSummary;
import com.causalbacktest.backtester.domain.Trade;
import com.causalbacktest.backtester.engine.BacktestEngine;
import com.causalbacktest.backtester.engine.BacktestResult;
import com.causalbacktest.backtester.optimizer.GridSearchOptimizer;
import com.causalbacktest.backtester.optimizer.OptimizationResult;
import com.causalbacktest.backtester.optimizer.OptimizationRow;
import com.causalbacktest.backtester.optimizer.SweepCancellation;
import com.causalbacktest.backtester.optimizer.SweepSpec;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Rolling out-of-sample validation. For each planned window the grid is optimized on the
 * train bars only, the winning parameters are run once on the test bars only, and the test
 * equity segments are chained into a single curve.
 */
@Slf4j
public class WalkForwardAnalyzer {

    static final String WINDOW_KEY = "window";

    private static final int EQUITY_SCALE = 8;

    private final GridSearchOptimizer optimizer;

    public WalkForwardAnalyzer(GridSearchOptimizer optimizer) {
        this.optimizer = optimizer;
    }

    public WalkForwardResult analyze(WalkForwardSpec spec) {
        return analyze(spec, SweepCancellation.create());
    }

    /**
     * @throws ConfigurationException if the windows do not fit the data, a requested window
     *                                count cannot be met, or no combination completes on a
     *                                train window
     */
    public WalkForwardResult analyze(WalkForwardSpec spec, SweepCancellation cancellation) {
        if (spec.getFeed() == null) {
            throw new ConfigurationException("feed", "A bar feed is required for walk-forward analysis");
        }
        if (spec.getConfig() == null) {
            throw new ConfigurationException("config", "Walk-forward window configuration is required");
        }
        if (spec.getPolicy() == null) {
            throw new ConfigurationException("policy", "A decision policy is required for walk-forward analysis");
        }
        if (spec.getGrid() == null) {
            throw new ConfigurationException("grid", "Parameter grid must contain at least one parameter");
        }
        spec.getGrid().validate();

        BarFeed feed = spec.getFeed();
        WalkForwardConfig config = spec.getConfig();
        List<WindowSpec> windows = WindowPlanner.plan(feed.length(), config);

        log.info("Starting walk-forward - Policy: {}, Bars: {}, Windows: {} (train {}, test {}, step {})",
                spec.getPolicy().getName(), feed.length(), windows.size(),
                config.getTrainBars(), config.getTestBars(), config.getEffectiveStep());

        List<WindowResult> results = new ArrayList<>();
        List<BacktestResult> testRuns = new ArrayList<>();
        boolean cancelled = false;

        for (WindowSpec window : windows) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            MDC.put(WINDOW_KEY, String.valueOf(window.getIndex()));
            try {
                Optional<WindowResult> result = runWindow(spec, window, cancellation, testRuns);
                if (result.isEmpty()) {
                    cancelled = true;
                    break;
                }
                results.add(result.get());
            } finally {
                MDC.remove(WINDOW_KEY);
            }
        }

        List<StitchedEquityPoint> stitched = stitch(spec.getInitialCapital(), results, testRuns);
        WalkForwardAggregate aggregate = aggregate(spec, results, testRuns, stitched);

        log.info("Walk-forward completed - Windows: {}/{}, Avg Sharpe: {}, Avg CAGR: {}%, OOS Return: {}%",
                results.size(), windows.size(), aggregate.getAvgSharpe(), aggregate.getAvgCagrPct(),
                aggregate.getOverall() == null ? null : aggregate.getOverall().getTotalReturnPct());

        return WalkForwardResult.builder()
                .policyName(spec.getPolicy().getName())
                .symbol(feed.getSymbol())
                .config(config)
                .windows(List.copyOf(results))
                .stitchedEquity(stitched)
                .aggregate(aggregate)
                .cancelled(cancelled)
                .build();
    }

    private Optional<WindowResult> runWindow(WalkForwardSpec spec, WindowSpec window, SweepCancellation cancellation,
                                             List<BacktestResult> testRuns) {
        BarFeed feed = spec.getFeed();
        BarFeed trainFeed = feed.subFeed(window.getTrainStart(), window.getTrainEnd());
        BarFeed testFeed = feed.subFeed(window.getTestStart(), window.getTestEnd());

        OptimizationResult optimization = optimizer.optimize(SweepSpec.builder()
                .policy(spec.getPolicy())
                .grid(spec.getGrid())
                .baseParameters(spec.getBaseParameters())
                .feed(trainFeed)
                .initialCapital(spec.getInitialCapital())
                .execution(spec.getExecution())
                .rankBy(spec.getConfig().getRankBy())
                .tieBreaker(spec.getConfig().getTieBreaker())
                .periodsPerYear(spec.getPeriodsPerYear())
                .build(), cancellation);

        if (optimization.isCancelled()) {
            log.info("Walk-forward window {} cancelled during optimization", window.getIndex());
            return Optional.empty();
        }
        OptimizationRow best = optimization.getBest().orElseThrow(() -> new ConfigurationException("grid",
                "No parameter combination completed on train window " + window.getIndex()
                        + " [" + window.getTrainStart() + ", " + window.getTrainEnd() + ")"));

        BacktestResult test = new BacktestEngine(BacktestEngine.BacktestConfig.builder()
                .policy(spec.getPolicy())
                .parameters(best.getParameters())
                .barFeed(testFeed)
                .initialCapital(spec.getInitialCapital())
                .execution(spec.getExecution())
                .periodsPerYear(spec.getPeriodsPerYear())
                .build()).runBacktest();
        testRuns.add(test);

        log.info("Window {} - train [{}, {}) chose {} (score {}), test [{}, {}) return {}%",
                window.getIndex(), window.getTrainStart(), window.getTrainEnd(), best.getParameters(),
                best.getScore(), window.getTestStart(), window.getTestEnd(), test.getSummary().getTotalReturnPct());

        return Optional.of(WindowResult.builder()
                .window(window)
                .trainStartTime(trainFeed.firstTimestamp())
                .trainEndTime(trainFeed.lastTimestamp())
                .testStartTime(testFeed.firstTimestamp())
                .testEndTime(testFeed.lastTimestamp())
                .chosenParameters(best.getParameters())
                .trainScore(best.getScore())
                .combinationsEvaluated(optimization.getRows().size())
                .testSummary(test.getSummary())
                .build());
    }

    /**
     * Chain test segments: each segment is scaled so that it starts from the equity the
     * previous segment ended with.
     */
    static List<StitchedEquityPoint> stitch(BigDecimal initialCapital, List<WindowResult> windows,
                                            List<BacktestResult> testRuns) {
        List<StitchedEquityPoint> points = new ArrayList<>();
        BigDecimal factor = BigDecimal.ONE;
        for (int w = 0; w < windows.size(); w++) {
            WindowSpec window = windows.get(w).getWindow();
            BigDecimal segmentEnd = null;
            for (EquitySnapshot snapshot : testRuns.get(w).getEquityHistory()) {
                BigDecimal equity = snapshot.getEquity().multiply(factor).setScale(EQUITY_SCALE, RoundingMode.HALF_UP);
                points.add(new StitchedEquityPoint(window.getIndex(), window.getTestStart() + snapshot.getBarIndex(),
                        snapshot.getTimestamp(), snapshot.getEquity(), equity));
                segmentEnd = equity;
            }
            if (segmentEnd != null) {
                factor = segmentEnd.divide(initialCapital, MathContext.DECIMAL64);
            }
        }
        return List.copyOf(points);
    }

    private static WalkForwardAggregate aggregate(WalkForwardSpec spec, List<WindowResult> windows,
                                                  List<BacktestResult> testRuns, List<StitchedEquityPoint> stitched) {
        List<PerformanceSummary> summaries = windows.stream().map(WindowResult::getTestSummary).toList();
        List<Trade> trades = new ArrayList<>();
        testRuns.forEach(run -> trades.addAll(run.getTrades()));

        PerformanceSummary overall = null;
        if (!stitched.isEmpty()) {
            overall = PerformanceMetrics.summarize(spec.getInitialCapital(), toSnapshots(stitched, testRuns),
                    trades, spec.getPeriodsPerYear());
        }

        return WalkForwardAggregate.builder()
                .numWindows(windows.size())
                .avgCagrPct(average(summaries, PerformanceSummary::getCagrPct))
                .avgSharpe(average(summaries, PerformanceSummary::getSharpeRatio))
                .avgMaxDrawdownPct(average(summaries, PerformanceSummary::getMaxDrawdownPct))
                .avgWinRatePct(average(summaries, PerformanceSummary::getWinRatePct))
                .totalTrades(summaries.stream().mapToInt(PerformanceSummary::getNumTrades).sum())
                .overall(overall)
                .build();
    }

    /**
     * Stitched points as snapshots, with cash and market value scaled by the same factor as
     * equity so that exposure stays meaningful.
     */
    private static List<EquitySnapshot> toSnapshots(List<StitchedEquityPoint> stitched, List<BacktestResult> testRuns) {
        List<EquitySnapshot> source = new ArrayList<>();
        testRuns.forEach(run -> source.addAll(run.getEquityHistory()));

        List<EquitySnapshot> snapshots = new ArrayList<>(stitched.size());
        BigDecimal peak = null;
        for (int i = 0; i < stitched.size(); i++) {
            StitchedEquityPoint point = stitched.get(i);
            EquitySnapshot original = source.get(i);
            BigDecimal factor = point.getSegmentEquity().signum() == 0
                    ? BigDecimal.ONE
                    : point.getEquity().divide(point.getSegmentEquity(), MathContext.DECIMAL64);
            if (peak == null || point.getEquity().compareTo(peak) > 0) {
                peak = point.getEquity();
            }
            snapshots.add(EquitySnapshot.builder()
                    .barIndex(point.getBarIndex())
                    .timestamp(point.getTimestamp())
                    .equity(point.getEquity())
                    .cash(original.getCash().multiply(factor, MathContext.DECIMAL64))
                    .marketValue(original.getMarketValue().multiply(factor, MathContext.DECIMAL64))
                    .drawdown(peak.signum() > 0
                            ? point.getEquity().subtract(peak).divide(peak, EQUITY_SCALE, RoundingMode.HALF_UP)
                            : BigDecimal.ZERO)
                    .build());
        }
        return snapshots;
    }

    private static BigDecimal average(List<PerformanceSummary> summaries,
                                      Function<PerformanceSummary, BigDecimal> metric) {
        if (summaries.isEmpty()) {
            return BigDecimal.ZERO.setScale(4, RoundingMode.HALF_UP);
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (PerformanceSummary summary : summaries) {
            sum = sum.add(metric.apply(summary));
        }
        return sum.divide(BigDecimal.valueOf(summaries.size()), 4, RoundingMode.HALF_UP);
    }
}
