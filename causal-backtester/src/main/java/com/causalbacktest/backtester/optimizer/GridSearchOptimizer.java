package com.causalbacktest.backtester.optimizer;

import com.causalbacktest.backtester.domain.BacktestException;
import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.engine.BacktestEngine;
import com.causalbacktest.backtester.engine.BacktestResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Exhaustive parameter sweep. Every combination runs on a freshly built engine on the
 * worker pool; workers share nothing and hand back a single row each. Rows are
 * collected in grid order by the calling thread and then ranked.
 */
@Slf4j
public class GridSearchOptimizer {

    static final String RUN_ID_KEY = "runId";

    private static final Comparator<OptimizationRow> RANKING = Comparator
            .comparingDouble(OptimizationRow::getScore).reversed()
            .thenComparing(Comparator.comparingDouble(OptimizationRow::getTieScore).reversed())
            .thenComparingInt(OptimizationRow::getIndex);

    private final ExecutorService executorService;

    public GridSearchOptimizer(ExecutorService executorService) {
        this.executorService = executorService;
    }

    public OptimizationResult optimize(SweepSpec spec) {
        return optimize(spec, SweepCancellation.create());
    }

    /**
     * Run the sweep. Configuration problems are raised before any worker is started.
     * Combinations not yet started when {@code cancellation} fires are skipped.
     *
     * @throws ConfigurationException for a missing policy or feed, an empty grid, a
     *                                parameter without values, or invalid execution settings
     */
    public OptimizationResult optimize(SweepSpec spec, SweepCancellation cancellation) {
        validate(spec);
        List<ParameterSet> combinations = spec.getGrid().combinations();
        String sweepId = UUID.randomUUID().toString().substring(0, 8);
        Map<String, String> callerContext = MDC.getCopyOfContextMap();

        log.info("Starting sweep {} - Policy: {}, Combinations: {}, Rank by: {} then {}",
                sweepId, spec.getPolicy().getName(), combinations.size(), spec.getRankBy(), spec.getTieBreaker());

        List<Future<Optional<OptimizationRow>>> futures = new ArrayList<>(combinations.size());
        for (int i = 0; i < combinations.size(); i++) {
            int index = i;
            ParameterSet parameters = spec.getBaseParameters().merge(combinations.get(i));
            futures.add(executorService.submit(() ->
                    runCombination(spec, index, parameters, sweepId, callerContext, cancellation)));
        }

        List<OptimizationRow> rows = new ArrayList<>(combinations.size());
        int skipped = 0;
        for (Future<Optional<OptimizationRow>> future : futures) {
            Optional<OptimizationRow> row = await(future, futures);
            if (row.isPresent()) {
                rows.add(row.get());
            } else {
                skipped++;
            }
        }

        rows.sort(RANKING);
        List<OptimizationRow> ranked = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            ranked.add(rows.get(i).withRank(i + 1));
        }

        int failed = (int) ranked.stream().filter(row -> !row.isCompleted()).count();
        OptimizationResult result = OptimizationResult.builder()
                .policyName(spec.getPolicy().getName())
                .rankBy(spec.getRankBy())
                .tieBreaker(spec.getTieBreaker())
                .totalCombinations(combinations.size())
                .completed(ranked.size() - failed)
                .failed(failed)
                .skipped(skipped)
                .cancelled(skipped > 0)
                .rows(List.copyOf(ranked))
                .build();

        log.info("Sweep {} finished - Completed: {}, Failed: {}, Skipped: {}, Best: {}",
                sweepId, result.getCompleted(), failed, skipped,
                result.getBest().map(best -> best.getParameters() + " score=" + best.getScore()).orElse("none"));
        return result;
    }

    private Optional<OptimizationRow> runCombination(SweepSpec spec, int index, ParameterSet parameters,
                                                     String sweepId, Map<String, String> callerContext,
                                                     SweepCancellation cancellation) {
        if (cancellation.isCancelled()) {
            return Optional.empty();
        }
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        MDC.put(RUN_ID_KEY, sweepId + "-" + index);
        try {
            BacktestEngine engine = new BacktestEngine(BacktestEngine.BacktestConfig.builder()
                    .policy(spec.getPolicy())
                    .parameters(parameters)
                    .barFeed(spec.getFeed())
                    .initialCapital(spec.getInitialCapital())
                    .execution(spec.getExecution())
                    .periodsPerYear(spec.getPeriodsPerYear())
                    .build());
            BacktestResult result = engine.runBacktest();
            int fills = result.getFills().size();

            return Optional.of(OptimizationRow.builder()
                    .index(index)
                    .parameters(parameters)
                    .status(RunStatus.COMPLETED)
                    .summary(result.getSummary())
                    .fillCount(fills)
                    .score(spec.getRankBy().score(result.getSummary(), fills))
                    .tieScore(spec.getTieBreaker().score(result.getSummary(), fills))
                    .build());
        } catch (BacktestException e) {
            log.warn("Combination {} {} failed [{}]: {}", index, parameters, e.getCategory(), e.getMessage());
            return Optional.of(failedRow(index, parameters, e));
        } catch (RuntimeException e) {
            log.error("Combination {} {} failed unexpectedly", index, parameters, e);
            return Optional.of(failedRow(index, parameters, e));
        } finally {
            MDC.clear();
        }
    }

    private static OptimizationRow failedRow(int index, ParameterSet parameters, RuntimeException e) {
        return OptimizationRow.builder()
                .index(index)
                .parameters(parameters)
                .status(RunStatus.FAILED)
                .score(RankingMetric.NO_SIGNAL_SCORE)
                .tieScore(RankingMetric.NO_SIGNAL_SCORE)
                .error(e.getMessage())
                .build();
    }

    private static Optional<OptimizationRow> await(Future<Optional<OptimizationRow>> future,
                                                   List<Future<Optional<OptimizationRow>>> all) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            all.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while waiting for sweep workers", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Sweep worker failed", e.getCause());
        }
    }

    private static void validate(SweepSpec spec) {
        if (spec.getPolicy() == null) {
            throw new ConfigurationException("policy", "A decision policy is required for a sweep");
        }
        if (spec.getFeed() == null) {
            throw new ConfigurationException("feed", "A bar feed is required for a sweep");
        }
        if (spec.getGrid() == null) {
            throw new ConfigurationException("grid", "Parameter grid must contain at least one parameter");
        }
        spec.getGrid().validate();
        if (spec.getInitialCapital() == null || spec.getInitialCapital().signum() <= 0) {
            throw new ConfigurationException("initialCapital",
                    "Initial capital must be positive, got " + spec.getInitialCapital());
        }
        if (spec.getRankBy() == null || spec.getTieBreaker() == null) {
            throw new ConfigurationException("rankBy", "Ranking and tie-break metrics are required");
        }
        if (spec.getExecution() == null) {
            throw new ConfigurationException("execution", "Execution settings are required");
        }
        spec.getExecution().validate();
    }
}
