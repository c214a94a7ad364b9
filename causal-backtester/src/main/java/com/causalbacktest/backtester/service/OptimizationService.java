package com.causalbacktest.backtester.service;

import com.causalbacktest.backtester.config.BacktestProperties;
import com.causalbacktest.backtester.controller.dto.ExecutionOverrides;
import com.causalbacktest.backtester.controller.dto.OptimizationRequest;
import com.causalbacktest.backtester.controller.dto.OptimizationResponse;
import com.causalbacktest.backtester.domain.BacktestException;
import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.optimizer.GridSearchOptimizer;
import com.causalbacktest.backtester.optimizer.OptimizationResult;
import com.causalbacktest.backtester.optimizer.ParameterGrid;
import com.causalbacktest.backtester.optimizer.RankingMetric;
import com.causalbacktest.backtester.optimizer.SweepCancellation;
import com.causalbacktest.backtester.optimizer.SweepSpec;
import com.causalbacktest.backtester.strategy.PolicyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Service for grid-search parameter sweeps.
 * Resolves request defaults from configuration and maps a time budget onto the sweep's
 * cancellation token.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimizationService {

    private final GridSearchOptimizer optimizer;
    private final MarketDataService marketDataService;
    private final BacktestProperties properties;
    private final BacktestMetricsService metricsService;

    public OptimizationResponse optimize(OptimizationRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            PolicyType policyType = PolicyType.fromName(request.getPolicy());
            ParameterGrid grid = ParameterGrid.of(request.getParameterGrid()).validate();
            RankingMetric rankBy = RankingMetric.fromName(
                    request.getRankBy() != null ? request.getRankBy() : properties.getOptimizer().getRankBy());
            RankingMetric tieBreaker = RankingMetric.fromName(
                    request.getTieBreaker() != null ? request.getTieBreaker() : properties.getOptimizer().getTieBreaker());
            BarFeed feed = marketDataService.loadBars(request.getSymbol(), request.getStartDate(), request.getEndDate());

            log.info("Sweeping {} over {} combinations of {} on {}",
                    policyType, grid.size(), grid.parameterNames(), request.getSymbol());

            OptimizationResult result = optimizer.optimize(SweepSpec.builder()
                    .policy(policyType.policy())
                    .grid(grid)
                    .baseParameters(ParameterSet.of(request.getBaseParameters()))
                    .feed(feed)
                    .initialCapital(request.getInitialCapital() != null
                            ? request.getInitialCapital() : properties.getInitialCash())
                    .execution(ExecutionOverrides.resolve(request.getExecution(),
                            properties.getExecution().toSettings()))
                    .rankBy(rankBy)
                    .tieBreaker(tieBreaker)
                    .periodsPerYear(properties.getMetrics().getPeriodsPerYear())
                    .build(), cancellation(request.getTimeBudgetSeconds()));

            long executionTime = System.currentTimeMillis() - startTime;
            metricsService.recordSweepCompleted(result.getRows().size(), executionTime);
            if (result.isCancelled()) {
                log.warn("Sweep of {} stopped by its time budget after {} of {} combinations",
                        policyType, result.getRows().size(), result.getTotalCombinations());
            }
            return OptimizationResponse.from(result, request.getTop());

        } catch (BacktestException e) {
            metricsService.recordFailure();
            log.warn("Optimization request rejected [{}] field={}: {}", e.getCategory(), e.getField(), e.getMessage());
            throw e;
        }
    }

    /**
     * Token for the request's budget, or the configured default budget when none is given.
     */
    SweepCancellation cancellation(Long timeBudgetSeconds) {
        Duration budget = timeBudgetSeconds != null
                ? Duration.ofSeconds(timeBudgetSeconds)
                : properties.getOptimizer().getTimeBudget();
        return budget == null ? SweepCancellation.create() : SweepCancellation.withDeadline(budget);
    }
}
