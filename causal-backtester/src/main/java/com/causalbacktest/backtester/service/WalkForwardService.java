package com.causalbacktest.backtester.service;

import com.causalbacktest.backtester.config.BacktestProperties;
import com.causalbacktest.backtester.controller.dto.ExecutionOverrides;
import com.causalbacktest.backtester.controller.dto.WalkForwardRequest;
import com.causalbacktest.backtester.controller.dto.WalkForwardResponse;
import com.causalbacktest.backtester.domain.BacktestException;
import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.optimizer.ParameterGrid;
import com.causalbacktest.backtester.optimizer.RankingMetric;
import com.causalbacktest.backtester.optimizer.SweepCancellation;
import com.causalbacktest.backtester.strategy.PolicyType;
import com.causalbacktest.backtester.walkforward.WalkForwardAnalyzer;
import com.causalbacktest.backtester.walkforward.WalkForwardConfig;
import com.causalbacktest.backtester.walkforward.WalkForwardResult;
import com.causalbacktest.backtester.walkforward.WalkForwardSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Service for walk-forward analyses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalkForwardService {

    private final WalkForwardAnalyzer analyzer;
    private final MarketDataService marketDataService;
    private final BacktestProperties properties;
    private final BacktestMetricsService metricsService;

    public WalkForwardResponse analyze(WalkForwardRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            PolicyType policyType = PolicyType.fromName(request.getPolicy());
            WalkForwardConfig config = WalkForwardConfig.builder()
                    .trainBars(request.getTrainBars())
                    .testBars(request.getTestBars())
                    .stepBars(request.getStepBars())
                    .windowCount(request.getWindowCount())
                    .rankBy(RankingMetric.fromName(request.getRankBy() != null
                            ? request.getRankBy() : properties.getOptimizer().getRankBy()))
                    .tieBreaker(RankingMetric.fromName(request.getTieBreaker() != null
                            ? request.getTieBreaker() : properties.getOptimizer().getTieBreaker()))
                    .build();
            BarFeed feed = marketDataService.loadBars(request.getSymbol(), request.getStartDate(), request.getEndDate());

            Duration budget = request.getTimeBudgetSeconds() != null
                    ? Duration.ofSeconds(request.getTimeBudgetSeconds())
                    : properties.getOptimizer().getTimeBudget();
            SweepCancellation cancellation = budget == null
                    ? SweepCancellation.create() : SweepCancellation.withDeadline(budget);

            WalkForwardResult result = analyzer.analyze(WalkForwardSpec.builder()
                    .policy(policyType.policy())
                    .grid(ParameterGrid.of(request.getParameterGrid()))
                    .baseParameters(ParameterSet.of(request.getBaseParameters()))
                    .feed(feed)
                    .initialCapital(request.getInitialCapital() != null
                            ? request.getInitialCapital() : properties.getInitialCash())
                    .execution(ExecutionOverrides.resolve(request.getExecution(),
                            properties.getExecution().toSettings()))
                    .config(config)
                    .periodsPerYear(properties.getMetrics().getPeriodsPerYear())
                    .build(), cancellation);

            metricsService.recordWalkForwardCompleted(System.currentTimeMillis() - startTime);
            return WalkForwardResponse.from(result);

        } catch (BacktestException e) {
            metricsService.recordFailure();
            log.warn("Walk-forward request rejected [{}] field={}: {}", e.getCategory(), e.getField(), e.getMessage());
            throw e;
        }
    }
}
