package com.causalbacktest.backtester.service;

import com.causalbacktest.backtester.config.BacktestProperties;
import com.causalbacktest.backtester.controller.dto.BacktestRequest;
import com.causalbacktest.backtester.controller.dto.BacktestResponse;
import com.causalbacktest.backtester.controller.dto.ExecutionOverrides;
import com.causalbacktest.backtester.domain.BacktestException;
import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.engine.BacktestEngine;
import com.causalbacktest.backtester.engine.BacktestResult;
import com.causalbacktest.backtester.strategy.PolicyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs single backtests synchronously on the calling thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final MarketDataService marketDataService;
    private final BacktestProperties properties;
    private final BacktestMetricsService metricsService;

    @Override
    public BacktestResponse runBacktest(BacktestRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            PolicyType policyType = PolicyType.fromName(request.getPolicy());
            BarFeed feed = marketDataService.loadBars(request.getSymbol(), request.getStartDate(), request.getEndDate());

            BacktestEngine engine = new BacktestEngine(BacktestEngine.BacktestConfig.builder()
                    .policy(policyType.policy())
                    .parameters(ParameterSet.of(request.getParameters()))
                    .barFeed(feed)
                    .initialCapital(request.getInitialCapital() != null
                            ? request.getInitialCapital() : properties.getInitialCash())
                    .execution(ExecutionOverrides.resolve(request.getExecution(),
                            properties.getExecution().toSettings()))
                    .periodsPerYear(properties.getMetrics().getPeriodsPerYear())
                    .build());
            BacktestResult result = engine.runBacktest();

            long executionTime = System.currentTimeMillis() - startTime;
            metricsService.recordRunCompleted(executionTime);
            log.info("Backtest {} on {} finished in {} ms with {} trades",
                    policyType, request.getSymbol(), executionTime, result.getTrades().size());
            return BacktestResponse.from(result);

        } catch (BacktestException e) {
            metricsService.recordFailure();
            log.warn("Backtest request rejected [{}] field={}: {}", e.getCategory(), e.getField(), e.getMessage());
            throw e;
        }
    }
}
