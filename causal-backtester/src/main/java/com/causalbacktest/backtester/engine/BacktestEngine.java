package com.causalbacktest.backtester.engine;

import com.causalbacktest.backtester.domain.Bar;
import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.CancelReason;
import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.ErrorCategory;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.domain.PerformanceMetrics;
import com.causalbacktest.backtester.domain.PerformanceSummary;
import com.causalbacktest.backtester.domain.Portfolio;
import com.causalbacktest.backtester.execution.Broker;
import com.causalbacktest.backtester.execution.ExecutionModel;
import com.causalbacktest.backtester.execution.ExecutionSettings;
import com.causalbacktest.backtester.indicator.IndicatorSet;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Core backtesting engine that drives one decision policy through a bar feed.
 *
 * <p>For each bar {@code t}, in this order: pending orders submitted before {@code t} are
 * matched against bar {@code t} and applied to the portfolio; indicators receive bar
 * {@code t}; the policy sees the closed bar and may submit orders for {@code t + 1} or
 * later; equity is recorded at the close. An engine instance runs once.
 */
@Slf4j
public class BacktestEngine {

    private final BacktestConfig config;
    private EngineState state = EngineState.INITIALIZED;
    private BacktestResult result;

    public BacktestEngine(BacktestConfig config) {
        if (config.getPolicy() == null) {
            throw new ConfigurationException("policy", "A decision policy is required");
        }
        if (config.getBarFeed() == null) {
            throw new ConfigurationException("barFeed", "A bar feed is required");
        }
        if (config.getInitialCapital() == null || config.getInitialCapital().signum() <= 0) {
            throw new ConfigurationException("initialCapital",
                    "Initial capital must be positive, got " + config.getInitialCapital());
        }
        if (config.getPeriodsPerYear() < 1) {
            throw new ConfigurationException("periodsPerYear",
                    "Periods per year must be positive, got " + config.getPeriodsPerYear());
        }
        config.getExecution().validate();
        this.config = config;
    }

    /**
     * Run the backtest to completion.
     *
     * @throws IllegalStateException if this engine has already run
     */
    public synchronized BacktestResult runBacktest() {
        if (state != EngineState.INITIALIZED) {
            throw new IllegalStateException("Backtest engine already " + state + "; create a new engine per run");
        }
        state = EngineState.RUNNING;
        try {
            result = run(config.getPolicy());
            return result;
        } finally {
            state = EngineState.FINISHED;
        }
    }

    public EngineState getState() {
        return state;
    }

    public Optional<BacktestResult> getResult() {
        return Optional.ofNullable(result);
    }

    private <S> BacktestResult run(DecisionPolicy<S> policy) {
        BarFeed feed = config.getBarFeed();
        ParameterSet parameters = policy.defaultParameters().merge(config.getParameters());
        ExecutionSettings execution = config.getExecution();

        log.info("Starting backtest - Policy: {}, Symbol: {}, Bars: {}, Parameters: {}",
                policy.getName(), feed.getSymbol(), feed.length(), parameters);

        Portfolio portfolio = Portfolio.builder()
                .initialCash(config.getInitialCapital())
                .allowShort(execution.isAllowShort())
                .marginEnabled(execution.isMarginEnabled())
                .build();
        Broker broker = new Broker(new ExecutionModel(execution), portfolio);
        IndicatorSet indicators = policy.createIndicators(parameters);
        S policyState = policy.onStart(parameters);

        for (int t = 0; t < feed.length(); t++) {
            Bar bar = feed.bar(t);

            broker.processPendingOrders(bar, t);
            indicators.update(bar);

            PolicyContext context = new PolicyContext(t, feed.historyUntil(t), indicators, portfolio, broker);
            try {
                policy.onBar(policyState, context);
            } finally {
                context.close();
            }

            portfolio.snapshot(t, bar);
        }

        int last = feed.length() - 1;
        broker.cancelAll(CancelReason.END_OF_DATA, ErrorCategory.EXECUTION, last, feed.lastTimestamp());
        policy.onFinish(policyState);

        PerformanceSummary summary = PerformanceMetrics.summarize(config.getInitialCapital(),
                portfolio.getEquityHistory(), portfolio.getTrades(), config.getPeriodsPerYear());

        log.info("Backtest completed - Policy: {}, Total Return: {}%, CAGR: {}%, Sharpe: {}, Max DD: {}%, "
                        + "Trades: {}, Annotations: {}",
                policy.getName(), summary.getTotalReturnPct(), summary.getCagrPct(), summary.getSharpeRatio(),
                summary.getMaxDrawdownPct(), summary.getNumTrades(), broker.getAnnotations().size());

        return BacktestResult.builder()
                .policyName(policy.getName())
                .symbol(feed.getSymbol())
                .parameters(parameters)
                .execution(execution)
                .initialCapital(config.getInitialCapital())
                .barCount(feed.length())
                .equityHistory(List.copyOf(portfolio.getEquityHistory()))
                .orders(List.copyOf(broker.getOrders()))
                .fills(List.copyOf(broker.getFills()))
                .trades(List.copyOf(portfolio.getTrades()))
                .annotations(List.copyOf(broker.getAnnotations()))
                .summary(summary)
                .build();
    }

    /**
     * Configuration for a backtest run.
     */
    @Value
    @Builder(toBuilder = true)
    public static class BacktestConfig {
        DecisionPolicy<?> policy;

        @Builder.Default
        ParameterSet parameters = ParameterSet.empty();

        BarFeed barFeed;
        BigDecimal initialCapital;

        @Builder.Default
        ExecutionSettings execution = ExecutionSettings.defaults();

        @Builder.Default
        int periodsPerYear = PerformanceMetrics.DEFAULT_PERIODS_PER_YEAR;
    }
}
