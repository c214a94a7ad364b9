package com.causalbacktest.backtester.optimizer;

import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.domain.PerformanceMetrics;
import com.causalbacktest.backtester.engine.DecisionPolicy;
import com.causalbacktest.backtester.execution.ExecutionSettings;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What to sweep: one policy, a grid of its parameters, and the run settings shared by
 * every combination. {@code baseParameters} are applied first and the grid combination
 * on top of them.
 */
@Value
@Builder(toBuilder = true)
public class SweepSpec {

    DecisionPolicy<?> policy;
    ParameterGrid grid;

    @Builder.Default
    ParameterSet baseParameters = ParameterSet.empty();

    BarFeed feed;
    BigDecimal initialCapital;

    @Builder.Default
    ExecutionSettings execution = ExecutionSettings.defaults();

    @Builder.Default
    RankingMetric rankBy = RankingMetric.SHARPE_RATIO;

    @Builder.Default
    RankingMetric tieBreaker = RankingMetric.TRADE_COUNT;

    @Builder.Default
    int periodsPerYear = PerformanceMetrics.DEFAULT_PERIODS_PER_YEAR;
}
