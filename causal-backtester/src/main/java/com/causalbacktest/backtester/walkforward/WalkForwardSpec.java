package com.causalbacktest.backtester.walkforward;

import com.causalbacktest.backtester.domain.BarFeed;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.domain.PerformanceMetrics;
import com.causalbacktest.backtester.engine.DecisionPolicy;
import com.causalbacktest.backtester.execution.ExecutionSettings;
import com.causalbacktest.backtester.optimizer.ParameterGrid;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class WalkForwardSpec {

    DecisionPolicy<?> policy;
    ParameterGrid grid;

    @Builder.Default
    ParameterSet baseParameters = ParameterSet.empty();

    BarFeed feed;
    BigDecimal initialCapital;

    @Builder.Default
    ExecutionSettings execution = ExecutionSettings.defaults();

    WalkForwardConfig config;

    @Builder.Default
    int periodsPerYear = PerformanceMetrics.DEFAULT_PERIODS_PER_YEAR;
}
