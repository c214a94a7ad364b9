package com.causalbacktest.backtester.walkforward;

import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.optimizer.RankingMetric;
import lombok.Builder;
import lombok.Value;

/**
 * Window geometry for a walk-forward analysis, in bars. {@code stepBars} defaults to
 * {@code testBars}, which makes test windows contiguous and non-overlapping.
 */
@Value
@Builder(toBuilder = true)
public class WalkForwardConfig {

    int trainBars;
    int testBars;
    Integer stepBars;
    Integer windowCount;

    @Builder.Default
    RankingMetric rankBy = RankingMetric.SHARPE_RATIO;

    @Builder.Default
    RankingMetric tieBreaker = RankingMetric.TRADE_COUNT;

    public int getEffectiveStep() {
        return stepBars == null ? testBars : stepBars;
    }

    public boolean isDefaultStep() {
        return stepBars == null || stepBars == testBars;
    }

    WalkForwardConfig validate() {
        if (trainBars < 1) {
            throw new ConfigurationException("trainBars", "Train window must be at least 1 bar, got " + trainBars);
        }
        if (testBars < 1) {
            throw new ConfigurationException("testBars", "Test window must be at least 1 bar, got " + testBars);
        }
        if (stepBars != null && stepBars < 1) {
            throw new ConfigurationException("stepBars", "Step must be at least 1 bar, got " + stepBars);
        }
        if (windowCount != null && windowCount < 1) {
            throw new ConfigurationException("windowCount", "Window count must be at least 1, got " + windowCount);
        }
        if (rankBy == null || tieBreaker == null) {
            throw new ConfigurationException("rankBy", "Ranking and tie-break metrics are required");
        }
        return this;
    }
}
