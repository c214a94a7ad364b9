package com.causalbacktest.backtester.walkforward;

import com.causalbacktest.backtester.domain.PerformanceSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Averages of the per-window out-of-sample summaries, plus a summary of the stitched curve.
 */
@Value
@Builder
public class WalkForwardAggregate {

    int numWindows;
    BigDecimal avgCagrPct;
    BigDecimal avgSharpe;
    BigDecimal avgMaxDrawdownPct;
    BigDecimal avgWinRatePct;
    int totalTrades;
    PerformanceSummary overall;
}
