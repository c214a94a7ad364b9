package com.causalbacktest.backtester.controller.dto;

import com.causalbacktest.backtester.walkforward.StitchedEquityPoint;
import com.causalbacktest.backtester.walkforward.WalkForwardAggregate;
import com.causalbacktest.backtester.walkforward.WalkForwardResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a walk-forward analysis.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WalkForwardResponse {

    private String policy;
    private String symbol;
    private boolean cancelled;
    private WalkForwardAggregate aggregate;
    private List<Map<String, Object>> windows;
    private List<StitchedEquityPoint> stitchedEquity;

    public static WalkForwardResponse from(WalkForwardResult result) {
        return WalkForwardResponse.builder()
                .policy(result.getPolicyName())
                .symbol(result.getSymbol())
                .cancelled(result.isCancelled())
                .aggregate(result.getAggregate())
                .windows(result.toTable())
                .stitchedEquity(result.getStitchedEquity())
                .build();
    }
}
