package com.causalbacktest.backtester.walkforward;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class WalkForwardResult {

    String policyName;
    String symbol;
    WalkForwardConfig config;
    List<WindowResult> windows;
    List<StitchedEquityPoint> stitchedEquity;
    WalkForwardAggregate aggregate;
    boolean cancelled;

    public List<Map<String, Object>> toTable() {
        return windows.stream().map(WindowResult::toRow).toList();
    }
}
