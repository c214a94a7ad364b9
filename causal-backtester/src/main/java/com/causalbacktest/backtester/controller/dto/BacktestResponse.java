package com.causalbacktest.backtester.controller.dto;

import com.causalbacktest.backtester.domain.EquitySnapshot;
import com.causalbacktest.backtester.domain.LedgerAnnotation;
import com.causalbacktest.backtester.domain.PerformanceSummary;
import com.causalbacktest.backtester.domain.Trade;
import com.causalbacktest.backtester.engine.BacktestResult;
import com.causalbacktest.backtester.execution.ExecutionSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a single backtest run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResponse {

    private String policy;
    private String symbol;
    private Map<String, Object> parameters;
    private BigDecimal initialCapital;
    private ExecutionSettings execution;
    private int bars;
    private int ordersSubmitted;
    private int fills;
    private PerformanceSummary summary;
    private List<Trade> trades;
    private List<EquitySnapshot> equityCurve;
    private List<LedgerAnnotation> annotations;

    public static BacktestResponse from(BacktestResult result) {
        return BacktestResponse.builder()
                .policy(result.getPolicyName())
                .symbol(result.getSymbol())
                .parameters(result.getParameters().asMap())
                .initialCapital(result.getInitialCapital())
                .execution(result.getExecution())
                .bars(result.getBarCount())
                .ordersSubmitted(result.getOrdersSubmitted())
                .fills(result.getFills().size())
                .summary(result.getSummary())
                .trades(result.getTrades())
                .equityCurve(result.getEquityHistory())
                .annotations(result.getAnnotations())
                .build();
    }
}
