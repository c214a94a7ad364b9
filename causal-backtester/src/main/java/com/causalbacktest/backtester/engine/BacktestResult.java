package com.causalbacktest.backtester.engine;

import com.causalbacktest.backtester.domain.EquitySnapshot;
import com.causalbacktest.backtester.domain.Fill;
import com.causalbacktest.backtester.domain.LedgerAnnotation;
import com.causalbacktest.backtester.domain.Order;
import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.domain.PerformanceSummary;
import com.causalbacktest.backtester.domain.Trade;
import com.causalbacktest.backtester.execution.ExecutionSettings;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything a finished run produced. Lists are immutable copies.
 */
@Value
@Builder
public class BacktestResult {

    String policyName;
    String symbol;
    ParameterSet parameters;
    ExecutionSettings execution;
    BigDecimal initialCapital;
    int barCount;
    List<EquitySnapshot> equityHistory;
    List<Order> orders;
    List<Fill> fills;
    List<Trade> trades;
    List<LedgerAnnotation> annotations;
    PerformanceSummary summary;

    public int getOrdersSubmitted() {
        return orders.size();
    }

    public BigDecimal getFinalEquity() {
        return summary.getFinalEquity();
    }
}
