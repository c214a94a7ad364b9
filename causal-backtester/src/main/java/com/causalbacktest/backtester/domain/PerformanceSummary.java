package com.causalbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scalar summary of one equity curve and its trades. Percentages are expressed
 * in percent (25 means 25%); max drawdown is negative.
 */
@Value
@Builder
public class PerformanceSummary {

    BigDecimal initialEquity;
    BigDecimal finalEquity;
    BigDecimal totalReturnPct;
    BigDecimal cagrPct;
    BigDecimal maxDrawdownPct;
    BigDecimal volatilityPct;
    BigDecimal sharpeRatio;
    BigDecimal sortinoRatio;
    BigDecimal winRatePct;
    BigDecimal profitFactor;
    int numTrades;
    int numWins;
    int numLosses;
    BigDecimal avgWin;
    BigDecimal avgWinPct;
    BigDecimal avgLoss;
    BigDecimal avgLossPct;
    BigDecimal exposurePct;
    LocalDateTime startTimestamp;
    LocalDateTime endTimestamp;
    long durationDays;

    /**
     * Flat column map, in a stable order, for tabular export.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("initial_equity", initialEquity);
        row.put("final_equity", finalEquity);
        row.put("total_return_pct", totalReturnPct);
        row.put("cagr_pct", cagrPct);
        row.put("max_drawdown_pct", maxDrawdownPct);
        row.put("volatility_pct", volatilityPct);
        row.put("sharpe_ratio", sharpeRatio);
        row.put("sortino_ratio", sortinoRatio);
        row.put("win_rate_pct", winRatePct);
        row.put("profit_factor", profitFactor);
        row.put("num_trades", numTrades);
        row.put("num_wins", numWins);
        row.put("num_losses", numLosses);
        row.put("avg_win", avgWin);
        row.put("avg_win_pct", avgWinPct);
        row.put("avg_loss", avgLoss);
        row.put("avg_loss_pct", avgLossPct);
        row.put("exposure_pct", exposurePct);
        row.put("start", startTimestamp);
        row.put("end", endTimestamp);
        row.put("duration_days", durationDays);
        return row;
    }
}
