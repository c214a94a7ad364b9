package com.causalbacktest.backtester.optimizer;

import com.causalbacktest.backtester.domain.ConfigurationException;
import com.causalbacktest.backtester.domain.PerformanceSummary;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.Function;

/**
 * Scalar used to rank sweep rows; higher is always better. Max drawdown is reported as
 * a negative percent, so the shallowest drawdown ranks first.
 */
public enum RankingMetric {
    SHARPE_RATIO(PerformanceSummary::getSharpeRatio),
    SORTINO_RATIO(PerformanceSummary::getSortinoRatio),
    TOTAL_RETURN(PerformanceSummary::getTotalReturnPct),
    CAGR(PerformanceSummary::getCagrPct),
    MAX_DRAWDOWN(PerformanceSummary::getMaxDrawdownPct),
    WIN_RATE(PerformanceSummary::getWinRatePct),
    PROFIT_FACTOR(PerformanceSummary::getProfitFactor),
    TRADE_COUNT(summary -> BigDecimal.valueOf(summary.getNumTrades()));

    /**
     * Score of a run that never traded or did not complete. Low enough to rank below any
     * real score, and never NaN.
     */
    public static final double NO_SIGNAL_SCORE = -1.0e9;

    private final Function<PerformanceSummary, BigDecimal> extractor;

    RankingMetric(Function<PerformanceSummary, BigDecimal> extractor) {
        this.extractor = extractor;
    }

    /**
     * @param summary   summary of a completed run, or null for a failed one
     * @param fillCount fills the run produced; zero means the policy never acted
     */
    public double score(PerformanceSummary summary, int fillCount) {
        if (summary == null) {
            return NO_SIGNAL_SCORE;
        }
        if (this != TRADE_COUNT && fillCount == 0) {
            return NO_SIGNAL_SCORE;
        }
        BigDecimal value = extractor.apply(summary);
        if (value == null) {
            return NO_SIGNAL_SCORE;
        }
        double score = value.doubleValue();
        return Double.isFinite(score) ? score : NO_SIGNAL_SCORE;
    }

    /**
     * Lenient lookup: enum names in any case, with or without separators, plus the short
     * names used in request payloads ({@code sharpe}, {@code return}, {@code drawdown}).
     */
    public static RankingMetric fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("rankBy", "Ranking metric is required");
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return switch (key) {
            case "sharperatio", "sharpe" -> SHARPE_RATIO;
            case "sortinoratio", "sortino" -> SORTINO_RATIO;
            case "totalreturn", "totalreturnpct", "return" -> TOTAL_RETURN;
            case "cagr", "cagrpct" -> CAGR;
            case "maxdrawdown", "maxdrawdownpct", "drawdown" -> MAX_DRAWDOWN;
            case "winrate", "winratepct" -> WIN_RATE;
            case "profitfactor" -> PROFIT_FACTOR;
            case "tradecount", "numtrades", "trades" -> TRADE_COUNT;
            default -> throw new ConfigurationException("rankBy", "Unknown ranking metric '" + name + "'");
        };
    }
}
