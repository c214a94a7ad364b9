package com.causalbacktest.backtester.optimizer;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ranked rows of a finished (or cancelled) sweep. Rows are ordered by rank.
 */
@Value
@Builder
public class OptimizationResult {

    String policyName;
    RankingMetric rankBy;
    RankingMetric tieBreaker;
    long totalCombinations;
    int completed;
    int failed;
    int skipped;
    boolean cancelled;
    List<OptimizationRow> rows;

    /**
     * Top-ranked completed row, if any combination completed.
     */
    public Optional<OptimizationRow> getBest() {
        return rows.stream().filter(OptimizationRow::isCompleted).findFirst();
    }

    public List<Map<String, Object>> toTable() {
        return rows.stream().map(OptimizationRow::toRow).toList();
    }
}
