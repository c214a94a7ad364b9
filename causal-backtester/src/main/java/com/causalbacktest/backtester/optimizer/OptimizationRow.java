package com.causalbacktest.backtester.optimizer;

import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.domain.PerformanceSummary;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one parameter combination in a sweep.
 */
@Value
@Builder
public class OptimizationRow {

    /** Position of the combination in grid order. */
    int index;
    ParameterSet parameters;
    RunStatus status;
    PerformanceSummary summary;
    int fillCount;
    double score;
    double tieScore;
    String error;

    @With
    int rank;

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    /**
     * Flat row: parameters first, then ranking columns, then the summary fields.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>(parameters.asMap());
        row.put("rank", rank);
        row.put("combination", index);
        row.put("status", status);
        row.put("score", score);
        if (summary != null) {
            row.putAll(summary.toRow());
        }
        if (error != null) {
            row.put("error", error);
        }
        return row;
    }
}
