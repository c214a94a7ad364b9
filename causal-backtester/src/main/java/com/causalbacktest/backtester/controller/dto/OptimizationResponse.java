package com.causalbacktest.backtester.controller.dto;

import com.causalbacktest.backtester.optimizer.OptimizationResult;
import com.causalbacktest.backtester.optimizer.OptimizationRow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a parameter sweep: ranked rows flattened to parameter and metric columns.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizationResponse {

    private String policy;
    private String rankBy;
    private String tieBreaker;
    private long totalCombinations;
    private int completed;
    private int failed;
    private int skipped;
    private boolean cancelled;
    private Map<String, Object> best;
    private List<Map<String, Object>> rows;

    public static OptimizationResponse from(OptimizationResult result, Integer top) {
        List<Map<String, Object>> table = result.toTable();
        if (top != null && top < table.size()) {
            table = table.subList(0, top);
        }
        return OptimizationResponse.builder()
                .policy(result.getPolicyName())
                .rankBy(result.getRankBy().name())
                .tieBreaker(result.getTieBreaker().name())
                .totalCombinations(result.getTotalCombinations())
                .completed(result.getCompleted())
                .failed(result.getFailed())
                .skipped(result.getSkipped())
                .cancelled(result.isCancelled())
                .best(result.getBest().map(OptimizationRow::toRow).orElse(null))
                .rows(List.copyOf(table))
                .build();
    }
}
