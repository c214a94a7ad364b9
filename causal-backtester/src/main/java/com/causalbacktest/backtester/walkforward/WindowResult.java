package com.causalbacktest.backtester.walkforward;

import com.causalbacktest.backtester.domain.ParameterSet;
import com.causalbacktest.backtester.domain.PerformanceSummary;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Train selection and out-of-sample outcome of one window.
 */
@Value
@Builder
public class WindowResult {

    WindowSpec window;
    LocalDateTime trainStartTime;
    LocalDateTime trainEndTime;
    LocalDateTime testStartTime;
    LocalDateTime testEndTime;
    ParameterSet chosenParameters;
    double trainScore;
    int combinationsEvaluated;
    PerformanceSummary testSummary;

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("window", window.getIndex());
        row.put("train_start", window.getTrainStart());
        row.put("train_end", window.getTrainEnd());
        row.put("test_start", window.getTestStart());
        row.put("test_end", window.getTestEnd());
        row.put("train_start_time", trainStartTime);
        row.put("train_end_time", trainEndTime);
        row.put("test_start_time", testStartTime);
        row.put("test_end_time", testEndTime);
        row.put("params", chosenParameters.asMap());
        row.put("train_score", trainScore);
        row.putAll(testSummary.toRow());
        return row;
    }
}
