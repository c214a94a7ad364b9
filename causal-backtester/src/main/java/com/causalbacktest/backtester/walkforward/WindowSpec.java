package com.causalbacktest.backtester.walkforward;

import lombok.Value;

/**
 * One train/test pair as half-open bar index ranges of the full feed.
 */
@Value
public class WindowSpec {

    int index;
    int trainStart;
    int trainEnd;
    int testStart;
    int testEnd;

    public int getTrainBars() {
        return trainEnd - trainStart;
    }

    public int getTestBars() {
        return testEnd - testStart;
    }
}
