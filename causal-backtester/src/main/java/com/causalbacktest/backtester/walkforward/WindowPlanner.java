package com.causalbacktest.backtester.walkforward;

import com.causalbacktest.backtester.domain.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits {@code [0, totalBars)} into rolling train/test windows.
 *
 * <p>Windows start at bar 0 and advance by the step while a full train and test window
 * fit. With the default step a trailing remainder shorter than {@code testBars} becomes
 * one last, shorter test window, so the test windows together cover
 * {@code [trainBars, totalBars)} exactly once. When {@code windowCount} is set, the first
 * {@code windowCount} windows are used.
 */
public final class WindowPlanner {

    private WindowPlanner() {
    }

    public static List<WindowSpec> plan(int totalBars, WalkForwardConfig config) {
        config.validate();
        int train = config.getTrainBars();
        int test = config.getTestBars();
        int step = config.getEffectiveStep();

        if (train + test > totalBars) {
            throw new ConfigurationException("trainBars", "Walk-forward needs at least " + (train + test)
                    + " bars (train " + train + " + test " + test + "), have " + totalBars);
        }

        List<WindowSpec> windows = new ArrayList<>();
        int start = 0;
        while (start + train + test <= totalBars) {
            windows.add(new WindowSpec(windows.size(), start, start + train, start + train, start + train + test));
            start += step;
        }

        if (config.isDefaultStep()) {
            int covered = windows.get(windows.size() - 1).getTestEnd();
            if (covered < totalBars) {
                windows.add(new WindowSpec(windows.size(), covered - train, covered, covered, totalBars));
            }
        }

        Integer requested = config.getWindowCount();
        if (requested != null) {
            if (requested > windows.size()) {
                throw new ConfigurationException("windowCount", "Requested " + requested + " windows but "
                        + totalBars + " bars only allow " + windows.size());
            }
            return List.copyOf(windows.subList(0, requested));
        }
        return List.copyOf(windows);
    }
}
