package com.causalbacktest.backtester.optimizer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a sweep. Workers check it before starting a run, never
 * during one. An optional wall-clock deadline counts as cancellation once passed.
 */
public final class SweepCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private SweepCancellation(Duration budget) {
        this.hasDeadline = budget != null;
        this.deadlineNanos = budget == null ? 0L : System.nanoTime() + budget.toNanos();
    }

    public static SweepCancellation create() {
        return new SweepCancellation(null);
    }

    public static SweepCancellation withDeadline(Duration budget) {
        return new SweepCancellation(budget);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }
}
