package com.energy.anomaly.engine.reconstruction;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and wall-clock budget for iterative training.
 *
 * A caller keeps a reference and may {@link #cancel()} from another thread; the trainer
 * calls {@link #checkpoint()} between mini-batches and stops at the next one.
 */
public final class TrainingMonitor {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final AtomicBoolean cancelled;
    private final long deadlineNanos;

    private TrainingMonitor(AtomicBoolean cancelled, long deadlineNanos) {
        this.cancelled = cancelled;
        this.deadlineNanos = deadlineNanos;
    }

    public static TrainingMonitor unbounded() {
        return new TrainingMonitor(new AtomicBoolean(false), NO_DEADLINE);
    }

    public static TrainingMonitor withTimeout(Duration timeout) {
        return unbounded().narrow(timeout);
    }

    /**
     * A monitor sharing this one's cancellation flag whose deadline is the earlier of
     * this deadline and now + timeout.
     */
    public TrainingMonitor narrow(Duration timeout) {
        long candidate;
        try {
            candidate = Math.addExact(System.nanoTime(), timeout.toNanos());
        } catch (ArithmeticException overflow) {
            candidate = NO_DEADLINE;
        }
        return new TrainingMonitor(cancelled, Math.min(deadlineNanos, candidate));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkpoint() throws TrainingAbortedException {
        if (cancelled.get()) {
            throw new TrainingAbortedException("training cancelled by caller");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new TrainingAbortedException("training thread interrupted");
        }
        if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
            throw new TrainingAbortedException("training exceeded its time budget");
        }
    }
}
