package com.phillippitts.speechmaker.util;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed point in (monotonic) time by which an external call must resolve.
 *
 * <p>Passed into every external-call wrapper so that nested waits share one budget instead of
 * each starting its own timer.
 */
public final class Deadline {

    private final Duration budget;
    private final long deadlineNanos;

    private Deadline(Duration budget) {
        this.budget = budget;
        this.deadlineNanos = System.nanoTime() + budget.toNanos();
    }

    public static Deadline after(Duration budget) {
        Objects.requireNonNull(budget, "budget");
        if (budget.isNegative()) {
            throw new IllegalArgumentException("budget must not be negative");
        }
        return new Deadline(budget);
    }

    public static Deadline afterMillis(long millis) {
        return after(Duration.ofMillis(millis));
    }

    public Duration budget() {
        return budget;
    }

    /** Time left, never negative. */
    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    @Override
    public String toString() {
        return "Deadline{budgetMs=" + budget.toMillis() + ", remainingMs=" + remaining().toMillis() + '}';
    }
}
