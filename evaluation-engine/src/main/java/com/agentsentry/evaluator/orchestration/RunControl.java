package com.agentsentry.evaluator.orchestration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External stop signal of a run: a wall-clock deadline and a cancellation
 * flag. Cancellation is not an error; the run still yields a summary.
 *
 * @author Naveed Gung
 */
public class RunControl {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RunControl(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static RunControl withDeadline(Duration budget) {
        Clock clock = Clock.systemUTC();
        return new RunControl(clock, clock.instant().plus(budget));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return clock.instant().isAfter(deadline);
    }

    /** True once the run must stop issuing new attempts. */
    public boolean shouldStop() {
        return isCancelled() || isExpired();
    }

    /** Why the run stopped early, or null while it may continue. */
    public String stopReason() {
        if (isCancelled()) {
            return "cancelled";
        }
        return isExpired() ? "deadline" : null;
    }

    public Instant getDeadline() {
        return deadline;
    }
}
