package com.phillippitts.swarmcouncil.service.workflow;

import com.phillippitts.swarmcouncil.util.TimeUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-supplied deadline and cancellation signal for a workflow run.
 *
 * <p>The pipeline checks the token before each stage and while waiting on a stage's provider call.
 * Cancelling never rolls back completed stages.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, false, Clock.systemUTC());

    private final Instant deadline;
    private final boolean cancellable;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationToken(Instant deadline, boolean cancellable, Clock clock) {
        this.deadline = deadline;
        this.cancellable = cancellable;
        this.clock = clock;
    }

    /** A token that never cancels. */
    public static CancellationToken none() {
        return NONE;
    }

    /** A token cancelled only through {@link #cancel()}. */
    public static CancellationToken manual() {
        return new CancellationToken(null, true, Clock.systemUTC());
    }

    /**
     * A token that cancels itself once the timeout elapses; zero or negative means no deadline.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        if (TimeUtils.isUnbounded(timeout)) {
            return manual();
        }
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), true, clock);
    }

    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("This token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /** True when this token can ever report cancellation. */
    public boolean isCancellable() {
        return cancellable;
    }

    /** Reason reported on cancelled runs. */
    public String reason() {
        return cancelled.get() ? "Workflow cancelled" : "Workflow deadline exceeded";
    }
}
