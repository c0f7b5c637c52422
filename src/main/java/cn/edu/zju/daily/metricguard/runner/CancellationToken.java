package cn.edu.zju.daily.metricguard.runner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal and optional deadline, checked by runners between units of work. Work that
 * already started is allowed to finish.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /** A token that is only cancelled explicitly. */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(deadline, clock);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    public Instant getDeadline() {
        return deadline;
    }
}
