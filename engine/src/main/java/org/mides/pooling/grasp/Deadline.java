package org.mides.pooling.grasp;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Pollable time budget shared by the driver and the engines of one run. The
 * engines only look at it between complete moves, so an expired deadline
 * never interrupts a half-applied mutation.
 */
public class Deadline {

    private final Clock clock;
    private final Instant expiry;
    private volatile boolean cancelled;

    private Deadline(Clock clock, Instant expiry) {
        this.clock = clock;
        this.expiry = expiry;
    }

    public static Deadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    public static Deadline after(Duration budget, Clock clock) {
        var now = clock.instant();
        if (budget.compareTo(Duration.between(now, Instant.MAX)) >= 0)
            return new Deadline(clock, Instant.MAX);
        return new Deadline(clock, now.plus(budget));
    }

    /** A deadline that only ends through {@link #cancel()}. */
    public static Deadline none() {
        return new Deadline(Clock.systemUTC(), Instant.MAX);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isExpired() {
        return cancelled || !clock.instant().isBefore(expiry);
    }

    public Duration remaining() {
        if (isExpired())
            return Duration.ZERO;
        return Duration.between(clock.instant(), expiry);
    }
}
