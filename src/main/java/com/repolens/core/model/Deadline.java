package com.repolens.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock limit shared by the scanner and the dependency mapper.
 * Work that finds the deadline expired stops and reports a partial result.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Clock.systemUTC(), Instant.MAX);

    private final Clock clock;
    private final Instant expiry;

    private Deadline(Clock clock, Instant expiry) {
        this.clock = clock;
        this.expiry = expiry;
    }

    public static Deadline after(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return NONE;
        }
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    /** A deadline that never expires. */
    public static Deadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return expiry != Instant.MAX && !clock.instant().isBefore(expiry);
    }

    /** Time left, zero once expired; {@link Duration#ofMillis(long) Long.MAX_VALUE ms} for no deadline. */
    public Duration remaining() {
        if (expiry == Instant.MAX) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        Duration left = Duration.between(clock.instant(), expiry);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
