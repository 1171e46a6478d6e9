package com.bko.coachbot.shared;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget of one inbound request. Every outbound call bounds its own timeout by what is left.
 */
public final class Deadline {
    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock, clock.instant().plus(budget));
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * The smaller of {@code cap} and the remaining budget.
     *
     * @throws CoachException with {@link ErrorKind#DEADLINE_EXCEEDED} when nothing is left
     */
    public Duration bound(Duration cap) {
        Duration left = remaining();
        if (left.isZero()) {
            throw new CoachException(ErrorKind.DEADLINE_EXCEEDED, "Request deadline exceeded");
        }
        return left.compareTo(cap) < 0 ? left : cap;
    }

    public void check(String step) {
        if (isExpired()) {
            throw new CoachException(ErrorKind.DEADLINE_EXCEEDED, "Request deadline exceeded before " + step);
        }
    }
}
