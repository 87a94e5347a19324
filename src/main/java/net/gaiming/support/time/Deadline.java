package net.gaiming.support.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied bound on how long an operation may run. {@link #none()} never expires.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public static Deadline at(Instant expiresAt, Clock clock) {
        return new Deadline(Objects.requireNonNull(expiresAt, "expiresAt"), clock);
    }

    public boolean isBounded() {
        return expiresAt != null;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public Optional<Instant> expiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    /**
     * Time left before expiry; empty for an unbounded deadline, zero once expired.
     */
    public Optional<Duration> remaining() {
        if (expiresAt == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    @Override
    public String toString() {
        return expiresAt == null ? "Deadline[none]" : "Deadline[" + expiresAt + "]";
    }
}
