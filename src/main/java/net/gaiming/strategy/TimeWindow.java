package net.gaiming.strategy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed measurement window {@code [from, to]}.
 */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after its end " + to);
        }
    }

    public static TimeWindow lastDays(int days, Clock clock) {
        Instant now = clock.instant();
        return new TimeWindow(now.minus(Duration.ofDays(days)), now);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(from) && !instant.isAfter(to);
    }
}
