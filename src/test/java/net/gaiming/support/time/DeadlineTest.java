package net.gaiming.support.time;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class DeadlineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void should_NeverExpire_When_Unbounded() {
        assertThat(Deadline.none().isBounded()).isFalse();
        assertThat(Deadline.none().isExpired()).isFalse();
        assertThat(Deadline.none().remaining()).isEmpty();
    }

    @Test
    void should_ReportRemainingTime_When_NotYetExpired() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(5), Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remaining()).contains(Duration.ofSeconds(5));
    }

    @Test
    void should_ClampRemainingToZero_When_Expired() {
        Deadline deadline = Deadline.at(NOW.minusSeconds(1), Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).contains(Duration.ZERO);
    }
}
