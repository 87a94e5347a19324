package net.gaiming.support.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CaffeineCacheServiceTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineCacheService cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineCacheService(1_000, nanos::get);
    }

    @Test
    void should_RunFactoryOnce_When_EntryStillFresh() {
        AtomicInteger calls = new AtomicInteger();

        String first = cache.getOrSet("k", Duration.ofMinutes(1), () -> "v" + calls.incrementAndGet());
        String second = cache.getOrSet("k", Duration.ofMinutes(1), () -> "v" + calls.incrementAndGet());

        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(calls).hasValue(1);
    }

    @Test
    void should_RecomputeValue_When_TtlElapsed() {
        cache.set("k", "old", Duration.ofSeconds(10));
        nanos.addAndGet(Duration.ofSeconds(11).toNanos());

        assertThat(cache.exists("k")).isFalse();
        assertThat(cache.getOrSet("k", Duration.ofSeconds(10), () -> "new")).isEqualTo("new");
    }

    @Test
    void should_NotStore_When_TtlIsZero() {
        AtomicInteger calls = new AtomicInteger();

        cache.getOrSet("k", Duration.ZERO, calls::incrementAndGet);
        cache.getOrSet("k", Duration.ZERO, calls::incrementAndGet);

        assertThat(calls).hasValue(2);
        assertThat(cache.exists("k")).isFalse();
    }

    @Test
    void should_ReturnEmpty_When_StoredValueHasOtherType() {
        cache.set("k", 42, Duration.ofMinutes(1));

        assertThat(cache.get("k", String.class)).isEmpty();
        assertThat(cache.get("k", Integer.class)).contains(42);
    }

    @Test
    void should_RemoveOnlyMatchingKeys_When_RemovingByPattern() {
        cache.set("recommendations:1:auto:lobby:10", "a", Duration.ofMinutes(1));
        cache.set("recommendations:1:hybrid:lobby:5", "b", Duration.ofMinutes(1));
        cache.set("recommendations:12:auto:lobby:10", "c", Duration.ofMinutes(1));
        cache.set("players:1", "d", Duration.ofMinutes(1));

        int removed = cache.removeByPattern("recommendations:1:*");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.exists("recommendations:12:auto:lobby:10")).isTrue();
        assertThat(cache.exists("players:1")).isTrue();
    }

    @Test
    void should_TreatRegexCharactersLiterally_When_ConvertingGlob() {
        assertThat(CaffeineCacheService.globToRegex("a.b*").matcher("a.bcd").matches()).isTrue();
        assertThat(CaffeineCacheService.globToRegex("a.b*").matcher("axbcd").matches()).isFalse();
    }

    @Test
    void should_DropEntry_When_SetWithNullValue() {
        cache.set("k", "v", Duration.ofMinutes(1));
        cache.set("k", null, Duration.ofMinutes(1));

        assertThat(cache.exists("k")).isFalse();
    }
}
