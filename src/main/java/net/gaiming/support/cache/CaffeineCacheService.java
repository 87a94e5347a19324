package net.gaiming.support.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link CacheService} on a single Caffeine cache whose entries each carry their own TTL.
 *
 * <p>Population is not synchronized per key: two concurrent misses may both run their
 * factory, and the last write wins.</p>
 */
@Slf4j
public class CaffeineCacheService implements CacheService {

    private final Cache<String, CacheEntry> cache;

    public CaffeineCacheService(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineCacheService(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new PerEntryExpiry())
            .ticker(ticker)
            .executor(Runnable::run)
            .recordStats()
            .build();
    }

    @Override
    public <T> T getOrSet(String key, Duration ttl, Supplier<T> factory) {
        if (!isCacheable(ttl)) {
            return factory.get();
        }
        CacheEntry existing = cache.getIfPresent(key);
        if (existing != null) {
            log.debug("Cache hit for key {}", key);
            @SuppressWarnings("unchecked")
            T hit = (T) existing.value();
            return hit;
        }
        log.debug("Cache miss for key {}", key);
        T created = factory.get();
        if (created != null) {
            cache.put(key, new CacheEntry(created, ttl.toNanos()));
        }
        return created;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null || !type.isInstance(entry.value())) {
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value()));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (value == null || !isCacheable(ttl)) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new CacheEntry(value, ttl.toNanos()));
    }

    @Override
    public boolean exists(String key) {
        return cache.getIfPresent(key) != null;
    }

    @Override
    public void remove(String key) {
        cache.invalidate(key);
    }

    @Override
    public int removeByPattern(String pattern) {
        if (!StringUtils.hasText(pattern)) {
            return 0;
        }
        Pattern regex = globToRegex(pattern);
        List<String> matching = cache.asMap().keySet().stream()
            .filter(key -> regex.matcher(key).matches())
            .collect(Collectors.toList());
        cache.invalidateAll(matching);
        if (!matching.isEmpty()) {
            log.debug("Evicted {} cache entries matching {}", matching.size(), pattern);
        }
        return matching.size();
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(glob.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }

    private static boolean isCacheable(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    private record CacheEntry(Object value, long ttlNanos) {
    }

    private static final class PerEntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
