package net.gaiming.support.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * TTL-keyed memoization layer in front of expensive reads.
 *
 * <p>The cache is purely an optimization: a TTL of zero or less disables storage for that
 * call and the factory always runs.</p>
 */
public interface CacheService {

    /**
     * Returns the cached value for {@code key} if it has not expired, otherwise invokes
     * {@code factory}, stores its (non-null) result for {@code ttl} and returns it.
     */
    <T> T getOrSet(String key, Duration ttl, Supplier<T> factory);

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, Duration ttl);

    boolean exists(String key);

    void remove(String key);

    /**
     * Removes every key matching a glob pattern where {@code *} matches any run of characters.
     *
     * @return number of removed entries
     */
    int removeByPattern(String pattern);
}
