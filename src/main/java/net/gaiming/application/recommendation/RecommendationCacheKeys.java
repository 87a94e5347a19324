package net.gaiming.application.recommendation;

import jakarta.annotation.Nullable;
import net.gaiming.support.cache.CacheService;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Cache key layout for served recommendations.
 *
 * <p>{@code recommendations:{playerId}} holds the last pipeline result and
 * {@code recommendations:{playerId}:{algorithm|auto}:{context}:{count}[:x{hash}]} holds query
 * results, the suffix being the SHA-256 of the sorted excluded game ids.</p>
 */
public final class RecommendationCacheKeys {

    public static final String PREFIX = "recommendations:";
    public static final String AUTO_ALGORITHM = "auto";

    private RecommendationCacheKeys() {
    }

    public static String forPlayer(long playerId) {
        return PREFIX + playerId;
    }

    public static String forQuery(long playerId, @Nullable String algorithm, String context, int count,
                                  Collection<Long> excludedGameIds) {
        StringBuilder key = new StringBuilder(forPlayer(playerId))
            .append(':').append(algorithm == null ? AUTO_ALGORITHM : algorithm.toLowerCase(Locale.ROOT))
            .append(':').append(context.toLowerCase(Locale.ROOT))
            .append(':').append(count);
        if (excludedGameIds != null && !excludedGameIds.isEmpty()) {
            String sorted = excludedGameIds.stream().sorted().map(String::valueOf).collect(Collectors.joining(","));
            key.append(":x").append(sha256Hex(sorted));
        }
        return key.toString();
    }

    /**
     * Evicts every entry of one player without touching players whose id shares the prefix.
     */
    public static int evictPlayer(CacheService cache, long playerId) {
        String base = forPlayer(playerId);
        int removed = cache.exists(base) ? 1 : 0;
        cache.remove(base);
        return removed + cache.removeByPattern(base + ":*");
    }

    public static int evictAll(CacheService cache) {
        return cache.removeByPattern(PREFIX + "*");
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
