package net.gaiming.domain.model;

import jakarta.annotation.Nullable;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * What a caller asks the engine for: how many games, for whom, where they will be shown,
 * and optionally which algorithm to use.
 *
 * @param algorithm explicit strategy override, {@code null} for automatic selection
 */
public record RecommendationRequest(long playerId,
                                    int count,
                                    String context,
                                    @Nullable String algorithm,
                                    Set<Long> excludedGameIds,
                                    Map<String, Object> parameters) {

    public static final String DEFAULT_CONTEXT = "lobby";
    public static final int DEFAULT_COUNT = 10;

    public RecommendationRequest {
        context = StringUtils.hasText(context) ? context.trim() : DEFAULT_CONTEXT;
        algorithm = StringUtils.hasText(algorithm) ? algorithm.trim() : null;
        excludedGameIds = excludedGameIds == null ? Set.of() : Set.copyOf(excludedGameIds);
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static RecommendationRequest of(long playerId, int count, String context) {
        return new RecommendationRequest(playerId, count, context, null, Set.of(), Map.of());
    }

    public boolean hasAlgorithmOverride() {
        return algorithm != null;
    }

    public boolean isExcluded(long gameId) {
        return excludedGameIds.contains(gameId);
    }

    public RecommendationRequest withCount(int newCount) {
        return new RecommendationRequest(playerId, newCount, context, algorithm, excludedGameIds, parameters);
    }
}
