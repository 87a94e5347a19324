package net.gaiming.domain.model;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one tracked interaction with a recommendation.
 */
@Getter
public class RecommendationInteraction extends BaseEntity {

    /** Stored in place of a missing session so the dedup key stays comparable. */
    public static final String NO_SESSION = "";

    private final long recommendationId;
    private final long playerId;
    private final long gameId;
    private final InteractionType interactionType;
    @Nullable
    private final Double value;
    private final String sessionId;
    @Nullable
    private final String platform;
    @Nullable
    private final String userAgent;
    private final Instant interactionDate;
    private final Map<String, Object> metadata;

    @Builder
    private RecommendationInteraction(long recommendationId, long playerId, long gameId,
                                      InteractionType interactionType, @Nullable Double value,
                                      @Nullable String sessionId, @Nullable String platform,
                                      @Nullable String userAgent, Instant interactionDate,
                                      Map<String, Object> metadata) {
        super(interactionDate);
        this.recommendationId = recommendationId;
        this.playerId = playerId;
        this.gameId = gameId;
        this.interactionType = Objects.requireNonNull(interactionType, "interactionType");
        this.value = value;
        this.sessionId = normalizeSession(sessionId);
        this.platform = platform;
        this.userAgent = userAgent;
        this.interactionDate = Objects.requireNonNull(interactionDate, "interactionDate");
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static String normalizeSession(@Nullable String sessionId) {
        return sessionId == null ? NO_SESSION : sessionId.trim();
    }
}
