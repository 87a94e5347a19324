package net.gaiming.domain.model;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import net.gaiming.domain.event.GameRecommendationGeneratedEvent;
import net.gaiming.domain.event.RecommendationClickedEvent;
import net.gaiming.domain.event.RecommendationPlayedEvent;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted recommendation. Append-only history: apart from the click and play
 * flags, nothing changes after creation, and those flags only move from unset to set.
 */
@Getter
public class GameRecommendation extends BaseEntity {

    private final long playerId;
    private final long gameId;
    private final String algorithm;
    private final double score;
    private final int position;
    private final String context;
    private final String category;
    private final String reason;
    private final double confidence;
    @Nullable
    private final String sessionId;
    @Nullable
    private final String platform;
    @Nullable
    private final String experimentVariant;
    private final String modelVersion;
    private final Map<String, Double> featureSnapshot;
    private final Map<String, Object> metadata;

    private boolean clicked;
    @Nullable
    private Instant clickedAt;
    private boolean played;
    @Nullable
    private Instant playedAt;

    @Builder
    private GameRecommendation(long playerId, long gameId, String algorithm, double score, int position,
                               String context, String category, String reason, double confidence,
                               @Nullable String sessionId, @Nullable String platform,
                               @Nullable String experimentVariant, String modelVersion,
                               Map<String, Double> featureSnapshot, Map<String, Object> metadata,
                               boolean clicked, @Nullable Instant clickedAt,
                               boolean played, @Nullable Instant playedAt,
                               Instant createdAt) {
        super(createdAt);
        this.playerId = playerId;
        this.gameId = gameId;
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.score = score;
        this.position = position;
        this.context = context == null ? "" : context;
        this.category = category == null ? "" : category;
        this.reason = reason == null ? "" : reason;
        this.confidence = confidence;
        this.sessionId = sessionId;
        this.platform = platform;
        this.experimentVariant = experimentVariant;
        this.modelVersion = modelVersion == null ? "" : modelVersion;
        this.featureSnapshot = featureSnapshot == null ? Map.of() : Map.copyOf(featureSnapshot);
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.clicked = clicked;
        this.clickedAt = clickedAt;
        this.played = played;
        this.playedAt = playedAt;
    }

    public static GameRecommendation fromServed(Recommendation served, @Nullable String sessionId,
                                                @Nullable String platform, Instant createdAt) {
        return GameRecommendation.builder()
            .playerId(served.getPlayerId())
            .gameId(served.getGameId())
            .algorithm(served.getAlgorithm())
            .score(served.getScore())
            .position(served.getPosition())
            .context(served.getContext())
            .category(served.getCategory())
            .reason(served.getReason())
            .confidence(served.getConfidence())
            .sessionId(sessionId != null ? sessionId : served.getSessionId())
            .platform(platform)
            .experimentVariant(served.getExperimentVariant())
            .modelVersion(served.getModelVersion())
            .featureSnapshot(served.getFeatureSnapshot())
            .metadata(served.getMetadata())
            .createdAt(createdAt)
            .build();
    }

    /**
     * Sets the click flag the first time; later calls leave the original timestamp alone.
     *
     * @return {@code true} if the flag changed
     */
    public boolean markClicked(Instant at, @Nullable String interactionSessionId) {
        if (clicked) {
            return false;
        }
        clicked = true;
        clickedAt = at;
        touch(at);
        raise(new RecommendationClickedEvent(at, requireId(), playerId, gameId, algorithm, interactionSessionId));
        return true;
    }

    /**
     * Sets the play flag the first time; later calls leave the original timestamp alone.
     *
     * @return {@code true} if the flag changed
     */
    public boolean markPlayed(Instant at, @Nullable String interactionSessionId) {
        if (played) {
            return false;
        }
        played = true;
        playedAt = at;
        touch(at);
        raise(new RecommendationPlayedEvent(at, requireId(), playerId, gameId, algorithm, interactionSessionId));
        return true;
    }

    @Override
    protected void onPersisted() {
        Instant at = getCreatedAt() != null ? getCreatedAt() : Instant.now();
        raise(new GameRecommendationGeneratedEvent(at, requireId(), playerId, gameId, algorithm, score, context));
    }

    public Recommendation toRecommendation() {
        return Recommendation.builder()
            .id(getId())
            .playerId(playerId)
            .gameId(gameId)
            .algorithm(algorithm)
            .score(score)
            .position(position)
            .context(context)
            .category(category)
            .reason(reason)
            .confidence(confidence)
            .clicked(clicked)
            .clickedAt(clickedAt)
            .played(played)
            .playedAt(playedAt)
            .sessionId(sessionId)
            .experimentVariant(experimentVariant)
            .modelVersion(modelVersion)
            .featureSnapshot(featureSnapshot)
            .metadata(metadata)
            .generatedAt(getCreatedAt())
            .build();
    }
}
