package net.gaiming.domain.model;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One ranked game suggested to a player.
 *
 * <p>Produced by a strategy with {@code id == null}; carries the persisted id and
 * interaction flags once read back from history.</p>
 */
@Value
@Builder(toBuilder = true)
public class Recommendation {

    @Nullable
    Long id;
    long playerId;
    long gameId;
    String algorithm;
    double score;
    int position;
    String context;
    String category;
    String reason;
    double confidence;

    boolean clicked;
    @Nullable
    Instant clickedAt;
    boolean played;
    @Nullable
    Instant playedAt;

    @Nullable
    String sessionId;
    @Nullable
    String experimentVariant;
    String modelVersion;
    @Singular("featureValue")
    Map<String, Double> featureSnapshot;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
    Instant generatedAt;

    public Recommendation withPosition(int newPosition) {
        return toBuilder().position(newPosition).build();
    }
}
