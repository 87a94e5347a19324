package net.gaiming.application.recommendation.command;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import net.gaiming.application.cqrs.Command;
import net.gaiming.application.cqrs.CommandMetadata;

import java.util.Map;

/**
 * Records a player interacting with a served recommendation.
 *
 * <p>{@code interactionType} is the raw value from the client (view, click, play, dismiss,
 * like, dislike; case-insensitive). The result is {@code true} when the interaction was
 * recorded and {@code false} when the same interaction was already tracked in the session.</p>
 */
@Value
@Builder
public class TrackRecommendationInteractionCommand implements Command<Boolean> {

    long recommendationId;
    long playerId;
    long gameId;
    String interactionType;
    @Nullable Double value;
    @Nullable String sessionId;
    @Nullable String platform;
    @Nullable String userAgent;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
    CommandMetadata commandMetadata;

    @Override
    public CommandMetadata metadata() {
        return commandMetadata;
    }
}
