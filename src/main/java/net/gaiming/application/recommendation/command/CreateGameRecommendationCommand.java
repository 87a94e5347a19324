package net.gaiming.application.recommendation.command;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import net.gaiming.application.cqrs.Command;
import net.gaiming.application.cqrs.CommandMetadata;

import java.util.Map;

/**
 * Persists one recommendation that was produced outside the pipeline (an offline batch or
 * an operator pick). Returns the new recommendation id.
 */
@Value
@Builder
public class CreateGameRecommendationCommand implements Command<Long> {

    long playerId;
    long gameId;
    String algorithm;
    double score;
    int position;
    String context;
    @Nullable String category;
    @Nullable String reason;
    double confidence;
    @Nullable String sessionId;
    @Nullable String platform;
    @Nullable String experimentVariant;
    @Nullable String modelVersion;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
    CommandMetadata commandMetadata;

    @Override
    public CommandMetadata metadata() {
        return commandMetadata;
    }
}
