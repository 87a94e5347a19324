package net.gaiming.domain.event;

import java.time.Instant;
import java.util.UUID;

public record GameRecommendationGeneratedEvent(
    UUID eventId,
    Instant occurredOn,
    long recommendationId,
    long playerId,
    long gameId,
    String algorithm,
    double score,
    String context
) implements DomainEvent {

    public GameRecommendationGeneratedEvent(Instant occurredOn, long recommendationId, long playerId, long gameId,
                                            String algorithm, double score, String context) {
        this(UUID.randomUUID(), occurredOn, recommendationId, playerId, gameId, algorithm, score, context);
    }
}
