package net.gaiming.domain.event;

import java.time.Instant;
import java.util.UUID;

public record RecommendationClickedEvent(
    UUID eventId,
    Instant occurredOn,
    long recommendationId,
    long playerId,
    long gameId,
    String algorithm,
    String sessionId
) implements DomainEvent {

    public RecommendationClickedEvent(Instant occurredOn, long recommendationId, long playerId, long gameId,
                                      String algorithm, String sessionId) {
        this(UUID.randomUUID(), occurredOn, recommendationId, playerId, gameId, algorithm, sessionId);
    }
}
