package net.gaiming.domain.event;

import java.time.Instant;
import java.util.UUID;

public record ExperimentVariantAssignedEvent(
    UUID eventId,
    Instant occurredOn,
    long experimentId,
    long playerId,
    String variantName
) implements DomainEvent {

    public ExperimentVariantAssignedEvent(Instant occurredOn, long experimentId, long playerId, String variantName) {
        this(UUID.randomUUID(), occurredOn, experimentId, playerId, variantName);
    }
}
