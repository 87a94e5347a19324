package net.gaiming.domain.event;

import java.time.Instant;
import java.util.UUID;

public record AbTestCompletedEvent(
    UUID eventId,
    Instant occurredOn,
    long experimentId,
    String experimentName,
    String winningVariant
) implements DomainEvent {

    public AbTestCompletedEvent(Instant occurredOn, long experimentId, String experimentName, String winningVariant) {
        this(UUID.randomUUID(), occurredOn, experimentId, experimentName, winningVariant);
    }
}
