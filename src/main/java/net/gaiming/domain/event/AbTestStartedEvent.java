package net.gaiming.domain.event;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AbTestStartedEvent(
    UUID eventId,
    Instant occurredOn,
    long experimentId,
    String experimentName,
    List<String> variantNames
) implements DomainEvent {

    public AbTestStartedEvent {
        variantNames = variantNames == null ? List.of() : List.copyOf(variantNames);
    }

    public AbTestStartedEvent(Instant occurredOn, long experimentId, String experimentName, List<String> variantNames) {
        this(UUID.randomUUID(), occurredOn, experimentId, experimentName, variantNames);
    }
}
