package net.gaiming.domain.event;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Raised when the per-game override settings change; {@code changedFields} names the overrides touched.
 */
public record GameManagementSettingsUpdatedEvent(
    UUID eventId,
    Instant occurredOn,
    long gameId,
    Set<String> changedFields,
    String updatedBy
) implements DomainEvent {

    public GameManagementSettingsUpdatedEvent {
        changedFields = changedFields == null ? Set.of() : Set.copyOf(changedFields);
    }

    public GameManagementSettingsUpdatedEvent(Instant occurredOn, long gameId, Set<String> changedFields, String updatedBy) {
        this(UUID.randomUUID(), occurredOn, gameId, changedFields, updatedBy);
    }
}
