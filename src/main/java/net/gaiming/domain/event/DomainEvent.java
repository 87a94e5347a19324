package net.gaiming.domain.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Something that happened to an aggregate, published after the change was saved.
 */
public interface DomainEvent {

    UUID eventId();

    Instant occurredOn();
}
