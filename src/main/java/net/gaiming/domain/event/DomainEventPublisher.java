package net.gaiming.domain.event;

/**
 * Outbound port for domain events dispatched by a unit of work after a successful save.
 */
public interface DomainEventPublisher {

    void publish(DomainEvent event);
}
