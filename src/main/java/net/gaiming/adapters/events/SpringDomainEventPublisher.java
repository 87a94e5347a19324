package net.gaiming.adapters.events;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.event.DomainEvent;
import net.gaiming.domain.event.DomainEventPublisher;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes domain events as in-process Spring application events; listeners use
 * {@code @EventListener} on the concrete event record.
 */
@Component
@Slf4j
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(DomainEvent event) {
        applicationEventPublisher.publishEvent(event);
        log.debug("Published {} {}", event.getClass().getSimpleName(), event.eventId());
    }
}
