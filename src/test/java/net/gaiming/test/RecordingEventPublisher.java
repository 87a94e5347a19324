package net.gaiming.test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import net.gaiming.domain.event.DomainEvent;
import net.gaiming.domain.event.DomainEventPublisher;

/**
 * Keeps every published event and forwards it to optional in-process listeners.
 */
public final class RecordingEventPublisher implements DomainEventPublisher {

    private final List<DomainEvent> published = new CopyOnWriteArrayList<>();
    private final List<Consumer<DomainEvent>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void publish(DomainEvent event) {
        published.add(event);
        listeners.forEach(listener -> listener.accept(event));
    }

    public void subscribe(Consumer<DomainEvent> listener) {
        listeners.add(listener);
    }

    public <E extends DomainEvent> List<E> eventsOfType(Class<E> type) {
        return published.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public List<DomainEvent> published() {
        return List.copyOf(published);
    }

    public void clear() {
        published.clear();
    }
}
