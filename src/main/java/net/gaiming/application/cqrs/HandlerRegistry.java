package net.gaiming.application.cqrs;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable request-type to handler map, built once at startup.
 */
@Slf4j
public final class HandlerRegistry {

    private final Map<Class<?>, RequestHandler<?, ?>> handlers;

    private HandlerRegistry(Map<Class<?>, RequestHandler<?, ?>> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * @throws IllegalStateException when two handlers claim the same request type
     */
    public static HandlerRegistry of(Collection<? extends RequestHandler<?, ?>> handlers) {
        Map<Class<?>, RequestHandler<?, ?>> byType = new LinkedHashMap<>();
        for (RequestHandler<?, ?> handler : handlers) {
            Class<?> type = handler.requestType();
            RequestHandler<?, ?> previous = byType.putIfAbsent(type, handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for " + type.getSimpleName() + ": "
                    + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        log.info("Registered {} request handler(s)", byType.size());
        return new HandlerRegistry(byType);
    }

    @SuppressWarnings("unchecked")
    public <R> Optional<RequestHandler<Request<R>, R>> find(Class<?> requestType) {
        return Optional.ofNullable((RequestHandler<Request<R>, R>) handlers.get(requestType));
    }

    public boolean hasHandler(Class<?> requestType) {
        return handlers.containsKey(requestType);
    }

    public Set<Class<?>> requestTypes() {
        return handlers.keySet();
    }
}
