package net.gaiming.domain.model;

import jakarta.annotation.Nullable;
import lombok.Getter;
import net.gaiming.domain.event.DomainEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Common state of persisted aggregates: surrogate id, optimistic version, audit
 * timestamps and the buffer of domain events raised since the last dispatch.
 */
@Getter
public abstract class BaseEntity {

    @Nullable
    private Long id;
    private long version;
    @Nullable
    private Instant createdAt;
    @Nullable
    private Instant updatedAt;

    @Getter(lombok.AccessLevel.NONE)
    private final List<DomainEvent> domainEvents = new ArrayList<>();

    protected BaseEntity(@Nullable Instant createdAt) {
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean isNew() {
        return id == null;
    }

    /**
     * Rehydrates identity and audit columns when an aggregate is loaded from storage.
     * Raises no events.
     */
    public void restore(long id, long version, @Nullable Instant createdAt, @Nullable Instant updatedAt) {
        this.id = id;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Called by the persistence layer right after the first insert.
     */
    public void assignIdentity(long generatedId) {
        if (this.id != null) {
            throw new IllegalStateException(getClass().getSimpleName() + " already has id " + this.id);
        }
        this.id = generatedId;
        onPersisted();
    }

    /**
     * Called by the persistence layer after a successful versioned update.
     */
    public void advanceVersion() {
        this.version++;
    }

    protected void touch(Instant at) {
        this.updatedAt = at;
    }

    /**
     * Hook for aggregates that announce their own creation once an id exists.
     */
    protected void onPersisted() {
    }

    protected void raise(DomainEvent event) {
        domainEvents.add(event);
    }

    public List<DomainEvent> getDomainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    public void clearDomainEvents() {
        domainEvents.clear();
    }

    protected long requireId() {
        if (id == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not been persisted yet");
        }
        return id;
    }
}
