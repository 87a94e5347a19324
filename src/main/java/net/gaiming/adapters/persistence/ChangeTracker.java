package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.BaseEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending inserts and updates registered by the repositories of one unit of work,
 * kept in registration order.
 */
final class ChangeTracker {

    @FunctionalInterface
    interface EntityWriter<T extends BaseEntity> {
        /**
         * Writes the entity and returns the number of affected rows.
         */
        int write(T entity);
    }

    private record PendingChange(BaseEntity entity, EntityWriter<BaseEntity> writer) {
    }

    // Entities do not override equals, so two instances of the same row are two changes.
    private final Map<BaseEntity, PendingChange> pending = new LinkedHashMap<>();

    @SuppressWarnings("unchecked")
    <T extends BaseEntity> void registerNew(T entity, EntityWriter<T> inserter) {
        if (!entity.isNew()) {
            throw new IllegalStateException(entity.getClass().getSimpleName() + " " + entity.getId()
                + " is already persisted; use update instead of add");
        }
        pending.putIfAbsent(entity, new PendingChange(entity, (EntityWriter<BaseEntity>) inserter));
    }

    @SuppressWarnings("unchecked")
    <T extends BaseEntity> void registerDirty(T entity, EntityWriter<T> updater) {
        if (entity.isNew()) {
            if (pending.containsKey(entity)) {
                // The pending insert will write the current state.
                return;
            }
            throw new IllegalStateException(entity.getClass().getSimpleName()
                + " has no id; add it before updating it");
        }
        pending.putIfAbsent(entity, new PendingChange(entity, (EntityWriter<BaseEntity>) updater));
    }

    boolean hasChanges() {
        return !pending.isEmpty();
    }

    int pendingCount() {
        return pending.size();
    }

    /**
     * Writes every pending change in order. Entities written successfully are appended to
     * {@code flushed}; on failure the remaining changes stay pending.
     */
    int flush(List<BaseEntity> flushed) {
        int affected = 0;
        List<BaseEntity> written = new ArrayList<>();
        try {
            for (PendingChange change : pending.values()) {
                affected += change.writer().write(change.entity());
                written.add(change.entity());
            }
        } finally {
            for (BaseEntity entity : written) {
                pending.remove(entity);
            }
            flushed.addAll(written);
        }
        return affected;
    }

    void clear() {
        pending.clear();
    }
}
