package net.gaiming.domain.repository;

import net.gaiming.domain.model.BaseEntity;

/**
 * Repository for aggregates the core writes. {@link #add} and {@link #update} only
 * register the change with the owning unit of work; rows are written on save.
 */
public interface EntityRepository<T extends BaseEntity> extends ReadOnlyRepository<T, Long> {

    void add(T entity);

    void update(T entity);
}
