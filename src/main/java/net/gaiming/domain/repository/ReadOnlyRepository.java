package net.gaiming.domain.repository;

import net.gaiming.support.specification.Specification;

import java.util.List;
import java.util.Optional;

/**
 * Query side shared by every repository port.
 *
 * @param <T> entity type
 * @param <K> identifier type
 */
public interface ReadOnlyRepository<T, K> {

    Optional<T> findById(K id);

    List<T> find(Specification<T> specification);

    /**
     * Counts matches of the criteria, ignoring paging.
     */
    long count(Specification<T> specification);

    default Optional<T> findFirst(Specification<T> specification) {
        return find(specification).stream().findFirst();
    }

    default boolean exists(Specification<T> specification) {
        return count(specification) > 0;
    }
}
