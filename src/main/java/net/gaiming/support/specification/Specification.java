package net.gaiming.support.specification;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Composable query description for one entity type: filter criteria, eager-load hints,
 * ordering and paging.
 *
 * <p>Specifications never change once built. Combining two specifications yields a new one;
 * see {@link #and(Specification)}, {@link #or(Specification)} and {@link #not()}.</p>
 *
 * @param <T> entity type the specification applies to
 */
public interface Specification<T> {

    /**
     * Filter criteria. A specification built without criteria matches every entity.
     */
    Predicate<T> criteria();

    /**
     * Names of associations the repository should load together with the matched entities.
     */
    List<String> includes();

    /**
     * Ordering applied after filtering, already oriented (ascending or descending).
     */
    Optional<Comparator<T>> ordering();

    /**
     * Paging window, applied last.
     */
    Optional<Paging> paging();

    default boolean isPagingEnabled() {
        return paging().isPresent();
    }

    default boolean isSatisfiedBy(T candidate) {
        return criteria().test(candidate);
    }

    default Specification<T> and(Specification<T> other) {
        return CompositeSpecification.and(this, other);
    }

    default Specification<T> or(Specification<T> other) {
        return CompositeSpecification.or(this, other);
    }

    default Specification<T> not() {
        return CompositeSpecification.not(this);
    }

    /**
     * Creates a criteria-only specification.
     */
    static <T> Specification<T> where(Predicate<T> criteria) {
        return new CriteriaSpecification<>(criteria);
    }

    /**
     * Specification with identity criteria; matches every entity.
     */
    static <T> Specification<T> all() {
        return new CriteriaSpecification<>(null);
    }

    /**
     * Skip/take window.
     */
    record Paging(int skip, int take) {
        public Paging {
            if (skip < 0) {
                throw new IllegalArgumentException("skip must not be negative: " + skip);
            }
            if (take <= 0) {
                throw new IllegalArgumentException("take must be positive: " + take);
            }
        }
    }
}
