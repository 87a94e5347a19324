package net.gaiming.support.specification;

import java.util.function.Predicate;

/**
 * Anonymous criteria-only specification produced by {@link Specification#where(Predicate)}.
 */
final class CriteriaSpecification<T> extends BaseSpecification<T> {

    CriteriaSpecification(Predicate<T> criteria) {
        super(criteria);
    }
}
