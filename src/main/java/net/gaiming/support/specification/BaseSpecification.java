package net.gaiming.support.specification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Base class for named specifications.
 *
 * <p>Subclasses configure themselves in their constructor through the protected
 * {@code apply*} and {@code addInclude} methods. Ordering can be set once; the
 * object is effectively immutable once the constructor returns.</p>
 *
 * @param <T> entity type
 */
public abstract class BaseSpecification<T> implements Specification<T> {

    private final Predicate<T> criteria;
    private final List<String> includes = new ArrayList<>();
    private Comparator<T> ordering;
    private Paging paging;

    protected BaseSpecification() {
        this(null);
    }

    protected BaseSpecification(Predicate<T> criteria) {
        this.criteria = criteria == null ? candidate -> true : criteria;
    }

    protected final void addInclude(String include) {
        includes.add(include);
    }

    protected final <K extends Comparable<? super K>> void applyOrderBy(Function<T, K> key) {
        setOrdering(Comparator.comparing(key, Comparator.nullsLast(Comparator.naturalOrder())));
    }

    protected final <K extends Comparable<? super K>> void applyOrderByDescending(Function<T, K> key) {
        setOrdering(Comparator.comparing(key, Comparator.nullsLast(Comparator.<K>reverseOrder())));
    }

    protected final void applyPaging(int skip, int take) {
        this.paging = new Paging(skip, take);
    }

    private void setOrdering(Comparator<T> comparator) {
        if (ordering != null) {
            throw new IllegalStateException("Ordering already applied to " + getClass().getSimpleName());
        }
        this.ordering = comparator;
    }

    @Override
    public Predicate<T> criteria() {
        return criteria;
    }

    @Override
    public List<String> includes() {
        return Collections.unmodifiableList(includes);
    }

    @Override
    public Optional<Comparator<T>> ordering() {
        return Optional.ofNullable(ordering);
    }

    @Override
    public Optional<Paging> paging() {
        return Optional.ofNullable(paging);
    }
}
