package net.gaiming.support.specification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Result of combining specifications with {@code and}, {@code or} or {@code not}.
 *
 * <p>The composite keeps the ordering and paging of its left operand and the union of
 * both operands' includes. Neither operand is modified.</p>
 */
final class CompositeSpecification<T> implements Specification<T> {

    private final Predicate<T> criteria;
    private final List<String> includes;
    private final Specification<T> shape;

    private CompositeSpecification(Predicate<T> criteria, List<String> includes, Specification<T> shape) {
        this.criteria = criteria;
        this.includes = includes;
        this.shape = shape;
    }

    static <T> Specification<T> and(Specification<T> left, Specification<T> right) {
        Objects.requireNonNull(right, "right");
        Predicate<T> l = left.criteria();
        Predicate<T> r = right.criteria();
        return new CompositeSpecification<>(candidate -> l.test(candidate) && r.test(candidate),
            mergeIncludes(left, right), left);
    }

    static <T> Specification<T> or(Specification<T> left, Specification<T> right) {
        Objects.requireNonNull(right, "right");
        Predicate<T> l = left.criteria();
        Predicate<T> r = right.criteria();
        return new CompositeSpecification<>(candidate -> l.test(candidate) || r.test(candidate),
            mergeIncludes(left, right), left);
    }

    static <T> Specification<T> not(Specification<T> operand) {
        Predicate<T> p = operand.criteria();
        return new CompositeSpecification<>(candidate -> !p.test(candidate), operand.includes(), operand);
    }

    private static <T> List<String> mergeIncludes(Specification<T> left, Specification<T> right) {
        Set<String> merged = new LinkedHashSet<>(left.includes());
        merged.addAll(right.includes());
        return Collections.unmodifiableList(new ArrayList<>(merged));
    }

    @Override
    public Predicate<T> criteria() {
        return criteria;
    }

    @Override
    public List<String> includes() {
        return includes;
    }

    @Override
    public Optional<Comparator<T>> ordering() {
        return shape.ordering();
    }

    @Override
    public Optional<Paging> paging() {
        return shape.paging();
    }
}
