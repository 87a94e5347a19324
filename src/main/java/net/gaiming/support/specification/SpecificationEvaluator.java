package net.gaiming.support.specification;

import java.util.Collection;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Applies a {@link Specification} to a collection of loaded entities.
 *
 * <p>Order is fixed: criteria, then includes, then ordering, then paging. Paging runs
 * last so that filtered counts stay correct.</p>
 */
public final class SpecificationEvaluator {

    private SpecificationEvaluator() {
    }

    public static <T> List<T> evaluate(Collection<T> source, Specification<T> specification) {
        return evaluate(source, specification, (entity, include) -> entity);
    }

    /**
     * Evaluates the specification, letting the caller resolve include hints on each
     * matched entity before ordering.
     *
     * @param includeLoader resolves one include name for one entity and returns the (possibly enriched) entity
     */
    public static <T> List<T> evaluate(Collection<T> source,
                                       Specification<T> specification,
                                       BiFunction<T, String, T> includeLoader) {
        Stream<T> stream = source.stream().filter(specification.criteria());

        List<String> includes = specification.includes();
        if (!includes.isEmpty()) {
            stream = stream.map(entity -> {
                T loaded = entity;
                for (String include : includes) {
                    loaded = includeLoader.apply(loaded, include);
                }
                return loaded;
            });
        }

        if (specification.ordering().isPresent()) {
            stream = stream.sorted(specification.ordering().get());
        }

        if (specification.paging().isPresent()) {
            Specification.Paging paging = specification.paging().get();
            stream = stream.skip(paging.skip()).limit(paging.take());
        }
        return stream.collect(Collectors.toList());
    }

    /**
     * Counts matches, ignoring paging.
     */
    public static <T> long count(Collection<T> source, Specification<T> specification) {
        return source.stream().filter(specification.criteria()).count();
    }
}
