package net.gaiming.domain.specification;

import net.gaiming.domain.model.GameRecommendation;
import net.gaiming.support.specification.BaseSpecification;
import net.gaiming.support.specification.Specification;

/**
 * One page of recommendation history, newest first, filtered by an arbitrary composed criteria.
 */
public class RecommendationHistorySpecification extends BaseSpecification<GameRecommendation> {

    public RecommendationHistorySpecification(Specification<GameRecommendation> filter, int page, int pageSize) {
        super(filter.criteria());
        if (page < 1) {
            throw new IllegalArgumentException("page must be 1 or greater: " + page);
        }
        applyOrderByDescending(GameRecommendation::getCreatedAt);
        applyPaging((page - 1) * pageSize, pageSize);
    }
}
