package net.gaiming.domain.repository;

import net.gaiming.domain.model.GameRecommendation;

import java.time.Instant;
import java.util.List;

public interface GameRecommendationRepository extends EntityRepository<GameRecommendation> {

    /**
     * Recommendations served by one algorithm inside a time window.
     */
    List<GameRecommendation> findByAlgorithm(String algorithm, Instant from, Instant to);

    /**
     * Rows matching every supplied column filter, newest first. The filtering happens in the
     * store, so callers only evaluate specifications over this reduced set.
     */
    List<GameRecommendation> findHistory(RecommendationHistoryCriteria criteria);
}
