package net.gaiming.domain.repository;

import net.gaiming.domain.model.InteractionType;
import net.gaiming.domain.model.RecommendationInteraction;

import java.util.List;

public interface RecommendationInteractionRepository extends EntityRepository<RecommendationInteraction> {

    /**
     * Checks the idempotency key {@code (recommendationId, sessionId, interactionType)}.
     */
    boolean exists(long recommendationId, String sessionId, InteractionType interactionType);

    List<RecommendationInteraction> findByRecommendation(long recommendationId);
}
