package net.gaiming.application.recommendation.query;

import jakarta.annotation.Nullable;
import net.gaiming.application.cqrs.Query;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranked games for one player, served through the recommendation pipeline.
 */
public record GetRecommendationsQuery(long playerId,
                                      int count,
                                      String context,
                                      @Nullable String algorithm,
                                      Set<Long> excludeGameIds,
                                      Map<String, Object> parameters) implements Query<List<Recommendation>> {

    public GetRecommendationsQuery {
        excludeGameIds = excludeGameIds == null ? Set.of() : Set.copyOf(excludeGameIds);
        parameters = parameters == null ? Map.of() : parameters;
    }

    public static GetRecommendationsQuery forPlayer(long playerId) {
        return new GetRecommendationsQuery(playerId, RecommendationRequest.DEFAULT_COUNT,
            RecommendationRequest.DEFAULT_CONTEXT, null, Set.of(), Map.of());
    }

    public RecommendationRequest toRequest() {
        return new RecommendationRequest(playerId, count, context, algorithm, excludeGameIds, parameters);
    }
}
