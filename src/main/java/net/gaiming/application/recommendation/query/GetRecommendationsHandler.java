package net.gaiming.application.recommendation.query;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.cqrs.RequestHandler;
import net.gaiming.application.recommendation.RecommendationCacheKeys;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.application.recommendation.pipeline.RecommendationPipelineService;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.support.cache.CacheService;
import net.gaiming.support.result.Result;

import java.util.List;
import java.util.Optional;

/**
 * Serves from cache when possible; only successful pipeline results are cached.
 */
@Slf4j
public class GetRecommendationsHandler implements RequestHandler<GetRecommendationsQuery, List<Recommendation>> {

    private final RecommendationPipelineService pipelineService;
    private final CacheService cache;
    private final RecommendationProperties properties;

    public GetRecommendationsHandler(RecommendationPipelineService pipelineService, CacheService cache,
                                     RecommendationProperties properties) {
        this.pipelineService = pipelineService;
        this.cache = cache;
        this.properties = properties;
    }

    @Override
    public Class<GetRecommendationsQuery> requestType() {
        return GetRecommendationsQuery.class;
    }

    @Override
    public Result<List<Recommendation>> handle(GetRecommendationsQuery query) {
        RecommendationRequest request = query.toRequest();
        String key = RecommendationCacheKeys.forQuery(request.playerId(), request.algorithm(), request.context(),
            request.count(), request.excludedGameIds());

        @SuppressWarnings("unchecked")
        Optional<List<Recommendation>> cached = cache.get(key, List.class).map(list -> (List<Recommendation>) list);
        if (cached.isPresent()) {
            log.debug("Serving {} cached recommendation(s) for player {}", cached.get().size(), request.playerId());
            return Result.success(cached.get());
        }

        Result<List<Recommendation>> result = pipelineService.execute(request);
        result.ifSuccess(recommendations -> cache.set(key, recommendations, properties.cacheTtl()));
        return result;
    }
}
