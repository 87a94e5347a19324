package net.gaiming.application.recommendation.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.recommendation.RecommendationCacheKeys;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.pipeline.AbstractPipelineStep;
import net.gaiming.pipeline.PipelineContext;
import net.gaiming.support.cache.CacheService;
import net.gaiming.support.result.Result;

import java.util.ArrayList;
import java.util.List;

/**
 * Terminal step: truncates to the requested count, renumbers positions {@code 1..n} and
 * caches the final list under {@code recommendations:{playerId}}.
 */
@Slf4j
public class CacheRecommendationsStep extends AbstractPipelineStep<CandidateSet, List<Recommendation>> {

    public static final String NAME = "CacheRecommendations";

    private final CacheService cache;
    private final RecommendationProperties properties;

    public CacheRecommendationsStep(CacheService cache, RecommendationProperties properties) {
        super(NAME, 7, CandidateSet.class, listType());
        this.cache = cache;
        this.properties = properties;
    }

    @SuppressWarnings("unchecked")
    public static Class<List<Recommendation>> listType() {
        return (Class<List<Recommendation>>) (Class<?>) List.class;
    }

    @Override
    public Result<List<Recommendation>> execute(CandidateSet input, PipelineContext context) {
        List<Recommendation> result = rank(input);
        String key = RecommendationCacheKeys.forPlayer(input.request().playerId());
        cache.set(key, result, properties.cacheTtl());
        context.set(RecommendationContextKeys.CACHE_KEY, key);
        log.debug("Cached {} recommendation(s) under {}", result.size(), key);
        return Result.success(result);
    }

    /**
     * Caching is an optimization: a cache failure still returns the ranked list.
     */
    @Override
    public Result<List<Recommendation>> handleFailure(CandidateSet input, PipelineContext context, Exception exception) {
        log.warn("Caching recommendations for player {} failed: {}", input.request().playerId(), exception.getMessage());
        return Result.success(rank(input));
    }

    private static List<Recommendation> rank(CandidateSet input) {
        List<Recommendation> candidates = input.recommendations();
        int limit = Math.min(input.request().count(), candidates.size());
        List<Recommendation> ranked = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            ranked.add(candidates.get(i).withPosition(i + 1));
        }
        return List.copyOf(ranked);
    }
}
