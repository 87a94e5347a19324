package net.gaiming.application.recommendation.pipeline;

import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.pipeline.Pipeline;
import net.gaiming.pipeline.PipelineBuilder;
import net.gaiming.strategy.StrategySelector;
import net.gaiming.support.cache.CacheService;

import java.util.List;

/**
 * Assembles the seven-step recommendation pipeline.
 */
public class RecommendationPipelineFactory {

    public static final String PIPELINE_NAME = "RecommendationPipeline";

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final StrategySelector selector;
    private final CacheService cache;
    private final RecommendationProperties properties;

    public RecommendationPipelineFactory(UnitOfWorkFactory unitOfWorkFactory,
                                         StrategySelector selector,
                                         CacheService cache,
                                         RecommendationProperties properties) {
        this.unitOfWorkFactory = unitOfWorkFactory;
        this.selector = selector;
        this.cache = cache;
        this.properties = properties;
    }

    public Pipeline<RecommendationRequest, List<Recommendation>> createRecommendationPipeline() {
        DiversifyRecommendationsStep diversify = new DiversifyRecommendationsStep(properties);
        return PipelineBuilder.create(PIPELINE_NAME, RecommendationRequest.class, CacheRecommendationsStep.listType())
            .addStep(new ValidatePlayerStep(unitOfWorkFactory, properties))
            .addStep(new ExtractFeaturesStep(unitOfWorkFactory))
            .addStep(new SelectAlgorithmStep(selector))
            .addStep(new GenerateRecommendationsStep(properties))
            .addStep(new ApplyBusinessRulesStep(unitOfWorkFactory, properties))
            .addStep(diversify, diversify.whenWorthDiversifying())
            .addStep(new CacheRecommendationsStep(cache, properties))
            .build();
    }
}
