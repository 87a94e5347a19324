package net.gaiming.application.recommendation.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.pipeline.AbstractPipelineStep;
import net.gaiming.pipeline.PipelineContext;
import net.gaiming.strategy.StrategySelection;
import net.gaiming.strategy.StrategySelector;
import net.gaiming.support.result.Result;

/**
 * Stores the strategy chosen for this request. The selector falls back to collaborative
 * filtering on its own, so the step never fails.
 */
@Slf4j
public class SelectAlgorithmStep extends AbstractPipelineStep<RecommendationRequest, RecommendationRequest> {

    public static final String NAME = "SelectAlgorithm";

    private final StrategySelector selector;

    public SelectAlgorithmStep(StrategySelector selector) {
        super(NAME, 3, RecommendationRequest.class, RecommendationRequest.class);
        this.selector = selector;
    }

    @Override
    public Result<RecommendationRequest> execute(RecommendationRequest input, PipelineContext context) {
        PlayerFeatures features = context.get(RecommendationContextKeys.PLAYER_FEATURES).orElse(null);
        StrategySelection selection = selector.selectStrategy(input, features);
        context.set(RecommendationContextKeys.STRATEGY_SELECTION, selection);
        log.debug("Player {} in {} served by {} ({})", input.playerId(), input.context(),
            selection.strategyName(), selection.source());
        return Result.success(input);
    }
}
