package net.gaiming.application.recommendation.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.pipeline.AbstractPipelineStep;
import net.gaiming.pipeline.PipelineContext;
import net.gaiming.strategy.StrategySelection;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.List;
import java.util.Optional;

/**
 * Asks the selected strategy for an oversampled candidate list so later filters still leave
 * enough games to fill the request.
 */
@Slf4j
public class GenerateRecommendationsStep extends AbstractPipelineStep<RecommendationRequest, CandidateSet> {

    public static final String NAME = "GenerateRecommendations";

    private final RecommendationProperties properties;

    public GenerateRecommendationsStep(RecommendationProperties properties) {
        super(NAME, 4, RecommendationRequest.class, CandidateSet.class);
        this.properties = properties;
    }

    @Override
    public Result<CandidateSet> execute(RecommendationRequest input, PipelineContext context) {
        Optional<PlayerFeatures> features = context.get(RecommendationContextKeys.PLAYER_FEATURES);
        Optional<List<GameFeatures>> games = context.get(RecommendationContextKeys.GAME_FEATURES);
        Optional<StrategySelection> selection = context.get(RecommendationContextKeys.STRATEGY_SELECTION);
        if (features.isEmpty() || games.isEmpty() || selection.isEmpty()) {
            return Result.failure(ErrorCode.INVALID_STATE,
                "Missing required context data for recommendation generation");
        }

        int oversampled = Math.multiplyExact(input.count(), properties.oversampleFactor());
        Result<List<Recommendation>> generated = selection.get().strategy()
            .generateRecommendations(input.withCount(oversampled), features.get(), games.get());
        if (generated.isFailure()) {
            log.warn("Strategy {} failed for player {}: {}", selection.get().strategyName(), input.playerId(),
                generated.getError());
            return generated.propagateFailure();
        }

        String variant = selection.get().experimentVariant();
        List<Recommendation> candidates = variant == null
            ? generated.getValue()
            : generated.getValue().stream().map(r -> r.toBuilder().experimentVariant(variant).build()).toList();
        log.debug("Strategy {} produced {} candidate(s) for player {}", selection.get().strategyName(),
            candidates.size(), input.playerId());
        return Result.success(new CandidateSet(input, candidates));
    }

    @Override
    public Result<CandidateSet> handleFailure(RecommendationRequest input, PipelineContext context, Exception exception) {
        return Result.failure(ErrorCode.STEP_FAILED,
            "Recommendation generation failed: " + exception.getMessage(), exception);
    }
}
