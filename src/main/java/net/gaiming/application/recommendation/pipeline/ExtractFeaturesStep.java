package net.gaiming.application.recommendation.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.PlayerFeatures;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.domain.repository.GameFeatureRepository;
import net.gaiming.domain.repository.PlayerFeatureRepository;
import net.gaiming.domain.specification.GameSpecifications;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.pipeline.AbstractPipelineStep;
import net.gaiming.pipeline.PipelineContext;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.List;
import java.util.Optional;

/**
 * Loads the player's feature profile and the active catalogue into the context.
 *
 * <p>A missing or unreadable player profile is replaced by {@link PlayerFeatures#newPlayer}
 * and flagged with {@link RecommendationContextKeys#FEATURES_DEFAULTED}. The catalogue is
 * required: a failure to read it stops the pipeline.</p>
 */
@Slf4j
public class ExtractFeaturesStep extends AbstractPipelineStep<RecommendationRequest, RecommendationRequest> {

    public static final String NAME = "ExtractFeatures";

    private final UnitOfWorkFactory unitOfWorkFactory;

    public ExtractFeaturesStep(UnitOfWorkFactory unitOfWorkFactory) {
        super(NAME, 2, RecommendationRequest.class, RecommendationRequest.class);
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    @Override
    public Result<RecommendationRequest> execute(RecommendationRequest input, PipelineContext context) {
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            PlayerFeatures features = loadPlayerFeatures(uow, input.playerId(), context);
            List<GameFeatures> games = uow.getRepository(GameFeatureRepository.class).find(GameSpecifications.active());

            context.set(RecommendationContextKeys.PLAYER_FEATURES, features);
            context.set(RecommendationContextKeys.GAME_FEATURES, List.copyOf(games));
            log.debug("Extracted features for player {}: {} active games", input.playerId(), games.size());
        }
        return Result.success(input);
    }

    private PlayerFeatures loadPlayerFeatures(UnitOfWork uow, long playerId, PipelineContext context) {
        Optional<PlayerFeatures> stored;
        try {
            stored = uow.getRepository(PlayerFeatureRepository.class).findById(playerId);
        } catch (RuntimeException ex) {
            log.warn("Failed to read features for player {}, using defaults: {}", playerId, ex.getMessage());
            stored = Optional.empty();
        }
        if (stored.isPresent()) {
            context.set(RecommendationContextKeys.FEATURES_DEFAULTED, Boolean.FALSE);
            return stored.get();
        }
        log.warn("No features for player {}, using new-player defaults", playerId);
        context.set(RecommendationContextKeys.FEATURES_DEFAULTED, Boolean.TRUE);
        return PlayerFeatures.newPlayer(playerId);
    }

    @Override
    public Result<RecommendationRequest> handleFailure(RecommendationRequest input, PipelineContext context,
                                                       Exception exception) {
        return Result.failure(ErrorCode.STEP_FAILED,
            "Feature extraction failed: " + exception.getMessage(), exception);
    }
}
