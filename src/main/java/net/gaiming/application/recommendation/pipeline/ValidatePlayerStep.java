package net.gaiming.application.recommendation.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.recommendation.RecommendationProperties;
import net.gaiming.domain.model.Player;
import net.gaiming.domain.model.RecommendationRequest;
import net.gaiming.domain.repository.PlayerRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.pipeline.AbstractPipelineStep;
import net.gaiming.pipeline.PipelineContext;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.Optional;

/**
 * Rejects requests for unknown or inactive players and out-of-range counts. Fails closed:
 * a storage error stops the pipeline.
 */
@Slf4j
public class ValidatePlayerStep extends AbstractPipelineStep<RecommendationRequest, RecommendationRequest> {

    public static final String NAME = "ValidatePlayer";

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final RecommendationProperties properties;

    public ValidatePlayerStep(UnitOfWorkFactory unitOfWorkFactory, RecommendationProperties properties) {
        super(NAME, 1, RecommendationRequest.class, RecommendationRequest.class);
        this.unitOfWorkFactory = unitOfWorkFactory;
        this.properties = properties;
    }

    @Override
    public Result<RecommendationRequest> execute(RecommendationRequest input, PipelineContext context) {
        if (input.playerId() <= 0) {
            return Result.failure(ErrorCode.VALIDATION, "Invalid player ID");
        }
        if (!properties.isCountAllowed(input.count())) {
            return Result.failure(ErrorCode.VALIDATION,
                "Count must be between 1 and " + properties.maxCount() + ", was " + input.count());
        }

        Optional<Player> player;
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            player = uow.getRepository(PlayerRepository.class).findById(input.playerId());
        }
        if (player.isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND, "Player not found");
        }
        if (!player.get().active()) {
            return Result.failure(ErrorCode.VALIDATION, "Player account is inactive");
        }

        context.set(RecommendationContextKeys.PLAYER_ID, input.playerId());
        context.set(RecommendationContextKeys.PLAYER, player.get());
        log.debug("Validated player {} for context {}", input.playerId(), input.context());
        return Result.success(input);
    }

    @Override
    public Result<RecommendationRequest> handleFailure(RecommendationRequest input, PipelineContext context,
                                                       Exception exception) {
        return Result.failure(ErrorCode.STEP_FAILED, "Player validation failed: " + exception.getMessage(), exception);
    }
}
