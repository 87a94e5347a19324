package net.gaiming.application.recommendation.command;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.cqrs.TransactionalCommandHandler;
import net.gaiming.application.recommendation.RecommendationCacheKeys;
import net.gaiming.domain.model.GameFeatures;
import net.gaiming.domain.model.GameRecommendation;
import net.gaiming.domain.model.Player;
import net.gaiming.domain.repository.GameFeatureRepository;
import net.gaiming.domain.repository.GameRecommendationRepository;
import net.gaiming.domain.repository.PlayerRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.cache.CacheService;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Slf4j
public class CreateGameRecommendationHandler
    extends TransactionalCommandHandler<CreateGameRecommendationCommand, Long> {

    private final CacheService cache;

    public CreateGameRecommendationHandler(UnitOfWorkFactory unitOfWorkFactory, CacheService cache, Clock clock,
                                           Duration transactionTimeout) {
        super(unitOfWorkFactory, clock, transactionTimeout);
        this.cache = cache;
    }

    @Override
    public Class<CreateGameRecommendationCommand> requestType() {
        return CreateGameRecommendationCommand.class;
    }

    @Override
    public Result<Long> handle(CreateGameRecommendationCommand command) {
        if (command.getScore() < 0.0 || command.getScore() > 1.0) {
            return Result.failure(ErrorCode.VALIDATION, "Score must be between 0 and 1, was " + command.getScore());
        }
        if (!StringUtils.hasText(command.getAlgorithm())) {
            return Result.failure(ErrorCode.VALIDATION, "Algorithm is required");
        }
        if (command.getPosition() < 1) {
            return Result.failure(ErrorCode.VALIDATION, "Position must be at least 1");
        }

        Result<Long> created = inTransaction(uow -> create(uow, command));
        created.ifSuccess(id -> {
            int evicted = RecommendationCacheKeys.evictPlayer(cache, command.getPlayerId());
            log.debug("Created recommendation {} for player {}; evicted {} cache entries",
                id, command.getPlayerId(), evicted);
        });
        return created;
    }

    private Result<Long> create(UnitOfWork uow, CreateGameRecommendationCommand command) {
        Optional<Player> player = uow.getRepository(PlayerRepository.class).findById(command.getPlayerId());
        if (player.isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND, "Player " + command.getPlayerId() + " not found");
        }
        Optional<GameFeatures> game = uow.getRepository(GameFeatureRepository.class).findById(command.getGameId());
        if (game.isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND, "Game " + command.getGameId() + " not found");
        }

        Instant now = clock.instant();
        GameRecommendation recommendation = GameRecommendation.builder()
            .playerId(command.getPlayerId())
            .gameId(command.getGameId())
            .algorithm(command.getAlgorithm())
            .score(command.getScore())
            .position(command.getPosition())
            .context(command.getContext())
            .category(command.getCategory() != null ? command.getCategory() : game.get().getGameType())
            .reason(command.getReason())
            .confidence(command.getConfidence())
            .sessionId(command.getSessionId())
            .platform(command.getPlatform())
            .experimentVariant(command.getExperimentVariant())
            .modelVersion(command.getModelVersion())
            .metadata(command.getMetadata())
            .createdAt(now)
            .build();
        uow.getRepository(GameRecommendationRepository.class).add(recommendation);
        return uow.saveChanges().map(rows -> recommendation.getId());
    }
}
