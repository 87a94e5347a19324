package net.gaiming.application.recommendation.command;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.cqrs.TransactionalCommandHandler;
import net.gaiming.application.recommendation.RecommendationCacheKeys;
import net.gaiming.domain.model.GameManagementSettings;
import net.gaiming.domain.repository.GameFeatureRepository;
import net.gaiming.domain.repository.GameManagementSettingsRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.cache.CacheService;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

@Slf4j
public class UpdateGameManagementSettingsHandler
    extends TransactionalCommandHandler<UpdateGameManagementSettingsCommand, Boolean> {

    private final CacheService cache;

    public UpdateGameManagementSettingsHandler(UnitOfWorkFactory unitOfWorkFactory, CacheService cache, Clock clock,
                                               Duration transactionTimeout) {
        super(unitOfWorkFactory, clock, transactionTimeout);
        this.cache = cache;
    }

    @Override
    public Class<UpdateGameManagementSettingsCommand> requestType() {
        return UpdateGameManagementSettingsCommand.class;
    }

    @Override
    public Result<Boolean> handle(UpdateGameManagementSettingsCommand command) {
        if (command.gameId() <= 0) {
            return Result.failure(ErrorCode.VALIDATION, "Invalid game ID");
        }
        Result<Boolean> updated = inTransaction(uow -> upsert(uow, command));
        updated.ifSuccess(ignored -> {
            // Overrides change which games may be served, so every player's list is stale.
            int evicted = RecommendationCacheKeys.evictAll(cache);
            log.info("Updated management settings of game {} by {}; evicted {} cached recommendation list(s)",
                command.gameId(), command.metadata().actor(), evicted);
        });
        return updated;
    }

    private Result<Boolean> upsert(UnitOfWork uow, UpdateGameManagementSettingsCommand command) {
        if (uow.getRepository(GameFeatureRepository.class).findById(command.gameId()).isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND, "Game " + command.gameId() + " not found");
        }
        GameManagementSettingsRepository repository = uow.getRepository(GameManagementSettingsRepository.class);
        Instant now = clock.instant();
        Optional<GameManagementSettings> existing = repository.findByGameId(command.gameId());
        GameManagementSettings settings = existing.orElseGet(() -> new GameManagementSettings(command.gameId(), now));

        Set<String> changed = settings.applyOverrides(command.overrides(), now, command.metadata().actor());
        if (existing.isPresent()) {
            repository.update(settings);
        } else {
            repository.add(settings);
        }
        log.debug("Game {} overrides changed: {}", command.gameId(), changed);
        return uow.saveChanges().map(rows -> Boolean.TRUE);
    }
}
