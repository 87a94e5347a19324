package net.gaiming.application.recommendation.command;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.cqrs.TransactionalCommandHandler;
import net.gaiming.domain.model.GameRecommendation;
import net.gaiming.domain.model.InteractionType;
import net.gaiming.domain.model.RecommendationInteraction;
import net.gaiming.domain.repository.GameRecommendationRepository;
import net.gaiming.domain.repository.RecommendationInteractionRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Idempotent on {@code (recommendationId, sessionId, interactionType)}. A click or play also
 * sets the matching flag on the recommendation the first time it happens.
 */
@Slf4j
public class TrackRecommendationInteractionHandler
    extends TransactionalCommandHandler<TrackRecommendationInteractionCommand, Boolean> {

    public TrackRecommendationInteractionHandler(UnitOfWorkFactory unitOfWorkFactory, Clock clock,
                                                 Duration transactionTimeout) {
        super(unitOfWorkFactory, clock, transactionTimeout);
    }

    @Override
    public Class<TrackRecommendationInteractionCommand> requestType() {
        return TrackRecommendationInteractionCommand.class;
    }

    @Override
    public Result<Boolean> handle(TrackRecommendationInteractionCommand command) {
        Optional<InteractionType> type = InteractionType.parse(command.getInteractionType());
        if (type.isEmpty()) {
            return Result.failure(ErrorCode.VALIDATION, "Unknown interaction type '" + command.getInteractionType() + "'");
        }
        String session = RecommendationInteraction.normalizeSession(command.getSessionId());

        Result<Boolean> tracked = inTransaction(uow -> track(uow, command, type.get(), session));
        if (tracked.isFailure() && tracked.getError().code() == ErrorCode.CONFLICT
            && alreadyTracked(command.getRecommendationId(), session, type.get())) {
            // Lost a race against the same interaction; the unique index kept the first one.
            log.debug("Duplicate {} on recommendation {} detected at insert", type.get(), command.getRecommendationId());
            return Result.success(false);
        }
        return tracked;
    }

    private Result<Boolean> track(UnitOfWork uow, TrackRecommendationInteractionCommand command,
                                  InteractionType type, String session) {
        GameRecommendationRepository recommendations = uow.getRepository(GameRecommendationRepository.class);
        Optional<GameRecommendation> found = recommendations.findById(command.getRecommendationId());
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND, "Recommendation " + command.getRecommendationId() + " not found");
        }
        GameRecommendation recommendation = found.get();
        if (recommendation.getPlayerId() != command.getPlayerId() || recommendation.getGameId() != command.getGameId()) {
            return Result.failure(ErrorCode.VALIDATION, "Recommendation " + command.getRecommendationId()
                + " does not belong to player " + command.getPlayerId() + " and game " + command.getGameId());
        }

        RecommendationInteractionRepository interactions = uow.getRepository(RecommendationInteractionRepository.class);
        if (interactions.exists(recommendation.getId(), session, type)) {
            log.debug("{} on recommendation {} already tracked for session '{}'", type, recommendation.getId(), session);
            return Result.success(false);
        }

        Instant now = clock.instant();
        boolean flagChanged = switch (type) {
            case CLICK -> recommendation.markClicked(now, command.getSessionId());
            case PLAY -> recommendation.markPlayed(now, command.getSessionId());
            default -> false;
        };
        if (flagChanged) {
            recommendations.update(recommendation);
        }
        interactions.add(RecommendationInteraction.builder()
            .recommendationId(recommendation.getId())
            .playerId(command.getPlayerId())
            .gameId(command.getGameId())
            .interactionType(type)
            .value(command.getValue())
            .sessionId(session)
            .platform(command.getPlatform())
            .userAgent(command.getUserAgent())
            .interactionDate(now)
            .metadata(command.getMetadata())
            .build());
        return uow.saveChanges().map(rows -> Boolean.TRUE);
    }

    private boolean alreadyTracked(long recommendationId, String session, InteractionType type) {
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            return uow.getRepository(RecommendationInteractionRepository.class).exists(recommendationId, session, type);
        }
    }
}
