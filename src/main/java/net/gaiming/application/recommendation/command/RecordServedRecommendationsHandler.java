package net.gaiming.application.recommendation.command;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.cqrs.TransactionalCommandHandler;
import net.gaiming.domain.model.GameRecommendation;
import net.gaiming.domain.model.Recommendation;
import net.gaiming.domain.repository.GameRecommendationRepository;
import net.gaiming.domain.repository.PlayerRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
public class RecordServedRecommendationsHandler
    extends TransactionalCommandHandler<RecordServedRecommendationsCommand, List<Long>> {

    public RecordServedRecommendationsHandler(UnitOfWorkFactory unitOfWorkFactory, Clock clock,
                                              Duration transactionTimeout) {
        super(unitOfWorkFactory, clock, transactionTimeout);
    }

    @Override
    public Class<RecordServedRecommendationsCommand> requestType() {
        return RecordServedRecommendationsCommand.class;
    }

    @Override
    public Result<List<Long>> handle(RecordServedRecommendationsCommand command) {
        if (command.served().isEmpty()) {
            return Result.failure(ErrorCode.VALIDATION, "Nothing to record");
        }
        Set<Long> games = new HashSet<>();
        Set<Integer> positions = new HashSet<>();
        for (Recommendation served : command.served()) {
            if (served.getPlayerId() != command.playerId()) {
                return Result.failure(ErrorCode.VALIDATION, "Recommendation for game " + served.getGameId()
                    + " belongs to player " + served.getPlayerId() + ", not " + command.playerId());
            }
            if (served.getScore() < 0.0 || served.getScore() > 1.0) {
                return Result.failure(ErrorCode.VALIDATION, "Score of game " + served.getGameId() + " is out of range");
            }
            if (!games.add(served.getGameId()) || !positions.add(served.getPosition())) {
                return Result.failure(ErrorCode.VALIDATION, "Served list repeats game " + served.getGameId()
                    + " or position " + served.getPosition());
            }
        }

        Result<List<Long>> recorded = inTransaction(uow -> record(uow, command));
        recorded.ifSuccess(ids -> log.debug("Recorded {} served recommendation(s) for player {}",
            ids.size(), command.playerId()));
        return recorded;
    }

    private Result<List<Long>> record(UnitOfWork uow, RecordServedRecommendationsCommand command) {
        if (uow.getRepository(PlayerRepository.class).findById(command.playerId()).isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND, "Player " + command.playerId() + " not found");
        }
        Instant now = clock.instant();
        GameRecommendationRepository repository = uow.getRepository(GameRecommendationRepository.class);
        List<GameRecommendation> rows = new ArrayList<>(command.served().size());
        for (Recommendation served : command.served()) {
            GameRecommendation row = GameRecommendation.fromServed(served, command.sessionId(), command.platform(), now);
            repository.add(row);
            rows.add(row);
        }
        return uow.saveChanges().map(affected -> rows.stream().map(GameRecommendation::getId).toList());
    }
}
