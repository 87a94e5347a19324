package net.gaiming.application.experiment;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.cqrs.TransactionalCommandHandler;
import net.gaiming.domain.model.AbTestExperiment;
import net.gaiming.domain.repository.AbTestExperimentRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * RUNNING or PAUSED to COMPLETED, recording the winner when one is named.
 */
@Slf4j
public class CompleteExperimentHandler extends TransactionalCommandHandler<CompleteExperimentCommand, Boolean> {

    public CompleteExperimentHandler(UnitOfWorkFactory unitOfWorkFactory, Clock clock, Duration transactionTimeout) {
        super(unitOfWorkFactory, clock, transactionTimeout);
    }

    @Override
    public Class<CompleteExperimentCommand> requestType() {
        return CompleteExperimentCommand.class;
    }

    @Override
    public Result<Boolean> handle(CompleteExperimentCommand command) {
        Result<Boolean> completed = inTransaction(uow -> complete(uow, command));
        completed.ifSuccess(ignored -> log.info("Experiment {} completed, winner {}",
            command.experimentName(), command.winningVariant() == null ? "none" : command.winningVariant()));
        return completed;
    }

    private Result<Boolean> complete(UnitOfWork uow, CompleteExperimentCommand command) {
        AbTestExperimentRepository repository = uow.getRepository(AbTestExperimentRepository.class);
        Optional<AbTestExperiment> found = repository.findByName(command.experimentName());
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND, "Experiment '" + command.experimentName() + "' not found");
        }
        AbTestExperiment experiment = found.get();
        if (command.winningVariant() != null && experiment.findVariant(command.winningVariant()).isEmpty()) {
            return Result.failure(ErrorCode.VALIDATION, "Unknown variant '" + command.winningVariant()
                + "' for experiment " + command.experimentName());
        }
        if (!experiment.complete(clock.instant(), command.winningVariant())) {
            return Result.failure(ErrorCode.INVALID_STATE, "Experiment '" + command.experimentName() + "' is "
                + experiment.getStatus() + " and cannot be completed");
        }
        repository.update(experiment);
        return uow.saveChanges().map(rows -> Boolean.TRUE);
    }
}
