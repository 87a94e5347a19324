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
 * DRAFT or PAUSED to RUNNING; any other state is an {@code INVALID_STATE} failure.
 */
@Slf4j
public class StartExperimentHandler extends TransactionalCommandHandler<StartExperimentCommand, Boolean> {

    public StartExperimentHandler(UnitOfWorkFactory unitOfWorkFactory, Clock clock, Duration transactionTimeout) {
        super(unitOfWorkFactory, clock, transactionTimeout);
    }

    @Override
    public Class<StartExperimentCommand> requestType() {
        return StartExperimentCommand.class;
    }

    @Override
    public Result<Boolean> handle(StartExperimentCommand command) {
        Result<Boolean> started = inTransaction(uow -> start(uow, command));
        started.ifSuccess(ignored -> log.info("Experiment {} started by {}",
            command.experimentName(), command.metadata().actor()));
        return started;
    }

    private Result<Boolean> start(UnitOfWork uow, StartExperimentCommand command) {
        AbTestExperimentRepository repository = uow.getRepository(AbTestExperimentRepository.class);
        Optional<AbTestExperiment> experiment = repository.findByName(command.experimentName());
        if (experiment.isEmpty()) {
            return Result.failure(ErrorCode.NOT_FOUND, "Experiment '" + command.experimentName() + "' not found");
        }
        if (!experiment.get().start(clock.instant())) {
            return Result.failure(ErrorCode.INVALID_STATE, "Experiment '" + command.experimentName() + "' is "
                + experiment.get().getStatus() + " and cannot be started");
        }
        repository.update(experiment.get());
        return uow.saveChanges().map(rows -> Boolean.TRUE);
    }
}
