package net.gaiming.application.experiment;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.application.cqrs.TransactionalCommandHandler;
import net.gaiming.domain.model.AbTestExperiment;
import net.gaiming.domain.model.ExperimentVariant;
import net.gaiming.domain.repository.AbTestExperimentRepository;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.strategy.StrategyRegistry;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

@Slf4j
public class CreateExperimentHandler extends TransactionalCommandHandler<CreateExperimentCommand, Long> {

    private final StrategyRegistry strategies;

    public CreateExperimentHandler(UnitOfWorkFactory unitOfWorkFactory, StrategyRegistry strategies, Clock clock,
                                   Duration transactionTimeout) {
        super(unitOfWorkFactory, clock, transactionTimeout);
        this.strategies = strategies;
    }

    @Override
    public Class<CreateExperimentCommand> requestType() {
        return CreateExperimentCommand.class;
    }

    @Override
    public Result<Long> handle(CreateExperimentCommand command) {
        Result<Void> valid = validate(command);
        if (valid.isFailure()) {
            return valid.propagateFailure();
        }
        Result<Long> created = inTransaction(uow -> create(uow, command));
        created.ifSuccess(id -> log.info("Created experiment {} ({}) with {} variant(s)",
            command.name(), id, command.variants().size()));
        return created;
    }

    private Result<Void> validate(CreateExperimentCommand command) {
        if (!StringUtils.hasText(command.name())) {
            return Result.failure(ErrorCode.VALIDATION, "Experiment name is required");
        }
        if (command.variants().isEmpty()) {
            return Result.failure(ErrorCode.VALIDATION, "Experiment needs at least one variant");
        }
        if (command.startDate() == null) {
            return Result.failure(ErrorCode.VALIDATION, "Start date is required");
        }
        if (command.endDate() != null && !command.endDate().isAfter(command.startDate())) {
            return Result.failure(ErrorCode.VALIDATION, "End date must be after start date");
        }
        Set<String> names = new HashSet<>();
        for (ExperimentVariant variant : command.variants()) {
            if (!names.add(variant.name())) {
                return Result.failure(ErrorCode.VALIDATION, "Duplicate variant name '" + variant.name() + "'");
            }
            if (strategies.find(variant.algorithm()).isEmpty()) {
                return Result.failure(ErrorCode.VALIDATION,
                    "Variant '" + variant.name() + "' uses unknown algorithm '" + variant.algorithm() + "'");
            }
        }
        return Result.success();
    }

    private Result<Long> create(UnitOfWork uow, CreateExperimentCommand command) {
        AbTestExperimentRepository repository = uow.getRepository(AbTestExperimentRepository.class);
        if (repository.findByName(command.name()).isPresent()) {
            return Result.failure(ErrorCode.CONFLICT, "Experiment '" + command.name() + "' already exists");
        }
        AbTestExperiment experiment = new AbTestExperiment(command.name(), command.description(),
            command.targetContexts(), command.variants(), command.startDate(), command.endDate(), clock.instant());
        repository.add(experiment);
        return uow.saveChanges().map(rows -> experiment.getId());
    }
}
