package net.gaiming.application.cqrs;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.domain.uow.UnitOfWorkFactory;
import net.gaiming.support.result.Result;
import net.gaiming.support.time.Deadline;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Base for command handlers that write through a unit of work.
 *
 * <p>{@link #inTransaction} runs the work in a fresh unit of work, commits, and only then
 * publishes the domain events raised by the saved aggregates.</p>
 */
@Slf4j
public abstract class TransactionalCommandHandler<C extends Command<R>, R> implements RequestHandler<C, R> {

    protected final UnitOfWorkFactory unitOfWorkFactory;
    protected final Clock clock;
    private final Duration timeout;

    protected TransactionalCommandHandler(UnitOfWorkFactory unitOfWorkFactory, Clock clock, Duration timeout) {
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "unitOfWorkFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timeout = timeout == null ? Duration.ZERO : timeout;
    }

    protected Result<R> inTransaction(Function<UnitOfWork, Result<R>> work) {
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            Result<R> outcome = uow.executeInTransaction(() -> work.apply(uow), deadline());
            if (outcome.isFailure()) {
                return outcome;
            }
            Result<Integer> dispatched = uow.saveChangesAndDispatchEvents();
            if (dispatched.isFailure()) {
                log.error("{} committed but event dispatch failed: {}", requestType().getSimpleName(),
                    dispatched.getError());
                return dispatched.propagateFailure();
            }
            return outcome;
        }
    }

    private Deadline deadline() {
        if (timeout.isZero() || timeout.isNegative()) {
            return Deadline.none();
        }
        return Deadline.after(timeout, clock);
    }
}
