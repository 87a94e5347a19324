package net.gaiming.adapters.persistence;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.domain.event.DomainEvent;
import net.gaiming.domain.event.DomainEventPublisher;
import net.gaiming.domain.model.BaseEntity;
import net.gaiming.domain.uow.UnitOfWork;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;
import net.gaiming.support.time.Deadline;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link UnitOfWork} over Spring JDBC.
 *
 * <p>Every transaction is opened with {@code PROPAGATION_REQUIRES_NEW}, so a unit of work
 * never joins a transaction owned by another unit running earlier on the same thread.</p>
 */
@Slf4j
public class JdbcUnitOfWork implements UnitOfWork {

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final PlatformTransactionManager transactionManager;
    private final DomainEventPublisher eventPublisher;
    private final JdbcRepositoryContext repositoryContext;
    private final Map<Class<?>, RepositoryBinding<?>> bindings;
    private final Map<Class<?>, Object> repositories = new HashMap<>();
    private final List<BaseEntity> savedAggregates = new ArrayList<>();

    private TransactionStatus transaction;
    private boolean closed;

    JdbcUnitOfWork(PlatformTransactionManager transactionManager,
                   DomainEventPublisher eventPublisher,
                   JdbcRepositoryContext repositoryContext,
                   Map<Class<?>, RepositoryBinding<?>> bindings) {
        this.transactionManager = transactionManager;
        this.eventPublisher = eventPublisher;
        this.repositoryContext = repositoryContext;
        this.bindings = bindings;
    }

    @Override
    public <R> R getRepository(Class<R> repositoryType) {
        ensureOpen();
        Object repository = repositories.computeIfAbsent(repositoryType, type -> {
            RepositoryBinding<?> binding = bindings.get(type);
            if (binding == null) {
                throw new IllegalStateException("No repository registered for " + type.getName());
            }
            return binding.create(repositoryContext);
        });
        return repositoryType.cast(repository);
    }

    @Override
    public Result<Void> beginTransaction() {
        return beginTransaction(Deadline.none());
    }

    @Override
    public Result<Void> beginTransaction(Deadline deadline) {
        if (closed) {
            return Result.failure(ErrorCode.INVALID_STATE, "Unit of work " + id + " is closed");
        }
        if (transaction != null) {
            return Result.failure(ErrorCode.INVALID_STATE, "Transaction already open in unit of work " + id);
        }
        if (deadline.isExpired()) {
            return Result.failure(ErrorCode.CANCELLED, "Deadline expired before transaction start");
        }
        DefaultTransactionDefinition definition =
            new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        definition.setName("uow-" + id);
        deadline.remaining().ifPresent(left -> definition.setTimeout(toTimeoutSeconds(left)));
        try {
            transaction = transactionManager.getTransaction(definition);
            log.debug("Unit of work {} opened transaction", id);
            return Result.success();
        } catch (TransactionException ex) {
            log.warn("Unit of work {} failed to open transaction: {}", id, ex.getMessage());
            return DataAccessFailures.toResult("Failed to begin transaction", ex);
        }
    }

    @Override
    public Result<Void> commitTransaction() {
        if (transaction == null) {
            return Result.success();
        }
        if (repositoryContext.changes().hasChanges()) {
            Result<Integer> flushed = saveChanges();
            if (flushed.isFailure()) {
                rollbackTransaction();
                return flushed.propagateFailure();
            }
        }
        TransactionStatus status = transaction;
        transaction = null;
        try {
            transactionManager.commit(status);
            log.debug("Unit of work {} committed", id);
            return Result.success();
        } catch (TransactionException ex) {
            discardTrackedState();
            log.warn("Unit of work {} failed to commit: {}", id, ex.getMessage());
            return DataAccessFailures.toResult("Failed to commit transaction", ex);
        }
    }

    @Override
    public Result<Void> rollbackTransaction() {
        discardTrackedState();
        if (transaction == null) {
            return Result.success();
        }
        TransactionStatus status = transaction;
        transaction = null;
        try {
            transactionManager.rollback(status);
            log.debug("Unit of work {} rolled back", id);
            return Result.success();
        } catch (TransactionException ex) {
            log.error("Unit of work {} failed to roll back", id, ex);
            return DataAccessFailures.toResult("Failed to roll back transaction", ex);
        }
    }

    @Override
    public boolean hasActiveTransaction() {
        return transaction != null;
    }

    @Override
    public Result<Integer> saveChanges() {
        if (closed) {
            return Result.failure(ErrorCode.INVALID_STATE, "Unit of work " + id + " is closed");
        }
        ChangeTracker changes = repositoryContext.changes();
        if (!changes.hasChanges()) {
            return Result.success(0);
        }
        boolean implicitTransaction = transaction == null;
        if (implicitTransaction) {
            Result<Void> begun = beginTransaction();
            if (begun.isFailure()) {
                return begun.propagateFailure();
            }
        }
        int pending = changes.pendingCount();
        try {
            int affected = changes.flush(savedAggregates);
            log.debug("Unit of work {} saved {} change(s), {} row(s)", id, pending, affected);
            if (implicitTransaction) {
                Result<Void> committed = commitTransaction();
                if (committed.isFailure()) {
                    return committed.propagateFailure();
                }
            }
            return Result.success(affected);
        } catch (RuntimeException ex) {
            log.warn("Unit of work {} failed to save changes: {}", id, ex.getMessage());
            if (implicitTransaction) {
                rollbackTransaction();
            }
            return DataAccessFailures.toResult("Failed to save changes", ex);
        }
    }

    @Override
    public Result<Integer> saveChangesAndDispatchEvents() {
        Result<Integer> saved = saveChanges();
        if (saved.isFailure()) {
            return saved;
        }
        List<DomainEvent> events = new ArrayList<>();
        for (BaseEntity aggregate : savedAggregates) {
            events.addAll(aggregate.getDomainEvents());
            aggregate.clearDomainEvents();
        }
        savedAggregates.clear();

        for (DomainEvent event : events) {
            try {
                eventPublisher.publish(event);
            } catch (RuntimeException ex) {
                log.error("Unit of work {} failed to dispatch {}", id, event.getClass().getSimpleName(), ex);
                return Result.failure(ErrorCode.UNEXPECTED,
                    "Changes saved but dispatching " + event.getClass().getSimpleName() + " failed: " + ex.getMessage(),
                    ex);
            }
        }
        if (!events.isEmpty()) {
            log.debug("Unit of work {} dispatched {} domain event(s)", id, events.size());
        }
        return saved;
    }

    @Override
    public <T> Result<T> executeInTransaction(Supplier<Result<T>> operation, Deadline deadline) {
        Result<Void> begun = beginTransaction(deadline);
        if (begun.isFailure()) {
            return begun.propagateFailure();
        }

        Result<T> outcome;
        try {
            outcome = operation.get();
        } catch (RuntimeException ex) {
            log.warn("Unit of work {} operation threw {}; rolling back", id, ex.toString());
            rollbackAfterFailure();
            return DataAccessFailures.toResult("Transactional operation failed", ex);
        }

        if (outcome == null) {
            rollbackAfterFailure();
            return Result.failure(ErrorCode.UNEXPECTED, "Transactional operation returned no result");
        }
        if (outcome.isFailure()) {
            log.debug("Unit of work {} operation failed ({}); rolling back", id, outcome.getError());
            rollbackAfterFailure();
            return outcome;
        }
        if (deadline.isExpired()) {
            log.warn("Unit of work {} exceeded its deadline; rolling back", id);
            rollbackAfterFailure();
            return Result.failure(ErrorCode.CANCELLED, "Deadline expired before commit");
        }

        Result<Void> committed = commitTransaction();
        if (committed.isFailure()) {
            return committed.propagateFailure();
        }
        return outcome;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (transaction != null) {
            log.warn("Unit of work {} closed with an open transaction; rolling back", id);
            rollbackTransaction();
        }
        discardTrackedState();
        closed = true;
    }

    private void rollbackAfterFailure() {
        // A failed rollback is logged inside rollbackTransaction and must not replace the original error.
        rollbackTransaction();
    }

    private void discardTrackedState() {
        repositoryContext.changes().clear();
        for (BaseEntity aggregate : savedAggregates) {
            aggregate.clearDomainEvents();
        }
        savedAggregates.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Unit of work " + id + " is closed");
        }
    }

    private static int toTimeoutSeconds(Duration remaining) {
        long seconds = (remaining.toMillis() + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }
}
