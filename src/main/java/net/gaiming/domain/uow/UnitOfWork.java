package net.gaiming.domain.uow;

import net.gaiming.support.result.Result;
import net.gaiming.support.time.Deadline;

import java.util.function.Supplier;

/**
 * Transaction boundary owning repository access for one logical operation.
 *
 * <p>Repositories obtained through {@link #getRepository(Class)} register their inserts and
 * updates here; nothing reaches storage until {@link #saveChanges()}. Domain events raised
 * by the saved aggregates are published by {@link #saveChangesAndDispatchEvents()} only
 * after the save succeeded.</p>
 *
 * <p>An instance belongs to a single worker and must not be shared between threads.</p>
 */
public interface UnitOfWork extends AutoCloseable {

    /**
     * Returns the repository bound to this unit for the given port type.
     *
     * @throws IllegalStateException when no implementation is registered for the type
     */
    <R> R getRepository(Class<R> repositoryType);

    /**
     * Opens a transaction. Fails with {@code INVALID_STATE} when one is already open.
     */
    Result<Void> beginTransaction();

    Result<Void> beginTransaction(Deadline deadline);

    /**
     * Commits the open transaction; a no-op success when none is open.
     */
    Result<Void> commitTransaction();

    /**
     * Rolls back the open transaction and discards pending changes; a no-op success when none is open.
     */
    Result<Void> rollbackTransaction();

    boolean hasActiveTransaction();

    /**
     * Flushes pending inserts and updates.
     *
     * @return number of affected rows
     */
    Result<Integer> saveChanges();

    /**
     * Flushes pending changes, then publishes and clears the events of every saved aggregate.
     */
    Result<Integer> saveChangesAndDispatchEvents();

    default <T> Result<T> executeInTransaction(Supplier<Result<T>> operation) {
        return executeInTransaction(operation, Deadline.none());
    }

    /**
     * Runs {@code operation} inside a new transaction. Commits on success; rolls back when the
     * operation fails, throws, or finishes after {@code deadline}.
     */
    <T> Result<T> executeInTransaction(Supplier<Result<T>> operation, Deadline deadline);

    /**
     * Rolls back any transaction still open.
     */
    @Override
    void close();
}
