package net.gaiming.application.cqrs;

import net.gaiming.support.result.Result;

/**
 * Handles exactly one request type.
 *
 * <p>Expected outcomes (validation, not found, conflicts) are returned as failures; an
 * exception escaping {@link #handle} is treated by the dispatcher as unexpected.</p>
 *
 * @param <Q> handled request type
 * @param <R> result value type
 */
public interface RequestHandler<Q extends Request<R>, R> {

    Class<Q> requestType();

    Result<R> handle(Q request);
}
