package net.gaiming.application.cqrs;

/**
 * Anything the {@link Dispatcher} can route to a handler.
 *
 * @param <R> value carried by a successful result
 */
public interface Request<R> {
}
