package net.gaiming.application.cqrs;

/**
 * A side-effect free read.
 */
public interface Query<R> extends Request<R> {
}
