package net.gaiming.application.cqrs;

/**
 * A request that changes state. Carries audit metadata about who issued it.
 */
public interface Command<R> extends Request<R> {

    CommandMetadata metadata();
}
