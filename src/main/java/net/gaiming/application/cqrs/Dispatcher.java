package net.gaiming.application.cqrs;

import net.gaiming.support.result.Result;

/**
 * Routes a command or query to its single handler. Never throws.
 */
public interface Dispatcher {

    <R> Result<R> dispatch(Request<R> request);
}
