package net.gaiming.application.cqrs;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link Dispatcher} backed by an immutable {@link HandlerRegistry}. Holds no per-request state.
 */
@Slf4j
public class MediatorDispatcher implements Dispatcher {

    private final HandlerRegistry registry;

    public MediatorDispatcher(HandlerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public <R> Result<R> dispatch(Request<R> request) {
        if (request == null) {
            return Result.failure(ErrorCode.VALIDATION, "Request must not be null");
        }
        String requestName = request.getClass().getSimpleName();
        Optional<RequestHandler<Request<R>, R>> handler = registry.find(request.getClass());
        if (handler.isEmpty()) {
            log.warn("No handler registered for {}", requestName);
            return Result.failure(ErrorCode.NO_HANDLER, "No handler registered for " + requestName);
        }

        long start = System.nanoTime();
        Result<R> result;
        try {
            result = handler.get().handle(request);
        } catch (RuntimeException ex) {
            log.error("Handler for {} threw", requestName, ex);
            return Result.failure(ErrorCode.UNEXPECTED,
                "Unexpected error handling " + requestName + ": " + ex.getMessage(), ex);
        }
        if (result == null) {
            log.error("Handler for {} returned no result", requestName);
            return Result.failure(ErrorCode.UNEXPECTED, "Handler for " + requestName + " returned no result");
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        if (result.isSuccess()) {
            log.debug("Dispatched {} (success=true) in {} ms", requestName, elapsedMs);
        } else {
            log.info("Dispatched {} (success=false, {}) in {} ms", requestName, result.getError(), elapsedMs);
        }
        return result;
    }
}
