package net.gaiming.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs steps in ascending order and stops at the first value of the output type, at the
 * first failure, or when the context deadline has passed.
 */
@Slf4j
class DefaultPipeline<I, O> implements Pipeline<I, O> {

    private final String name;
    private final Class<I> inputType;
    private final Class<O> outputType;
    private final List<PipelineStep<?, ?>> steps;

    DefaultPipeline(String name, Class<I> inputType, Class<O> outputType, List<PipelineStep<?, ?>> steps) {
        this.name = name;
        this.inputType = inputType;
        this.outputType = outputType;
        this.steps = List.copyOf(steps);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<I> inputType() {
        return inputType;
    }

    @Override
    public Class<O> outputType() {
        return outputType;
    }

    @Override
    public List<PipelineStep<?, ?>> steps() {
        return steps;
    }

    @Override
    public Result<O> execute(I input, PipelineContext context) {
        long pipelineStart = System.nanoTime();
        Object current = input;
        for (PipelineStep<?, ?> candidate : steps) {
            if (!candidate.isEnabled()) {
                log.debug("Pipeline {} skipping disabled step {}", name, candidate.name());
                continue;
            }
            if (context.isExpired()) {
                log.warn("Pipeline {} cancelled before step {} (context {}): deadline expired",
                    name, candidate.name(), context.getContextId());
                return Result.failure(ErrorCode.CANCELLED,
                    "Pipeline '" + name + "' cancelled before step '" + candidate.name() + "': deadline expired");
            }
            @SuppressWarnings("unchecked")
            PipelineStep<Object, Object> step = (PipelineStep<Object, Object>) candidate;
            if (!step.inputType().isInstance(current)) {
                return Result.failure(ErrorCode.UNEXPECTED, "Step '" + step.name() + "' expects "
                    + step.inputType().getSimpleName() + " but received "
                    + (current == null ? "null" : current.getClass().getSimpleName()));
            }

            long stepStart = System.nanoTime();
            Result<Object> outcome;
            try {
                outcome = step.execute(current, context);
            } catch (Exception ex) {
                log.warn("Pipeline {} step {} threw {}", name, step.name(), ex.toString());
                return recover(step, current, context, ex);
            }
            log.debug("Pipeline {} step {} finished in {} ms", name, step.name(), elapsedMillis(stepStart));

            if (outcome == null) {
                return Result.failure(ErrorCode.UNEXPECTED, "Step '" + step.name() + "' returned no result");
            }
            if (outcome.isFailure()) {
                log.debug("Pipeline {} stopped at step {}: {}", name, step.name(), outcome.getError());
                return outcome.propagateFailure();
            }
            current = outcome.getValue();
            if (outputType.isInstance(current)) {
                log.debug("Pipeline {} completed at step {} in {} ms", name, step.name(), elapsedMillis(pipelineStart));
                return Result.success(outputType.cast(current));
            }
        }
        return Result.failure(ErrorCode.UNEXPECTED,
            "Pipeline '" + name + "' finished without producing a " + outputType.getSimpleName());
    }

    private Result<O> recover(PipelineStep<Object, Object> step, Object input, PipelineContext context, Exception ex) {
        Result<Object> handled;
        try {
            handled = step.handleFailure(input, context, ex);
        } catch (RuntimeException handlerFailure) {
            log.error("Pipeline {} failure handler of step {} threw", name, step.name(), handlerFailure);
            handled = null;
        }
        if (handled != null && handled.isSuccess() && outputType.isInstance(handled.getValue())) {
            log.info("Pipeline {} recovered from failure in step {}", name, step.name());
            return Result.success(outputType.cast(handled.getValue()));
        }
        return Result.failure(ErrorCode.STEP_FAILED,
            "Pipeline step '" + step.name() + "' failed: " + ex.getMessage(), ex);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
