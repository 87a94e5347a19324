package net.gaiming.pipeline;

import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

/**
 * One stage of a {@link Pipeline}.
 *
 * @param <I> input type
 * @param <O> output type
 */
public interface PipelineStep<I, O> {

    String name();

    /**
     * Position in the pipeline; lower runs first.
     */
    int order();

    boolean isEnabled();

    Class<I> inputType();

    Class<O> outputType();

    Result<O> execute(I input, PipelineContext context);

    /**
     * Called when {@link #execute} throws. A success whose value is an instance of the
     * pipeline's output type ends the run with that value; the remaining steps do not run.
     * Any other outcome fails the run with {@code STEP_FAILED}.
     */
    default Result<O> handleFailure(I input, PipelineContext context, Exception exception) {
        return Result.failure(ErrorCode.STEP_FAILED,
            "Step '" + name() + "' failed: " + exception.getMessage(), exception);
    }
}
