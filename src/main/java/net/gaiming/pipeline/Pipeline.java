package net.gaiming.pipeline;

import net.gaiming.support.result.Result;

import java.util.List;

/**
 * An ordered, immutable chain of steps turning an {@code I} into an {@code O}.
 */
public interface Pipeline<I, O> {

    String name();

    Class<I> inputType();

    Class<O> outputType();

    /**
     * Steps in execution order, disabled ones included.
     */
    List<PipelineStep<?, ?>> steps();

    Result<O> execute(I input, PipelineContext context);
}
