package net.gaiming.pipeline;

import net.gaiming.support.result.ErrorCode;
import net.gaiming.support.result.Result;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Runs the wrapped step only when the condition holds; otherwise hands the input on unchanged,
 * which requires the input to already be of the step's output type.
 */
public class ConditionalPipelineStep<I, O> implements PipelineStep<I, O> {

    private final PipelineStep<I, O> inner;
    private final BiPredicate<? super I, PipelineContext> condition;

    public ConditionalPipelineStep(PipelineStep<I, O> inner, BiPredicate<? super I, PipelineContext> condition) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    @Override
    public String name() {
        return "Conditional(" + inner.name() + ")";
    }

    @Override
    public int order() {
        return inner.order();
    }

    @Override
    public boolean isEnabled() {
        return inner.isEnabled();
    }

    @Override
    public Class<I> inputType() {
        return inner.inputType();
    }

    @Override
    public Class<O> outputType() {
        return inner.outputType();
    }

    public PipelineStep<I, O> inner() {
        return inner;
    }

    @Override
    public Result<O> execute(I input, PipelineContext context) {
        if (condition.test(input, context)) {
            return inner.execute(input, context);
        }
        if (outputType().isInstance(input)) {
            return Result.success(outputType().cast(input));
        }
        return Result.failure(ErrorCode.INVALID_STATE, "Step '" + name() + "' was skipped but its input is not a "
            + outputType().getSimpleName());
    }

    @Override
    public Result<O> handleFailure(I input, PipelineContext context, Exception exception) {
        return inner.handleFailure(input, context, exception);
    }
}
