package net.gaiming.pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Consumer;

/**
 * Assembles a {@link Pipeline}. Steps are sorted by order (ties keep insertion order) and
 * the input/output types of consecutive enabled steps are checked when {@link #build()} runs.
 */
public final class PipelineBuilder<I, O> {

    private final String name;
    private final Class<I> inputType;
    private final Class<O> outputType;
    private final List<PipelineStep<?, ?>> steps = new ArrayList<>();

    private PipelineBuilder(String name, Class<I> inputType, Class<O> outputType) {
        this.name = Objects.requireNonNull(name, "name");
        this.inputType = Objects.requireNonNull(inputType, "inputType");
        this.outputType = Objects.requireNonNull(outputType, "outputType");
    }

    public static <I, O> PipelineBuilder<I, O> create(String name, Class<I> inputType, Class<O> outputType) {
        return new PipelineBuilder<>(name, inputType, outputType);
    }

    public PipelineBuilder<I, O> addStep(PipelineStep<?, ?> step) {
        steps.add(Objects.requireNonNull(step, "step"));
        return this;
    }

    public <S extends PipelineStep<?, ?>> PipelineBuilder<I, O> addStep(S step, Consumer<? super S> configurer) {
        configurer.accept(step);
        return addStep(step);
    }

    public <SI, SO> PipelineBuilder<I, O> addStep(PipelineStep<SI, SO> step,
                                                  BiPredicate<? super SI, PipelineContext> condition) {
        return addStep(new ConditionalPipelineStep<>(step, condition));
    }

    public <SI, SO, S extends PipelineStep<SI, SO>> PipelineBuilder<I, O> addStep(
        S step, Consumer<? super S> configurer, BiPredicate<? super SI, PipelineContext> condition) {
        configurer.accept(step);
        return addStep(new ConditionalPipelineStep<>(step, condition));
    }

    /**
     * @throws IllegalStateException when there are no enabled steps, when a step cannot accept
     *                               the previous step's output, or when the chain never yields {@code O}
     */
    public Pipeline<I, O> build() {
        List<PipelineStep<?, ?>> ordered = new ArrayList<>(steps);
        ordered.sort(Comparator.comparingInt(PipelineStep::order));

        Class<?> flowing = inputType;
        boolean anyEnabled = false;
        for (PipelineStep<?, ?> step : ordered) {
            if (!step.isEnabled()) {
                continue;
            }
            anyEnabled = true;
            if (!step.inputType().isAssignableFrom(flowing)) {
                throw new IllegalStateException("Pipeline " + name + ": step '" + step.name() + "' expects "
                    + step.inputType().getSimpleName() + " but receives " + flowing.getSimpleName());
            }
            flowing = step.outputType();
        }
        if (!anyEnabled) {
            throw new IllegalStateException("Pipeline " + name + " has no enabled steps");
        }
        if (!outputType.isAssignableFrom(flowing)) {
            throw new IllegalStateException("Pipeline " + name + " ends with " + flowing.getSimpleName()
                + " instead of " + outputType.getSimpleName());
        }
        return new DefaultPipeline<>(name, inputType, outputType, ordered);
    }
}
