package net.gaiming.pipeline;

import java.util.Objects;

/**
 * Holds the name, order, enabled flag and I/O types of a step. Order and the enabled flag
 * may be adjusted by a builder configurer before the pipeline is built.
 */
public abstract class AbstractPipelineStep<I, O> implements PipelineStep<I, O> {

    private final String name;
    private final Class<I> inputType;
    private final Class<O> outputType;
    private int order;
    private boolean enabled = true;

    protected AbstractPipelineStep(String name, int order, Class<I> inputType, Class<O> outputType) {
        this.name = Objects.requireNonNull(name, "name");
        this.order = order;
        this.inputType = Objects.requireNonNull(inputType, "inputType");
        this.outputType = Objects.requireNonNull(outputType, "outputType");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int order() {
        return order;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Class<I> inputType() {
        return inputType;
    }

    @Override
    public Class<O> outputType() {
        return outputType;
    }

    public void setOrder(int order) {
        this.order = order;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String toString() {
        return name + "#" + order;
    }
}
