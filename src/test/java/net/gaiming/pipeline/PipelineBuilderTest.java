package net.gaiming.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.gaiming.support.result.Result;
import org.junit.jupiter.api.Test;

class PipelineBuilderTest {

    static final class ParseStep extends AbstractPipelineStep<String, Integer> {
        ParseStep(int order) {
            super("Parse", order, String.class, Integer.class);
        }

        @Override
        public Result<Integer> execute(String input, PipelineContext context) {
            return Result.success(Integer.parseInt(input.trim()));
        }
    }

    static final class HalveStep extends AbstractPipelineStep<Integer, Double> {
        HalveStep(int order) {
            super("Halve", order, Integer.class, Double.class);
        }

        @Override
        public Result<Double> execute(Integer input, PipelineContext context) {
            return Result.success(input / 2.0);
        }
    }

    @Test
    void should_SortStepsByOrder_When_AddedOutOfOrder() {
        Pipeline<String, Double> pipeline = PipelineBuilder.create("Numbers", String.class, Double.class)
            .addStep(new HalveStep(2))
            .addStep(new ParseStep(1))
            .build();

        assertThat(pipeline.steps()).extracting(PipelineStep::name).containsExactly("Parse", "Halve");
        assertThat(pipeline.execute(" 9 ", PipelineContext.create()).getValue()).isEqualTo(4.5);
    }

    @Test
    void should_RejectPipeline_When_StepTypesDoNotChain() {
        PipelineBuilder<String, Double> builder = PipelineBuilder.create("Broken", String.class, Double.class)
            .addStep(new HalveStep(1));

        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("expects Integer but receives String");
    }

    @Test
    void should_RejectPipeline_When_ChainDoesNotEndInOutputType() {
        PipelineBuilder<String, Double> builder = PipelineBuilder.create("Short", String.class, Double.class)
            .addStep(new ParseStep(1));

        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ends with Integer");
    }

    @Test
    void should_RejectPipeline_When_NoStepIsEnabled() {
        PipelineBuilder<String, Integer> builder = PipelineBuilder.create("Empty", String.class, Integer.class)
            .addStep(new ParseStep(1), step -> step.setEnabled(false));

        assertThatThrownBy(builder::build).hasMessageContaining("no enabled steps");
    }

    @Test
    void should_ApplyConfigurer_When_AddingStep() {
        Pipeline<String, Double> pipeline = PipelineBuilder.create("Configured", String.class, Double.class)
            .addStep(new ParseStep(10), step -> step.setOrder(0))
            .addStep(new HalveStep(5))
            .build();

        assertThat(pipeline.steps()).extracting(PipelineStep::order).containsExactly(0, 5);
    }

    @Test
    void should_WrapInConditionalStep_When_ConditionGiven() {
        Pipeline<String, Double> pipeline = PipelineBuilder.create("Conditional", String.class, Double.class)
            .addStep(new ParseStep(1))
            .addStep(new HalveStep(2), (value, context) -> value > 0)
            .build();

        assertThat(pipeline.steps().get(1)).isInstanceOf(ConditionalPipelineStep.class);
        assertThat(pipeline.steps().get(1).name()).isEqualTo("Conditional(Halve)");
    }
}
