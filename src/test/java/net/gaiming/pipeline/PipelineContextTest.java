package net.gaiming.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PipelineContextTest {

    private static final ContextKey<Long> PLAYER_ID = ContextKey.of("PlayerId", Long.class);

    @Test
    void should_DefaultCorrelationIdToContextId_When_NotSupplied() {
        PipelineContext context = PipelineContext.create();

        assertThat(context.getCorrelationId()).isEqualTo(context.getContextId());
        assertThat(context.getDeadline().isBounded()).isFalse();
        assertThat(context.isExpired()).isFalse();
    }

    @Test
    void should_KeepSuppliedCorrelationId_When_Built() {
        PipelineContext context = PipelineContext.builder().userId("ops").correlationId("req-7").build();

        assertThat(context.getCorrelationId()).isEqualTo("req-7");
        assertThat(context.getUserId()).isEqualTo("ops");
    }

    @Test
    void should_RemoveProperty_When_SetToNull() {
        PipelineContext context = PipelineContext.create();
        context.set(PLAYER_ID, 42L);
        context.set(PLAYER_ID, null);

        assertThat(context.has(PLAYER_ID)).isFalse();
    }

    @Test
    void should_ReturnEmpty_When_RawValueHasOtherType() {
        PipelineContext context = PipelineContext.create();
        context.set("PlayerId", "42");

        assertThat(context.get("PlayerId", Long.class)).isEmpty();
        assertThatThrownBy(() -> context.get(PLAYER_ID)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void should_Throw_When_RequiredPropertyMissing() {
        PipelineContext context = PipelineContext.create();

        assertThatThrownBy(() -> context.require(PLAYER_ID))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("PlayerId");
        assertThat(context.getOrDefault(PLAYER_ID, 7L)).isEqualTo(7L);
    }
}
