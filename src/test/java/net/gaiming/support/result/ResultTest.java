package net.gaiming.support.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ResultTest {

    @Test
    void should_CarryValue_When_Successful() {
        Result<String> result = Result.success("ok");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isFailure()).isFalse();
        assertThat(result.getValue()).isEqualTo("ok");
        assertThatThrownBy(result::getError).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void should_AllowNullValue_When_CommandOnlyAcknowledges() {
        Result<Void> result = Result.success();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isNull();
        assertThat(result.toOptional()).isEmpty();
    }

    @Test
    void should_ThrowOnGetValue_When_Failed() {
        Result<String> result = Result.failure(ErrorCode.NOT_FOUND, "Player not found");

        assertThat(result.getError().code()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(result.getError().message()).isEqualTo("Player not found");
        assertThatThrownBy(result::getValue)
            .isInstanceOf(NoSuchElementException.class)
            .hasMessageContaining("Player not found");
    }

    @Test
    void should_SkipMapper_When_Failed() {
        AtomicBoolean invoked = new AtomicBoolean();
        Result<Integer> failed = Result.failure(ErrorCode.VALIDATION, "bad");

        Result<String> mapped = failed.map(value -> {
            invoked.set(true);
            return "never";
        });

        assertThat(invoked).isFalse();
        assertThat(mapped.getError().code()).isEqualTo(ErrorCode.VALIDATION);
    }

    @Test
    void should_ChainFailure_When_FlatMapReturnsFailure() {
        Result<Integer> chained = Result.success(3)
            .flatMap(value -> Result.<Integer>failure(ErrorCode.CONFLICT, "taken"));

        assertThat(chained.isFailure()).isTrue();
        assertThat(chained.getError().message()).isEqualTo("taken");
    }

    @Test
    void should_KeepErrorAndCause_When_PropagatingFailureToOtherType() {
        IllegalStateException cause = new IllegalStateException("db down");
        Result<Long> failed = Result.failure(ErrorCode.TRANSIENT, "Storage unavailable", cause);

        Result<String> propagated = failed.propagateFailure();

        assertThat(propagated.getError()).isEqualTo(failed.getError());
        assertThat(propagated.getError().cause()).isSameAs(cause);
    }

    @Test
    void should_ReturnFallback_When_SuccessCarriesNull() {
        assertThat(Result.<String>success(null).orElse("fallback")).isEqualTo("fallback");
        assertThat(Result.<String>failure(ErrorCode.UNEXPECTED, "x").orElse("fallback")).isEqualTo("fallback");
        assertThat(Result.success("value").orElse("fallback")).isEqualTo("value");
    }
}
