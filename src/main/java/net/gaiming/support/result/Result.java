package net.gaiming.support.result;

import jakarta.annotation.Nullable;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Tagged outcome returned by every engine boundary in place of throwing.
 *
 * <p>A success may carry a {@code null} value (commands that only acknowledge);
 * a failure always carries a {@link ResultError}.</p>
 *
 * @param <T> value type on success
 */
public final class Result<T> {

    private static final Result<Void> EMPTY_SUCCESS = new Result<>(null, null);

    @Nullable
    private final T value;
    @Nullable
    private final ResultError error;

    private Result(@Nullable T value, @Nullable ResultError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(@Nullable T value) {
        return new Result<>(value, null);
    }

    public static Result<Void> success() {
        return EMPTY_SUCCESS;
    }

    public static <T> Result<T> failure(ResultError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> Result<T> failure(ErrorCode code, String message) {
        return failure(ResultError.of(code, message));
    }

    public static <T> Result<T> failure(ErrorCode code, String message, Throwable cause) {
        return failure(new ResultError(code, message, cause));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the success value.
     *
     * @throws NoSuchElementException when called on a failure
     */
    @Nullable
    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present on failed result: " + error);
        }
        return value;
    }

    /**
     * Returns the failure payload.
     *
     * @throws NoSuchElementException when called on a success
     */
    public ResultError getError() {
        if (error == null) {
            throw new NoSuchElementException("Successful result carries no error");
        }
        return error;
    }

    public Optional<T> toOptional() {
        return error == null ? Optional.ofNullable(value) : Optional.empty();
    }

    public T orElse(T fallback) {
        return error == null && value != null ? value : fallback;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return Objects.requireNonNull(mapper.apply(value), "flatMap mapper returned null");
    }

    /**
     * Re-types a failure so it can be propagated from a boundary with a different value type.
     */
    public <U> Result<U> propagateFailure() {
        return failure(getError());
    }

    public Result<T> ifSuccess(Consumer<? super T> action) {
        if (error == null) {
            action.accept(value);
        }
        return this;
    }

    public Result<T> onFailure(Consumer<ResultError> action) {
        if (error != null) {
            action.accept(error);
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
