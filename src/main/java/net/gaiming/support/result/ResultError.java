package net.gaiming.support.result;

import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * Failure payload of a {@link Result}: a machine code, a human-readable message and,
 * where the failure came from an exception, the original cause.
 */
public record ResultError(ErrorCode code, String message, @Nullable Throwable cause) {

    public ResultError {
        Objects.requireNonNull(code, "code");
        message = message == null ? code.name() : message;
    }

    public static ResultError of(ErrorCode code, String message) {
        return new ResultError(code, message, null);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
