package com.agrotrace.core.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tagged outcome of a mutating operation: either a success payload or exactly one error code.
 *
 * @param <T> success payload type
 */
public final class OperationResult<T> {

    private final T value;
    private final ErrorCode error;

    private OperationResult(T value, ErrorCode error) {
        this.value = value;
        this.error = error;
    }

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(Objects.requireNonNull(value, "Success value cannot be null"), null);
    }

    public static <T> OperationResult<T> failure(ErrorCode error) {
        return new OperationResult<>(null, Objects.requireNonNull(error, "Error code cannot be null"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the success payload.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error.name() + " (" + error.code() + ")");
        }
        return value;
    }

    public Optional<ErrorCode> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Numeric error code, or 0 for a success.
     */
    public int errorCode() {
        return error == null ? 0 : error.code();
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperationResult<?> that)) return false;
        return Objects.equals(value, that.value) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null
                ? "ok(" + value + ")"
                : "err(" + error.name() + "/" + error.code() + ")";
    }
}
