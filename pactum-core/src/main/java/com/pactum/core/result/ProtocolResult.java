package com.pactum.core.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a protocol operation: either a value or a {@link ProtocolError}.
 * Rejected requests travel as values, never as exceptions.
 *
 * @param <T> type of the success value
 */
public final class ProtocolResult<T> {

    private final T value;
    private final ProtocolError error;

    private ProtocolResult(T value, ProtocolError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ProtocolResult<T> ok(T value) {
        return new ProtocolResult<>(Objects.requireNonNull(value, "Value cannot be null"), null);
    }

    public static <T> ProtocolResult<T> failure(ErrorKind kind, String message) {
        return new ProtocolResult<>(null, new ProtocolError(kind, message));
    }

    public static <T> ProtocolResult<T> failure(ProtocolError error) {
        return new ProtocolResult<>(null, Objects.requireNonNull(error, "Error cannot be null"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the success value.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error.kind() + " - " + error.message());
        }
        return value;
    }

    /**
     * Returns the error.
     *
     * @throws IllegalStateException if this result is a success
     */
    public ProtocolError error() {
        if (error == null) {
            throw new IllegalStateException("Result is not a failure");
        }
        return error;
    }

    public Optional<ErrorKind> errorKind() {
        return error == null ? Optional.empty() : Optional.of(error.kind());
    }

    public boolean hasError(ErrorKind kind) {
        return error != null && error.kind() == kind;
    }

    public <U> ProtocolResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return new ProtocolResult<>(null, error);
        }
        return ProtocolResult.ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return error == null ? "Ok[" + value + "]" : "Failure[" + error.kind() + ": " + error.message() + "]";
    }
}
