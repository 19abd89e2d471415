package com.trustboundary.application;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a governance operation: a value, or an {@link ErrorKind} with a message.
 *
 * <p>Used for routine outcomes such as a missing request. Fatal conditions
 * (tether failure, storage failure) are thrown instead.
 *
 * @param <T> value type
 */
public final class Result<T> {

    private final T value;
    private final ErrorKind error;
    private final String message;

    private Result(T value, ErrorKind error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value must not be null"), null, null);
    }

    public static <T> Result<T> failure(ErrorKind error, String message) {
        return new Result<>(null, Objects.requireNonNull(error, "error must not be null"), message);
    }

    public static <T> Result<T> notFound(String message) {
        return failure(ErrorKind.NOT_FOUND, message);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws NoSuchElementException if this is a failure
     */
    public T get() {
        if (error != null) {
            throw new NoSuchElementException("Result is a failure: " + error + " " + message);
        }
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<ErrorKind> error() {
        return Optional.ofNullable(error);
    }

    public String message() {
        return message;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return isOk() ? Result.ok(mapper.apply(value)) : Result.failure(error, message);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + value + "]" : "Failure[" + error + ": " + message + "]";
    }
}
