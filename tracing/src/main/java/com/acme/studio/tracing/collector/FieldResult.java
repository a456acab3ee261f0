package com.acme.studio.tracing.collector;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Outcome of one field resolver: a value or the exception it raised. The tracer records
 * timing for both and hands the result back so the engine can re-raise the failure.
 */
public sealed interface FieldResult<T> permits FieldResult.Success, FieldResult.Failure {
    record Success<T>(T value) implements FieldResult<T> {}

    record Failure<T>(RuntimeException error) implements FieldResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> FieldResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> FieldResult<T> failure(RuntimeException error) {
        return new Failure<>(error);
    }

    /** Runs {@code resolver}, capturing a thrown exception as a failure. */
    static <T> FieldResult<T> capture(Supplier<T> resolver) {
        try {
            return success(resolver.get());
        } catch (RuntimeException e) {
            return failure(e);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /** Returns the value or rethrows the captured exception. */
    default T getOrThrow() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        throw ((Failure<T>) this).error();
    }
}
