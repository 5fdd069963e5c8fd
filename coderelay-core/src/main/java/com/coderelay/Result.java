package com.coderelay;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a coordinator request: a value, or the error that prevented it.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }
    }

    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException re) {
                throw re;
            }
            throw new ReplyException("Reply failed", error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        /**
         * True when the coordinator never performed the request.
         */
        public boolean isDropped() {
            return error instanceof RequestDroppedException;
        }
    }

    boolean isSuccess();

    T getOrThrow();

    T getOrElse(T defaultValue);

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> success) {
            try {
                return new Success<>(fn.apply(success.value()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default Optional<T> toOptional() {
        if (this instanceof Success<T> success) {
            return Optional.ofNullable(success.value());
        }
        return Optional.empty();
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.error());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
