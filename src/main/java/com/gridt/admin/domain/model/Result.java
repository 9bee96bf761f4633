package com.gridt.admin.domain.model;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation that either produced a value or hit an expected business error.
 * Expected outcomes (a missing follower, a movement that does not exist) travel as a
 * {@link Failure}; infrastructure problems still travel as exceptions.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public E errorOrNull() {
            return null;
        }

        @Override
        public <R> R fold(Function<T, R> onSuccess, Function<E, R> onFailure) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("No value present, operation failed with: " + error);
        }

        @Override
        public E errorOrNull() {
            return error;
        }

        @Override
        public <R> R fold(Function<T, R> onSuccess, Function<E, R> onFailure) {
            return onFailure.apply(error);
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    T getOrThrow();

    E errorOrNull();

    /**
     * Collapses both branches into a single value, typically a line of operator output.
     */
    <R> R fold(Function<T, R> onSuccess, Function<E, R> onFailure);

    default Result<T, E> onFailure(Consumer<E> action) {
        if (isFailure()) {
            action.accept(errorOrNull());
        }
        return this;
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
