package com.giggityflix.peer.core.parallel;

import java.util.Objects;

/**
 * Outcome of one {@link TaskDescriptor}: a value or the failure it raised.
 */
public sealed interface TaskResult<T> {

    boolean isSuccess();

    /**
     * @throws IllegalStateException if this is a failure
     */
    T value();

    /**
     * @throws IllegalStateException if this is a success
     */
    Throwable failure();

    record Success<T>(T result) implements TaskResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T value() {
            return result;
        }

        @Override
        public Throwable failure() {
            throw new IllegalStateException("Task succeeded");
        }
    }

    record Failure<T>(Throwable error) implements TaskResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Task failed: " + error, error);
        }

        @Override
        public Throwable failure() {
            return error;
        }
    }

    static <T> TaskResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> TaskResult<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
