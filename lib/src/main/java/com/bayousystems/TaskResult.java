package com.bayousystems;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an executed task: exactly one of {@link Success} or {@link Failure}.
 * Produced once per accepted task that a worker executes.
 *
 * @param <R> the type of the value computed by the task
 */
public sealed interface TaskResult<R> permits TaskResult.Success, TaskResult.Failure {

    /**
     * Successful result containing the computed value.
     */
    record Success<R>(String taskId, R value) implements TaskResult<R> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public R getOrThrow() {
            return value;
        }

        @Override
        public R getOrElse(R defaultValue) {
            return value;
        }
    }

    /**
     * Failed result. {@code cause} may be null when the failure did not originate from an exception.
     */
    record Failure<R>(String taskId, ErrorKind errorKind, String message, Throwable cause) implements TaskResult<R> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public R getOrThrow() {
            throw new TaskFailedException(this);
        }

        @Override
        public R getOrElse(R defaultValue) {
            return defaultValue;
        }
    }

    String taskId();

    boolean isSuccess();

    R getOrThrow();

    R getOrElse(R defaultValue);

    default <U> TaskResult<U> map(Function<R, U> fn) {
        if (this instanceof Success<R> success) {
            try {
                return new Success<>(success.taskId(), fn.apply(success.value()));
            } catch (Exception e) {
                return new Failure<>(success.taskId(), ErrorKind.TASK_EXECUTION_FAILURE, e.getMessage(), e);
            }
        }
        Failure<R> failure = (Failure<R>) this;
        return new Failure<>(failure.taskId(), failure.errorKind(), failure.message(), failure.cause());
    }

    default void ifSuccess(Consumer<R> consumer) {
        if (this instanceof Success<R> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<Failure<R>> consumer) {
        if (this instanceof Failure<R> failure) {
            consumer.accept(failure);
        }
    }

    static <R> TaskResult<R> success(String taskId, R value) {
        return new Success<>(taskId, value);
    }

    static <R> TaskResult<R> failure(String taskId, ErrorKind errorKind, Throwable cause) {
        String message = cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
        return new Failure<>(taskId, errorKind, message, cause);
    }
}
