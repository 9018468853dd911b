package com.bayousystems;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Implementation of TaskHandle backed by CompletableFuture.
 */
record PendingTaskHandle<R>(String taskId, String workerId, CompletableFuture<TaskResult<R>> future)
        implements TaskHandle<R> {

    @Override
    public TaskResult<R> await() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    @Override
    public TaskResult<R> await(Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted while waiting for task " + taskId, workerId,
                    ErrorKind.WORKER_TERMINATED, e);
        }
    }

    @Override
    public R get() {
        return await().getOrThrow();
    }

    @Override
    public R get(Duration timeout) throws TimeoutException {
        return await(timeout).getOrThrow();
    }

    @Override
    public Optional<TaskResult<R>> poll() {
        // covers cancelled and abandoned tasks, which future() reports
        if (!future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    @Override
    public boolean cancel() {
        return future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
        return future.isCancelled();
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    @Override
    public void onComplete(Consumer<TaskResult<R>> consumer) {
        future.thenAccept(consumer);
    }

    private RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new WorkerException("Task " + taskId + " did not complete", workerId,
                ErrorKind.WORKER_TERMINATED, cause);
    }
}
