package com.bayousystems;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Handle to the eventual result of a submitted task.
 * <p>
 * Waiting is always explicit and can be bounded:
 * <ul>
 *   <li>Simple: {@link #get()} returns the value or throws {@link TaskFailedException}</li>
 *   <li>Safe: {@link #await()} returns the {@link TaskResult}</li>
 *   <li>Advanced: {@link #future()} for composition</li>
 * </ul>
 * If the task is abandoned (its worker was stopped or gave up) every wait fails with
 * {@link WorkerTerminatedException}. {@link #cancel()} is a soft cancel: the caller stops
 * waiting, the worker still executes the task and the handle discards the result.
 *
 * @param <R> the result value type
 */
public interface TaskHandle<R> {

    String taskId();

    /**
     * Id of the worker the task was routed to.
     */
    String workerId();

    /**
     * Blocks until the result is available.
     *
     * @throws WorkerTerminatedException if the task was abandoned
     * @throws java.util.concurrent.CancellationException if the handle was cancelled
     */
    TaskResult<R> await();

    /**
     * Blocks until the result is available or the timeout expires.
     *
     * @throws TimeoutException if no result arrived in time; the task keeps running
     */
    TaskResult<R> await(Duration timeout) throws TimeoutException;

    /**
     * Blocks for the result and returns its value.
     *
     * @throws TaskFailedException if the task failed
     */
    R get();

    R get(Duration timeout) throws TimeoutException;

    /**
     * Non-blocking check. Never throws. Empty while the task has not completed, after a soft
     * cancel, and when the task was abandoned; {@link #isDone()} tells the last two apart from a
     * pending task and {@link #future()} carries the {@link WorkerTerminatedException}.
     */
    Optional<TaskResult<R>> poll();

    /**
     * Soft cancel: stop waiting for the result. Has no effect on the executing worker.
     *
     * @return true if the handle was cancelled by this call
     */
    boolean cancel();

    boolean isCancelled();

    boolean isDone();

    void onComplete(Consumer<TaskResult<R>> consumer);

    CompletableFuture<TaskResult<R>> future();
}
