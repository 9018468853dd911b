package com.bayousystems.test;

import com.bayousystems.Supervisable;
import com.bayousystems.TaskHandle;
import com.bayousystems.TaskResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Polling assertions for code that completes on worker threads.
 * Use these instead of {@code Thread.sleep()} when waiting for an asynchronous outcome.
 *
 * <p>Usage:
 * <pre>{@code
 * AsyncAssertion.eventually(() -> worker.getQueueDepth() == 0, Duration.ofSeconds(2));
 *
 * int completed = AsyncAssertion.awaitValue(() -> pool.getMetrics().completed(), 10L, Duration.ofSeconds(2));
 *
 * List<TaskResult<String>> results = AsyncAssertion.awaitAll(handles, Duration.ofSeconds(5));
 * }</pre>
 */
public final class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 20;

    private AsyncAssertion() {
    }

    public static void eventually(BooleanSupplier condition, Duration timeout) {
        eventually(condition, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Polls until the condition holds.
     *
     * @throws AssertionError if it does not hold within the timeout; the last exception thrown by
     *                        the condition, if any, is attached as the cause
     */
    public static void eventually(BooleanSupplier condition, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        Throwable lastError = null;

        do {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
            } catch (RuntimeException | AssertionError e) {
                lastError = e;
            }
            pause(pollIntervalMs, "condition");
        } while (System.nanoTime() < deadline);

        String message = "Condition did not become true within " + timeout;
        if (lastError != null) {
            throw new AssertionError(message + ". Last error: " + lastError.getMessage(), lastError);
        }
        throw new AssertionError(message);
    }

    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout) {
        return awaitValue(supplier, expected, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Polls until the supplier returns a value equal to {@code expected}.
     *
     * @return the matching value
     * @throws AssertionError listing the distinct values seen if it never matches
     */
    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        List<T> history = new ArrayList<>();
        T lastValue = null;

        do {
            lastValue = supplier.get();
            if (history.isEmpty() || !Objects.equals(lastValue, history.get(history.size() - 1))) {
                history.add(lastValue);
            }
            if (Objects.equals(expected, lastValue)) {
                return lastValue;
            }
            pause(pollIntervalMs, "value");
        } while (System.nanoTime() < deadline);

        throw new AssertionError("Value did not become " + expected + " within " + timeout
                + ". Values seen: " + history + ". Final value: " + lastValue);
    }

    public static void eventuallyAssert(Runnable assertion, Duration timeout) {
        Objects.requireNonNull(assertion, "assertion cannot be null");
        eventually(() -> {
            assertion.run();
            return true;
        }, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Waits until the worker or supervisor has terminated.
     */
    public static void awaitTerminated(Supervisable entity, Duration timeout) {
        Objects.requireNonNull(entity, "entity cannot be null");
        try {
            eventually(entity::isTerminated, timeout);
        } catch (AssertionError e) {
            throw new AssertionError(entity.getId() + " did not terminate within " + timeout, e);
        }
    }

    /**
     * Waits for every handle and returns the results in the handles' order.
     *
     * @throws AssertionError if the handles do not all complete within the timeout, or one of them
     *                        was abandoned or cancelled
     */
    public static <R> List<TaskResult<R>> awaitAll(Collection<? extends TaskHandle<R>> handles, Duration timeout) {
        Objects.requireNonNull(handles, "handles cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        List<TaskResult<R>> results = new ArrayList<>(handles.size());
        for (TaskHandle<R> handle : handles) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            try {
                results.add(handle.await(remaining));
            } catch (TimeoutException e) {
                throw new AssertionError("Task " + handle.taskId() + " on " + handle.workerId()
                        + " did not complete within " + timeout, e);
            } catch (RuntimeException e) {
                throw new AssertionError("Task " + handle.taskId() + " did not produce a result: " + e, e);
            }
        }
        return results;
    }

    private static void pause(long pollIntervalMs, String what) {
        try {
            Thread.sleep(pollIntervalMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for " + what, e);
        }
    }
}
