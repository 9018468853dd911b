package com.bayousystems;

/**
 * Classifies every error the runtime reports, either as a {@link TaskResult.Failure}
 * or as a {@link WorkerException} thrown at submission time.
 */
public enum ErrorKind {
    /** The task's computation threw. The worker keeps running. */
    TASK_EXECUTION_FAILURE,

    /** Unrecoverable fault of the worker itself. The worker terminates and may be restarted. */
    WORKER_FATAL_FAULT,

    /** A bounded mailbox had no room and the overflow policy does not block. */
    MAILBOX_FULL,

    /** The worker (or pool) no longer accepts work. */
    WORKER_TERMINATED,

    /** A pool could not find a worker that accepts work. */
    NO_AVAILABLE_WORKER,

    /** Rejected because the circuit breaker is open. */
    CIRCUIT_OPEN,

    /** Rejected by admission throttling. */
    RATE_LIMITED,

    /** A supervisor gave up restarting an entity. */
    RESTART_BUDGET_EXCEEDED;

    /**
     * Returns true for errors raised synchronously by {@code submit}.
     *
     * @return true if this is a submission-time rejection
     */
    public boolean isSubmissionError() {
        return this == MAILBOX_FULL
                || this == WORKER_TERMINATED
                || this == NO_AVAILABLE_WORKER
                || this == CIRCUIT_OPEN
                || this == RATE_LIMITED;
    }
}
