package com.bayousystems;

/**
 * Why a worker or supervisor stopped processing.
 */
public enum ExitReason {
    /** Explicit {@code stop()}. */
    STOPPED,

    /** Graceful shutdown completed. */
    SHUTDOWN,

    /** A {@link FatalWorkerFault} or VM error terminated the worker. */
    FATAL_FAULT,

    /** A supervisor gave up on one of its entities. */
    RESTART_BUDGET_EXCEEDED,

    /** A supervisor escalated a task error to its own observers. */
    ESCALATED;

    /**
     * Requested exits are never restarted by a supervisor.
     *
     * @return true for STOPPED and SHUTDOWN
     */
    public boolean isRequested() {
        return this == STOPPED || this == SHUTDOWN;
    }
}
