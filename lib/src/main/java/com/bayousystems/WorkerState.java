package com.bayousystems;

/**
 * Observable state of a worker.
 */
public enum WorkerState {
    /** Running and waiting for work. */
    IDLE,

    /** Executing a task. */
    BUSY,

    /** Dequeue halted by {@link Worker#pause()}; queued tasks are kept. */
    PAUSED,

    /** Not processing and not accepting work. */
    TERMINATED
}
