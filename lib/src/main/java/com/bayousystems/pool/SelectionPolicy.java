package com.bayousystems.pool;

/**
 * How a pool picks the worker that receives a submission.
 */
public enum SelectionPolicy {
    /**
     * Cycles deterministically over worker indices 0, 1, ..., n-1, 0, ...
     */
    ROUND_ROBIN,

    /**
     * Picks the worker with the smallest load (queued plus in-flight); ties go to the lowest index.
     */
    LEAST_LOADED
}
