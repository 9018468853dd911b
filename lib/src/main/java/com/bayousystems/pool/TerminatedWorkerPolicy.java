package com.bayousystems.pool;

/**
 * What a pool does when the selected worker no longer accepts work.
 */
public enum TerminatedWorkerPolicy {
    /** Fail the submission with {@link com.bayousystems.NoAvailableWorkerException}. */
    FAIL,

    /** Try the following workers in index order; fail only if none accepts. */
    RETRY
}
