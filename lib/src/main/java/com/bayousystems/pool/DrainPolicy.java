package com.bayousystems.pool;

/**
 * What happens to workers removed by {@link WorkerPool#resize(int)}.
 */
public enum DrainPolicy {
    /** Removed workers finish their queued tasks, then terminate. */
    DRAIN,

    /** Removed workers are stopped; their queued tasks are abandoned. */
    STOP
}
