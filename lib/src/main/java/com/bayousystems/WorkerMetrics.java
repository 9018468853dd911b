package com.bayousystems;

/**
 * Point-in-time snapshot of a worker's counters.
 */
public record WorkerMetrics(
        String workerId,
        WorkerState state,
        int queueDepth,
        long completed,
        long failed,
        long abandoned,
        int restarts) {

    /**
     * Queued tasks plus the task in execution, if any.
     */
    public int load() {
        return queueDepth + (state == WorkerState.BUSY ? 1 : 0);
    }
}
