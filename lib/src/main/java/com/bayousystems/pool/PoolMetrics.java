package com.bayousystems.pool;

import com.bayousystems.WorkerMetrics;

import java.util.List;

/**
 * Point-in-time snapshot of a pool's counters and of each of its workers.
 */
public record PoolMetrics(
        String poolName,
        int size,
        long submitted,
        long completed,
        long failed,
        long rejected,
        List<WorkerMetrics> workers) {

    public PoolMetrics {
        workers = List.copyOf(workers);
    }

    /**
     * Tasks accepted but not yet completed or failed. Abandoned tasks stay counted here.
     */
    public long pending() {
        return submitted - completed - failed;
    }
}
