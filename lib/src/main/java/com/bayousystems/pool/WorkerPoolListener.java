package com.bayousystems.pool;

import com.bayousystems.Worker;

/**
 * Observes pool membership. Supervisors use it to follow workers added and removed by resizing.
 */
public interface WorkerPoolListener {

    void workerAdded(Worker<?, ?> worker);

    void workerRemoved(Worker<?, ?> worker);
}
