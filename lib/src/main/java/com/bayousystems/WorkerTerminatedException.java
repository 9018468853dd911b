package com.bayousystems;

/**
 * Thrown when work is submitted to a worker or pool that no longer accepts it, and used
 * to fail the handles of tasks that were abandoned by {@link Worker#stop()}.
 */
public class WorkerTerminatedException extends WorkerException {

    public WorkerTerminatedException(String workerId) {
        super("Worker " + workerId + " is not accepting work", workerId, ErrorKind.WORKER_TERMINATED);
    }

    public WorkerTerminatedException(String workerId, String message) {
        super(message, workerId, ErrorKind.WORKER_TERMINATED);
    }
}
