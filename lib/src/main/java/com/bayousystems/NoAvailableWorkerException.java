package com.bayousystems;

/**
 * Thrown by a pool when the selected worker is terminated and no other worker may be used.
 */
public class NoAvailableWorkerException extends WorkerException {

    public NoAvailableWorkerException(String poolName, String message) {
        super(message, poolName, ErrorKind.NO_AVAILABLE_WORKER);
    }

    public NoAvailableWorkerException(String poolName, String message, Throwable cause) {
        super(message, poolName, ErrorKind.NO_AVAILABLE_WORKER, cause);
    }
}
