package com.bayousystems;

/**
 * Thrown by task code to signal that the worker's isolated context is no longer usable.
 * <p>
 * Unlike any other exception thrown by a {@link TaskHandler}, a fatal fault terminates
 * the worker. The current task is reported as a {@link ErrorKind#WORKER_FATAL_FAULT}
 * failure and a supervising {@code Supervisor} decides whether to restart the worker.
 */
public class FatalWorkerFault extends WorkerException {

    public FatalWorkerFault(String message) {
        super(message, null, ErrorKind.WORKER_FATAL_FAULT);
    }

    public FatalWorkerFault(String message, Throwable cause) {
        super(message, null, ErrorKind.WORKER_FATAL_FAULT, cause);
    }
}
