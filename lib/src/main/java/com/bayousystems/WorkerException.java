package com.bayousystems;

/**
 * Base class of all errors raised by the runtime.
 * Carries the id of the worker, pool or supervisor that raised it and the {@link ErrorKind}.
 */
public class WorkerException extends RuntimeException {

    /** The ID of the worker, pool or supervisor where the error occurred. */
    private final String sourceId;
    private final ErrorKind errorKind;

    /**
     * Creates a new WorkerException.
     *
     * @param message   the detail message
     * @param sourceId  the id of the component that raised the error
     * @param errorKind the error classification
     */
    public WorkerException(String message, String sourceId, ErrorKind errorKind) {
        super(message);
        this.sourceId = sourceId;
        this.errorKind = errorKind;
    }

    /**
     * Creates a new WorkerException with a cause.
     *
     * @param message   the detail message
     * @param sourceId  the id of the component that raised the error
     * @param errorKind the error classification
     * @param cause     the cause
     */
    public WorkerException(String message, String sourceId, ErrorKind errorKind, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
        this.errorKind = errorKind;
    }

    /**
     * Returns the id of the worker, pool or supervisor where the error occurred.
     *
     * @return the source id, or null if not specified
     */
    public String getSourceId() {
        return sourceId;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
