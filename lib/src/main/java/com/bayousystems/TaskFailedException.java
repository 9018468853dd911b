package com.bayousystems;

/**
 * Unchecked exception thrown when the value of a failed task is requested.
 */
public class TaskFailedException extends WorkerException {

    private final transient TaskResult.Failure<?> failure;

    public TaskFailedException(TaskResult.Failure<?> failure) {
        super("Task " + failure.taskId() + " failed (" + failure.errorKind() + "): " + failure.message(),
                failure.taskId(), failure.errorKind(), failure.cause());
        this.failure = failure;
    }

    public TaskResult.Failure<?> getFailure() {
        return failure;
    }
}
