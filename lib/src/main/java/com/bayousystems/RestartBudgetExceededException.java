package com.bayousystems;

import java.time.Duration;

/**
 * Raised by a supervisor when an entity fails more often than its restart policy allows.
 * The entity is marked permanently failed and this error is surfaced to the next
 * supervisor up, or to the application when there is none.
 */
public class RestartBudgetExceededException extends WorkerException {

    private final String supervisorId;
    private final int maxRestarts;
    private final Duration window;

    public RestartBudgetExceededException(String supervisorId, String entityId, int maxRestarts,
                                          Duration window, Throwable lastFailure) {
        super("Entity " + entityId + " exceeded " + maxRestarts + " restarts within " + window
                        + " under supervisor " + supervisorId,
                entityId, ErrorKind.RESTART_BUDGET_EXCEEDED, lastFailure);
        this.supervisorId = supervisorId;
        this.maxRestarts = maxRestarts;
        this.window = window;
    }

    public String getSupervisorId() {
        return supervisorId;
    }

    public int getMaxRestarts() {
        return maxRestarts;
    }

    public Duration getWindow() {
        return window;
    }
}
