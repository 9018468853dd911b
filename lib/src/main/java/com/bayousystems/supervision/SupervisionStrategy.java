package com.bayousystems.supervision;

/**
 * How a supervisor reacts when a supervised worker reports a failed task.
 * Fatal worker faults are always handled by the restart policy regardless of this setting.
 */
public enum SupervisionStrategy {
    /**
     * Ignore the failed task; the worker keeps running.
     */
    RESUME,

    /**
     * Restart the worker. Counts against the restart budget.
     */
    RESTART,

    /**
     * Stop the worker. It is not restarted.
     */
    STOP,

    /**
     * Report the failure to the supervisor's own observers.
     */
    ESCALATE
}
