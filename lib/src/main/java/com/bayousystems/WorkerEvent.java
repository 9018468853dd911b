package com.bayousystems;

/**
 * Lifecycle signals emitted by workers and supervisors. This is the only channel through
 * which failure information crosses component boundaries.
 */
public sealed interface WorkerEvent
        permits WorkerEvent.Started, WorkerEvent.Completed, WorkerEvent.Errored, WorkerEvent.Exited {

    /**
     * Id of the worker or supervisor that emitted the event.
     */
    String sourceId();

    record Started(String sourceId) implements WorkerEvent {
    }

    record Completed(String sourceId, String taskId) implements WorkerEvent {
    }

    record Errored(String sourceId, String taskId, Throwable cause) implements WorkerEvent {
    }

    record Exited(String sourceId, ExitReason reason, Throwable cause) implements WorkerEvent {
    }
}
