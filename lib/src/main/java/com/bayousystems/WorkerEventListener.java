package com.bayousystems;

/**
 * Receives lifecycle events. Called on the emitting thread, so implementations should only
 * record or forward the event.
 */
@FunctionalInterface
public interface WorkerEventListener {

    void onEvent(WorkerEvent event);
}
