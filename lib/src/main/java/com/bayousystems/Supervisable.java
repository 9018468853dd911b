package com.bayousystems;

/**
 * Anything a supervisor can observe and restart: workers, and supervisors themselves
 * so that supervisors can be nested.
 */
public interface Supervisable {

    String getId();

    void addEventListener(WorkerEventListener listener);

    void removeEventListener(WorkerEventListener listener);

    /**
     * Brings the entity back into service with fresh internal state.
     */
    void restart();

    /**
     * Requested, immediate termination. Never triggers a restart.
     */
    void stop();

    boolean isTerminated();
}
