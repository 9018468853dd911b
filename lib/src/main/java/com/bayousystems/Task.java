package com.bayousystems;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable unit of work submitted to a worker or pool.
 * <p>
 * The payload is opaque to the runtime. Higher {@code priority} values are more urgent;
 * priority only affects ordering when the receiving worker uses a priority mailbox.
 *
 * @param id       unique identifier, used in results and logs
 * @param payload  input data handed to the worker's {@link TaskHandler}
 * @param priority scheduling priority, higher is more urgent
 * @param <P>      the payload type
 */
public record Task<P>(String id, P payload, int priority) {

    public static final int DEFAULT_PRIORITY = 0;

    public Task {
        Objects.requireNonNull(id, "Task id cannot be null");
    }

    /**
     * Creates a task with a generated id and the default priority.
     */
    public static <P> Task<P> of(P payload) {
        return new Task<>(UUID.randomUUID().toString(), payload, DEFAULT_PRIORITY);
    }

    /**
     * Creates a task with a generated id.
     */
    public static <P> Task<P> of(P payload, int priority) {
        return new Task<>(UUID.randomUUID().toString(), payload, priority);
    }

    /**
     * Creates a task with an explicit id and the default priority.
     */
    public static <P> Task<P> withId(String id, P payload) {
        return new Task<>(id, payload, DEFAULT_PRIORITY);
    }

    /**
     * Returns a copy of this task with another priority.
     */
    public Task<P> withPriority(int newPriority) {
        return new Task<>(id, payload, newPriority);
    }
}
