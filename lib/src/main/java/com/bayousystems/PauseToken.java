package com.bayousystems;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque, single-use capability returned by {@link Worker#pause()}.
 * Only the token of the outstanding pause can resume the worker, and only once.
 */
public final class PauseToken {

    private final String workerId;
    private final UUID value;

    private PauseToken(String workerId, UUID value) {
        this.workerId = workerId;
        this.value = value;
    }

    static PauseToken issue(String workerId) {
        return new PauseToken(workerId, UUID.randomUUID());
    }

    public String workerId() {
        return workerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PauseToken other)) {
            return false;
        }
        return workerId.equals(other.workerId) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerId, value);
    }

    @Override
    public String toString() {
        return "PauseToken[" + workerId + "]";
    }
}
