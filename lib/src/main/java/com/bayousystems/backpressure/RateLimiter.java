package com.bayousystems.backpressure;

import com.bayousystems.RateLimitedException;

import java.time.Duration;

/**
 * Admission limiter: at most {@link #limit()} admissions in any interval of length {@link #window()}.
 */
public interface RateLimiter {

    /**
     * Non-blocking check. Records the admission when it returns true.
     *
     * @return true if admitted
     */
    boolean allow();

    /**
     * Waits up to {@code timeout} for an admission.
     *
     * @return true if admitted, false if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean tryAcquire(Duration timeout) throws InterruptedException;

    /**
     * Like {@link #allow()} but throws when rejected.
     *
     * @param sourceId id of the caller, carried by the exception
     * @throws RateLimitedException if the limit is reached
     */
    default void acquirePermission(String sourceId) {
        if (!allow()) {
            throw new RateLimitedException(sourceId, limit(), window());
        }
    }

    int limit();

    Duration window();
}
