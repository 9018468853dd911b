package com.bayousystems.supervision;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded restart: at most {@code maxRestarts} restarts of one entity within any {@code window};
 * one more failure marks the entity permanently failed.
 *
 * @param maxRestarts restarts allowed per window, zero means never restart
 * @param window      length of the sliding restart window
 * @param backoff     delay before each restart
 */
public record RestartPolicy(int maxRestarts, Duration window, BackoffStrategy backoff) {

    public static final int DEFAULT_MAX_RESTARTS = 3;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    public RestartPolicy {
        Objects.requireNonNull(window, "window cannot be null");
        Objects.requireNonNull(backoff, "backoff cannot be null");
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative: " + maxRestarts);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public static RestartPolicy defaults() {
        return new RestartPolicy(DEFAULT_MAX_RESTARTS, DEFAULT_WINDOW,
                BackoffStrategy.exponential(Duration.ofMillis(100), Duration.ofSeconds(10)));
    }

    public RestartPolicy withBackoff(BackoffStrategy newBackoff) {
        return new RestartPolicy(maxRestarts, window, newBackoff);
    }
}
