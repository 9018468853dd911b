package com.bayousystems.backpressure;

import java.time.Duration;
import java.util.Objects;

/**
 * Circuit breaker settings.
 *
 * @param failureThreshold       consecutive failures within the observation window that open the breaker
 * @param observationWindow      how far back failures count towards the threshold
 * @param openTimeout            time after the last failure before a probe is allowed
 * @param requiredProbeSuccesses consecutive probe successes needed to close again
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration observationWindow,
        Duration openTimeout,
        int requiredProbeSuccesses) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_OBSERVATION_WINDOW = Duration.ofSeconds(60);
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_REQUIRED_PROBE_SUCCESSES = 1;

    public CircuitBreakerConfig {
        Objects.requireNonNull(observationWindow, "observationWindow cannot be null");
        Objects.requireNonNull(openTimeout, "openTimeout cannot be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1: " + failureThreshold);
        }
        if (observationWindow.isNegative() || observationWindow.isZero()) {
            throw new IllegalArgumentException("observationWindow must be positive: " + observationWindow);
        }
        if (openTimeout.isNegative()) {
            throw new IllegalArgumentException("openTimeout must not be negative: " + openTimeout);
        }
        if (requiredProbeSuccesses < 1) {
            throw new IllegalArgumentException("requiredProbeSuccesses must be at least 1: " + requiredProbeSuccesses);
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_OBSERVATION_WINDOW,
                DEFAULT_OPEN_TIMEOUT, DEFAULT_REQUIRED_PROBE_SUCCESSES);
    }
}
