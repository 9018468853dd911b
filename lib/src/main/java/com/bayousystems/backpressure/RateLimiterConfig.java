package com.bayousystems.backpressure;

import java.time.Duration;
import java.util.Objects;

/**
 * Rate limiter settings.
 *
 * @param limit  maximum admissions in any window
 * @param window length of the sliding window
 */
public record RateLimiterConfig(int limit, Duration window) {

    public RateLimiterConfig {
        Objects.requireNonNull(window, "window cannot be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public static RateLimiterConfig perSecond(int limit) {
        return new RateLimiterConfig(limit, Duration.ofSeconds(1));
    }
}
