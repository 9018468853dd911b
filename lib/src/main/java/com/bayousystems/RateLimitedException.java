package com.bayousystems;

import java.time.Duration;

/**
 * Thrown when admission throttling rejects a submission.
 */
public class RateLimitedException extends WorkerException {

    private final int limit;
    private final Duration window;

    public RateLimitedException(String sourceId, int limit, Duration window) {
        super("Rate limit of " + limit + " per " + window + " exceeded for " + sourceId,
                sourceId, ErrorKind.RATE_LIMITED);
        this.limit = limit;
        this.window = window;
    }

    public int getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }
}
