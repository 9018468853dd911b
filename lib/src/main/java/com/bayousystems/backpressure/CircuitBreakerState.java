package com.bayousystems.backpressure;

/**
 * States of a {@link CircuitBreaker}. The breaker starts CLOSED and cycles through these forever.
 */
public enum CircuitBreakerState {
    /** Calls flow through; failures are counted. */
    CLOSED,

    /** Calls are rejected until the open timeout has elapsed. */
    OPEN,

    /** A single trial call at a time is admitted to test recovery. */
    HALF_OPEN
}
