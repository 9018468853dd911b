package com.bayousystems.backpressure;

import com.bayousystems.TaskResult;

/**
 * The admission checks applied to a submission before it is enqueued: the rate limiter first,
 * then the circuit breaker. Either may be absent. Also routes task outcomes back to the breaker.
 */
public final class AdmissionControl {

    private static final AdmissionControl NONE = new AdmissionControl(null, null);

    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;

    private AdmissionControl(RateLimiter rateLimiter, CircuitBreaker circuitBreaker) {
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
    }

    public static AdmissionControl none() {
        return NONE;
    }

    /**
     * @param rateLimiter    limiter, or null
     * @param circuitBreaker breaker, or null
     */
    public static AdmissionControl of(RateLimiter rateLimiter, CircuitBreaker circuitBreaker) {
        if (rateLimiter == null && circuitBreaker == null) {
            return NONE;
        }
        return new AdmissionControl(rateLimiter, circuitBreaker);
    }

    /**
     * Runs the admission checks for one submission.
     *
     * @return the breaker permit to report the task's outcome with, or null without a breaker
     * @throws com.bayousystems.RateLimitedException if the rate limiter rejects
     * @throws com.bayousystems.CircuitOpenException if the breaker rejects
     */
    public CircuitBreaker.Permit admit(String sourceId) {
        if (rateLimiter != null) {
            rateLimiter.acquirePermission(sourceId);
        }
        if (circuitBreaker != null) {
            return circuitBreaker.acquirePermission(sourceId);
        }
        return null;
    }

    /**
     * Called when an admitted submission could not be enqueued.
     * The rate limiter admission is not returned.
     */
    public void cancelAdmission(CircuitBreaker.Permit permit) {
        if (circuitBreaker != null && permit != null) {
            circuitBreaker.releasePermission(permit);
        }
    }

    public void recordResult(CircuitBreaker.Permit permit, TaskResult<?> result) {
        if (circuitBreaker == null || permit == null) {
            return;
        }
        if (result instanceof TaskResult.Failure<?> failure) {
            circuitBreaker.recordFailure(permit, failure.cause());
        } else {
            circuitBreaker.recordSuccess(permit);
        }
    }

    /**
     * Called when an admitted task was dropped without executing.
     */
    public void recordAbandoned(CircuitBreaker.Permit permit) {
        cancelAdmission(permit);
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public boolean isEmpty() {
        return rateLimiter == null && circuitBreaker == null;
    }
}
