package com.bayousystems;

/**
 * Thrown when a circuit breaker rejects an admission attempt.
 * Callers should retry later or fail fast.
 */
public class CircuitOpenException extends WorkerException {

    private final String breakerName;

    public CircuitOpenException(String sourceId, String breakerName) {
        super("Circuit breaker " + breakerName + " rejected work for " + sourceId,
                sourceId, ErrorKind.CIRCUIT_OPEN);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
