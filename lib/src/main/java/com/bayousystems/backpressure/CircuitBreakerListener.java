package com.bayousystems.backpressure;

/**
 * Notified on every state transition of a circuit breaker, on the thread that caused it.
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    void onStateChange(String breakerName, CircuitBreakerState from, CircuitBreakerState to);
}
