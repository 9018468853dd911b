package com.bayousystems.supervision;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay before a supervisor restarts a failed entity.
 */
@FunctionalInterface
public interface BackoffStrategy {

    /**
     * @param restartsInWindow restarts already made within the current restart window
     * @return the delay before the next restart, never negative
     */
    Duration delay(int restartsInWindow);

    static BackoffStrategy none() {
        return restartsInWindow -> Duration.ZERO;
    }

    static BackoffStrategy fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        return restartsInWindow -> delay;
    }

    /**
     * {@code min(cap, base * 2^n)}.
     */
    static BackoffStrategy exponential(Duration base, Duration cap) {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(cap, "cap cannot be null");
        if (base.isNegative() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Expected 0 <= base <= cap, got base=" + base + " cap=" + cap);
        }
        return restartsInWindow -> {
            if (restartsInWindow >= 62) {
                return cap;
            }
            try {
                Duration delay = base.multipliedBy(1L << Math.max(0, restartsInWindow));
                return delay.compareTo(cap) > 0 ? cap : delay;
            } catch (ArithmeticException e) {
                return cap;
            }
        };
    }
}
