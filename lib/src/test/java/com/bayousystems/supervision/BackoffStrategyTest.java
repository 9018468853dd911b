package com.bayousystems.supervision;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffStrategyTest {

    @Test
    void testNoneIsAlwaysZero() {
        BackoffStrategy backoff = BackoffStrategy.none();
        assertEquals(Duration.ZERO, backoff.delay(0));
        assertEquals(Duration.ZERO, backoff.delay(10));
    }

    @Test
    void testFixedDelay() {
        BackoffStrategy backoff = BackoffStrategy.fixed(Duration.ofMillis(250));
        assertEquals(Duration.ofMillis(250), backoff.delay(0));
        assertEquals(Duration.ofMillis(250), backoff.delay(7));
        assertThrows(IllegalArgumentException.class, () -> BackoffStrategy.fixed(Duration.ofMillis(-1)));
    }

    @Test
    void testExponentialDoublesUpToCap() {
        BackoffStrategy backoff = BackoffStrategy.exponential(Duration.ofMillis(100), Duration.ofSeconds(1));
        assertEquals(Duration.ofMillis(100), backoff.delay(0));
        assertEquals(Duration.ofMillis(200), backoff.delay(1));
        assertEquals(Duration.ofMillis(400), backoff.delay(2));
        assertEquals(Duration.ofMillis(800), backoff.delay(3));
        assertEquals(Duration.ofSeconds(1), backoff.delay(4));
        assertEquals(Duration.ofSeconds(1), backoff.delay(40));
        assertEquals(Duration.ofSeconds(1), backoff.delay(Integer.MAX_VALUE));
    }

    @Test
    void testExponentialRejectsCapBelowBase() {
        assertThrows(IllegalArgumentException.class,
                () -> BackoffStrategy.exponential(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }

    @Test
    void testRestartPolicyValidation() {
        RestartPolicy defaults = RestartPolicy.defaults();
        assertEquals(RestartPolicy.DEFAULT_MAX_RESTARTS, defaults.maxRestarts());
        assertEquals(RestartPolicy.DEFAULT_WINDOW, defaults.window());
        assertEquals(Duration.ofMillis(100), defaults.backoff().delay(0));

        RestartPolicy immediate = defaults.withBackoff(BackoffStrategy.none());
        assertEquals(Duration.ZERO, immediate.backoff().delay(3));
        assertEquals(defaults.maxRestarts(), immediate.maxRestarts());

        assertThrows(IllegalArgumentException.class,
                () -> new RestartPolicy(-1, Duration.ofSeconds(1), BackoffStrategy.none()));
        assertThrows(IllegalArgumentException.class,
                () -> new RestartPolicy(1, Duration.ZERO, BackoffStrategy.none()));
        assertThrows(NullPointerException.class,
                () -> new RestartPolicy(1, Duration.ofSeconds(1), null));
    }
}
