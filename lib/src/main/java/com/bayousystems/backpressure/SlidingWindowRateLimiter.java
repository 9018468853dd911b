package com.bayousystems.backpressure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window log limiter. Keeps the timestamp of every admission inside the window;
 * timestamps at or before {@code now - window} are pruned lazily on each call. There are no
 * fixed buckets, so no burst is possible at bucket boundaries.
 */
public class SlidingWindowRateLimiter implements RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private static final long MAX_WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final int limit;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> admissions = new ArrayDeque<>();

    public SlidingWindowRateLimiter(RateLimiterConfig config) {
        this(config, Clock.systemUTC());
    }

    public SlidingWindowRateLimiter(RateLimiterConfig config, Clock clock) {
        this(config.limit(), config.window(), clock);
    }

    public SlidingWindowRateLimiter(int limit, Duration window, Clock clock) {
        RateLimiterConfig validated = new RateLimiterConfig(limit, window);
        this.limit = validated.limit();
        this.window = validated.window();
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public synchronized boolean allow() {
        Instant now = clock.instant();
        prune(now);
        if (admissions.size() < limit) {
            admissions.addLast(now);
            return true;
        }
        logger.debug("Rate limit of {} per {} reached", limit, window);
        return false;
    }

    @Override
    public boolean tryAcquire(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long waitNanos;
            synchronized (this) {
                if (allow()) {
                    return true;
                }
                Instant oldest = admissions.peekFirst();
                waitNanos = oldest == null ? 0
                        : Duration.between(clock.instant(), oldest.plus(window)).toNanos();
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.sleep(Math.max(1, Math.min(Math.min(waitNanos, remaining), MAX_WAIT_SLICE_NANOS)));
        }
    }

    /**
     * Admissions currently counted in the window.
     */
    public synchronized int currentCount() {
        prune(clock.instant());
        return admissions.size();
    }

    @Override
    public int limit() {
        return limit;
    }

    @Override
    public Duration window() {
        return window;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!admissions.isEmpty() && !admissions.peekFirst().isAfter(cutoff)) {
            admissions.pollFirst();
        }
    }
}
