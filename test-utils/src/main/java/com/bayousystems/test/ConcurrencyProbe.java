package com.bayousystems.test;

import com.bayousystems.TaskHandler;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps task handlers and records how many of them run at the same time.
 * One probe can wrap the handlers of several workers to observe a whole pool.
 *
 * <pre>{@code
 * ConcurrencyProbe probe = new ConcurrencyProbe();
 * Worker<String, String> worker = Worker.<String, String>builder("w", () -> probe.wrap(handler)).start();
 * ...
 * assertEquals(1, probe.maxObserved());
 * }</pre>
 */
public class ConcurrencyProbe {

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxObserved = new AtomicInteger();
    private final AtomicLong invocations = new AtomicLong();

    public <P, R> TaskHandler<P, R> wrap(TaskHandler<P, R> delegate) {
        return task -> {
            int running = active.incrementAndGet();
            maxObserved.accumulateAndGet(running, Math::max);
            invocations.incrementAndGet();
            try {
                return delegate.handle(task);
            } finally {
                active.decrementAndGet();
            }
        };
    }

    /**
     * Handlers executing right now.
     */
    public int active() {
        return active.get();
    }

    public int maxObserved() {
        return maxObserved.get();
    }

    public long invocations() {
        return invocations.get();
    }

    public void reset() {
        maxObserved.set(active.get());
        invocations.set(0);
    }
}
