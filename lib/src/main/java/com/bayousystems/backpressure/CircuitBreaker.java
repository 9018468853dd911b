package com.bayousystems.backpressure;

import com.bayousystems.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Three-state circuit breaker guarding a downstream worker or pool.
 * <p>
 * CLOSED opens once {@code failureThreshold} failures have been recorded within the observation
 * window with no success in between. OPEN turns into HALF_OPEN lazily, on the first query after
 * {@code openTimeout} has passed since the last failure. HALF_OPEN admits one trial call at a
 * time; {@code requiredProbeSuccesses} successful trial calls close the breaker and any trial
 * failure opens it again.
 * <p>
 * Calls admitted through {@link #tryAcquirePermit()} report their outcome with the returned
 * {@link Permit}. Every state change starts a new generation, and outcomes of permits from an
 * earlier generation are ignored, so a slow call admitted while CLOSED cannot decide the trial.
 * <p>
 * All state changes happen under the breaker's monitor, so it is safe to share between
 * submitting threads and worker threads reporting outcomes.
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private final Deque<Instant> recentFailures = new ArrayDeque<>();
    private Instant lastFailureTime;
    private long generation;
    private boolean trialInFlight;
    private int trialSuccesses;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Asks for permission to make one call.
     *
     * @return true if the call may proceed; in HALF_OPEN the caller holds the single trial slot
     */
    public boolean tryAcquire() {
        return tryAcquirePermit().isPresent();
    }

    /**
     * Asks for permission to make one call and returns it as a {@link Permit}. Outcomes reported
     * with the permit are ignored once the breaker has changed state since it was issued.
     *
     * @return the permit, or empty if the call is rejected
     */
    public synchronized Optional<Permit> tryAcquirePermit() {
        refreshState(clock.instant());
        switch (state) {
            case CLOSED:
                return Optional.of(new Permit(this, generation, false));
            case HALF_OPEN:
                if (trialInFlight) {
                    return Optional.empty();
                }
                trialInFlight = true;
                logger.debug("Circuit breaker {} admitted trial call", name);
                return Optional.of(new Permit(this, generation, true));
            case OPEN:
            default:
                return Optional.empty();
        }
    }

    /**
     * Like {@link #tryAcquirePermit()} but throws when the call is not permitted.
     *
     * @param sourceId id of the caller, carried by the exception
     * @throws CircuitOpenException if the breaker rejects the call
     */
    public Permit acquirePermission(String sourceId) {
        return tryAcquirePermit().orElseThrow(() -> new CircuitOpenException(sourceId, name));
    }

    /**
     * Gives back a permission whose call never produced an outcome, e.g. because enqueueing failed
     * or the task was abandoned. Only frees the trial slot, and only if the permit holds it.
     */
    public synchronized void releasePermission(Permit permit) {
        if (isCurrentTrial(permit)) {
            trialInFlight = false;
            logger.debug("Circuit breaker {} trial slot released without outcome", name);
        }
    }

    /**
     * Records a success that is not tied to a permit, e.g. one observed outside the breaker.
     */
    public synchronized void recordSuccess() {
        onSuccess();
    }

    /**
     * Records the success of a call admitted with {@code permit}.
     */
    public synchronized void recordSuccess(Permit permit) {
        if (isStale(permit)) {
            logger.debug("Circuit breaker {} ignoring success of a call admitted in an earlier state", name);
            return;
        }
        onSuccess();
    }

    /**
     * Records a failure that is not tied to a permit.
     */
    public synchronized void recordFailure(Throwable cause) {
        onFailure(cause);
    }

    /**
     * Records the failure of a call admitted with {@code permit}.
     */
    public synchronized void recordFailure(Permit permit, Throwable cause) {
        if (isStale(permit)) {
            logger.debug("Circuit breaker {} ignoring failure of a call admitted in an earlier state", name);
            return;
        }
        onFailure(cause);
    }

    /**
     * Runs a call through the breaker, recording its outcome.
     *
     * @throws CircuitOpenException if the breaker rejects the call
     * @throws Exception whatever the call throws, after it has been recorded as a failure
     */
    public <T> T execute(Callable<T> call) throws Exception {
        Permit permit = acquirePermission(name);
        try {
            T result = call.call();
            recordSuccess(permit);
            return result;
        } catch (Exception e) {
            recordFailure(permit, e);
            throw e;
        }
    }

    public synchronized CircuitBreakerState getState() {
        refreshState(clock.instant());
        return state;
    }

    /**
     * Forces the breaker back to CLOSED and forgets all recorded failures.
     */
    public synchronized void reset() {
        recentFailures.clear();
        lastFailureTime = null;
        if (state != CircuitBreakerState.CLOSED) {
            transitionTo(CircuitBreakerState.CLOSED);
        }
    }

    /**
     * A permission handed out by {@link #tryAcquirePermit()}. It remembers the breaker state it
     * was issued in and whether it holds the HALF_OPEN trial slot.
     */
    public static final class Permit {
        private final CircuitBreaker breaker;
        private final long generation;
        private final boolean trial;

        private Permit(CircuitBreaker breaker, long generation, boolean trial) {
            this.breaker = breaker;
            this.generation = generation;
            this.trial = trial;
        }

        public boolean isTrial() {
            return trial;
        }

        @Override
        public String toString() {
            return "Permit{breaker=" + breaker.name + ", generation=" + generation + ", trial=" + trial + "}";
        }
    }

    public void addListener(CircuitBreakerListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(CircuitBreakerListener listener) {
        listeners.remove(listener);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private void onSuccess() {
        switch (state) {
            case CLOSED:
                recentFailures.clear();
                break;
            case HALF_OPEN:
                trialInFlight = false;
                trialSuccesses++;
                if (trialSuccesses >= config.requiredProbeSuccesses()) {
                    transitionTo(CircuitBreakerState.CLOSED);
                }
                break;
            case OPEN:
            default:
                break;
        }
    }

    private void onFailure(Throwable cause) {
        Instant now = clock.instant();
        switch (state) {
            case CLOSED:
                lastFailureTime = now;
                recentFailures.addLast(now);
                pruneFailures(now);
                if (recentFailures.size() >= config.failureThreshold()) {
                    logger.warn("Circuit breaker {} opening after {} failures, last: {}",
                            name, recentFailures.size(), cause != null ? cause.getMessage() : "unknown");
                    transitionTo(CircuitBreakerState.OPEN);
                }
                break;
            case HALF_OPEN:
                lastFailureTime = now;
                trialInFlight = false;
                logger.warn("Circuit breaker {} trial call failed, reopening", name);
                transitionTo(CircuitBreakerState.OPEN);
                break;
            case OPEN:
            default:
                break;
        }
    }

    // a permit from another breaker, an earlier state, or a non-trial call while HALF_OPEN
    private boolean isStale(Permit permit) {
        Objects.requireNonNull(permit, "permit cannot be null");
        refreshState(clock.instant());
        if (permit.breaker != this || permit.generation != generation) {
            return true;
        }
        return state == CircuitBreakerState.HALF_OPEN && !permit.trial;
    }

    private boolean isCurrentTrial(Permit permit) {
        return permit != null && permit.breaker == this && permit.trial
                && permit.generation == generation && state == CircuitBreakerState.HALF_OPEN && trialInFlight;
    }

    private void refreshState(Instant now) {
        if (state == CircuitBreakerState.OPEN
                && Duration.between(lastFailureTime, now).compareTo(config.openTimeout()) > 0) {
            transitionTo(CircuitBreakerState.HALF_OPEN);
        }
    }

    private void pruneFailures(Instant now) {
        Instant cutoff = now.minus(config.observationWindow());
        while (!recentFailures.isEmpty() && !recentFailures.peekFirst().isAfter(cutoff)) {
            recentFailures.pollFirst();
        }
    }

    private void transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = next;
        generation++;
        trialInFlight = false;
        trialSuccesses = 0;
        if (next != CircuitBreakerState.OPEN) {
            recentFailures.clear();
        }
        logger.info("Circuit breaker {} transitioned {} -> {}", name, previous, next);
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onStateChange(name, previous, next);
            } catch (RuntimeException e) {
                logger.warn("Circuit breaker {} listener failed", name, e);
            }
        }
    }
}
