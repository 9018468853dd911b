package com.bayousystems.supervision;

import com.bayousystems.ErrorKind;
import com.bayousystems.ExitReason;
import com.bayousystems.RestartBudgetExceededException;
import com.bayousystems.Supervisable;
import com.bayousystems.Worker;
import com.bayousystems.WorkerEvent;
import com.bayousystems.WorkerEventListener;
import com.bayousystems.WorkerException;
import com.bayousystems.config.ThreadPoolFactory;
import com.bayousystems.mailbox.LinkedMailbox;
import com.bayousystems.mailbox.Mailbox;
import com.bayousystems.pool.WorkerPool;
import com.bayousystems.pool.WorkerPoolListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Watches workers (and other supervisors) and restarts them when they fail, within a bounded
 * restart budget.
 * <p>
 * The supervisor is itself message driven: listeners registered on supervised entities only
 * enqueue the events into the supervisor's inbox, and a single supervisor thread handles them.
 * All restart bookkeeping is owned by that thread. Restart delays are timed on a scheduled
 * executor which, when due, enqueues a restart request back into the inbox.
 * <p>
 * Requested exits (stop, graceful shutdown) are never restarted. When an entity fails more than
 * {@code maxRestarts} times within the restart window it is stopped, marked permanently failed, and
 * a {@link RestartBudgetExceededException} is raised to the supervisor's own observers and to its
 * fatal handler. Because a supervisor is {@link Supervisable}, a parent supervisor can watch it and
 * restart it, which clears its counters and restarts everything it supervises.
 */
public class Supervisor implements Supervisable {
    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    private static final long POLL_TIMEOUT_MS = 10;

    private final String id;
    private final RestartPolicy restartPolicy;
    private final SupervisionStrategy taskErrorStrategy;
    private final Clock clock;
    private final ThreadPoolFactory threadPoolFactory;
    private final Consumer<WorkerException> fatalHandler;

    private final Mailbox<Signal> inbox = new LinkedMailbox<>();
    private final Map<String, Managed> managed = new ConcurrentHashMap<>();
    private final Map<WorkerPool<?, ?>, WorkerPoolListener> poolBindings = new IdentityHashMap<>();
    private final List<WorkerEventListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();
    private volatile boolean running = false;
    private volatile boolean stopped = false;
    private volatile Thread thread;
    private volatile ScheduledExecutorService scheduler;

    private Supervisor(Builder builder) {
        this.id = builder.id;
        this.restartPolicy = builder.restartPolicy;
        this.taskErrorStrategy = builder.taskErrorStrategy;
        this.clock = builder.clock;
        this.threadPoolFactory = builder.threadPoolFactory != null ? builder.threadPoolFactory : new ThreadPoolFactory();
        this.fatalHandler = builder.fatalHandler != null ? builder.fatalHandler : this::logFatal;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Starts the supervisor thread. Events that arrived earlier are handled now.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                logger.debug("Supervisor {} already running", id);
                return;
            }
            stopped = false;
            running = true;
            scheduler = threadPoolFactory.createScheduledExecutorService(id);
            CountDownLatch ready = new CountDownLatch(1);
            thread = threadPoolFactory.createThreadFactory(id).newThread(() -> {
                ready.countDown();
                processLoop();
            });
            thread.start();
            try {
                if (!ready.await(threadPoolFactory.getStartupTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Supervisor {} did not start within timeout", id);
                }
            } catch (InterruptedException e) {
                logger.warn("Interrupted while waiting for supervisor {} to start", id);
                Thread.currentThread().interrupt();
            }
            logger.info("Supervisor {} started ({} restarts per {}, task errors: {})",
                    id, restartPolicy.maxRestarts(), restartPolicy.window(), taskErrorStrategy);
        }
        emit(new WorkerEvent.Started(id));
    }

    /**
     * Starts watching an entity.
     *
     * @throws IllegalArgumentException if an entity with the same id is already supervised
     */
    public void supervise(Supervisable entity) {
        Objects.requireNonNull(entity, "entity cannot be null");
        if (entity == this) {
            throw new IllegalArgumentException("Supervisor " + id + " cannot supervise itself");
        }
        Managed entry = new Managed(entity);
        if (managed.putIfAbsent(entity.getId(), entry) != null) {
            throw new IllegalArgumentException("Entity " + entity.getId() + " is already supervised by " + id);
        }
        entity.addEventListener(entry.listener);
        logger.debug("Supervisor {} now supervising {}", id, entity.getId());
    }

    /**
     * Watches every current and future worker of a pool. Workers removed by resizing are
     * no longer watched.
     */
    public void supervise(WorkerPool<?, ?> pool) {
        Objects.requireNonNull(pool, "pool cannot be null");
        WorkerPoolListener binding = new WorkerPoolListener() {
            @Override
            public void workerAdded(Worker<?, ?> worker) {
                supervise(worker);
            }

            @Override
            public void workerRemoved(Worker<?, ?> worker) {
                unsupervise(worker);
            }
        };
        synchronized (poolBindings) {
            if (poolBindings.putIfAbsent(pool, binding) != null) {
                throw new IllegalArgumentException("Pool " + pool.getName() + " is already supervised by " + id);
            }
        }
        pool.addPoolListener(binding);
        logger.debug("Supervisor {} now supervising pool {}", id, pool.getName());
    }

    /**
     * Stops watching an entity. A pending restart of it is cancelled.
     */
    public void unsupervise(Supervisable entity) {
        Managed entry = managed.get(entity.getId());
        if (entry == null || entry.entity != entity) {
            return;
        }
        managed.remove(entity.getId(), entry);
        entity.removeEventListener(entry.listener);
        entry.cancelPendingRestart();
        logger.debug("Supervisor {} stopped supervising {}", id, entity.getId());
    }

    public void unsupervise(WorkerPool<?, ?> pool) {
        WorkerPoolListener binding;
        synchronized (poolBindings) {
            binding = poolBindings.remove(pool);
        }
        if (binding != null) {
            pool.removePoolListener(binding);
            for (String workerId : pool.workerIds()) {
                Managed entry = managed.get(workerId);
                if (entry != null) {
                    unsupervise(entry.entity);
                }
            }
        }
    }

    /**
     * Number of restarts performed for an entity since it was supervised or the supervisor was
     * last restarted.
     */
    public int restartCount(String entityId) {
        Managed entry = managed.get(entityId);
        return entry != null ? entry.restartCount : 0;
    }

    public boolean isPermanentlyFailed(String entityId) {
        Managed entry = managed.get(entityId);
        return entry != null && entry.permanentlyFailed;
    }

    public List<String> supervisedIds() {
        return new ArrayList<>(managed.keySet());
    }

    /**
     * Clears all restart counters and permanently-failed marks and restarts every supervised
     * entity. Used by a parent supervisor after this supervisor escalated.
     */
    @Override
    public void restart() {
        logger.info("Supervisor {} restarting", id);
        inbox.offer(new RestartAll());
        if (!running) {
            start();
        }
    }

    /**
     * Stops the supervisor and every entity it supervises. Emits {@code Exited(STOPPED)}.
     */
    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            running = false;
            Thread current = thread;
            if (current != null && current != Thread.currentThread()) {
                current.interrupt();
                try {
                    current.join(threadPoolFactory.getJoinTimeout().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            thread = null;
            if (scheduler != null) {
                scheduler.shutdownNow();
            }
            inbox.clear();
        }
        for (Managed entry : managed.values()) {
            entry.cancelPendingRestart();
            entry.entity.stop();
        }
        logger.info("Supervisor {} stopped", id);
        emit(new WorkerEvent.Exited(id, ExitReason.STOPPED, null));
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void addEventListener(WorkerEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    @Override
    public void removeEventListener(WorkerEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public boolean isTerminated() {
        return stopped;
    }

    public RestartPolicy getRestartPolicy() {
        return restartPolicy;
    }

    // ----- supervisor thread -----

    private void processLoop() {
        while (running) {
            try {
                Signal signal = inbox.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (signal == null) {
                    continue;
                }
                handle(signal);
            } catch (InterruptedException e) {
                logger.debug("Supervisor {} inbox interrupted", id);
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.error("Supervisor {} failed handling a signal", id, e);
            }
        }
    }

    private void handle(Signal signal) {
        if (signal instanceof EntityEvent entityEvent) {
            Managed entry = entityEvent.entry;
            if (managed.get(entry.entity.getId()) != entry) {
                return;
            }
            onEntityEvent(entry, entityEvent.event);
        } else if (signal instanceof RestartDue restartDue) {
            Managed entry = restartDue.entry;
            if (managed.get(entry.entity.getId()) != entry
                    || entry.generation != restartDue.generation
                    || entry.permanentlyFailed) {
                return;
            }
            entry.pendingRestart = null;
            performRestart(entry);
        } else if (signal instanceof RestartAll) {
            for (Managed entry : managed.values()) {
                entry.cancelPendingRestart();
                entry.restartTimes.clear();
                entry.restartCount = 0;
                entry.permanentlyFailed = false;
                try {
                    entry.entity.restart();
                } catch (RuntimeException e) {
                    logger.error("Supervisor {} could not restart {}", id, entry.entity.getId(), e);
                }
            }
        }
    }

    private void onEntityEvent(Managed entry, WorkerEvent event) {
        String entityId = entry.entity.getId();
        if (event instanceof WorkerEvent.Exited exited) {
            if (exited.reason().isRequested()) {
                logger.debug("Supervisor {}: {} exited ({}), not restarting", id, entityId, exited.reason());
                entry.cancelPendingRestart();
                return;
            }
            if (entry.permanentlyFailed || entry.pendingRestart != null) {
                return;
            }
            logger.warn("Supervisor {}: {} exited abnormally ({})", id, entityId, exited.reason());
            onFailure(entry, exited.cause());
        } else if (event instanceof WorkerEvent.Errored errored) {
            switch (taskErrorStrategy) {
                case RESUME -> logger.debug("Supervisor {}: {} resuming after failed task {}",
                        id, entityId, errored.taskId());
                case RESTART -> {
                    if (!entry.permanentlyFailed && entry.pendingRestart == null) {
                        onFailure(entry, errored.cause());
                    }
                }
                case STOP -> {
                    logger.info("Supervisor {} stopping {} after failed task {}", id, entityId, errored.taskId());
                    entry.cancelPendingRestart();
                    entry.entity.stop();
                }
                case ESCALATE -> {
                    logger.info("Supervisor {} escalating failed task {} of {}", id, errored.taskId(), entityId);
                    raise(new WorkerException("Task " + errored.taskId() + " of " + entityId + " failed",
                            entityId, ErrorKind.TASK_EXECUTION_FAILURE, errored.cause()), ExitReason.ESCALATED);
                }
            }
        }
    }

    private void onFailure(Managed entry, Throwable cause) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(restartPolicy.window());
        while (!entry.restartTimes.isEmpty() && !entry.restartTimes.peekFirst().isAfter(cutoff)) {
            entry.restartTimes.pollFirst();
        }
        int restartsInWindow = entry.restartTimes.size();
        if (restartsInWindow >= restartPolicy.maxRestarts()) {
            giveUp(entry, cause);
            return;
        }
        entry.restartTimes.addLast(now);
        Duration delay = restartPolicy.backoff().delay(restartsInWindow);
        if (delay.isZero() || delay.isNegative()) {
            performRestart(entry);
            return;
        }
        long generation = ++entry.generation;
        logger.info("Supervisor {} restarting {} in {}ms", id, entry.entity.getId(), delay.toMillis());
        entry.pendingRestart = scheduler.schedule(
                () -> inbox.offer(new RestartDue(entry, generation)), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void performRestart(Managed entry) {
        entry.restartCount++;
        logger.info("Supervisor {} restarting {} (restart #{})", id, entry.entity.getId(), entry.restartCount);
        try {
            entry.entity.restart();
        } catch (RuntimeException e) {
            logger.error("Supervisor {} failed to restart {}", id, entry.entity.getId(), e);
            onFailure(entry, e);
        }
    }

    private void giveUp(Managed entry, Throwable cause) {
        String entityId = entry.entity.getId();
        entry.permanentlyFailed = true;
        entry.cancelPendingRestart();
        logger.error("Supervisor {} giving up on {} after {} restarts within {}",
                id, entityId, restartPolicy.maxRestarts(), restartPolicy.window());
        entry.entity.stop();
        raise(new RestartBudgetExceededException(id, entityId, restartPolicy.maxRestarts(),
                restartPolicy.window(), cause), ExitReason.RESTART_BUDGET_EXCEEDED);
    }

    private void raise(WorkerException error, ExitReason reason) {
        try {
            fatalHandler.accept(error);
        } catch (RuntimeException e) {
            logger.warn("Supervisor {} fatal handler failed", id, e);
        }
        emit(new WorkerEvent.Exited(id, reason, error));
    }

    private void logFatal(WorkerException error) {
        logger.error("Supervisor {} escalated an unrecoverable failure", id, error);
    }

    private void emit(WorkerEvent event) {
        for (WorkerEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Supervisor {} event listener failed on {}", id, event, e);
            }
        }
    }

    // ----- inbox messages -----

    private sealed interface Signal permits EntityEvent, RestartDue, RestartAll {
    }

    private record EntityEvent(Managed entry, WorkerEvent event) implements Signal {
    }

    private record RestartDue(Managed entry, long generation) implements Signal {
    }

    private record RestartAll() implements Signal {
    }

    /**
     * Bookkeeping for one supervised entity. Mutated only on the supervisor thread.
     */
    private final class Managed {
        final Supervisable entity;
        final WorkerEventListener listener;
        final Deque<Instant> restartTimes = new ArrayDeque<>();
        volatile int restartCount;
        volatile boolean permanentlyFailed;
        ScheduledFuture<?> pendingRestart;
        long generation;

        Managed(Supervisable entity) {
            this.entity = entity;
            this.listener = event -> inbox.offer(new EntityEvent(this, event));
        }

        void cancelPendingRestart() {
            generation++;
            if (pendingRestart != null) {
                pendingRestart.cancel(false);
                pendingRestart = null;
            }
        }
    }

    /**
     * Builder for {@link Supervisor}.
     */
    public static final class Builder {
        private final String id;
        private RestartPolicy restartPolicy = RestartPolicy.defaults();
        private SupervisionStrategy taskErrorStrategy = SupervisionStrategy.RESUME;
        private Clock clock = Clock.systemUTC();
        private ThreadPoolFactory threadPoolFactory;
        private Consumer<WorkerException> fatalHandler;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id cannot be null");
        }

        public Builder withRestartPolicy(RestartPolicy restartPolicy) {
            this.restartPolicy = Objects.requireNonNull(restartPolicy);
            return this;
        }

        public Builder withTaskErrorStrategy(SupervisionStrategy taskErrorStrategy) {
            this.taskErrorStrategy = Objects.requireNonNull(taskErrorStrategy);
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder withThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
            this.threadPoolFactory = threadPoolFactory;
            return this;
        }

        /**
         * Called with every failure this supervisor escalates. Defaults to logging at ERROR.
         */
        public Builder onFatal(Consumer<WorkerException> fatalHandler) {
            this.fatalHandler = fatalHandler;
            return this;
        }

        public Supervisor build() {
            return new Supervisor(this);
        }

        public Supervisor start() {
            Supervisor supervisor = build();
            supervisor.start();
            return supervisor;
        }
    }
}
