package com.bayousystems.pool;

import com.bayousystems.NoAvailableWorkerException;
import com.bayousystems.ReplyTarget;
import com.bayousystems.Task;
import com.bayousystems.TaskHandle;
import com.bayousystems.TaskHandler;
import com.bayousystems.TaskResult;
import com.bayousystems.Worker;
import com.bayousystems.WorkerException;
import com.bayousystems.WorkerMetrics;
import com.bayousystems.WorkerTerminatedException;
import com.bayousystems.backpressure.AdmissionControl;
import com.bayousystems.backpressure.CircuitBreaker;
import com.bayousystems.backpressure.RateLimiter;
import com.bayousystems.config.ThreadPoolFactory;
import com.bayousystems.config.WorkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A fixed-size, resizable group of identical workers behind a single submission point.
 * <p>
 * Each submission passes the pool's rate limiter, then its circuit breaker, and is forwarded to
 * one worker picked by the {@link SelectionPolicy}. Worker selection happens under the pool lock;
 * forwarding happens outside it. A submission is never silently dropped: it is either accepted by
 * exactly one worker or rejected with an exception.
 * <p>
 * Workers are named {@code <pool>-worker-<n>}. The pool exposes their ids and metrics, never the
 * workers themselves.
 *
 * @param <P> the task payload type
 * @param <R> the result type
 */
public class WorkerPool<P, R> {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final String name;
    private final Supplier<? extends TaskHandler<P, R>> handlerFactory;
    private final WorkerConfig workerConfig;
    private final ThreadPoolFactory threadPoolFactory;
    private final SelectionPolicy selectionPolicy;
    private final TerminatedWorkerPolicy terminatedWorkerPolicy;
    private final DrainPolicy drainPolicy;
    private final AdmissionControl admissionControl;
    private final ReplyTarget<R> resultTarget;
    private final Duration shutdownTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Worker<P, R>> workers = new ArrayList<>();
    private final List<WorkerPoolListener> poolListeners = new CopyOnWriteArrayList<>();
    private int nextIndex = 0;
    private int workerSequence = 0;
    private volatile boolean shutdown = false;

    private final AtomicLong submittedCount = new AtomicLong();
    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();

    private WorkerPool(Builder<P, R> builder) {
        this.name = builder.name;
        this.handlerFactory = builder.handlerFactory;
        this.workerConfig = builder.workerConfig != null ? builder.workerConfig : new WorkerConfig();
        this.threadPoolFactory = builder.threadPoolFactory != null ? builder.threadPoolFactory : new ThreadPoolFactory();
        this.selectionPolicy = builder.selectionPolicy;
        this.terminatedWorkerPolicy = builder.terminatedWorkerPolicy;
        this.drainPolicy = builder.drainPolicy;
        this.admissionControl = AdmissionControl.of(builder.rateLimiter, builder.circuitBreaker);
        this.resultTarget = builder.resultTarget;
        this.shutdownTimeout = builder.shutdownTimeout != null
                ? builder.shutdownTimeout : workerConfig.getShutdownTimeout();

        lock.lock();
        try {
            for (int i = 0; i < builder.size; i++) {
                workers.add(newWorker());
            }
        } finally {
            lock.unlock();
        }
        logger.info("Worker pool {} started with {} workers ({})", name, builder.size, selectionPolicy);
    }

    /**
     * Creates a builder for a pool.
     *
     * @param name           pool name, used as prefix of the worker ids
     * @param handlerFactory produces one handler per worker incarnation
     */
    public static <P, R> Builder<P, R> builder(String name, Supplier<? extends TaskHandler<P, R>> handlerFactory) {
        return new Builder<>(name, handlerFactory);
    }

    public TaskHandle<R> submit(Task<P> task) {
        return submit(task, null);
    }

    /**
     * Submits a task to one of the pool's workers.
     *
     * @param task        the task
     * @param replyTarget receives the result in addition to the returned handle, may be null
     * @return a handle whose {@code workerId()} names the receiving worker
     * @throws WorkerTerminatedException   if the pool is shut down
     * @throws NoAvailableWorkerException  if no worker accepted the task
     * @throws com.bayousystems.RateLimitedException if the pool's rate limiter rejects it
     * @throws com.bayousystems.CircuitOpenException if the pool's breaker rejects it
     * @throws com.bayousystems.MailboxFullException if the selected worker's mailbox is full
     */
    public TaskHandle<R> submit(Task<P> task, ReplyTarget<R> replyTarget) {
        Objects.requireNonNull(task, "task cannot be null");
        if (shutdown) {
            rejectedCount.incrementAndGet();
            throw new WorkerTerminatedException(name, "Pool " + name + " is shut down");
        }
        CircuitBreaker.Permit permit;
        try {
            permit = admissionControl.admit(name);
        } catch (WorkerException e) {
            rejectedCount.incrementAndGet();
            throw e;
        }

        ReplyTarget<R> target = recordingTarget(permit, replyTarget);
        List<Worker<P, R>> candidates = selectCandidates();
        for (Worker<P, R> worker : candidates) {
            try {
                TaskHandle<R> handle = worker.submit(task, target);
                submittedCount.incrementAndGet();
                handle.future().whenComplete((result, error) -> {
                    if (error instanceof WorkerTerminatedException) {
                        admissionControl.recordAbandoned(permit);
                    }
                });
                return handle;
            } catch (WorkerTerminatedException e) {
                if (terminatedWorkerPolicy == TerminatedWorkerPolicy.FAIL) {
                    reject(permit);
                    throw new NoAvailableWorkerException(name,
                            "Selected worker " + worker.getId() + " is terminated", e);
                }
                logger.debug("Pool {} skipping terminated worker {}", name, worker.getId());
            } catch (RuntimeException e) {
                reject(permit);
                throw e;
            }
        }
        reject(permit);
        throw new NoAvailableWorkerException(name, "No worker of pool " + name + " accepted task " + task.id());
    }

    /**
     * Grows or shrinks the pool. New workers are started (and announced to pool listeners such as
     * a supervisor); removed workers are taken from the highest index and drained or stopped
     * according to the drain policy.
     *
     * @param newSize the new number of workers, at least 1
     */
    public void resize(int newSize) {
        if (newSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1: " + newSize);
        }
        List<Worker<P, R>> added = new ArrayList<>();
        List<Worker<P, R>> removed = new ArrayList<>();
        lock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("Pool " + name + " is shut down");
            }
            while (workers.size() < newSize) {
                Worker<P, R> worker = newWorker();
                workers.add(worker);
                added.add(worker);
            }
            while (workers.size() > newSize) {
                removed.add(workers.remove(workers.size() - 1));
            }
            nextIndex = nextIndex % workers.size();
        } finally {
            lock.unlock();
        }

        for (Worker<P, R> worker : added) {
            poolListeners.forEach(listener -> listener.workerAdded(worker));
        }
        for (Worker<P, R> worker : removed) {
            poolListeners.forEach(listener -> listener.workerRemoved(worker));
            if (drainPolicy == DrainPolicy.DRAIN) {
                worker.shutdownGraceful();
            } else {
                worker.stop();
            }
        }
        logger.info("Pool {} resized to {} workers (+{} -{}, {})", name, newSize, added.size(), removed.size(),
                drainPolicy);
    }

    /**
     * Gracefully shuts down every worker and waits, up to the shutdown timeout, until all of
     * them have terminated. Later submissions fail with {@link WorkerTerminatedException}.
     *
     * @return true if every worker terminated in time
     */
    public boolean shutdown() {
        shutdown = true;
        List<Worker<P, R>> snapshot = snapshot();
        logger.info("Shutting down pool {} ({} workers)", name, snapshot.size());
        CompletableFuture<?>[] futures = snapshot.stream()
                .map(Worker::shutdownGraceful)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Pool {} did not terminate within {}ms", name, shutdownTimeout.toMillis());
        } catch (ExecutionException e) {
            logger.warn("Pool {} had a worker fail during shutdown", name, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while shutting down pool {}", name);
        }
        return snapshot.stream().allMatch(Worker::isTerminated);
    }

    /**
     * Stops every worker immediately.
     */
    public void stop() {
        shutdown = true;
        snapshot().forEach(Worker::stop);
        logger.info("Pool {} stopped", name);
    }

    /**
     * Registers a membership listener. Current workers are reported as added right away.
     */
    public void addPoolListener(WorkerPoolListener listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        List<Worker<P, R>> current;
        lock.lock();
        try {
            poolListeners.add(listener);
            current = new ArrayList<>(workers);
        } finally {
            lock.unlock();
        }
        current.forEach(listener::workerAdded);
    }

    public void removePoolListener(WorkerPoolListener listener) {
        poolListeners.remove(listener);
    }

    public String getName() {
        return name;
    }

    public int getSize() {
        lock.lock();
        try {
            return workers.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public List<String> workerIds() {
        return snapshot().stream().map(Worker::getId).toList();
    }

    public PoolMetrics getMetrics() {
        List<WorkerMetrics> workerMetrics = snapshot().stream().map(Worker::getMetrics).toList();
        return new PoolMetrics(name, workerMetrics.size(), submittedCount.get(), completedCount.get(),
                failedCount.get(), rejectedCount.get(), workerMetrics);
    }

    private List<Worker<P, R>> selectCandidates() {
        lock.lock();
        try {
            int size = workers.size();
            int chosen;
            if (selectionPolicy == SelectionPolicy.LEAST_LOADED) {
                chosen = 0;
                int lowest = Integer.MAX_VALUE;
                for (int i = 0; i < size; i++) {
                    int load = workers.get(i).getLoad();
                    if (load < lowest) {
                        lowest = load;
                        chosen = i;
                    }
                }
            } else {
                chosen = nextIndex % size;
                nextIndex = (chosen + 1) % size;
            }
            List<Worker<P, R>> candidates = new ArrayList<>(size);
            candidates.add(workers.get(chosen));
            if (terminatedWorkerPolicy == TerminatedWorkerPolicy.RETRY) {
                for (int offset = 1; offset < size; offset++) {
                    candidates.add(workers.get((chosen + offset) % size));
                }
            }
            return candidates;
        } finally {
            lock.unlock();
        }
    }

    private ReplyTarget<R> recordingTarget(CircuitBreaker.Permit permit, ReplyTarget<R> callerTarget) {
        ReplyTarget<R> recording = result -> recordResult(permit, result);
        return recording.andThen(resultTarget).andThen(callerTarget);
    }

    private void recordResult(CircuitBreaker.Permit permit, TaskResult<R> result) {
        if (result.isSuccess()) {
            completedCount.incrementAndGet();
        } else {
            failedCount.incrementAndGet();
        }
        admissionControl.recordResult(permit, result);
    }

    private void reject(CircuitBreaker.Permit permit) {
        admissionControl.cancelAdmission(permit);
        rejectedCount.incrementAndGet();
    }

    private List<Worker<P, R>> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(workers);
        } finally {
            lock.unlock();
        }
    }

    private Worker<P, R> newWorker() {
        String workerId = name + "-worker-" + workerSequence++;
        return Worker.<P, R>builder(workerId, handlerFactory)
                .withConfig(workerConfig.copy())
                .withThreadPoolFactory(threadPoolFactory)
                .start();
    }

    /**
     * Builder for {@link WorkerPool}. {@link #build()} starts the workers.
     */
    public static final class Builder<P, R> {
        private final String name;
        private final Supplier<? extends TaskHandler<P, R>> handlerFactory;
        private int size = Runtime.getRuntime().availableProcessors();
        private SelectionPolicy selectionPolicy = SelectionPolicy.ROUND_ROBIN;
        private TerminatedWorkerPolicy terminatedWorkerPolicy = TerminatedWorkerPolicy.FAIL;
        private DrainPolicy drainPolicy = DrainPolicy.DRAIN;
        private WorkerConfig workerConfig;
        private ThreadPoolFactory threadPoolFactory;
        private RateLimiter rateLimiter;
        private CircuitBreaker circuitBreaker;
        private ReplyTarget<R> resultTarget;
        private Duration shutdownTimeout;

        private Builder(String name, Supplier<? extends TaskHandler<P, R>> handlerFactory) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
            this.handlerFactory = Objects.requireNonNull(handlerFactory, "handlerFactory cannot be null");
        }

        public Builder<P, R> withSize(int size) {
            if (size < 1) {
                throw new IllegalArgumentException("Pool size must be at least 1: " + size);
            }
            this.size = size;
            return this;
        }

        public Builder<P, R> withSelectionPolicy(SelectionPolicy selectionPolicy) {
            this.selectionPolicy = Objects.requireNonNull(selectionPolicy);
            return this;
        }

        public Builder<P, R> withTerminatedWorkerPolicy(TerminatedWorkerPolicy terminatedWorkerPolicy) {
            this.terminatedWorkerPolicy = Objects.requireNonNull(terminatedWorkerPolicy);
            return this;
        }

        public Builder<P, R> withDrainPolicy(DrainPolicy drainPolicy) {
            this.drainPolicy = Objects.requireNonNull(drainPolicy);
            return this;
        }

        public Builder<P, R> withWorkerConfig(WorkerConfig workerConfig) {
            this.workerConfig = workerConfig;
            return this;
        }

        public Builder<P, R> withThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
            this.threadPoolFactory = threadPoolFactory;
            return this;
        }

        public Builder<P, R> withRateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder<P, R> withCircuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        /**
         * Receives the result of every task executed by the pool.
         */
        public Builder<P, R> withResultTarget(ReplyTarget<R> resultTarget) {
            this.resultTarget = resultTarget;
            return this;
        }

        /**
         * Overrides how long {@link WorkerPool#shutdown()} waits. Defaults to the worker config's
         * shutdown timeout.
         */
        public Builder<P, R> withShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout);
            return this;
        }

        public WorkerPool<P, R> build() {
            return new WorkerPool<>(this);
        }
    }
}
