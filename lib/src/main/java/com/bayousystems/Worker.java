package com.bayousystems;

import com.bayousystems.backpressure.AdmissionControl;
import com.bayousystems.backpressure.CircuitBreaker;
import com.bayousystems.backpressure.RateLimiter;
import com.bayousystems.config.OverflowPolicy;
import com.bayousystems.config.ThreadPoolFactory;
import com.bayousystems.config.WorkerConfig;
import com.bayousystems.mailbox.Mailbox;
import com.bayousystems.mailbox.config.DefaultMailboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * An isolated, sequential task executor that owns exactly one mailbox.
 * <p>
 * Tasks reach the worker only through {@link #submit(Task)}; a dedicated thread dequeues
 * them one at a time (highest priority first, FIFO among equals) and runs them through the
 * worker's private {@link TaskHandler}. Each result goes to the task's handle and, when given,
 * to a {@link ReplyTarget}. At most one task is in execution at any time.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>{@link #start()} launches the receive loop</li>
 *   <li>{@link #pause()}/{@link #resume(PauseToken)} halt and continue dequeueing</li>
 *   <li>{@link #shutdownGraceful()} finishes the queue, then terminates</li>
 *   <li>{@link #stop()} terminates at once, abandoning the in-flight and queued tasks</li>
 *   <li>{@link #restart()} starts a new incarnation with a fresh handler, keeping queued tasks</li>
 * </ul>
 *
 * @param <P> the task payload type
 * @param <R> the result type
 */
public class Worker<P, R> implements Supervisable {
    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private static final long POLL_TIMEOUT_MS = 10;
    private static final long BLOCK_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final String id;
    private final Supplier<? extends TaskHandler<P, R>> handlerFactory;
    private final WorkerConfig config;
    private final ThreadPoolFactory threadPoolFactory;
    private final AdmissionControl admissionControl;
    private final Mailbox<Envelope<P, R>> mailbox;
    private final List<WorkerEventListener> listeners = new CopyOnWriteArrayList<>();

    // accepting/terminated flips happen under the write lock, enqueues under the read lock
    private final ReentrantReadWriteLock acceptLock = new ReentrantReadWriteLock();
    private final Object lifecycleLock = new Object();
    // fair, so pause() is not starved by the receive loop re-acquiring between polls
    private final ReentrantLock pauseLock = new ReentrantLock(true);
    private final Condition resumed = pauseLock.newCondition();

    private volatile boolean accepting = true;
    private volatile boolean terminated = false;
    private volatile boolean stopped = false;
    private volatile PauseToken pauseToken;
    private volatile Incarnation current;
    private volatile CompletableFuture<Void> terminationSignal = new CompletableFuture<>();
    private volatile CompletableFuture<Void> shutdownFuture;

    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicLong abandonedCount = new AtomicLong();
    private final AtomicInteger restartCount = new AtomicInteger();
    private final AtomicInteger outstanding = new AtomicInteger();

    private Worker(Builder<P, R> builder) {
        this.id = builder.id;
        this.handlerFactory = builder.handlerFactory;
        this.config = builder.config != null ? builder.config : new WorkerConfig();
        this.threadPoolFactory = builder.threadPoolFactory != null ? builder.threadPoolFactory : new ThreadPoolFactory();
        this.admissionControl = AdmissionControl.of(builder.rateLimiter, builder.circuitBreaker);
        this.mailbox = new DefaultMailboxProvider<Envelope<P, R>>()
                .createMailbox(config.toMailboxConfig(), envelope -> envelope.task.priority());
        this.listeners.addAll(builder.listeners);
    }

    /**
     * Creates a builder for a worker.
     *
     * @param id             unique worker id
     * @param handlerFactory produces the handler for each incarnation of the worker
     */
    public static <P, R> Builder<P, R> builder(String id, Supplier<? extends TaskHandler<P, R>> handlerFactory) {
        return new Builder<>(id, handlerFactory);
    }

    /**
     * Launches the receive loop and returns once it is running.
     * Tasks submitted before {@code start()} are queued and processed afterwards.
     *
     * @throws IllegalStateException if the worker has terminated; use {@link #restart()} instead
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (terminated) {
                throw new IllegalStateException("Worker " + id + " has terminated, restart it instead");
            }
            if (current != null && current.running) {
                logger.debug("Worker {} already running", id);
                return;
            }
            launch();
        }
    }

    public TaskHandle<R> submit(Task<P> task) {
        return submit(task, null);
    }

    /**
     * Submits a task. Admission checks run first (rate limiter, then circuit breaker),
     * then the task is enqueued according to the overflow policy.
     *
     * @param task        the task
     * @param replyTarget receives the result in addition to the returned handle, may be null
     * @return a handle to the eventual result
     * @throws WorkerTerminatedException if the worker is terminated or shutting down
     * @throws MailboxFullException      if the mailbox is full and the overflow policy gives up
     * @throws RateLimitedException      if the rate limiter rejects the submission
     * @throws CircuitOpenException      if the circuit breaker rejects the submission
     */
    public TaskHandle<R> submit(Task<P> task, ReplyTarget<R> replyTarget) {
        Objects.requireNonNull(task, "task cannot be null");
        ensureAccepting();
        CircuitBreaker.Permit permit = admissionControl.admit(id);
        Envelope<P, R> envelope = new Envelope<>(task, replyTarget, permit);
        outstanding.incrementAndGet();
        try {
            enqueue(envelope);
        } catch (RuntimeException e) {
            outstanding.decrementAndGet();
            admissionControl.cancelAdmission(permit);
            throw e;
        }
        logger.trace("Worker {} accepted task {}", id, task.id());
        return new PendingTaskHandle<>(task.id(), id, envelope.future);
    }

    /**
     * Halts dequeueing before the next task. The task in execution, if any, finishes.
     *
     * @return the single-use token that resumes the worker
     * @throws IllegalStateException if already paused, terminated or shutting down
     */
    public PauseToken pause() {
        pauseLock.lock();
        try {
            if (terminated || !accepting) {
                throw new IllegalStateException("Worker " + id + " is not running");
            }
            if (pauseToken != null) {
                throw new IllegalStateException("Worker " + id + " is already paused");
            }
            pauseToken = PauseToken.issue(id);
            logger.debug("Worker {} paused", id);
            return pauseToken;
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * Resumes dequeueing. The token is invalidated.
     *
     * @throws IllegalStateException      if the worker is not paused
     * @throws InvalidPauseTokenException if the token is not the outstanding one
     */
    public void resume(PauseToken token) {
        pauseLock.lock();
        try {
            if (pauseToken == null) {
                throw new IllegalStateException("Worker " + id + " is not paused");
            }
            if (!pauseToken.equals(token)) {
                throw new InvalidPauseTokenException("Token " + token + " does not match the pause of worker " + id);
            }
            pauseToken = null;
            resumed.signalAll();
            logger.debug("Worker {} resumed", id);
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * Immediate termination. The in-flight task is abandoned (its thread is interrupted and its
     * outcome discarded) and queued tasks are drained without processing. Abandoned handles fail
     * with {@link WorkerTerminatedException}. Emits {@code Exited(STOPPED)}.
     */
    @Override
    public void stop() {
        Incarnation incarnation;
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            closeAdmission(true);
            releasePause();
            incarnation = current;
            if (incarnation != null) {
                incarnation.running = false;
                incarnation.abandoned = true;
                Envelope<P, R> inFlight = incarnation.inFlight;
                if (inFlight != null) {
                    abandon(inFlight);
                }
                joinIncarnation(incarnation);
            }
            int drained = abandonQueued();
            logger.info("Worker {} stopped, {} queued tasks abandoned", id, drained);
        }
        exit(incarnation, ExitReason.STOPPED, null);
    }

    /**
     * Stops accepting submissions at once, finishes queued and in-flight tasks, then terminates
     * and emits {@code Exited(SHUTDOWN)}. A paused worker is resumed so its queue can drain; a
     * worker that was never started is started.
     *
     * @return completes when the worker has terminated
     */
    public CompletableFuture<Void> shutdownGraceful() {
        synchronized (lifecycleLock) {
            if (shutdownFuture != null) {
                return shutdownFuture;
            }
            shutdownFuture = new CompletableFuture<>();
            if (terminated) {
                int drained = abandonQueued();
                logger.debug("Worker {} already terminated, {} queued tasks abandoned", id, drained);
                shutdownFuture.complete(null);
                return shutdownFuture;
            }
            closeAdmission(false);
            releasePause();
            if (current == null || !current.running) {
                launch();
            }
            logger.info("Worker {} shutting down gracefully with {} queued tasks", id, mailbox.size());
            current.draining = true;
            return shutdownFuture;
        }
    }

    /**
     * Waits until the worker is terminated.
     *
     * @return true if terminated, false if the timeout elapsed first
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        try {
            terminationSignal.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    /**
     * Starts a new incarnation with a fresh handler. Queued tasks are kept in their order. A task
     * in execution finishes on the old incarnation and delivers its result; it is abandoned only
     * if it outlasts the configured {@link WorkerConfig#getShutdownTimeout() shutdown timeout}.
     * A stopped or shut down worker accepts work again.
     */
    @Override
    public void restart() {
        synchronized (lifecycleLock) {
            Incarnation old = current;
            if (old != null && old.running) {
                old.retiring = true;
                old.running = false;
                retire(old);
            }
            int restarts = restartCount.incrementAndGet();
            acceptLock.writeLock().lock();
            try {
                terminated = false;
                stopped = false;
                accepting = true;
            } finally {
                acceptLock.writeLock().unlock();
            }
            shutdownFuture = null;
            terminationSignal = new CompletableFuture<>();
            logger.info("Restarting worker {} (restart #{}) with {} queued tasks", id, restarts, mailbox.size());
            launch();
        }
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
        return terminated;
    }

    public boolean isAcceptingWork() {
        return accepting && !terminated;
    }

    public WorkerState getState() {
        if (terminated) {
            return WorkerState.TERMINATED;
        }
        if (pauseToken != null) {
            return WorkerState.PAUSED;
        }
        Incarnation incarnation = current;
        if (incarnation != null && incarnation.inFlight != null) {
            return WorkerState.BUSY;
        }
        return WorkerState.IDLE;
    }

    public int getQueueDepth() {
        return mailbox.size();
    }

    /**
     * Queued tasks plus the task in execution.
     */
    public int getLoad() {
        return outstanding.get();
    }

    public int getRestartCount() {
        return restartCount.get();
    }

    public WorkerMetrics getMetrics() {
        return new WorkerMetrics(id, getState(), mailbox.size(), completedCount.get(), failedCount.get(),
                abandonedCount.get(), restartCount.get());
    }

    public WorkerConfig getConfig() {
        return config;
    }

    // ----- submission -----

    private void ensureAccepting() {
        if (!accepting || terminated) {
            throw new WorkerTerminatedException(id);
        }
    }

    private void enqueue(Envelope<P, R> envelope) {
        if (config.getOverflowPolicy() == OverflowPolicy.FAIL || !config.isBounded()) {
            acceptLock.readLock().lock();
            try {
                ensureAccepting();
                if (!mailbox.offer(envelope)) {
                    throw new MailboxFullException(id, mailbox.capacity());
                }
            } finally {
                acceptLock.readLock().unlock();
            }
            return;
        }

        // BLOCK: wait in slices so that shutdown and stop are not held up by a blocked sender
        long deadline = System.nanoTime() + config.getBlockTimeout().toNanos();
        while (true) {
            acceptLock.readLock().lock();
            try {
                ensureAccepting();
                long remaining = deadline - System.nanoTime();
                if (mailbox.offer(envelope, Math.min(Math.max(remaining, 0), BLOCK_SLICE_NANOS), TimeUnit.NANOSECONDS)) {
                    return;
                }
                if (remaining <= 0) {
                    throw new MailboxFullException(id, mailbox.capacity(),
                            "no space within " + config.getBlockTimeout().toMillis() + "ms");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkerException("Interrupted while waiting for mailbox space of worker " + id,
                        id, ErrorKind.MAILBOX_FULL, e);
            } finally {
                acceptLock.readLock().unlock();
            }
        }
    }

    private void closeAdmission(boolean terminate) {
        acceptLock.writeLock().lock();
        try {
            accepting = false;
            if (terminate) {
                terminated = true;
            }
        } finally {
            acceptLock.writeLock().unlock();
        }
    }

    // ----- lifecycle internals -----

    private void launch() {
        Incarnation incarnation = new Incarnation(handlerFactory.get());
        current = incarnation;
        Thread thread = threadPoolFactory.createThreadFactory(id).newThread(() -> processLoop(incarnation));
        incarnation.thread = thread;
        logger.info("Starting worker {}", id);
        thread.start();
        try {
            if (!incarnation.ready.await(threadPoolFactory.getStartupTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Worker {} did not start within timeout", id);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for worker {} to start", id);
            Thread.currentThread().interrupt();
        }
    }

    private void joinIncarnation(Incarnation incarnation) {
        Thread thread = incarnation.thread;
        if (thread != null && Thread.currentThread() != thread) {
            thread.interrupt();
            try {
                thread.join(threadPoolFactory.getJoinTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                logger.warn("Worker {} thread did not exit within {}ms, its outcome will be discarded",
                        id, threadPoolFactory.getJoinTimeout().toMillis());
            }
        }
    }

    /**
     * Waits for a replaced incarnation to finish its task in execution. After the shutdown
     * timeout the task is abandoned and the thread interrupted.
     */
    private void retire(Incarnation incarnation) {
        Thread thread = incarnation.thread;
        if (thread == null || Thread.currentThread() == thread) {
            return;
        }
        long timeoutMillis = config.getShutdownTimeout().toMillis();
        try {
            // join(0) would wait forever
            thread.join(Math.max(timeoutMillis, 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            logger.warn("Worker {} task still running {}ms after restart, abandoning it", id, timeoutMillis);
            incarnation.abandoned = true;
            Envelope<P, R> inFlight = incarnation.inFlight;
            if (inFlight != null) {
                abandon(inFlight);
            }
            joinIncarnation(incarnation);
        }
    }

    private void releasePause() {
        pauseLock.lock();
        try {
            if (pauseToken != null) {
                pauseToken = null;
                resumed.signalAll();
            }
        } finally {
            pauseLock.unlock();
        }
    }

    private int abandonQueued() {
        List<Envelope<P, R>> drained = new ArrayList<>();
        mailbox.drainTo(drained, Integer.MAX_VALUE);
        for (Envelope<P, R> envelope : drained) {
            abandon(envelope);
        }
        return drained.size();
    }

    private void abandon(Envelope<P, R> envelope) {
        if (!envelope.settle()) {
            return;
        }
        outstanding.decrementAndGet();
        abandonedCount.incrementAndGet();
        admissionControl.recordAbandoned(envelope.permit);
        envelope.future.completeExceptionally(
                new WorkerTerminatedException(id, "Task " + envelope.task.id() + " abandoned by worker " + id));
    }

    /**
     * Marks the worker terminated and emits its exit event, once per incarnation.
     */
    private void exit(Incarnation incarnation, ExitReason reason, Throwable cause) {
        if (incarnation != null && incarnation.retiring) {
            // replaced by restart, the new incarnation keeps the worker alive
            return;
        }
        if (incarnation != null && !incarnation.exited.compareAndSet(false, true)) {
            return;
        }
        if (incarnation != null && incarnation != current) {
            return;
        }
        closeAdmission(true);
        emit(new WorkerEvent.Exited(id, reason, cause));
        CompletableFuture<Void> pendingShutdown = shutdownFuture;
        terminationSignal.complete(null);
        if (pendingShutdown != null) {
            if (reason == ExitReason.FATAL_FAULT) {
                pendingShutdown.completeExceptionally(cause);
            } else {
                pendingShutdown.complete(null);
            }
        }
    }

    private void emit(WorkerEvent event) {
        for (WorkerEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Worker {} event listener failed on {}", id, event, e);
            }
        }
    }

    // ----- receive loop -----

    private void processLoop(Incarnation incarnation) {
        incarnation.ready.countDown();
        emit(new WorkerEvent.Started(id));

        while (incarnation.running) {
            try {
                Envelope<P, R> envelope = nextEnvelope(incarnation);
                if (envelope == null) {
                    if (!incarnation.running) {
                        break;
                    }
                    if (incarnation.draining && mailbox.isEmpty()) {
                        incarnation.running = false;
                        logger.info("Worker {} drained its mailbox", id);
                        exit(incarnation, ExitReason.SHUTDOWN, null);
                    }
                    continue;
                }
                if (incarnation.abandoned) {
                    // stop raced with the dequeue
                    abandon(envelope);
                    break;
                }
                // a restart racing with the dequeue lets this incarnation run the task first
                execute(incarnation, envelope);
            } catch (InterruptedException e) {
                if (incarnation.running) {
                    logger.debug("Worker {} interrupted while running, continuing", id);
                    continue;
                }
                logger.debug("Worker {} mailbox interrupted", id);
                break;
            }
        }
        logger.debug("Worker {} receive loop exited", id);
    }

    /**
     * Waits out a pause, then dequeues. Both happen under the pause lock so that no task is
     * dequeued after {@link #pause()} has returned.
     */
    private Envelope<P, R> nextEnvelope(Incarnation incarnation) throws InterruptedException {
        pauseLock.lock();
        try {
            while (pauseToken != null && incarnation.running) {
                resumed.await(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            }
            if (!incarnation.running) {
                return null;
            }
            return mailbox.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } finally {
            pauseLock.unlock();
        }
    }

    private void execute(Incarnation incarnation, Envelope<P, R> envelope) {
        Task<P> task = envelope.task;
        incarnation.inFlight = envelope;
        TaskResult<R> result;
        Throwable fatal = null;
        try {
            R value = incarnation.handler.handle(task);
            result = TaskResult.success(task.id(), value);
        } catch (FatalWorkerFault e) {
            fatal = e;
            result = TaskResult.failure(task.id(), ErrorKind.WORKER_FATAL_FAULT, e);
        } catch (VirtualMachineError e) {
            fatal = e;
            result = TaskResult.failure(task.id(), ErrorKind.WORKER_FATAL_FAULT, e);
        } catch (Throwable e) {
            result = TaskResult.failure(task.id(), ErrorKind.TASK_EXECUTION_FAILURE, e);
        } finally {
            incarnation.inFlight = null;
        }

        if (incarnation.abandoned) {
            // abandoned by stop, or by a restart that timed out, while executing
            Thread.interrupted();
            abandon(envelope);
            return;
        }
        deliver(envelope, result);

        if (fatal != null) {
            logger.error("Worker {} terminated by fatal fault in task {}, {} tasks kept queued",
                    id, task.id(), mailbox.size(), fatal);
            incarnation.running = false;
            exit(incarnation, ExitReason.FATAL_FAULT, fatal);
        } else if (result instanceof TaskResult.Failure<R> failure) {
            logger.warn("Worker {} task {} failed: {}", id, task.id(), failure.message());
            emit(new WorkerEvent.Errored(id, task.id(), failure.cause()));
        } else {
            emit(new WorkerEvent.Completed(id, task.id()));
        }
    }

    private void deliver(Envelope<P, R> envelope, TaskResult<R> result) {
        if (!envelope.settle()) {
            return;
        }
        outstanding.decrementAndGet();
        if (result.isSuccess()) {
            completedCount.incrementAndGet();
        } else {
            failedCount.incrementAndGet();
        }
        admissionControl.recordResult(envelope.permit, result);
        envelope.future.complete(result);
        if (envelope.replyTarget != null) {
            try {
                envelope.replyTarget.deliver(result);
            } catch (RuntimeException e) {
                logger.warn("Worker {} could not deliver result of task {} to its reply target",
                        id, result.taskId(), e);
            }
        }
    }

    /**
     * One run of the receive loop with its own handler and thread.
     */
    private final class Incarnation {
        final TaskHandler<P, R> handler;
        final CountDownLatch ready = new CountDownLatch(1);
        final AtomicBoolean exited = new AtomicBoolean(false);
        volatile Thread thread;
        volatile boolean running = true;
        volatile boolean draining = false;
        // replaced by restart, finishes its task in execution without exiting the worker
        volatile boolean retiring = false;
        // outcome of the task in execution is discarded
        volatile boolean abandoned = false;
        volatile Envelope<P, R> inFlight;

        Incarnation(TaskHandler<P, R> handler) {
            this.handler = Objects.requireNonNull(handler, "handler factory returned null");
        }
    }

    /**
     * A queued task with its reply routing. Settled exactly once, by delivery or abandonment.
     */
    private static final class Envelope<P, R> {
        final Task<P> task;
        final ReplyTarget<R> replyTarget;
        // null when the worker has no circuit breaker
        final CircuitBreaker.Permit permit;
        final CompletableFuture<TaskResult<R>> future = new CompletableFuture<>();
        private final AtomicBoolean settled = new AtomicBoolean(false);

        Envelope(Task<P> task, ReplyTarget<R> replyTarget, CircuitBreaker.Permit permit) {
            this.task = task;
            this.replyTarget = replyTarget;
            this.permit = permit;
        }

        boolean settle() {
            return settled.compareAndSet(false, true);
        }
    }

    /**
     * Builder for {@link Worker}.
     */
    public static final class Builder<P, R> {
        private final String id;
        private final Supplier<? extends TaskHandler<P, R>> handlerFactory;
        private final List<WorkerEventListener> listeners = new ArrayList<>();
        private WorkerConfig config;
        private ThreadPoolFactory threadPoolFactory;
        private RateLimiter rateLimiter;
        private CircuitBreaker circuitBreaker;

        private Builder(String id, Supplier<? extends TaskHandler<P, R>> handlerFactory) {
            this.id = Objects.requireNonNull(id, "id cannot be null");
            this.handlerFactory = Objects.requireNonNull(handlerFactory, "handlerFactory cannot be null");
        }

        public Builder<P, R> withConfig(WorkerConfig config) {
            this.config = config;
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

        public Builder<P, R> withListener(WorkerEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
            return this;
        }

        public Worker<P, R> build() {
            return new Worker<>(this);
        }

        /**
         * Builds and starts the worker.
         */
        public Worker<P, R> start() {
            Worker<P, R> worker = build();
            worker.start();
            return worker;
        }
    }
}
