package com.bayousystems.config;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the threads used by the runtime.
 * Every worker incarnation runs on one dedicated platform thread created here; supervisors
 * additionally use a scheduled executor for restart backoff. Centralizing creation keeps
 * thread naming and daemon settings consistent and easy to tune.
 */
public class ThreadPoolFactory {
    // Default values
    private static final int DEFAULT_SCHEDULER_THREADS = 1;
    private static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(1);

    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    private Duration startupTimeout = DEFAULT_STARTUP_TIMEOUT;
    private Duration joinTimeout = DEFAULT_JOIN_TIMEOUT;
    private boolean useNamedThreads = true;
    private boolean daemon = true;
    private String threadNamePrefix = "bayou";

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates a thread factory for one worker or supervisor. Each call to
     * {@code newThread} produces a fresh thread, one per incarnation.
     *
     * @param ownerId The id of the worker or supervisor the threads belong to
     * @return A thread factory producing named platform threads
     */
    public ThreadFactory createThreadFactory(String ownerId) {
        return createNamedThreadFactory(threadNamePrefix + "-" + ownerId);
    }

    /**
     * Creates a scheduled executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new scheduled executor service
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        if (useNamedThreads) {
            return Executors.newScheduledThreadPool(schedulerThreads,
                    createNamedThreadFactory(threadNamePrefix + "-" + poolName + "-scheduler"));
        } else {
            return Executors.newScheduledThreadPool(schedulerThreads, createNamedThreadFactory(null));
        }
    }

    /**
     * Creates a thread factory for better thread identification in logs and profilers.
     *
     * @param prefix The prefix for thread names, or null for JVM default names
     * @return A thread factory
     */
    private ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = (useNamedThreads && prefix != null)
                        ? new Thread(r, prefix + "-" + threadNumber.getAndIncrement())
                        : new Thread(r);
                thread.setDaemon(daemon);
                return thread;
            }
        };
    }

    // Getters and setters

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be at least 1");
        }
        this.schedulerThreads = schedulerThreads;
        return this;
    }

    /**
     * How long {@code start()} waits for a new worker thread to report that it is running.
     */
    public Duration getStartupTimeout() {
        return startupTimeout;
    }

    public ThreadPoolFactory setStartupTimeout(Duration startupTimeout) {
        this.startupTimeout = startupTimeout;
        return this;
    }

    /**
     * How long {@code stop()} waits for an interrupted worker thread to exit.
     */
    public Duration getJoinTimeout() {
        return joinTimeout;
    }

    public ThreadPoolFactory setJoinTimeout(Duration joinTimeout) {
        this.joinTimeout = joinTimeout;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ThreadPoolFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public ThreadPoolFactory setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }
}
