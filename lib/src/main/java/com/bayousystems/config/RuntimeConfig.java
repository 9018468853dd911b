package com.bayousystems.config;

import com.bayousystems.backpressure.CircuitBreakerConfig;
import com.bayousystems.backpressure.RateLimiterConfig;
import com.bayousystems.mailbox.config.MailboxConfig;
import com.bayousystems.mailbox.config.MailboxOrdering;
import com.bayousystems.pool.DrainPolicy;
import com.bayousystems.pool.SelectionPolicy;
import com.bayousystems.pool.TerminatedWorkerPolicy;
import com.bayousystems.supervision.BackoffStrategy;
import com.bayousystems.supervision.RestartPolicy;
import com.bayousystems.supervision.SupervisionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Runtime settings read from {@code bayou.properties} on the classpath, overridden by JVM
 * system properties with the same {@code bayou.*} keys. Missing keys fall back to defaults.
 * <p>
 * Durations are given in milliseconds. A mailbox capacity of {@code 0} means unbounded and a
 * rate limit of {@code 0} disables rate limiting.
 */
public final class RuntimeConfig {
    private static final Logger logger = LoggerFactory.getLogger(RuntimeConfig.class);

    public static final String DEFAULT_RESOURCE = "bayou.properties";
    public static final String PREFIX = "bayou.";

    public static final String POOL_SIZE = "bayou.pool.size";
    public static final String POOL_SELECTION = "bayou.pool.selection";
    public static final String POOL_TERMINATED_WORKER_POLICY = "bayou.pool.terminated-worker-policy";
    public static final String POOL_DRAIN_POLICY = "bayou.pool.drain-policy";
    public static final String MAILBOX_CAPACITY = "bayou.mailbox.capacity";
    public static final String MAILBOX_ORDERING = "bayou.mailbox.ordering";
    public static final String MAILBOX_OVERFLOW = "bayou.mailbox.overflow";
    public static final String MAILBOX_BLOCK_TIMEOUT_MS = "bayou.mailbox.block-timeout-ms";
    public static final String SUPERVISOR_MAX_RESTARTS = "bayou.supervisor.max-restarts";
    public static final String SUPERVISOR_WINDOW_MS = "bayou.supervisor.window-ms";
    public static final String SUPERVISOR_BACKOFF = "bayou.supervisor.backoff";
    public static final String SUPERVISOR_BACKOFF_BASE_MS = "bayou.supervisor.backoff-base-ms";
    public static final String SUPERVISOR_BACKOFF_CAP_MS = "bayou.supervisor.backoff-cap-ms";
    public static final String SUPERVISOR_TASK_ERROR_STRATEGY = "bayou.supervisor.task-error-strategy";
    public static final String BREAKER_FAILURE_THRESHOLD = "bayou.breaker.failure-threshold";
    public static final String BREAKER_WINDOW_MS = "bayou.breaker.window-ms";
    public static final String BREAKER_OPEN_TIMEOUT_MS = "bayou.breaker.open-timeout-ms";
    public static final String BREAKER_PROBE_SUCCESSES = "bayou.breaker.probe-successes";
    public static final String RATELIMIT_LIMIT = "bayou.ratelimit.limit";
    public static final String RATELIMIT_WINDOW_MS = "bayou.ratelimit.window-ms";
    public static final String SHUTDOWN_TIMEOUT_MS = "bayou.shutdown-timeout-ms";

    private final Properties properties;

    private RuntimeConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads {@code bayou.properties} from the classpath with system property overrides.
     */
    public static RuntimeConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads the given classpath resource with system property overrides.
     * A missing resource is not an error; defaults apply.
     */
    public static RuntimeConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = RuntimeConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
                logger.info("Loaded {} properties from classpath:{}", properties.size(), resource);
            } else {
                logger.debug("No classpath:{} found, using defaults", resource);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read classpath:" + resource, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return new RuntimeConfig(properties);
    }

    /**
     * Uses the given properties as they are, without system property overrides.
     */
    public static RuntimeConfig from(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new RuntimeConfig(copy);
    }

    public int getPoolSize() {
        int size = getInt(POOL_SIZE, Runtime.getRuntime().availableProcessors());
        if (size < 1) {
            throw new IllegalArgumentException(POOL_SIZE + " must be at least 1: " + size);
        }
        return size;
    }

    public SelectionPolicy getSelectionPolicy() {
        return getEnum(POOL_SELECTION, SelectionPolicy.class, SelectionPolicy.ROUND_ROBIN);
    }

    public TerminatedWorkerPolicy getTerminatedWorkerPolicy() {
        return getEnum(POOL_TERMINATED_WORKER_POLICY, TerminatedWorkerPolicy.class, TerminatedWorkerPolicy.FAIL);
    }

    public DrainPolicy getDrainPolicy() {
        return getEnum(POOL_DRAIN_POLICY, DrainPolicy.class, DrainPolicy.DRAIN);
    }

    public Duration getShutdownTimeout() {
        return getMillis(SHUTDOWN_TIMEOUT_MS, WorkerConfig.DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public SupervisionStrategy getTaskErrorStrategy() {
        return getEnum(SUPERVISOR_TASK_ERROR_STRATEGY, SupervisionStrategy.class, SupervisionStrategy.RESUME);
    }

    public WorkerConfig workerConfig() {
        int capacity = getInt(MAILBOX_CAPACITY, 0);
        if (capacity < 0) {
            throw new IllegalArgumentException(MAILBOX_CAPACITY + " must not be negative: " + capacity);
        }
        return new WorkerConfig()
                .setMailboxCapacity(capacity == 0 ? MailboxConfig.UNBOUNDED : capacity)
                .setOrdering(getEnum(MAILBOX_ORDERING, MailboxOrdering.class, MailboxOrdering.PRIORITY))
                .setOverflowPolicy(getEnum(MAILBOX_OVERFLOW, OverflowPolicy.class, OverflowPolicy.BLOCK))
                .setBlockTimeout(getMillis(MAILBOX_BLOCK_TIMEOUT_MS, WorkerConfig.DEFAULT_BLOCK_TIMEOUT))
                .setShutdownTimeout(getShutdownTimeout());
    }

    public RestartPolicy restartPolicy() {
        RestartPolicy defaults = RestartPolicy.defaults();
        return new RestartPolicy(
                getInt(SUPERVISOR_MAX_RESTARTS, defaults.maxRestarts()),
                getMillis(SUPERVISOR_WINDOW_MS, defaults.window()),
                backoffStrategy());
    }

    public BackoffStrategy backoffStrategy() {
        String kind = properties.getProperty(SUPERVISOR_BACKOFF, "exponential").trim().toLowerCase(Locale.ROOT);
        Duration base = getMillis(SUPERVISOR_BACKOFF_BASE_MS, Duration.ofMillis(100));
        switch (kind) {
            case "none":
                return BackoffStrategy.none();
            case "fixed":
                return BackoffStrategy.fixed(base);
            case "exponential":
                return BackoffStrategy.exponential(base, getMillis(SUPERVISOR_BACKOFF_CAP_MS, Duration.ofSeconds(10)));
            default:
                throw new IllegalArgumentException("Unknown " + SUPERVISOR_BACKOFF + ": " + kind
                        + " (expected none, fixed or exponential)");
        }
    }

    public CircuitBreakerConfig circuitBreakerConfig() {
        return new CircuitBreakerConfig(
                getInt(BREAKER_FAILURE_THRESHOLD, CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD),
                getMillis(BREAKER_WINDOW_MS, CircuitBreakerConfig.DEFAULT_OBSERVATION_WINDOW),
                getMillis(BREAKER_OPEN_TIMEOUT_MS, CircuitBreakerConfig.DEFAULT_OPEN_TIMEOUT),
                getInt(BREAKER_PROBE_SUCCESSES, CircuitBreakerConfig.DEFAULT_REQUIRED_PROBE_SUCCESSES));
    }

    /**
     * @return the rate limiter settings, or empty when rate limiting is disabled
     */
    public Optional<RateLimiterConfig> rateLimiterConfig() {
        int limit = getInt(RATELIMIT_LIMIT, 0);
        if (limit <= 0) {
            return Optional.empty();
        }
        return Optional.of(new RateLimiterConfig(limit, getMillis(RATELIMIT_WINDOW_MS, Duration.ofSeconds(1))));
    }

    /**
     * Raw access for settings not covered by the typed accessors.
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(properties.getProperty(key)).map(String::trim);
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private Duration getMillis(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for " + key + ": " + value, e);
        }
    }

    private <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String constant = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, constant);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
