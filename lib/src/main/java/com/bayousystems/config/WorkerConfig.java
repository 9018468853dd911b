package com.bayousystems.config;

import com.bayousystems.mailbox.config.MailboxConfig;
import com.bayousystems.mailbox.config.MailboxOrdering;

import java.time.Duration;

/**
 * Configuration for a single worker: its mailbox and how submissions behave when it is full.
 */
public class WorkerConfig {
    public static final Duration DEFAULT_BLOCK_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private int mailboxCapacity = MailboxConfig.UNBOUNDED;
    private MailboxOrdering ordering = MailboxOrdering.PRIORITY;
    private OverflowPolicy overflowPolicy = OverflowPolicy.BLOCK;
    private Duration blockTimeout = DEFAULT_BLOCK_TIMEOUT;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

    /**
     * Sets the mailbox capacity. Use {@link MailboxConfig#UNBOUNDED} for no limit.
     *
     * @param mailboxCapacity The capacity, must be positive
     * @return This WorkerConfig instance
     */
    public WorkerConfig setMailboxCapacity(int mailboxCapacity) {
        if (mailboxCapacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive: " + mailboxCapacity);
        }
        this.mailboxCapacity = mailboxCapacity;
        return this;
    }

    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    public boolean isBounded() {
        return mailboxCapacity != MailboxConfig.UNBOUNDED;
    }

    /**
     * Sets the dequeue order. PRIORITY (the default) honours task priority with FIFO tie-break;
     * FIFO ignores priority.
     */
    public WorkerConfig setOrdering(MailboxOrdering ordering) {
        this.ordering = ordering != null ? ordering : MailboxOrdering.PRIORITY;
        return this;
    }

    public MailboxOrdering getOrdering() {
        return ordering;
    }

    public WorkerConfig setOverflowPolicy(OverflowPolicy overflowPolicy) {
        this.overflowPolicy = overflowPolicy != null ? overflowPolicy : OverflowPolicy.BLOCK;
        return this;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    /**
     * Sets the maximum time a sender waits for space under {@link OverflowPolicy#BLOCK}.
     */
    public WorkerConfig setBlockTimeout(Duration blockTimeout) {
        if (blockTimeout == null || blockTimeout.isNegative()) {
            throw new IllegalArgumentException("Block timeout must be non-negative");
        }
        this.blockTimeout = blockTimeout;
        return this;
    }

    public Duration getBlockTimeout() {
        return blockTimeout;
    }

    public WorkerConfig setShutdownTimeout(Duration shutdownTimeout) {
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("Shutdown timeout must be non-negative");
        }
        this.shutdownTimeout = shutdownTimeout;
        return this;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Converts to the mailbox module's configuration.
     */
    public MailboxConfig toMailboxConfig() {
        return new MailboxConfig()
                .setCapacity(mailboxCapacity)
                .setOrdering(ordering);
    }

    /**
     * Creates a copy so that pools can hand each worker its own instance.
     */
    public WorkerConfig copy() {
        return new WorkerConfig()
                .setMailboxCapacity(mailboxCapacity)
                .setOrdering(ordering)
                .setOverflowPolicy(overflowPolicy)
                .setBlockTimeout(blockTimeout)
                .setShutdownTimeout(shutdownTimeout);
    }

    @Override
    public String toString() {
        return "WorkerConfig{capacity=" + (isBounded() ? mailboxCapacity : "unbounded")
                + ", ordering=" + ordering
                + ", overflow=" + overflowPolicy
                + ", blockTimeout=" + blockTimeout
                + ", shutdownTimeout=" + shutdownTimeout + "}";
    }
}
