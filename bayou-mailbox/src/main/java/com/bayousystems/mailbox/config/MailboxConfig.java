package com.bayousystems.mailbox.config;

/**
 * Configuration used by the mailbox module to create mailboxes.
 */
public class MailboxConfig {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final int DEFAULT_CAPACITY = UNBOUNDED;
    public static final MailboxOrdering DEFAULT_ORDERING = MailboxOrdering.FIFO;

    private int capacity = DEFAULT_CAPACITY;
    private MailboxOrdering ordering = DEFAULT_ORDERING;

    /**
     * Sets the maximum number of queued messages. Use {@link #UNBOUNDED} for no limit.
     *
     * @param capacity The capacity, must be positive
     * @return This MailboxConfig instance
     */
    public MailboxConfig setCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isBounded() {
        return capacity != UNBOUNDED;
    }

    /**
     * Sets the delivery order of the mailbox.
     *
     * @param ordering FIFO or PRIORITY
     * @return This MailboxConfig instance
     */
    public MailboxConfig setOrdering(MailboxOrdering ordering) {
        this.ordering = ordering != null ? ordering : DEFAULT_ORDERING;
        return this;
    }

    public MailboxOrdering getOrdering() {
        return ordering;
    }

    @Override
    public String toString() {
        return "MailboxConfig{capacity=" + (isBounded() ? capacity : "unbounded") + ", ordering=" + ordering + "}";
    }
}
