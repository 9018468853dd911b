package com.bayousystems.mailbox.config;

/**
 * Delivery order of a mailbox.
 */
public enum MailboxOrdering {
    /**
     * Messages are delivered in the order they arrived.
     */
    FIFO,

    /**
     * Messages are delivered highest priority first; equal priorities in arrival order.
     */
    PRIORITY
}
