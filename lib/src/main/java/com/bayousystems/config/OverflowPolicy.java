package com.bayousystems.config;

/**
 * What a submission does when the worker's bounded mailbox is full.
 */
public enum OverflowPolicy {
    /**
     * The sender waits for space, up to the configured block timeout.
     */
    BLOCK,

    /**
     * The submission fails at once with {@link com.bayousystems.MailboxFullException}.
     */
    FAIL
}
