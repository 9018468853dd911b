package com.bayousystems.mailbox.config;

import com.bayousystems.mailbox.Mailbox;

import java.util.function.ToIntFunction;

/**
 * Strategy interface for creating mailboxes for one delivery order.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxCreationStrategy<M> {

    /**
     * Creates a mailbox according to this strategy.
     *
     * @param config     The mailbox configuration
     * @param priorityOf Extracts the priority of a message; ignored by FIFO strategies
     * @return A new mailbox instance
     */
    Mailbox<M> createMailbox(MailboxConfig config, ToIntFunction<? super M> priorityOf);
}
