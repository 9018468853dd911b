package com.bayousystems.mailbox.config;

import com.bayousystems.mailbox.Mailbox;

import java.util.function.ToIntFunction;

/**
 * Creates the mailbox a worker will own.
 *
 * @param <M> The message type
 */
public interface MailboxProvider<M> {

    /**
     * Creates a new mailbox.
     *
     * @param config     The mailbox configuration, or null for defaults
     * @param priorityOf Extracts the priority of a message, used by priority mailboxes
     * @return A new mailbox instance
     */
    Mailbox<M> createMailbox(MailboxConfig config, ToIntFunction<? super M> priorityOf);
}
