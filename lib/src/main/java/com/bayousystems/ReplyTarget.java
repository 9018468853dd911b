package com.bayousystems;

import com.bayousystems.mailbox.Mailbox;

import java.util.Objects;

/**
 * Destination a worker sends a task's result to, in addition to the task's handle.
 * Called on the worker's thread; implementations should return quickly.
 *
 * @param <R> the result value type
 */
@FunctionalInterface
public interface ReplyTarget<R> {

    void deliver(TaskResult<R> result);

    /**
     * Creates a reply target that sends results into a mailbox owned by the caller.
     * A full bounded mailbox makes delivery fail with {@link MailboxFullException}.
     *
     * @param mailbox the caller's reply mailbox
     * @return a reply target
     */
    static <R> ReplyTarget<R> mailbox(Mailbox<TaskResult<R>> mailbox) {
        Objects.requireNonNull(mailbox, "mailbox cannot be null");
        return result -> {
            if (!mailbox.offer(result)) {
                throw new MailboxFullException("reply-channel", mailbox.capacity());
            }
        };
    }

    /**
     * Returns a reply target delivering to this target and then to {@code next}.
     */
    default ReplyTarget<R> andThen(ReplyTarget<R> next) {
        if (next == null) {
            return this;
        }
        return result -> {
            deliver(result);
            next.deliver(result);
        };
    }
}
