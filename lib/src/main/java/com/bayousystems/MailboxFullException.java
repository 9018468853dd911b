package com.bayousystems;

/**
 * Thrown by {@code submit} when a bounded mailbox is full and the overflow policy
 * does not allow (further) blocking.
 */
public class MailboxFullException extends WorkerException {

    private final int capacity;

    public MailboxFullException(String workerId, int capacity) {
        super("Mailbox of worker " + workerId + " is full (capacity " + capacity + ")",
                workerId, ErrorKind.MAILBOX_FULL);
        this.capacity = capacity;
    }

    public MailboxFullException(String workerId, int capacity, String detail) {
        super("Mailbox of worker " + workerId + " is full (capacity " + capacity + "): " + detail,
                workerId, ErrorKind.MAILBOX_FULL);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
