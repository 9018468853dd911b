package com.bayousystems.mailbox;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToIntFunction;

/**
 * Mailbox that delivers messages by priority rather than arrival order.
 * <p>
 * Messages are ordered by {@code (priority DESC, arrivalSequence ASC)}: the highest
 * priority message is delivered first, and messages of equal priority are delivered
 * in the order they were offered. For a fixed sequence of offers the delivery order
 * is fully deterministic.
 * <p>
 * The priority of a message is read once, when it is offered.
 *
 * @param <T> The type of messages
 */
public class PriorityMailbox<T> implements Mailbox<T> {

    private static final Comparator<Slot<?>> DELIVERY_ORDER =
            Comparator.<Slot<?>>comparingInt(Slot::priority).reversed()
                    .thenComparingLong(Slot::sequence);

    private final ToIntFunction<? super T> priorityOf;
    private final PriorityQueue<Slot<T>> queue;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private long nextSequence;

    /**
     * Creates an unbounded priority mailbox.
     *
     * @param priorityOf extracts the priority of a message; higher is more urgent
     */
    public PriorityMailbox(ToIntFunction<? super T> priorityOf) {
        this(priorityOf, Integer.MAX_VALUE);
    }

    /**
     * Creates a bounded priority mailbox.
     *
     * @param priorityOf extracts the priority of a message; higher is more urgent
     * @param capacity   the maximum number of messages
     */
    public PriorityMailbox(ToIntFunction<? super T> priorityOf, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.priorityOf = Objects.requireNonNull(priorityOf, "priorityOf cannot be null");
        this.capacity = capacity;
        this.queue = new PriorityQueue<>(DELIVERY_ORDER);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lock();
        try {
            if (queue.size() >= capacity) {
                return false;
            }
            enqueue(message);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.size() >= capacity) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            enqueue(message);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(T message) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lockInterruptibly();
        try {
            while (queue.size() >= capacity) {
                notFull.await();
            }
            enqueue(message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T poll() {
        lock.lock();
        try {
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "collection cannot be null");
        lock.lock();
        try {
            int transferred = 0;
            while (transferred < maxElements && !queue.isEmpty()) {
                collection.add(dequeue());
                transferred++;
            }
            return transferred;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public int remainingCapacity() {
        if (capacity == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        lock.lock();
        try {
            return capacity - queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            queue.clear();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    // Must be called with the lock held
    private void enqueue(T message) {
        queue.add(new Slot<>(message, priorityOf.applyAsInt(message), nextSequence++));
        notEmpty.signal();
    }

    // Must be called with the lock held
    private T dequeue() {
        Slot<T> slot = queue.poll();
        if (slot == null) {
            return null;
        }
        notFull.signal();
        return slot.message();
    }

    private record Slot<T>(T message, int priority, long sequence) {
    }
}
