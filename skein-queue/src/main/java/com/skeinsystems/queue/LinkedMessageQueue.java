package com.skeinsystems.queue;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default queue implementation: an {@link ArrayDeque} guarded by one lock.
 * Pushes, pops and close are mutually exclusive; the consumer parks on a condition
 * while the queue is empty and open.
 *
 * Recommended for:
 * - General-purpose component queues
 * - When a bounded capacity is needed
 *
 * @param <T> The type of messages
 */
public class LinkedMessageQueue<T> implements MessageQueue<T> {

    private final ArrayDeque<T> queue = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final int capacity;
    private boolean closed = false;

    /**
     * Creates an unbounded queue.
     */
    public LinkedMessageQueue() {
        this(Integer.MAX_VALUE);
    }

    /**
     * Creates a bounded queue with the specified capacity.
     *
     * @param capacity the maximum number of messages
     */
    public LinkedMessageQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public boolean push(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lock();
        try {
            if (closed || queue.size() >= capacity) {
                return false;
            }
            queue.addLast(message);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T awaitNext() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (closed) {
                    return null;
                }
                notEmpty.await();
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
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
    public void clear() {
        lock.lock();
        try {
            queue.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }
}
