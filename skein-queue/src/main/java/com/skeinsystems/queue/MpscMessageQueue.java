package com.skeinsystems.queue;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * High-throughput queue built on the JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free enqueuing with respect to the consumer
 * - Minimal allocation overhead
 *
 * Trade-offs:
 * - Unbounded: the initial capacity is only the chunk size
 * - Producers share a read lock so that {@link #close()} can fence out late pushes
 * - The consumer takes a lock only when it has to park
 *
 * @param <T> The type of messages
 */
public class MpscMessageQueue<T> implements MessageQueue<T> {

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final int initialCapacity;
    private volatile boolean closed = false;
    private volatile boolean hasWaitingConsumer = false;

    /**
     * Creates an MPSC queue with default chunk size (128).
     */
    public MpscMessageQueue() {
        this(128);
    }

    /**
     * Creates an MPSC queue with the specified chunk size.
     *
     * @param initialCapacity the chunk size, rounded up to a power of 2
     */
    public MpscMessageQueue(int initialCapacity) {
        // JCTools requires a chunk size of at least 2
        int safeCapacity = initialCapacity <= 1 ? 2 : initialCapacity;
        this.initialCapacity = nextPowerOfTwo(safeCapacity);
        this.queue = new MpscUnboundedArrayQueue<>(this.initialCapacity);
    }

    @Override
    public boolean push(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        closeLock.readLock().lock();
        try {
            if (closed) {
                return false;
            }
            queue.offer(message);
        } finally {
            closeLock.readLock().unlock();
        }
        signalNotEmpty();
        return true;
    }

    @Override
    public T awaitNext() throws InterruptedException {
        // Fast path: try non-blocking poll first
        T message = queue.poll();
        if (message != null) {
            return message;
        }

        lock.lockInterruptibly();
        try {
            // Set before re-checking so a concurrent producer either sees the flag or we see its message
            hasWaitingConsumer = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (closed) {
                    // close() fences out producers, so anything offered before it is visible now
                    return queue.poll();
                }
                notEmpty.await();
            }
        } finally {
            hasWaitingConsumer = false;
            lock.unlock();
        }
    }

    @Override
    public void close() {
        closeLock.writeLock().lock();
        try {
            closed = true;
        } finally {
            closeLock.writeLock().unlock();
        }
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public int capacity() {
        return Integer.MAX_VALUE;
    }

    /**
     * Returns the chunk size the underlying queue grows by.
     *
     * @return the chunk size
     */
    public int getInitialCapacity() {
        return initialCapacity;
    }

    /**
     * Signals the consumer that a message is available.
     * Only acquires the lock if the consumer is actually parked.
     */
    private void signalNotEmpty() {
        if (hasWaitingConsumer) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    private static int nextPowerOfTwo(int value) {
        if ((value & (value - 1)) == 0) {
            return value;
        }
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
