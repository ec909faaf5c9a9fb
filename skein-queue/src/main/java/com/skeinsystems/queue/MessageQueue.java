package com.skeinsystems.queue;

/**
 * Closable blocking FIFO shared between any number of producer threads and exactly one
 * consumer thread.
 * <p>
 * Once {@link #close() closed}, the queue refuses new messages; the consumer keeps
 * receiving what was already queued and then gets {@code null} from {@link #awaitNext()},
 * which is its signal to leave the loop.
 *
 * @param <T> The type of messages stored in the queue
 */
public interface MessageQueue<T> {

    /**
     * Appends a message unless the queue is closed or full. Never blocks.
     *
     * @param message the message to add
     * @return true if the message was queued, false if it was refused
     * @throws NullPointerException if message is null
     */
    boolean push(T message);

    /**
     * Retrieves and removes the head of the queue, waiting until a message is available
     * or the queue has been closed and drained.
     *
     * @return the head of the queue, or null once the queue is closed and empty
     * @throws InterruptedException if interrupted while waiting
     */
    T awaitNext() throws InterruptedException;

    /**
     * Closes the queue and wakes every waiting consumer. Idempotent.
     */
    void close();

    /**
     * Returns true once {@link #close()} has been called.
     *
     * @return whether the queue is closed
     */
    boolean isClosed();

    /**
     * Returns the number of messages in the queue.
     *
     * @return the number of messages
     */
    int size();

    /**
     * Returns true if the queue contains no messages.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Removes all queued messages without closing the queue.
     */
    void clear();

    /**
     * Returns the maximum number of messages the queue holds, or Integer.MAX_VALUE if unbounded.
     *
     * @return the capacity
     */
    int capacity();

    /**
     * Returns the number of additional messages this queue can accept,
     * or Integer.MAX_VALUE if unbounded.
     *
     * @return the remaining capacity
     */
    default int remainingCapacity() {
        int capacity = capacity();
        if (capacity == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return Math.max(0, capacity - size());
    }
}
