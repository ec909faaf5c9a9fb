package com.skeinsystems.queue.config;

/**
 * Configuration for component message queues.
 * Queues are unbounded unless a capacity is set explicitly.
 */
public class QueueConfig {
    // Default values for queue configuration
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final int DEFAULT_INITIAL_CAPACITY = 128;
    public static final QueueType DEFAULT_QUEUE_TYPE = QueueType.LINKED;

    private QueueType queueType;
    private int capacity;
    private int initialCapacity;

    /**
     * Creates a new QueueConfig with default values.
     */
    public QueueConfig() {
        this.queueType = DEFAULT_QUEUE_TYPE;
        this.capacity = UNBOUNDED;
        this.initialCapacity = DEFAULT_INITIAL_CAPACITY;
    }

    /**
     * Sets the queue implementation.
     *
     * @param queueType The queue type
     * @return This QueueConfig instance
     */
    public QueueConfig setQueueType(QueueType queueType) {
        if (queueType == null) {
            throw new IllegalArgumentException("Queue type cannot be null");
        }
        this.queueType = queueType;
        return this;
    }

    /**
     * Sets the maximum number of queued messages. Pushes beyond it are refused.
     *
     * @param capacity The capacity, or {@link #UNBOUNDED}
     * @return This QueueConfig instance
     */
    public QueueConfig setCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    /**
     * Sets the chunk size used by growable queues.
     *
     * @param initialCapacity The initial capacity
     * @return This QueueConfig instance
     */
    public QueueConfig setInitialCapacity(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("Initial capacity must be positive, got " + initialCapacity);
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    public QueueType getQueueType() {
        return queueType;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public boolean isBounded() {
        return capacity != UNBOUNDED;
    }

    @Override
    public String toString() {
        return "QueueConfig{" +
                "queueType=" + queueType +
                ", capacity=" + (isBounded() ? capacity : "unbounded") +
                ", initialCapacity=" + initialCapacity +
                '}';
    }
}
