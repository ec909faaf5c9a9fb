package com.skeinsystems.queue.config;

import com.skeinsystems.queue.MessageQueue;

/**
 * Strategy interface for creating one kind of queue.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface QueueCreationStrategy<M> {

    /**
     * Creates a queue according to this strategy.
     *
     * @param config The queue configuration
     * @return A new queue instance
     */
    MessageQueue<M> createQueue(QueueConfig config);
}
