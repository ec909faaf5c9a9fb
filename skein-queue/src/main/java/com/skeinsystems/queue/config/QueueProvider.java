package com.skeinsystems.queue.config;

import com.skeinsystems.queue.MessageQueue;

/**
 * Creates the message queue of a component.
 *
 * @param <M> The type of messages the queue will hold.
 */
public interface QueueProvider<M> {

    /**
     * Creates a queue for the given configuration.
     *
     * @param config The queue configuration, or null for defaults
     * @return A new, open queue
     */
    MessageQueue<M> createQueue(QueueConfig config);
}
