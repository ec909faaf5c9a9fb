package com.skeinsystems.queue.config;

import com.skeinsystems.queue.LinkedMessageQueue;
import com.skeinsystems.queue.MessageQueue;

/**
 * Creates single-lock queues, bounded when the configuration asks for it.
 *
 * @param <M> The message type
 */
public class LinkedQueueStrategy<M> implements QueueCreationStrategy<M> {

    @Override
    public MessageQueue<M> createQueue(QueueConfig config) {
        return config.isBounded()
                ? new LinkedMessageQueue<>(config.getCapacity())
                : new LinkedMessageQueue<>();
    }
}
