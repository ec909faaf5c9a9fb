package com.skeinsystems.queue.config;

import com.skeinsystems.queue.MessageQueue;
import com.skeinsystems.queue.MpscMessageQueue;

/**
 * Creates JCTools-backed unbounded queues for high-throughput components.
 *
 * @param <M> The message type
 */
public class MpscQueueStrategy<M> implements QueueCreationStrategy<M> {

    @Override
    public MessageQueue<M> createQueue(QueueConfig config) {
        return new MpscMessageQueue<>(config.getInitialCapacity());
    }
}
