package com.skeinsystems.queue.config;

/**
 * Queue implementations available to components.
 */
public enum QueueType {
    /**
     * Single-lock deque. Supports a bounded capacity.
     */
    LINKED,

    /**
     * JCTools multi-producer single-consumer queue. Always unbounded.
     */
    MPSC
}
