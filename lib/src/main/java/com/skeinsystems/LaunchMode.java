package com.skeinsystems;

/**
 * How {@link Component#run(LaunchMode, Runnable, Runnable)} executes the message loop.
 */
public enum LaunchMode {
    /**
     * Runs the loop on the calling thread; {@code run} returns only after the component stops.
     */
    SYNC,

    /**
     * Runs the loop on a new worker thread; {@code run} returns immediately.
     */
    ASYNC
}
