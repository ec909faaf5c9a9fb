package com.skeinsystems.handler;

import com.skeinsystems.message.Message;

/**
 * Handles messages of one type on the owning component's thread.
 *
 * @param <M> The type of messages this handler processes
 */
@FunctionalInterface
public interface MessageHandler<M extends Message> {

    /**
     * Processes a message. Runs on the component's loop thread, never concurrently with
     * another handler of the same component. Exceptions are caught and logged by the loop.
     *
     * @param message The message to process
     */
    void onMessage(M message);
}
