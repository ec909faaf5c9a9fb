package com.skeinsystems.message;

import java.util.Objects;

/**
 * Carries a timer expiration onto the owning component's thread.
 *
 * @param timerId  the timer manager job that fired
 * @param callback the user callback to run on the component's thread
 */
public record TimeoutMessage(long timerId, Runnable callback) implements Message {

    public TimeoutMessage {
        Objects.requireNonNull(callback, "callback cannot be null");
    }

    public void execute() {
        callback.run();
    }
}
