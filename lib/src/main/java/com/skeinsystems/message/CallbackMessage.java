package com.skeinsystems.message;

import java.util.Objects;

/**
 * Deferred unit of work to run on a component's thread.
 *
 * @param callback the work to run
 */
public record CallbackMessage(Runnable callback) implements Message {

    public CallbackMessage {
        Objects.requireNonNull(callback, "callback cannot be null");
    }

    public void execute() {
        callback.run();
    }
}
