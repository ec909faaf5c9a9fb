package com.skeinsystems.message;

/**
 * A unit of work posted to a component.
 * <p>
 * Messages are dispatched by their type tag, which by default is the runtime class of the
 * message. The set of message types is open: any class implementing this interface can be
 * registered with a handler. Implementations should be immutable once posted, since a
 * message is handed from the producer thread to the component's own thread.
 */
public interface Message {

    /**
     * Returns the tag used as the dispatch key for this message.
     *
     * @return the message type tag
     */
    default Class<? extends Message> type() {
        return getClass();
    }
}
