package com.skeinsystems;

/**
 * Defines lifecycle callbacks for a component used by {@link MessageLoop}.
 * All three run on the loop thread.
 *
 * @param <T> The type of messages accepted by the component
 */
public interface ComponentLifecycle<T> {
    /** Called before queue processing begins. */
    void onEntry();

    /**
     * Called to dispatch a dequeued message to the component.
     *
     * @param message the message to be processed by the component
     */
    void dispatch(T message);

    /** Called after queue processing ends. */
    void onExit();
}
