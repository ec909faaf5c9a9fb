package com.skeinsystems;

import java.lang.ref.WeakReference;
import java.util.Optional;

/**
 * Weak, liveness-checked handle to a component.
 * <p>
 * Holding a ComponentRef never keeps a component reachable. {@link #get()} resolves it to
 * a usable component, or to empty once the component has been closed or collected.
 */
public final class ComponentRef {

    private static final ComponentRef EMPTY = new ComponentRef(null);

    private final WeakReference<Component> reference;

    private ComponentRef(Component component) {
        this.reference = new WeakReference<>(component);
    }

    static ComponentRef of(Component component) {
        return new ComponentRef(component);
    }

    /**
     * Returns a handle that never resolves.
     *
     * @return the empty handle
     */
    public static ComponentRef empty() {
        return EMPTY;
    }

    /**
     * Resolves the handle.
     *
     * @return the component if it is still alive, otherwise empty
     */
    public Optional<Component> get() {
        Component component = reference.get();
        if (component == null || !component.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(component);
    }

    public boolean isAlive() {
        return get().isPresent();
    }

    @Override
    public String toString() {
        Component component = reference.get();
        return component == null ? "ComponentRef[gone]" : "ComponentRef[" + component.describe() + "]";
    }
}
