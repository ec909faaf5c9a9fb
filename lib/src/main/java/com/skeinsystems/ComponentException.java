package com.skeinsystems;

/**
 * Exception thrown when a component is used in a way its lifecycle does not allow,
 * such as running it twice or running it after it was stopped.
 */
public class ComponentException extends RuntimeException {

    /** The name of the component where the exception occurred. */
    private final String componentName;

    /**
     * Creates a new ComponentException with the specified detail message.
     *
     * @param message the detail message
     */
    public ComponentException(String message) {
        super(message);
        this.componentName = null;
    }

    /**
     * Creates a new ComponentException with the specified detail message and component name.
     *
     * @param message the detail message
     * @param componentName the name of the component where the exception occurred
     */
    public ComponentException(String message, String componentName) {
        super(message);
        this.componentName = componentName;
    }

    /**
     * Creates a new ComponentException with the specified detail message, cause, and component name.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param componentName the name of the component where the exception occurred
     */
    public ComponentException(String message, Throwable cause, String componentName) {
        super(message, cause);
        this.componentName = componentName;
    }

    /**
     * Returns the name of the component where the exception occurred.
     *
     * @return the component name, or null if not specified
     */
    public String getComponentName() {
        return componentName;
    }
}
