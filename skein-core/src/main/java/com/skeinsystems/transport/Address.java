package com.skeinsystems.transport;

import java.util.Objects;

/**
 * Location of a message receiver in another process.
 * The interpretation of {@code name} and {@code port} is up to the transport
 * (a pipe name, a host name, a socket path).
 *
 * @param name the receiver name or host
 * @param port the receiver port, or {@link #NO_PORT} when the transport does not use ports
 */
public record Address(String name, int port) {

    public static final int NO_PORT = -1;

    /** Address that never designates a receiver. */
    public static final Address INVALID = new Address("", NO_PORT);

    public Address {
        Objects.requireNonNull(name, "name cannot be null");
        if (port < NO_PORT || port > 65_535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
    }

    /**
     * Creates an address for a port-less transport.
     *
     * @param name the receiver name
     * @return the address
     */
    public static Address of(String name) {
        return new Address(name, NO_PORT);
    }

    public boolean isValid() {
        return !name.isEmpty();
    }

    @Override
    public String toString() {
        return port == NO_PORT ? name : name + ":" + port;
    }
}
