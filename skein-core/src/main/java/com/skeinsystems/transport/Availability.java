package com.skeinsystems.transport;

/**
 * Reachability of a receiver as seen by a {@link Sender}.
 */
public enum Availability {
    AVAILABLE,
    UNAVAILABLE,
    UNKNOWN
}
