package com.skeinsystems.transport;

/**
 * Outcome of {@link Sender#send(byte[], Address)}.
 */
public enum DataTransmissionErrorCode {
    SUCCESS,
    RECEIVER_UNAVAILABLE,
    FAILED_UNKNOWN
}
