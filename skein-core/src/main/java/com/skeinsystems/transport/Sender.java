package com.skeinsystems.transport;

/**
 * Sending side of an inter-process transport.
 * <p>
 * Skein does not ship a concrete transport. Implementations (named pipes, sockets) carry
 * already-serialized messages between processes; they hold no scheduling or lifetime logic.
 */
public interface Sender {

    /**
     * Binds this sender to a default receiver. Invalid addresses, and the address the
     * sender is already bound to, leave it unchanged.
     *
     * @param address the receiver address
     */
    void initConnection(Address address);

    /**
     * Sends a payload.
     *
     * @param payload     the serialized message
     * @param destination the receiver, or {@link Address#INVALID} for the bound receiver
     * @return the transmission outcome
     */
    DataTransmissionErrorCode send(byte[] payload, Address destination);

    /**
     * Returns the address this sender is bound to.
     *
     * @return the bound address, or {@link Address#INVALID}
     */
    Address receiverAddress();

    /**
     * Checks whether the bound receiver is currently reachable.
     *
     * @return the receiver availability
     */
    Availability checkReceiverStatus();
}
