package com.skeinsystems.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for transports that talk to one default receiver at a time.
 * Keeps the bound address; subclasses supply the actual delivery and reachability check.
 */
public abstract class AbstractSender implements Sender {
    private static final Logger logger = LoggerFactory.getLogger(AbstractSender.class);

    private volatile Address receiverAddress = Address.INVALID;

    @Override
    public void initConnection(Address address) {
        if (address == null || !address.isValid() || address.equals(receiverAddress)) {
            return;
        }
        logger.debug("{} bound to receiver {}", getClass().getSimpleName(), address);
        receiverAddress = address;
        onReceiverChanged(address);
    }

    @Override
    public Address receiverAddress() {
        return receiverAddress;
    }

    /**
     * Sends a payload to the bound receiver.
     *
     * @param payload the serialized message
     * @return the transmission outcome, {@link DataTransmissionErrorCode#RECEIVER_UNAVAILABLE}
     *         if no receiver is bound
     */
    public DataTransmissionErrorCode send(byte[] payload) {
        if (!receiverAddress.isValid()) {
            return DataTransmissionErrorCode.RECEIVER_UNAVAILABLE;
        }
        return send(payload, receiverAddress);
    }

    /**
     * Called when the bound receiver changes, e.g. to derive a pipe name from the address.
     *
     * @param address the new receiver address
     */
    protected void onReceiverChanged(Address address) {
    }
}
