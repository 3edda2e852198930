package io.scalex.bridge.mailbox;

/**
 * Outbound side of the messaging transport.
 * 
 * Dispatch is fire-and-forget: a successful return means the transport accepted
 * the message, not that it was delivered. Delivery is at-least-once, unordered,
 * and not guaranteed.
 */
public interface MessageTransport {

    /**
     * Address recipients use to authenticate deliveries made by this transport.
     */
    String getAddress();

    /**
     * Domain of the network this transport instance serves.
     */
    int getLocalDomain();

    /**
     * Dispatch an opaque body to a recipient on another domain.
     *
     * @param sender address of the dispatching component, attested to the recipient
     * @param destinationDomain destination network
     * @param recipient destination component address
     * @param body encoded message body
     * @return message id of the dispatched message
     * @throws io.scalex.bridge.error.BridgeException DISPATCH_FAILED if the transport did not accept it
     */
    String dispatch(String sender, int destinationDomain, String recipient, byte[] body);
}
