package io.scalex.bridge.mailbox;

/**
 * Inbound side of the messaging transport, implemented by gateways and the hub ledger.
 */
public interface MessageRecipient {

    String getAddress();

    /**
     * Apply a delivered message.
     * 
     * Must be idempotent and commutative with respect to delivery order and
     * duplication. Throwing leaves the recipient unchanged and lets the
     * transport retry.
     *
     * @param caller address of the delivering transport
     * @param originDomain domain the message was dispatched from
     * @param sender component that dispatched the message
     * @param body encoded message body
     */
    void handle(String caller, int originDomain, String sender, byte[] body);
}
