package io.scalex.bridge.mailbox;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands envelopes arriving on one domain to the local recipient they address.
 * 
 * The transport address passed to {@link MessageRecipient#handle} is the
 * address of the transport this delivery belongs to.
 */
public class MailboxDelivery {

    private static final Logger log = LoggerFactory.getLogger(MailboxDelivery.class);

    private final String transportAddress;
    private final int localDomain;
    private final Map<String, MessageRecipient> recipients = new ConcurrentHashMap<>();

    public MailboxDelivery(String transportAddress, int localDomain) {
        this.transportAddress = Addresses.normalize(transportAddress);
        this.localDomain = localDomain;
    }

    public String getTransportAddress() {
        return transportAddress;
    }

    public int getLocalDomain() {
        return localDomain;
    }

    public void register(MessageRecipient recipient) {
        recipients.put(Addresses.normalize(recipient.getAddress()), recipient);
        log.info("Registered mailbox recipient {} on domain {}", recipient.getAddress(), localDomain);
    }

    /**
     * Deliver an envelope to its recipient. Exceptions from the recipient propagate.
     */
    public void deliver(MailboxEnvelope envelope) {
        if (envelope.getDestinationDomain() != localDomain) {
            throw new BridgeException(BridgeErrorCode.NOT_CONFIGURED, String.format(
                "Envelope %s is for domain %d, this mailbox serves %d",
                envelope.getMessageId(), envelope.getDestinationDomain(), localDomain));
        }
        MessageRecipient recipient = recipients.get(Addresses.normalize(envelope.getRecipient()));
        if (recipient == null) {
            throw new BridgeException(BridgeErrorCode.NOT_CONFIGURED,
                "No recipient registered at " + envelope.getRecipient() + " on domain " + localDomain);
        }
        log.debug("Delivering message {} from domain {} to {}",
            envelope.getMessageId(), envelope.getOriginDomain(), envelope.getRecipient());
        recipient.handle(transportAddress, envelope.getOriginDomain(), envelope.getSender(), envelope.getBody());
    }
}
