package io.scalex.bridge.mailbox;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.codec.MessageIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * One domain's endpoint on an {@link InMemoryMailboxNetwork}.
 */
public class InMemoryMailbox implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMailbox.class);

    private final InMemoryMailboxNetwork network;
    private final MailboxDelivery delivery;

    InMemoryMailbox(InMemoryMailboxNetwork network, String address, int localDomain) {
        this.network = network;
        this.delivery = new MailboxDelivery(address, localDomain);
    }

    @Override
    public String getAddress() {
        return delivery.getTransportAddress();
    }

    @Override
    public int getLocalDomain() {
        return delivery.getLocalDomain();
    }

    public MailboxDelivery getDelivery() {
        return delivery;
    }

    public void register(MessageRecipient recipient) {
        delivery.register(recipient);
    }

    @Override
    public String dispatch(String sender, int destinationDomain, String recipient, byte[] body) {
        String messageId = MessageIds.compute(getLocalDomain(), sender, body);
        MailboxEnvelope envelope = MailboxEnvelope.builder()
            .messageId(messageId)
            .originDomain(getLocalDomain())
            .sender(Addresses.normalize(sender))
            .destinationDomain(destinationDomain)
            .recipient(Addresses.normalize(recipient))
            .body(body.clone())
            .dispatchedAt(Instant.now())
            .build();
        network.enqueue(envelope);
        log.debug("Dispatched message {} from domain {} to domain {}", messageId, getLocalDomain(), destinationDomain);
        return messageId;
    }
}
