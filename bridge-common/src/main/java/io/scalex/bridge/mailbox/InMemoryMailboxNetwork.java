package io.scalex.bridge.mailbox;

import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process transport connecting several domains.
 * 
 * Dispatched envelopes wait in a pending pool until a caller delivers them, so
 * tests decide delivery order, duplication, delay and loss. An envelope whose
 * delivery throws stays pending.
 */
public class InMemoryMailboxNetwork {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMailboxNetwork.class);

    private final Map<Integer, InMemoryMailbox> mailboxes = new ConcurrentHashMap<>();
    private final List<MailboxEnvelope> pending = Collections.synchronizedList(new ArrayList<>());
    private final List<MailboxEnvelope> delivered = Collections.synchronizedList(new ArrayList<>());

    /**
     * Create (or return) the mailbox serving {@code domain}.
     */
    public InMemoryMailbox mailbox(int domain, String address) {
        return mailboxes.computeIfAbsent(domain, d -> new InMemoryMailbox(this, address, d));
    }

    void enqueue(MailboxEnvelope envelope) {
        if (!mailboxes.containsKey(envelope.getDestinationDomain())) {
            log.warn("Dispatch to domain {} with no mailbox, message {} will never be delivered",
                envelope.getDestinationDomain(), envelope.getMessageId());
        }
        pending.add(envelope);
    }

    public List<MailboxEnvelope> pending() {
        synchronized (pending) {
            return new ArrayList<>(pending);
        }
    }

    public List<MailboxEnvelope> pendingFor(int destinationDomain) {
        List<MailboxEnvelope> result = new ArrayList<>();
        for (MailboxEnvelope envelope : pending()) {
            if (envelope.getDestinationDomain() == destinationDomain) {
                result.add(envelope);
            }
        }
        return result;
    }

    public List<MailboxEnvelope> delivered() {
        synchronized (delivered) {
            return new ArrayList<>(delivered);
        }
    }

    /**
     * Deliver one envelope. It leaves the pending pool only if the recipient accepts it.
     * Delivering an envelope that was already delivered is a duplicate delivery.
     */
    public void deliver(MailboxEnvelope envelope) {
        InMemoryMailbox mailbox = mailboxes.get(envelope.getDestinationDomain());
        if (mailbox == null) {
            throw new BridgeException(BridgeErrorCode.NOT_CONFIGURED,
                "No mailbox for domain " + envelope.getDestinationDomain());
        }
        mailbox.getDelivery().deliver(envelope);
        pending.remove(envelope);
        delivered.add(envelope);
    }

    /**
     * Deliver every pending envelope in dispatch order.
     *
     * @return number of envelopes delivered; failures stay pending
     */
    public int deliverAll() {
        return deliverEach(pending());
    }

    /**
     * Deliver every pending envelope in a random order.
     */
    public int deliverAllShuffled(Random random) {
        List<MailboxEnvelope> batch = pending();
        Collections.shuffle(batch, random);
        return deliverEach(batch);
    }

    public Optional<MailboxEnvelope> findPending(String messageId) {
        for (MailboxEnvelope envelope : pending()) {
            if (envelope.getMessageId().equals(messageId)) {
                return Optional.of(envelope);
            }
        }
        return Optional.empty();
    }

    /**
     * Lose a pending envelope, simulating a delivery that never happens.
     */
    public boolean drop(String messageId) {
        return findPending(messageId).map(pending::remove).orElse(false);
    }

    private int deliverEach(List<MailboxEnvelope> batch) {
        int count = 0;
        for (MailboxEnvelope envelope : batch) {
            try {
                deliver(envelope);
                count++;
            } catch (RuntimeException e) {
                log.warn("Delivery of {} failed, left pending: {}", envelope.getMessageId(), e.getMessage());
            }
        }
        return count;
    }
}
