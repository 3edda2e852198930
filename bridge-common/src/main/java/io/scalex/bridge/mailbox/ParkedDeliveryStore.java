package io.scalex.bridge.mailbox;

import io.scalex.bridge.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Failed deliveries waiting for retry.
 * 
 * A delivery is parked when the recipient throws, for example on a deposit for a
 * token the registry does not map yet. Parked deliveries are keyed by message id,
 * so redelivering the same message updates one record. Retrying is safe at any
 * time since recipients deduplicate by message id. A record is dropped as soon as
 * its message is delivered, so the store only holds deliveries still waiting.
 * 
 * In-memory storage; in production this would be a database table.
 */
public class ParkedDeliveryStore {

    private static final Logger log = LoggerFactory.getLogger(ParkedDeliveryStore.class);

    private final MailboxDelivery delivery;
    private final Map<String, ParkedDelivery> parked = new ConcurrentHashMap<>();

    public ParkedDeliveryStore(MailboxDelivery delivery) {
        this.delivery = delivery;
    }

    /**
     * Deliver an envelope, parking it if the recipient rejects it.
     *
     * @return true if delivered, false if parked
     */
    public boolean deliverOrPark(MailboxEnvelope envelope) {
        try {
            delivery.deliver(envelope);
            markDelivered(envelope.getMessageId());
            return true;
        } catch (RuntimeException e) {
            park(envelope, e);
            return false;
        }
    }

    public ParkedDelivery park(MailboxEnvelope envelope, RuntimeException failure) {
        String now = Instant.now().toString();
        ParkedDelivery record = parked.compute(envelope.getMessageId(), (id, existing) -> {
            ParkedDelivery next = existing != null ? existing : ParkedDelivery.builder()
                .parkId(id)
                .envelope(envelope)
                .firstFailedAt(now)
                .build();
            next.setAttempts(next.getAttempts() + 1);
            next.setLastAttemptAt(now);
            next.setStatus(ParkedDelivery.ParkStatus.PARKED);
            next.setErrorCode(failure instanceof BridgeException ? ((BridgeException) failure).getCode() : null);
            next.setErrorMessage(failure.getMessage());
            return next;
        });
        log.error("Parked delivery - messageId={}, origin={}, recipient={}, attempts={}, error={}",
            envelope.getMessageId(), envelope.getOriginDomain(), envelope.getRecipient(),
            record.getAttempts(), failure.getMessage());
        return record;
    }

    /**
     * Retry one parked delivery.
     *
     * @return the updated record, or empty if no delivery is parked under that id
     */
    public Optional<ParkedDelivery> retry(String parkId) {
        ParkedDelivery record = parked.get(parkId);
        if (record == null) {
            return Optional.empty();
        }
        log.info("Retrying parked delivery: messageId={}, attempt={}", parkId, record.getAttempts() + 1);
        if (deliverOrPark(record.getEnvelope())) {
            return Optional.of(record);
        }
        return Optional.of(parked.get(parkId));
    }

    /**
     * Retry every parked delivery once.
     *
     * @return number of deliveries that succeeded
     */
    public int retryAll() {
        int delivered = 0;
        for (ParkedDelivery record : getParked()) {
            if (deliverOrPark(record.getEnvelope())) {
                delivered++;
            }
        }
        log.info("Retried parked deliveries: delivered={}, still parked={}", delivered, parked.size());
        return delivered;
    }

    public Optional<ParkedDelivery> get(String parkId) {
        return Optional.ofNullable(parked.get(parkId));
    }

    /**
     * Deliveries still waiting, oldest failure first.
     */
    public List<ParkedDelivery> getParked() {
        List<ParkedDelivery> waiting = new ArrayList<>(parked.values());
        waiting.sort(Comparator.comparing(ParkedDelivery::getFirstFailedAt));
        return waiting;
    }

    public int size() {
        return parked.size();
    }

    // The caller keeps the removed record to report the outcome
    private void markDelivered(String messageId) {
        ParkedDelivery record = parked.remove(messageId);
        if (record != null) {
            record.setStatus(ParkedDelivery.ParkStatus.DELIVERED);
            record.setLastAttemptAt(Instant.now().toString());
            log.info("Parked delivery succeeded and was removed: messageId={}", messageId);
        }
    }
}
