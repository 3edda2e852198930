package io.scalex.bridge.kafka;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.codec.MessageIds;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import io.scalex.bridge.mailbox.MailboxEnvelope;
import io.scalex.bridge.mailbox.MessageTransport;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka-backed transport. Each domain has one inbox topic; dispatch appends the
 * envelope to the destination domain's inbox, keyed by message id.
 * 
 * Dispatch waits for the broker acknowledgment so a caller that gets a message
 * id back knows the envelope was accepted. Delivery is left to the destination
 * domain's {@link KafkaMailboxListener}.
 */
public class KafkaMailbox implements MessageTransport {
    
    private static final Logger log = LoggerFactory.getLogger(KafkaMailbox.class);
    
    public static final String TOPIC_PREFIX = "bridge.mailbox.";
    
    private final Producer<String, MailboxEnvelope> producer;
    private final String address;
    private final int localDomain;
    private final long sendTimeoutMs;
    
    public KafkaMailbox(Producer<String, MailboxEnvelope> producer, String address, int localDomain, long sendTimeoutMs) {
        this.producer = producer;
        this.address = Addresses.normalize(address);
        this.localDomain = localDomain;
        this.sendTimeoutMs = sendTimeoutMs;
    }
    
    public static String inboxTopic(int domain) {
        return TOPIC_PREFIX + Integer.toUnsignedString(domain);
    }
    
    @Override
    public String getAddress() {
        return address;
    }
    
    @Override
    public int getLocalDomain() {
        return localDomain;
    }
    
    @Override
    public String dispatch(String sender, int destinationDomain, String recipient, byte[] body) {
        String messageId = MessageIds.compute(localDomain, sender, body);
        MailboxEnvelope envelope = MailboxEnvelope.builder()
            .messageId(messageId)
            .originDomain(localDomain)
            .sender(Addresses.normalize(sender))
            .destinationDomain(destinationDomain)
            .recipient(Addresses.normalize(recipient))
            .body(body)
            .dispatchedAt(Instant.now())
            .build();
        
        String topic = inboxTopic(destinationDomain);
        try {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, messageId, envelope))
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.info("Dispatched message {} to {} (partition={}, offset={})",
                messageId, topic, metadata.partition(), metadata.offset());
            return messageId;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException(BridgeErrorCode.DISPATCH_FAILED, "Interrupted dispatching " + messageId, e);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to dispatch message {} to {}", messageId, topic, e);
            throw new BridgeException(BridgeErrorCode.DISPATCH_FAILED, "Failed to dispatch " + messageId, e);
        }
    }
}
