package io.scalex.bridge.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.scalex.bridge.mailbox.MailboxEnvelope;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka serializer for MailboxEnvelope using Jackson JSON serialization.
 * 
 * The message body is written as base64 text, the dispatch time as ISO 8601.
 * 
 * Thread-safe: ObjectMapper is thread-safe after configuration.
 */
public class MailboxEnvelopeSerializer implements Serializer<MailboxEnvelope> {
    
    private static final Logger log = LoggerFactory.getLogger(MailboxEnvelopeSerializer.class);
    
    private final ObjectMapper objectMapper;
    
    public MailboxEnvelopeSerializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
    
    @Override
    public byte[] serialize(String topic, MailboxEnvelope data) {
        if (data == null) {
            return null;
        }
        
        try {
            return objectMapper.writeValueAsBytes(data);
        } catch (Exception e) {
            log.error("Failed to serialize MailboxEnvelope for topic: {}", topic, e);
            throw new SerializationException("Failed to serialize MailboxEnvelope", e);
        }
    }
    
    @Override
    public void close() {
        // ObjectMapper doesn't require cleanup
    }
}
