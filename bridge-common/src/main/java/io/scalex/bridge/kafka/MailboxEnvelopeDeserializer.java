package io.scalex.bridge.kafka;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.scalex.bridge.mailbox.MailboxEnvelope;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka deserializer for MailboxEnvelope using Jackson JSON deserialization.
 * 
 * Thread-safe: ObjectMapper is thread-safe after configuration.
 */
public class MailboxEnvelopeDeserializer implements Deserializer<MailboxEnvelope> {
    
    private static final Logger log = LoggerFactory.getLogger(MailboxEnvelopeDeserializer.class);
    
    private final ObjectMapper objectMapper;
    
    public MailboxEnvelopeDeserializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
    
    @Override
    public MailboxEnvelope deserialize(String topic, byte[] data) {
        if (data == null) {
            return null;
        }
        
        try {
            return objectMapper.readValue(data, MailboxEnvelope.class);
        } catch (Exception e) {
            log.error("Failed to deserialize MailboxEnvelope from topic: {}", topic, e);
            throw new SerializationException("Failed to deserialize MailboxEnvelope", e);
        }
    }
    
    @Override
    public void close() {
        // ObjectMapper doesn't require cleanup
    }
}
