package io.scalex.bridge.kafka;

import io.scalex.bridge.mailbox.MailboxEnvelope;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Spring Kafka configuration for the bridge mailbox.
 * 
 * Shared by the hub and gateway services. Only active when
 * {@code bridge.transport.mode=kafka} (the default).
 * 
 * Key Features:
 * - Manual offset commit: a record is committed after it was delivered or parked
 * - Idempotent producer with acks=all: a dispatch that returns was persisted
 * - JSON serialization using MailboxEnvelopeSerializer/Deserializer
 * 
 * Configuration Properties:
 * - kafka.bootstrap.servers: Kafka broker addresses (e.g., "localhost:9092")
 * - kafka.consumer.group-id: Consumer group ID (should be set per service)
 * - kafka.consumer.auto-offset-reset: Offset reset policy (default: "earliest")
 */
@Configuration
@ConditionalOnProperty(name = "bridge.transport.mode", havingValue = "kafka", matchIfMissing = true)
public class KafkaConfig {
    
    @Value("${kafka.bootstrap.servers:localhost:9092}")
    private String bootstrapServers;
    
    @Value("${kafka.consumer.group-id:bridge-mailbox-group}")
    private String groupId;
    
    @Value("${kafka.consumer.auto-offset-reset:earliest}")
    private String autoOffsetReset;
    
    /**
     * Producer factory for mailbox envelopes.
     * 
     * - Acks: all - dispatch must survive a leader failover, custody already moved
     * - Retries: 3 - handles transient failures
     * - Idempotence: broker-side dedup of producer retries
     */
    @Bean
    public ProducerFactory<String, MailboxEnvelope> mailboxProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, MailboxEnvelopeSerializer.class);
        
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, 16384); // 16KB batch size
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        
        return new DefaultKafkaProducerFactory<>(props);
    }
    
    /**
     * Consumer factory for mailbox envelopes.
     * 
     * - Manual offset commit (ENABLE_AUTO_COMMIT = false)
     * - Small poll batches: every record is applied and committed one by one
     */
    @Bean
    public ConsumerFactory<String, MailboxEnvelope> mailboxConsumerFactory() {
        Map<String, Object> props = new HashMap<>();
        
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, MailboxEnvelopeDeserializer.class);
        
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
        
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000); // 5 minutes max processing time
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000); // 30 seconds
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000); // 10 seconds
        
        return new DefaultKafkaConsumerFactory<>(props);
    }
}
