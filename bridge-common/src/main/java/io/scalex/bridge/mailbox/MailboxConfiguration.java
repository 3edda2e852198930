package io.scalex.bridge.mailbox;

import io.scalex.bridge.kafka.KafkaMailbox;
import io.scalex.bridge.kafka.KafkaMailboxListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.ProducerFactory;

/**
 * Mailbox transport wiring shared by the hub and gateway services.
 * 
 * {@code bridge.transport.mode} selects the implementation:
 * - kafka (default): KafkaMailbox + KafkaMailboxListener on this domain's inbox topic
 * - local: in-process InMemoryMailboxNetwork, nothing is delivered unless a caller does it
 * 
 * Configuration Properties:
 * - bridge.transport.address: address recipients authenticate deliveries against
 * - bridge.local-domain: domain of this service's network
 * - bridge.transport.send-timeout-ms: broker acknowledgment timeout for dispatch
 */
@Configuration
public class MailboxConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MailboxConfiguration.class);

    @Bean
    public ParkedDeliveryStore parkedDeliveryStore(MailboxDelivery mailboxDelivery) {
        return new ParkedDeliveryStore(mailboxDelivery);
    }

    @Configuration
    @ConditionalOnProperty(name = "bridge.transport.mode", havingValue = "kafka", matchIfMissing = true)
    static class KafkaTransportConfiguration {

        @Bean
        public MailboxDelivery mailboxDelivery(@Value("${bridge.transport.address}") String transportAddress,
                                               @Value("${bridge.local-domain}") int localDomain) {
            return new MailboxDelivery(transportAddress, localDomain);
        }

        @Bean
        public MessageTransport messageTransport(ProducerFactory<String, MailboxEnvelope> mailboxProducerFactory,
                                                 @Value("${bridge.transport.address}") String transportAddress,
                                                 @Value("${bridge.local-domain}") int localDomain,
                                                 @Value("${bridge.transport.send-timeout-ms:10000}") long sendTimeoutMs) {
            log.info("Using Kafka mailbox transport for domain {}", localDomain);
            return new KafkaMailbox(mailboxProducerFactory.createProducer(), transportAddress, localDomain, sendTimeoutMs);
        }

        @Bean(initMethod = "start", destroyMethod = "stop")
        public KafkaMailboxListener kafkaMailboxListener(ConsumerFactory<String, MailboxEnvelope> mailboxConsumerFactory,
                                                         ParkedDeliveryStore parkedDeliveryStore,
                                                         @Value("${bridge.local-domain}") int localDomain) {
            return new KafkaMailboxListener(mailboxConsumerFactory.createConsumer(), parkedDeliveryStore, localDomain);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "bridge.transport.mode", havingValue = "local")
    static class LocalTransportConfiguration {

        @Bean
        public InMemoryMailboxNetwork inMemoryMailboxNetwork() {
            return new InMemoryMailboxNetwork();
        }

        @Bean
        public InMemoryMailbox messageTransport(InMemoryMailboxNetwork inMemoryMailboxNetwork,
                                                @Value("${bridge.transport.address}") String transportAddress,
                                                @Value("${bridge.local-domain}") int localDomain) {
            log.info("Using in-memory mailbox transport for domain {}", localDomain);
            return inMemoryMailboxNetwork.mailbox(localDomain, transportAddress);
        }

        @Bean
        public MailboxDelivery mailboxDelivery(InMemoryMailbox messageTransport) {
            return messageTransport.getDelivery();
        }
    }
}
