package io.scalex.bridge.kafka;

import io.scalex.bridge.mailbox.MailboxEnvelope;
import io.scalex.bridge.mailbox.ParkedDeliveryStore;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumes one domain's inbox topic and delivers each envelope to its local recipient.
 * 
 * Offsets are committed manually after each record is either delivered or parked,
 * so a crash between delivery and commit redelivers the record. Recipients
 * deduplicate by message id, which makes that redelivery harmless.
 */
public class KafkaMailboxListener {
    
    private static final Logger log = LoggerFactory.getLogger(KafkaMailboxListener.class);
    
    private final Consumer<String, MailboxEnvelope> consumer;
    private final ParkedDeliveryStore parkedDeliveryStore;
    private final String topic;
    
    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    
    public KafkaMailboxListener(Consumer<String, MailboxEnvelope> consumer,
                                ParkedDeliveryStore parkedDeliveryStore,
                                int localDomain) {
        this.consumer = consumer;
        this.parkedDeliveryStore = parkedDeliveryStore;
        this.topic = KafkaMailbox.inboxTopic(localDomain);
    }
    
    public String getTopic() {
        return topic;
    }
    
    public void start() {
        log.info("Starting mailbox listener on {}", topic);
        consumer.subscribe(Collections.singletonList(topic));
        running.set(true);
        executorService = Executors.newSingleThreadExecutor();
        executorService.submit(this::processEnvelopes);
    }
    
    public void stop() {
        log.info("Shutting down mailbox listener on {}", topic);
        
        running.set(false);
        
        if (executorService != null) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        
        consumer.close();
        log.info("Mailbox listener on {} shut down", topic);
    }
    
    private void processEnvelopes() {
        log.info("Mailbox processing thread started for {}", topic);
        
        while (running.get()) {
            try {
                pollOnce(Duration.ofSeconds(1));
            } catch (Exception e) {
                log.error("Error in mailbox processing loop for {}", topic, e);
            }
        }
        
        log.info("Mailbox processing thread stopped for {}", topic);
    }
    
    /**
     * Poll once and deliver every record received.
     *
     * @return number of records processed
     */
    public int pollOnce(Duration timeout) {
        ConsumerRecords<String, MailboxEnvelope> records = consumer.poll(timeout);
        int processed = 0;
        
        for (ConsumerRecord<String, MailboxEnvelope> record : records) {
            MailboxEnvelope envelope = record.value();
            if (envelope == null) {
                log.warn("Skipping empty record at {}-{} offset {}", record.topic(), record.partition(), record.offset());
            } else {
                parkedDeliveryStore.deliverOrPark(envelope);
            }
            consumer.commitSync();
            processed++;
        }
        
        return processed;
    }
}
