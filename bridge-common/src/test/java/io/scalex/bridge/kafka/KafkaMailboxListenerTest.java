package io.scalex.bridge.kafka;

import io.scalex.bridge.mailbox.MailboxDelivery;
import io.scalex.bridge.mailbox.MailboxEnvelope;
import io.scalex.bridge.mailbox.MessageRecipient;
import io.scalex.bridge.mailbox.ParkedDelivery;
import io.scalex.bridge.mailbox.ParkedDeliveryStore;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Listener tests: every record is delivered or parked, then committed.
 */
public class KafkaMailboxListenerTest {
    
    private static final int HUB = 4661;
    private static final String TOPIC = "bridge.mailbox.4661";
    
    private final TopicPartition partition = new TopicPartition(TOPIC, 0);
    private MockConsumer<String, MailboxEnvelope> consumer;
    private ParkedDeliveryStore parkedDeliveryStore;
    private final List<String> handled = new ArrayList<>();
    
    @BeforeEach
    public void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.assign(Collections.singletonList(partition));
        consumer.updateBeginningOffsets(Map.of(partition, 0L));
        
        MailboxDelivery delivery = new MailboxDelivery("0xa1", HUB);
        delivery.register(new MessageRecipient() {
            @Override
            public String getAddress() {
                return "0x5a1e";
            }
            
            @Override
            public void handle(String caller, int originDomain, String sender, byte[] body) {
                if (body[0] == 0) {
                    throw new BridgeException(BridgeErrorCode.UNMAPPED_TOKEN, "no mapping");
                }
                handled.add(sender);
            }
        });
        parkedDeliveryStore = new ParkedDeliveryStore(delivery);
    }
    
    private MailboxEnvelope envelope(String id, byte marker) {
        return MailboxEnvelope.builder()
            .messageId(id)
            .originDomain(421614)
            .sender("0x6a7e")
            .destinationDomain(HUB)
            .recipient("0x5a1e")
            .body(new byte[] {marker})
            .build();
    }
    
    @Test
    public void testTopicFollowsLocalDomain() {
        assertEquals(TOPIC, new KafkaMailboxListener(consumer, parkedDeliveryStore, HUB).getTopic());
    }
    
    @Test
    public void testDeliversParksAndCommits() {
        KafkaMailboxListener listener = new KafkaMailboxListener(consumer, parkedDeliveryStore, HUB);
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "0x01", envelope("0x01", (byte) 1)));
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "0x02", envelope("0x02", (byte) 0)));
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 2L, "0x03", null));
        
        assertEquals(3, listener.pollOnce(Duration.ofMillis(10)));
        
        assertEquals(1, handled.size());
        ParkedDelivery parked = parkedDeliveryStore.get("0x02").orElseThrow();
        assertEquals(BridgeErrorCode.UNMAPPED_TOKEN, parked.getErrorCode());
        
        OffsetAndMetadata committed = consumer.committed(Collections.singleton(partition)).get(partition);
        assertNotNull(committed);
        assertEquals(3L, committed.offset());
    }
}
