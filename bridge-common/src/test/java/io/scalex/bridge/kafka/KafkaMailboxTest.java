package io.scalex.bridge.kafka;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.codec.MessageIds;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import io.scalex.bridge.mailbox.MailboxEnvelope;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class KafkaMailboxTest {
    
    private static final byte[] BODY = {1, 2, 3};
    
    @Test
    public void testDispatchWritesToDestinationInbox() {
        MockProducer<String, MailboxEnvelope> producer =
            new MockProducer<>(true, new StringSerializer(), new MailboxEnvelopeSerializer());
        KafkaMailbox mailbox = new KafkaMailbox(producer, "0xb1", 421614, 1000);
        
        String id = mailbox.dispatch("0x6a7e", 4661, "0x5a1e", BODY);
        
        assertEquals(MessageIds.compute(421614, "0x6a7e", BODY), id);
        assertEquals(1, producer.history().size());
        ProducerRecord<String, MailboxEnvelope> record = producer.history().get(0);
        assertEquals("bridge.mailbox.4661", record.topic());
        assertEquals(id, record.key());
        assertEquals(421614, record.value().getOriginDomain());
        assertEquals(Addresses.normalize("0x5a1e"), record.value().getRecipient());
        assertArrayEquals(BODY, record.value().getBody());
    }
    
    @Test
    public void testUnacknowledgedSendFailsDispatch() {
        MockProducer<String, MailboxEnvelope> producer =
            new MockProducer<>(false, new StringSerializer(), new MailboxEnvelopeSerializer());
        KafkaMailbox mailbox = new KafkaMailbox(producer, "0xb1", 421614, 50);
        
        BridgeException e = assertThrows(BridgeException.class,
            () -> mailbox.dispatch("0x6a7e", 4661, "0x5a1e", BODY));
        assertEquals(BridgeErrorCode.DISPATCH_FAILED, e.getCode());
    }
    
    @Test
    public void testInboxTopicIsUnsigned() {
        assertEquals("bridge.mailbox.4294967295", KafkaMailbox.inboxTopic(-1));
    }
    
    @Test
    public void testEnvelopeCarriesDispatchTimeAsIsoText() {
        Instant dispatchedAt = Instant.parse("2026-10-19T08:30:00Z");
        MailboxEnvelope envelope = MailboxEnvelope.builder()
            .messageId("0x01")
            .originDomain(421614)
            .sender(Addresses.normalize("0x6a7e"))
            .destinationDomain(4661)
            .recipient(Addresses.normalize("0x5a1e"))
            .body(BODY)
            .dispatchedAt(dispatchedAt)
            .build();
        
        byte[] json = new MailboxEnvelopeSerializer().serialize("bridge.mailbox.4661", envelope);
        assertTrue(new String(json, StandardCharsets.UTF_8).contains("\"dispatchedAt\":\"2026-10-19T08:30:00Z\""));
        
        MailboxEnvelope decoded = new MailboxEnvelopeDeserializer().deserialize("bridge.mailbox.4661", json);
        assertEquals(dispatchedAt, decoded.getDispatchedAt());
        assertArrayEquals(BODY, decoded.getBody());
    }
}
