package io.scalex.bridge.mailbox;

import io.scalex.bridge.error.BridgeErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parked delivery tests.
 * 
 * A rejected delivery is parked under its message id and can be retried
 * once the recipient accepts it.
 */
public class ParkedDeliveryStoreTest {
    
    private static final int HUB = 4661;
    
    private RecordingRecipient recipient;
    private ParkedDeliveryStore store;
    
    @BeforeEach
    public void setUp() {
        MailboxDelivery delivery = new MailboxDelivery("0xa1", HUB);
        recipient = new RecordingRecipient("0x5a1e");
        delivery.register(recipient);
        store = new ParkedDeliveryStore(delivery);
    }
    
    private MailboxEnvelope envelope(String id) {
        return MailboxEnvelope.builder()
            .messageId(id)
            .originDomain(421614)
            .sender("0x6a7e")
            .destinationDomain(HUB)
            .recipient("0x5a1e")
            .body(new byte[] {1})
            .build();
    }
    
    @Test
    public void testAcceptedDeliveryIsNotParked() {
        assertTrue(store.deliverOrPark(envelope("0x01")));
        assertEquals(0, store.size());
    }
    
    @Test
    public void testRejectedDeliveryParkedThenRetried() {
        recipient.rejecting = true;
        assertFalse(store.deliverOrPark(envelope("0x01")));
        assertFalse(store.deliverOrPark(envelope("0x01")));
        
        ParkedDelivery parked = store.get("0x01").orElseThrow();
        assertEquals(ParkedDelivery.ParkStatus.PARKED, parked.getStatus());
        assertEquals(BridgeErrorCode.UNMAPPED_TOKEN, parked.getErrorCode());
        assertEquals(2, parked.getAttempts(), "redelivery updates the same record");
        
        recipient.rejecting = false;
        ParkedDelivery retried = store.retry("0x01").orElseThrow();
        assertEquals(ParkedDelivery.ParkStatus.DELIVERED, retried.getStatus());
        assertTrue(store.getParked().isEmpty());
        assertFalse(store.get("0x01").isPresent(), "delivered records are dropped");
        assertFalse(store.retry("0x01").isPresent());
        assertEquals(1, recipient.bodies.size());
    }
    
    @Test
    public void testRetryAll() {
        recipient.rejecting = true;
        store.deliverOrPark(envelope("0x01"));
        store.deliverOrPark(envelope("0x02"));
        assertEquals(0, store.retryAll());
        
        recipient.rejecting = false;
        assertEquals(2, store.retryAll());
        assertTrue(store.getParked().isEmpty());
        assertEquals(0, store.size());
    }
    
    @Test
    public void testStoreHoldsOnlyWaitingDeliveries() {
        recipient.rejecting = true;
        for (int i = 0; i < 50; i++) {
            store.deliverOrPark(envelope("0x" + Integer.toHexString(i)));
        }
        assertEquals(50, store.size());
        
        recipient.rejecting = false;
        store.retryAll();
        store.deliverOrPark(envelope("0xff"));
        
        assertEquals(0, store.size());
        assertEquals(51, recipient.bodies.size());
    }
    
    @Test
    public void testRetryUnknownIsEmpty() {
        assertFalse(store.retry("0x99").isPresent());
    }
}
