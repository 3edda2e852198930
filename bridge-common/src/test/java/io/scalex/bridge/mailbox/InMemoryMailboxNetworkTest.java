package io.scalex.bridge.mailbox;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.codec.MessageIds;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryMailboxNetworkTest {
    
    private static final int HUB = 4661;
    private static final int SIDE = 421614;
    private static final String HUB_TRANSPORT = "0xa1";
    private static final String SIDE_TRANSPORT = "0xb1";
    
    private InMemoryMailboxNetwork network;
    private InMemoryMailbox sideMailbox;
    private RecordingRecipient hubRecipient;
    
    @BeforeEach
    public void setUp() {
        network = new InMemoryMailboxNetwork();
        InMemoryMailbox hubMailbox = network.mailbox(HUB, HUB_TRANSPORT);
        sideMailbox = network.mailbox(SIDE, SIDE_TRANSPORT);
        hubRecipient = new RecordingRecipient("0x5a1e");
        hubMailbox.register(hubRecipient);
    }
    
    @Test
    public void testDispatchWaitsForDelivery() {
        String id = sideMailbox.dispatch("0x6a7e", HUB, "0x5a1e", new byte[] {1});
        
        assertEquals(MessageIds.compute(SIDE, "0x6a7e", new byte[] {1}), id);
        assertEquals(1, network.pendingFor(HUB).size());
        assertTrue(hubRecipient.bodies.isEmpty());
        
        assertEquals(1, network.deliverAll());
        assertEquals(1, hubRecipient.bodies.size());
        assertEquals(Addresses.normalize(HUB_TRANSPORT), hubRecipient.callers.get(0),
            "the destination transport is the caller");
        assertTrue(network.pending().isEmpty());
    }
    
    @Test
    public void testRedeliveryOfDeliveredEnvelope() {
        sideMailbox.dispatch("0x6a7e", HUB, "0x5a1e", new byte[] {1});
        MailboxEnvelope envelope = network.pending().get(0);
        network.deliverAll();
        
        network.deliver(envelope);
        assertEquals(2, hubRecipient.bodies.size());
    }
    
    @Test
    public void testRejectedEnvelopeStaysPending() {
        hubRecipient.rejecting = true;
        sideMailbox.dispatch("0x6a7e", HUB, "0x5a1e", new byte[] {1});
        sideMailbox.dispatch("0x6a7e", HUB, "0x5a1e", new byte[] {2});
        
        assertEquals(0, network.deliverAllShuffled(new Random(7)));
        assertEquals(2, network.pending().size());
        
        hubRecipient.rejecting = false;
        assertEquals(2, network.deliverAll());
    }
    
    @Test
    public void testDropLosesEnvelope() {
        String id = sideMailbox.dispatch("0x6a7e", HUB, "0x5a1e", new byte[] {1});
        
        assertTrue(network.drop(id));
        assertFalse(network.findPending(id).isPresent());
        assertEquals(0, network.deliverAll());
    }
    
    @Test
    public void testUnknownRecipientNotConfigured() {
        sideMailbox.dispatch("0x6a7e", HUB, "0xdead", new byte[] {1});
        
        BridgeException e = assertThrows(BridgeException.class, () -> network.deliver(network.pending().get(0)));
        assertEquals(BridgeErrorCode.NOT_CONFIGURED, e.getCode());
    }
}
