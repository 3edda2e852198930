package io.scalex.bridge.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MessageIdsTest {
    
    private static final String SENDER = "0x6a7e000000000000000000000000000000421614";
    private static final byte[] BODY = {1, 2, 3};
    
    @Test
    public void testDeterministicKeccakHex() {
        String id = MessageIds.compute(421614, SENDER, BODY);
        
        assertEquals(id, MessageIds.compute(421614, SENDER.toUpperCase().replace("0X", "0x"), BODY.clone()));
        assertTrue(id.matches("0x[0-9a-f]{64}"), id);
    }
    
    @Test
    public void testOriginSenderAndBodyAllBindTheId() {
        String id = MessageIds.compute(421614, SENDER, BODY);
        
        assertNotEquals(id, MessageIds.compute(84532, SENDER, BODY));
        assertNotEquals(id, MessageIds.compute(421614, "0xbeef", BODY));
        assertNotEquals(id, MessageIds.compute(421614, SENDER, new byte[] {1, 2, 4}));
    }
    
    @Test
    public void testKnownVector() {
        // keccak256(0x00066eee ++ 12 zero bytes ++ sender ++ 0x010203)
        assertEquals("0xf94a8e8ca7d9aa13229827de38e93e53a5f6c016356f94f5f6d61275678f0366",
            MessageIds.compute(421614, SENDER, BODY));
    }
}
