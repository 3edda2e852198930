package io.scalex.bridge.codec;

import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AddressesTest {
    
    @Test
    public void testNormalizePadsAndLowercases() {
        assertEquals("0x" + "0".repeat(24) + "75faf114eafb1bdbe2f0316df893fd58ce46aa4d",
            Addresses.normalize("0x75FAF114EAFB1BDBE2F0316DF893FD58CE46AA4D"));
        assertEquals(Addresses.normalize("0xabc"), Addresses.normalize("abc"));
    }
    
    @Test
    public void testInvalidAddressesRejected() {
        for (String bad : new String[] {"0x", "0xzz", "0x" + "1".repeat(65)}) {
            BridgeException e = assertThrows(BridgeException.class, () -> Addresses.normalize(bad));
            assertEquals(BridgeErrorCode.MALFORMED_MESSAGE, e.getCode());
        }
    }
    
    @Test
    public void testZeroAddress() {
        assertTrue(Addresses.isZero(null));
        assertTrue(Addresses.isZero(""));
        assertTrue(Addresses.isZero("0x0"));
        assertTrue(Addresses.isZero(Addresses.ZERO));
        assertFalse(Addresses.isZero("0x1"));
    }
    
    @Test
    public void testSame() {
        assertTrue(Addresses.same("0xABC", "0x0000abc"));
        assertFalse(Addresses.same("0xabc", "0xabd"));
        assertFalse(Addresses.same(null, "0xabc"));
    }
}
