package io.scalex.bridge.hub.registry;

import io.scalex.bridge.canonical.ChainEndpoint;
import io.scalex.bridge.canonical.enums.ChainStatus;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChainRegistryTest {
    
    private static final String OWNER = "0xaa";
    private static final String GATEWAY = "0x6a7e000000000000000000000000000000421614";
    
    private ChainRegistry registry;
    
    @BeforeEach
    public void setUp() {
        registry = new ChainRegistry(OWNER);
        registry.setChainEndpoint(OWNER, 421614, GATEWAY, "arbitrum-sepolia");
    }
    
    @Test
    public void testTrustedSenderIsRegisteredGatewayOnly() {
        assertTrue(registry.isTrustedSender(421614, GATEWAY.toUpperCase().replace("0X", "0x")));
        assertFalse(registry.isTrustedSender(421614, "0xbeef"));
        assertFalse(registry.isTrustedSender(84532, GATEWAY));
    }
    
    @Test
    public void testReplaceGateway() {
        ChainEndpoint endpoint = registry.setChainEndpoint(OWNER, 421614, "0xbeef");
        
        assertEquals(ChainStatus.ACTIVE, endpoint.getStatus());
        assertTrue(registry.isTrustedSender(421614, "0xbeef"));
        assertFalse(registry.isTrustedSender(421614, GATEWAY));
    }
    
    @Test
    public void testInactiveChainNotTrusted() {
        registry.setChainStatus(OWNER, 421614, false);
        
        assertFalse(registry.isTrustedSender(421614, GATEWAY));
        assertTrue(registry.getChainEndpoint(421614).isPresent());
        assertFalse(registry.getActiveEndpoint(421614).isPresent());
        assertTrue(registry.getActiveChains().isEmpty());
    }
    
    @Test
    public void testUnknownChainOperationsFail() {
        BridgeException status = assertThrows(BridgeException.class,
            () -> registry.setChainStatus(OWNER, 84532, true));
        assertEquals(BridgeErrorCode.CHAIN_NOT_FOUND, status.getCode());
        
        registry.removeChainEndpoint(OWNER, 421614);
        BridgeException remove = assertThrows(BridgeException.class,
            () -> registry.removeChainEndpoint(OWNER, 421614));
        assertEquals(BridgeErrorCode.CHAIN_NOT_FOUND, remove.getCode());
    }
    
    @Test
    public void testOwnerOnlyAndNonZeroGateway() {
        BridgeException auth = assertThrows(BridgeException.class,
            () -> registry.setChainEndpoint("0xbb", 84532, GATEWAY));
        assertEquals(BridgeErrorCode.UNAUTHORIZED, auth.getCode());
        
        BridgeException zero = assertThrows(BridgeException.class,
            () -> registry.setChainEndpoint(OWNER, 84532, "0x0"));
        assertEquals(BridgeErrorCode.ZERO_ADDRESS, zero.getCode());
    }
}
