package io.scalex.bridge.hub.api;

import io.scalex.bridge.canonical.BridgeMessage;
import io.scalex.bridge.canonical.enums.MessageKind;
import io.scalex.bridge.codec.BridgeMessageCodec;
import io.scalex.bridge.mailbox.InMemoryMailbox;
import io.scalex.bridge.mailbox.InMemoryMailboxNetwork;
import io.scalex.bridge.mailbox.ParkedDeliveryStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Hub service wired with the bundled topology and the in-memory transport.
 */
@SpringBootTest(properties = "bridge.transport.mode=local")
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
public class HubLedgerControllerTest {
    
    private static final int SIDE = 421614;
    private static final String OWNER = "0x00000000000000000000000000000000000000aa";
    private static final String GATEWAY = "0x6a7e000000000000000000000000000000421614";
    private static final String USDC = "0x75faf114eafb1bdbe2f0316df893fd58ce46aa4d";
    private static final String GS_USDC = "0x5a1e0000000000000000000000000000000000c1";
    private static final String ALICE = "0x00000000000000000000000000000000000a11ce";
    
    @Autowired
    private MockMvc mockMvc;
    
    @Autowired
    private InMemoryMailboxNetwork network;
    
    @Autowired
    private ParkedDeliveryStore parkedDeliveryStore;
    
    private String depositFromSide(String token, long amount) {
        InMemoryMailbox side = network.mailbox(SIDE, "0xb1");
        byte[] body = BridgeMessageCodec.encode(BridgeMessage.builder()
            .kind(MessageKind.DEPOSIT)
            .token(token)
            .recipient(ALICE)
            .amount(BigInteger.valueOf(amount))
            .originDomain(SIDE)
            .sequence(BigInteger.ZERO)
            .build());
        return side.dispatch(GATEWAY, 4661, "0x5a1e000000000000000000000000000000000001", body);
    }
    
    @Test
    public void testTopologyLoaded() throws Exception {
        mockMvc.perform(get("/api/hub/chains/421614"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("arbitrum-sepolia"))
            .andExpect(jsonPath("$.status").value("ACTIVE"));
        
        mockMvc.perform(get("/api/hub/token-mappings")
                .param("sourceDomain", "421614")
                .param("sourceToken", USDC))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.syntheticDecimals").value(6));
        
        mockMvc.perform(get("/api/hub/config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.localDomain").value(4661));
    }
    
    @Test
    public void testDepositThenWithdrawOverRest() throws Exception {
        String id = depositFromSide(USDC, 1_000);
        assertEquals(1, network.deliverAll());
        
        mockMvc.perform(get("/api/hub/messages/" + id))
            .andExpect(jsonPath("$.processed").value(true));
        mockMvc.perform(get("/api/hub/balances/" + ALICE + "/" + GS_USDC))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(1000));
        
        mockMvc.perform(post("/api/hub/withdrawals")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user\":\"" + ALICE + "\",\"syntheticToken\":\"" + GS_USDC
                    + "\",\"amount\":400,\"targetDomain\":421614}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.messageId").exists());
        
        mockMvc.perform(get("/api/hub/assets/" + GS_USDC + "/audit"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalCredited").value(600))
            .andExpect(jsonPath("$.balanced").value(true));
        
        mockMvc.perform(get("/api/hub/users/" + ALICE + "/processed-count"))
            .andExpect(jsonPath("$.processedCount").value(1))
            .andExpect(jsonPath("$.withdrawNonce").value(1));
    }
    
    @Test
    public void testWithdrawWithoutBalanceConflicts() throws Exception {
        mockMvc.perform(post("/api/hub/withdrawals")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user\":\"" + ALICE + "\",\"syntheticToken\":\"" + GS_USDC
                    + "\",\"amount\":1,\"targetDomain\":421614}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_BALANCE"));
    }
    
    @Test
    public void testAdminNeedsOwnerHeader() throws Exception {
        mockMvc.perform(put("/api/hub/chains/84532")
                .header("X-Bridge-Caller", ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"gatewayAddress\":\"0xbeef\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        
        mockMvc.perform(put("/api/hub/chains/84532")
                .header("X-Bridge-Caller", OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"gatewayAddress\":\"0xbeef\",\"name\":\"base-sepolia\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ACTIVE"));
    }
    
    @Test
    public void testUnmappedDepositParkedAndRetried() throws Exception {
        String unlisted = "0x0000000000000000000000000000000000d0d0e5";
        String id = depositFromSide(unlisted, 77);
        assertFalse(parkedDeliveryStore.deliverOrPark(network.findPending(id).orElseThrow()));
        
        mockMvc.perform(get("/api/mailbox/failures"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].parkId").value(id))
            .andExpect(jsonPath("$[0].errorCode").value("UNMAPPED_TOKEN"));
        
        mockMvc.perform(put("/api/hub/token-mappings")
                .header("X-Bridge-Caller", OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sourceDomain\":421614,\"sourceToken\":\"" + unlisted
                    + "\",\"syntheticToken\":\"" + GS_USDC + "\",\"syntheticDecimals\":6}"))
            .andExpect(status().isOk());
        
        mockMvc.perform(post("/api/mailbox/failures/" + id + "/retry"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DELIVERED"));
        mockMvc.perform(get("/api/mailbox/failures/" + id))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/hub/balances/" + ALICE + "/" + GS_USDC))
            .andExpect(jsonPath("$.balance").value(77));
    }
}
