package io.scalex.bridge.gateway.api;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.error.BridgeErrorResponses;
import io.scalex.bridge.error.BridgeException;
import io.scalex.bridge.gateway.SourceGatewayService;
import io.scalex.bridge.gateway.api.dto.ApprovalRequest;
import io.scalex.bridge.gateway.api.dto.DepositRequest;
import io.scalex.bridge.gateway.api.dto.GatewayConfigRequest;
import io.scalex.bridge.token.FungibleToken;
import io.scalex.bridge.token.TokenDirectory;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST Controller for the source gateway.
 * 
 * The caller identity (depositor or owner) comes from the X-Bridge-Caller header.
 */
@RestController
@RequestMapping("/api/gateway")
public class SourceGatewayController {
    
    private static final Logger log = LoggerFactory.getLogger(SourceGatewayController.class);
    static final String CALLER_HEADER = "X-Bridge-Caller";
    
    private final SourceGatewayService gateway;
    private final TokenDirectory tokenDirectory;
    
    public SourceGatewayController(SourceGatewayService gateway, TokenDirectory tokenDirectory) {
        this.gateway = gateway;
        this.tokenDirectory = tokenDirectory;
    }
    
    @PostMapping("/deposits")
    public ResponseEntity<?> deposit(@RequestHeader(CALLER_HEADER) String caller,
                                     @Valid @RequestBody DepositRequest request) {
        try {
            String recipient = request.getRecipient() != null ? request.getRecipient() : caller;
            String messageId = gateway.deposit(caller, request.getToken(), request.getAmount(), recipient);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "messageId", messageId,
                "token", request.getToken(),
                "amount", request.getAmount(),
                "recipient", recipient
            ));
        } catch (BridgeException e) {
            log.warn("Deposit rejected for {}: {}", caller, e.getMessage());
            return BridgeErrorResponses.of(e);
        }
    }
    
    @GetMapping("/whitelist")
    public ResponseEntity<List<String>> getWhitelist() {
        return ResponseEntity.ok(gateway.getWhitelistedTokens());
    }
    
    @GetMapping("/whitelist/{token}")
    public ResponseEntity<Map<String, Object>> isWhitelisted(@PathVariable String token) {
        return ResponseEntity.ok(Map.of(
            "token", token,
            "whitelisted", gateway.isTokenWhitelisted(token)
        ));
    }
    
    @PutMapping("/whitelist/{token}")
    public ResponseEntity<?> addToWhitelist(@RequestHeader(CALLER_HEADER) String caller, @PathVariable String token) {
        try {
            gateway.addWhitelistedToken(caller, token);
            return ResponseEntity.ok(Map.of("token", Addresses.normalize(token), "whitelisted", true));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @DeleteMapping("/whitelist/{token}")
    public ResponseEntity<?> removeFromWhitelist(@RequestHeader(CALLER_HEADER) String caller,
                                                 @PathVariable String token) {
        try {
            gateway.removeWhitelistedToken(caller, token);
            return ResponseEntity.noContent().build();
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @GetMapping("/token-mappings/{token}")
    public ResponseEntity<?> getTokenMapping(@PathVariable String token) {
        try {
            return ResponseEntity.ok(Map.of(
                "token", Addresses.normalize(token),
                "syntheticToken", gateway.getTokenMapping(token)
            ));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @PutMapping("/token-mappings/{token}")
    public ResponseEntity<?> setTokenMapping(@RequestHeader(CALLER_HEADER) String caller,
                                             @PathVariable String token,
                                             @RequestParam String syntheticToken) {
        try {
            gateway.setTokenMapping(caller, token, syntheticToken);
            return ResponseEntity.ok(Map.of(
                "token", Addresses.normalize(token),
                "syntheticToken", gateway.getTokenMapping(token)
            ));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @GetMapping("/config")
    public ResponseEntity<?> getConfig() {
        return gateway.getCrossChainConfig()
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElse(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "NOT_CONFIGURED")));
    }
    
    /**
     * Re-point the gateway at a hub, keeping the currently wired transport.
     */
    @PutMapping("/config")
    public ResponseEntity<?> updateConfig(@RequestHeader(CALLER_HEADER) String caller,
                                          @Valid @RequestBody GatewayConfigRequest request) {
        try {
            return ResponseEntity.ok(gateway.updateCrossChainConfig(caller, gateway.getTransport(),
                request.getLocalDomain(), request.getDestinationDomain(), request.getDestinationGateway()));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @GetMapping("/messages/{messageId}")
    public ResponseEntity<Map<String, Object>> getMessageStatus(@PathVariable String messageId) {
        return ResponseEntity.ok(Map.of(
            "messageId", messageId,
            "processed", gateway.isMessageProcessed(messageId)
        ));
    }
    
    @GetMapping("/users/{user}/nonce")
    public ResponseEntity<?> getUserNonce(@PathVariable String user) {
        try {
            return ResponseEntity.ok(Map.of("user", user, "nonce", gateway.getUserNonce(user)));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    /**
     * Custody and per-user locked balances of one collateral token.
     */
    @GetMapping("/locked/{token}")
    public ResponseEntity<?> getLocked(@PathVariable String token, @RequestParam(required = false) String user) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("token", Addresses.normalize(token));
            body.put("custody", gateway.getLockedBalance(token));
            if (user != null) {
                body.put("user", Addresses.normalize(user));
                body.put("lockedByUser", gateway.getLockedBalance(user, token));
            }
            return ResponseEntity.ok(body);
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    // Local network token operations, for demo wallets
    
    @GetMapping("/tokens/{token}/balances/{account}")
    public ResponseEntity<?> getTokenBalance(@PathVariable String token, @PathVariable String account) {
        try {
            Optional<FungibleToken> collateral = tokenDirectory.find(token);
            if (collateral.isEmpty()) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(Map.of(
                "token", collateral.get().getAddress(),
                "account", Addresses.normalize(account),
                "balance", collateral.get().balanceOf(account),
                "allowance", collateral.get().allowance(account, gateway.getAddress())
            ));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    /**
     * Approve the gateway to pull {@code amount} of {@code token} from the caller.
     */
    @PostMapping("/tokens/{token}/approvals")
    public ResponseEntity<?> approve(@RequestHeader(CALLER_HEADER) String caller,
                                     @PathVariable String token,
                                     @Valid @RequestBody ApprovalRequest request) {
        try {
            Optional<FungibleToken> collateral = tokenDirectory.find(token);
            if (collateral.isEmpty()) {
                return ResponseEntity.notFound().build();
            }
            collateral.get().approve(caller, gateway.getAddress(), request.getAmount());
            return ResponseEntity.ok(Map.of(
                "token", collateral.get().getAddress(),
                "owner", Addresses.normalize(caller),
                "spender", gateway.getAddress(),
                "allowance", request.getAmount()
            ));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
}
