package io.scalex.bridge.hub.api;

import io.scalex.bridge.canonical.ChainEndpoint;
import io.scalex.bridge.canonical.CrossChainConfig;
import io.scalex.bridge.canonical.TokenMapping;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeErrorResponses;
import io.scalex.bridge.error.BridgeException;
import io.scalex.bridge.hub.api.dto.ChainEndpointRequest;
import io.scalex.bridge.hub.api.dto.TokenMappingRequest;
import io.scalex.bridge.hub.api.dto.WithdrawRequest;
import io.scalex.bridge.hub.asset.SyntheticAsset;
import io.scalex.bridge.hub.asset.SyntheticAssetFactory;
import io.scalex.bridge.hub.ledger.HubLedgerService;
import io.scalex.bridge.hub.registry.ChainRegistry;
import io.scalex.bridge.hub.registry.TokenRegistry;
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

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST Controller for the hub ledger.
 * 
 * Admin operations take the caller identity from the X-Bridge-Caller header.
 */
@RestController
@RequestMapping("/api/hub")
public class HubLedgerController {
    
    private static final Logger log = LoggerFactory.getLogger(HubLedgerController.class);
    static final String CALLER_HEADER = "X-Bridge-Caller";
    
    private final HubLedgerService hubLedger;
    private final ChainRegistry chainRegistry;
    private final SyntheticAssetFactory syntheticAssetFactory;
    
    public HubLedgerController(HubLedgerService hubLedger, ChainRegistry chainRegistry,
                               SyntheticAssetFactory syntheticAssetFactory) {
        this.hubLedger = hubLedger;
        this.chainRegistry = chainRegistry;
        this.syntheticAssetFactory = syntheticAssetFactory;
    }
    
    @GetMapping("/balances/{user}/{asset}")
    public ResponseEntity<?> getBalance(@PathVariable String user, @PathVariable String asset) {
        try {
            return ResponseEntity.ok(Map.of(
                "user", user,
                "asset", asset,
                "balance", hubLedger.getBalance(user, asset)
            ));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @GetMapping("/messages/{messageId}")
    public ResponseEntity<Map<String, Object>> getMessageStatus(@PathVariable String messageId) {
        return ResponseEntity.ok(Map.of(
            "messageId", messageId,
            "processed", hubLedger.isMessageProcessed(messageId)
        ));
    }
    
    @GetMapping("/users/{user}/processed-count")
    public ResponseEntity<?> getProcessedCount(@PathVariable String user) {
        try {
            return ResponseEntity.ok(Map.of(
                "user", user,
                "processedCount", hubLedger.getUserProcessedCount(user),
                "withdrawNonce", hubLedger.getUserNonce(user)
            ));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @GetMapping("/chains")
    public ResponseEntity<List<ChainEndpoint>> getChains() {
        return ResponseEntity.ok(chainRegistry.getAllChains());
    }
    
    @GetMapping("/chains/{domain}")
    public ResponseEntity<ChainEndpoint> getChain(@PathVariable int domain) {
        return hubLedger.getChainEndpoint(domain)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
    
    /**
     * Set (or replace) a chain's trusted gateway; optionally flip its status.
     */
    @PutMapping("/chains/{domain}")
    public ResponseEntity<?> setChain(@RequestHeader(CALLER_HEADER) String caller,
                                      @PathVariable int domain,
                                      @Valid @RequestBody ChainEndpointRequest request) {
        try {
            ChainEndpoint endpoint = request.getName() != null
                ? chainRegistry.setChainEndpoint(caller, domain, request.getGatewayAddress(), request.getName())
                : hubLedger.setChainEndpoint(caller, domain, request.getGatewayAddress());
            if (request.getActive() != null && !request.getActive()) {
                endpoint = chainRegistry.setChainStatus(caller, domain, false);
            }
            return ResponseEntity.ok(endpoint);
        } catch (BridgeException e) {
            log.warn("Chain endpoint update rejected for domain {}: {}", domain, e.getMessage());
            return BridgeErrorResponses.of(e);
        }
    }
    
    @DeleteMapping("/chains/{domain}")
    public ResponseEntity<?> removeChain(@RequestHeader(CALLER_HEADER) String caller, @PathVariable int domain) {
        try {
            chainRegistry.removeChainEndpoint(caller, domain);
            return ResponseEntity.noContent().build();
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @GetMapping("/config")
    public ResponseEntity<?> getConfig() {
        return hubLedger.getCrossChainConfig()
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElse(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "NOT_CONFIGURED")));
    }
    
    /**
     * Re-point the ledger's local domain on the currently wired transport.
     */
    @PutMapping("/config")
    public ResponseEntity<?> updateConfig(@RequestHeader(CALLER_HEADER) String caller,
                                          @RequestParam int localDomain) {
        try {
            return ResponseEntity.ok(
                hubLedger.updateCrossChainConfig(caller, hubLedger.getTransport(), localDomain));
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @PostMapping("/withdrawals")
    public ResponseEntity<?> requestWithdraw(@Valid @RequestBody WithdrawRequest request) {
        try {
            String recipient = request.getRecipient() != null ? request.getRecipient() : request.getUser();
            String messageId = hubLedger.requestWithdraw(request.getUser(), request.getSyntheticToken(),
                request.getAmount(), request.getTargetDomain(), recipient);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "messageId", messageId,
                "user", request.getUser(),
                "amount", request.getAmount(),
                "targetDomain", request.getTargetDomain()
            ));
        } catch (BridgeException e) {
            log.warn("Withdrawal rejected for {}: {}", request.getUser(), e.getMessage());
            return BridgeErrorResponses.of(e);
        }
    }
    
    @GetMapping("/token-mappings")
    public ResponseEntity<?> getTokenMappings(@RequestParam int sourceDomain,
                                              @RequestParam(required = false) String sourceToken,
                                              @RequestParam(required = false) Integer targetDomain) {
        if (sourceToken == null) {
            return ResponseEntity.ok(registry().getChainTokens(sourceDomain));
        }
        try {
            Optional<TokenMapping> mapping = registry().getTokenMapping(sourceDomain, sourceToken,
                targetDomain != null ? targetDomain : localDomain());
            return mapping.<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    @PutMapping("/token-mappings")
    public ResponseEntity<?> putTokenMapping(@RequestHeader(CALLER_HEADER) String caller,
                                             @Valid @RequestBody TokenMappingRequest request) {
        int targetDomain = request.getTargetDomain() != null ? request.getTargetDomain() : localDomain();
        try {
            TokenMapping mapping = registry().updateTokenMapping(caller, request.getSourceDomain(),
                request.getSourceToken(), targetDomain, request.getSyntheticToken(), request.getSyntheticDecimals());
            if (request.getActive() != null && !request.getActive()) {
                mapping = registry().setTokenMappingStatus(caller, request.getSourceDomain(),
                    request.getSourceToken(), targetDomain, false);
            }
            return ResponseEntity.ok(mapping);
        } catch (BridgeException e) {
            log.warn("Token mapping update rejected: {}", e.getMessage());
            return BridgeErrorResponses.of(e);
        }
    }
    
    @DeleteMapping("/token-mappings")
    public ResponseEntity<?> removeTokenMapping(@RequestHeader(CALLER_HEADER) String caller,
                                                @RequestParam int sourceDomain,
                                                @RequestParam String sourceToken,
                                                @RequestParam(required = false) Integer targetDomain) {
        try {
            registry().removeTokenMapping(caller, sourceDomain, sourceToken,
                targetDomain != null ? targetDomain : localDomain());
            return ResponseEntity.noContent().build();
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    /**
     * Conservation audit for one synthetic asset: ledger credits against the
     * custody balance and total supply of the token.
     */
    @GetMapping("/assets/{asset}/audit")
    public ResponseEntity<?> audit(@PathVariable String asset) {
        try {
            Optional<SyntheticAsset> token = syntheticAssetFactory.find(asset);
            if (token.isEmpty()) {
                return ResponseEntity.notFound().build();
            }
            BigInteger credited = hubLedger.getTotalCredited(token.get().getAddress());
            BigInteger custody = token.get().balanceOf(hubLedger.getAddress());
            BigInteger supply = token.get().totalSupply();
            
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("asset", token.get().getAddress());
            body.put("symbol", token.get().getSymbol());
            body.put("totalCredited", credited);
            body.put("custodyBalance", custody);
            body.put("totalSupply", supply);
            body.put("balanced", credited.equals(custody) && custody.equals(supply));
            return ResponseEntity.ok(body);
        } catch (BridgeException e) {
            return BridgeErrorResponses.of(e);
        }
    }
    
    private TokenRegistry registry() {
        return hubLedger.getTokenRegistry();
    }
    
    private int localDomain() {
        return hubLedger.getCrossChainConfig()
            .map(CrossChainConfig::getLocalDomain)
            .orElseThrow(() -> new BridgeException(BridgeErrorCode.NOT_CONFIGURED,
                "Hub ledger has no cross-chain configuration"));
    }
}
