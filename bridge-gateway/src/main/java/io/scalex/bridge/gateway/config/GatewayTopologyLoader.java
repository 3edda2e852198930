package io.scalex.bridge.gateway.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scalex.bridge.gateway.SourceGatewayService;
import io.scalex.bridge.token.MintableToken;
import io.scalex.bridge.token.TokenDirectory;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;

/**
 * Loads the collateral tokens of this side network, their opening balances,
 * the whitelist and the synthetic token hints from a classpath JSON file.
 * 
 * Collateral tokens are minted by the configured owner.
 */
@Component
public class GatewayTopologyLoader {
    
    private static final Logger log = LoggerFactory.getLogger(GatewayTopologyLoader.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    private final TokenDirectory tokenDirectory;
    private final SourceGatewayService gateway;
    
    @Value("${bridge.owner}")
    private String owner;
    
    @Value("${bridge.topology.file:data/gateway_topology.json}")
    private String topologyFile;
    
    public GatewayTopologyLoader(TokenDirectory tokenDirectory, SourceGatewayService gateway) {
        this.tokenDirectory = tokenDirectory;
        this.gateway = gateway;
    }
    
    @PostConstruct
    public void loadTopology() throws IOException {
        ClassPathResource resource = new ClassPathResource(topologyFile);
        if (!resource.exists()) {
            log.warn("Topology file not found: {}. Starting without collateral tokens.", topologyFile);
            return;
        }
        
        try (InputStream is = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(is);
            
            for (JsonNode token : root.path("tokens")) {
                MintableToken collateral = new MintableToken(
                    token.path("address").asText(),
                    token.path("name").asText(),
                    token.path("symbol").asText(),
                    token.path("decimals").asInt(),
                    owner);
                tokenDirectory.register(collateral);
                
                for (JsonNode balance : token.path("balances")) {
                    collateral.mint(owner, balance.path("account").asText(),
                        new BigInteger(balance.path("amount").asText()));
                }
                if (token.path("whitelisted").asBoolean(false)) {
                    gateway.addWhitelistedToken(owner, collateral.getAddress());
                }
                if (token.hasNonNull("synthetic_token")) {
                    gateway.setTokenMapping(owner, collateral.getAddress(), token.path("synthetic_token").asText());
                }
            }
            
            log.info("Loaded topology from {}: {} tokens, {} whitelisted",
                topologyFile, tokenDirectory.all().size(), gateway.getWhitelistedTokens().size());
        }
    }
}
