package io.scalex.bridge.hub.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scalex.bridge.hub.asset.SyntheticAssetFactory;
import io.scalex.bridge.hub.registry.ChainRegistry;
import io.scalex.bridge.hub.registry.TokenRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the startup topology (chains, synthetic assets, token mappings) from a
 * classpath JSON file, acting as the configured owner.
 * 
 * A missing file leaves the registries empty. A malformed file fails startup.
 */
@Slf4j
@Component
public class HubTopologyLoader {
    
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    private final ChainRegistry chainRegistry;
    private final TokenRegistry tokenRegistry;
    private final SyntheticAssetFactory syntheticAssetFactory;
    
    @Value("${bridge.owner}")
    private String owner;
    
    @Value("${bridge.local-domain}")
    private int localDomain;
    
    @Value("${bridge.topology.file:data/hub_topology.json}")
    private String topologyFile;
    
    public HubTopologyLoader(ChainRegistry chainRegistry, TokenRegistry tokenRegistry,
                             SyntheticAssetFactory syntheticAssetFactory) {
        this.chainRegistry = chainRegistry;
        this.tokenRegistry = tokenRegistry;
        this.syntheticAssetFactory = syntheticAssetFactory;
    }
    
    @PostConstruct
    public void loadTopology() throws IOException {
        ClassPathResource resource = new ClassPathResource(topologyFile);
        if (!resource.exists()) {
            log.warn("Topology file not found: {}. Starting with empty registries.", topologyFile);
            return;
        }
        
        try (InputStream is = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(is);
            
            int chains = 0;
            for (JsonNode chain : root.path("chains")) {
                chainRegistry.setChainEndpoint(owner,
                    chain.path("domain").asInt(),
                    chain.path("gateway").asText(),
                    chain.path("name").asText(null));
                chains++;
            }
            
            int assets = 0;
            for (JsonNode asset : root.path("synthetic_assets")) {
                syntheticAssetFactory.createSyntheticToken(owner,
                    asset.path("address").asText(),
                    asset.path("source_domain").asInt(),
                    asset.path("source_token").asText(),
                    asset.path("name").asText(),
                    asset.path("symbol").asText(),
                    asset.path("decimals").asInt());
                assets++;
            }
            
            int mappings = 0;
            for (JsonNode mapping : root.path("token_mappings")) {
                tokenRegistry.registerTokenMapping(owner,
                    mapping.path("source_domain").asInt(),
                    mapping.path("source_token").asText(),
                    mapping.path("target_domain").asInt(localDomain),
                    mapping.path("synthetic_token").asText(),
                    mapping.path("synthetic_decimals").asInt());
                mappings++;
            }
            
            log.info("Loaded topology from {}: {} chains, {} synthetic assets, {} token mappings",
                topologyFile, chains, assets, mappings);
        }
    }
}
