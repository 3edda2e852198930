package io.scalex.bridge.hub.registry;

import io.scalex.bridge.access.OwnershipGuard;
import io.scalex.bridge.canonical.TokenMapping;
import io.scalex.bridge.canonical.TokenMappingKey;
import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Maps (source domain, source token, target domain) to the synthetic asset it
 * is minted as.
 * 
 * Decimals are stored for auditing only; amounts are never rescaled. Replacing
 * a mapping does not migrate balances already credited under the previous
 * synthetic asset, so two synthetics for the same underlying can coexist.
 */
public class TokenRegistry {

    private static final Logger log = LoggerFactory.getLogger(TokenRegistry.class);

    private static final int MAX_DECIMALS = 255;

    private final OwnershipGuard ownership;
    private final Map<TokenMappingKey, TokenMapping> mappings = new ConcurrentHashMap<>();

    public TokenRegistry(String owner) {
        this.ownership = new OwnershipGuard("TokenRegistry", owner);
    }

    public OwnershipGuard getOwnership() {
        return ownership;
    }

    /**
     * Create or overwrite a mapping. The mapping becomes active.
     */
    public TokenMapping registerTokenMapping(String caller, int sourceDomain, String sourceToken, int targetDomain,
                                             String syntheticToken, int syntheticDecimals) {
        ownership.checkOwner(caller, "registerTokenMapping");
        return put(sourceDomain, sourceToken, targetDomain, syntheticToken, syntheticDecimals, "registered");
    }

    /**
     * Same effect as {@link #registerTokenMapping}; used to correct a mapping.
     * Existing balances stay with the previous synthetic asset.
     */
    public TokenMapping updateTokenMapping(String caller, int sourceDomain, String sourceToken, int targetDomain,
                                           String syntheticToken, int syntheticDecimals) {
        ownership.checkOwner(caller, "updateTokenMapping");
        return put(sourceDomain, sourceToken, targetDomain, syntheticToken, syntheticDecimals, "updated");
    }

    public TokenMapping setTokenMappingStatus(String caller, int sourceDomain, String sourceToken, int targetDomain,
                                              boolean active) {
        ownership.checkOwner(caller, "setTokenMappingStatus");
        TokenMapping updated = mappings.computeIfPresent(key(sourceDomain, sourceToken, targetDomain),
            (k, existing) -> existing.toBuilder()
                .active(active)
                .updatedAt(Instant.now().toString())
                .build());
        if (updated == null) {
            throw unmapped(sourceDomain, sourceToken, targetDomain);
        }
        log.info("Token mapping status changed: {}:{} -> {} active={}",
            sourceDomain, updated.getSourceToken(), targetDomain, active);
        return updated;
    }

    public void removeTokenMapping(String caller, int sourceDomain, String sourceToken, int targetDomain) {
        ownership.checkOwner(caller, "removeTokenMapping");
        if (mappings.remove(key(sourceDomain, sourceToken, targetDomain)) == null) {
            throw unmapped(sourceDomain, sourceToken, targetDomain);
        }
        log.info("Token mapping removed: {}:{} -> {}", sourceDomain, Addresses.normalize(sourceToken), targetDomain);
    }

    /**
     * @return synthetic asset address, or {@link Addresses#ZERO} if unmapped
     */
    public String getSyntheticToken(int sourceDomain, String sourceToken, int targetDomain) {
        return getTokenMapping(sourceDomain, sourceToken, targetDomain)
            .map(TokenMapping::getSyntheticToken)
            .orElse(Addresses.ZERO);
    }

    public Optional<TokenMapping> getTokenMapping(int sourceDomain, String sourceToken, int targetDomain) {
        if (sourceToken == null || sourceToken.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.get(key(sourceDomain, sourceToken, targetDomain)));
    }

    public boolean isTokenMappingActive(int sourceDomain, String sourceToken, int targetDomain) {
        return getTokenMapping(sourceDomain, sourceToken, targetDomain)
            .map(TokenMapping::isActive)
            .orElse(false);
    }

    /**
     * Reverse lookup: the source token on {@code sourceDomain} currently mapped to
     * {@code syntheticToken} on {@code targetDomain}.
     *
     * @return source token address, or {@link Addresses#ZERO} if none
     */
    public String getSourceToken(int targetDomain, String syntheticToken, int sourceDomain) {
        return mappings.values().stream()
            .filter(m -> m.getTargetDomain() == targetDomain && m.getSourceDomain() == sourceDomain)
            .filter(m -> Addresses.same(m.getSyntheticToken(), syntheticToken))
            .map(TokenMapping::getSourceToken)
            .findFirst()
            .orElse(Addresses.ZERO);
    }

    public List<TokenMapping> getChainTokens(int sourceDomain) {
        return mappings.values().stream()
            .filter(m -> m.getSourceDomain() == sourceDomain)
            .collect(Collectors.toList());
    }

    private TokenMapping put(int sourceDomain, String sourceToken, int targetDomain,
                             String syntheticToken, int syntheticDecimals, String action) {
        if (Addresses.isZero(sourceToken)) {
            throw BridgeException.zeroAddress("source token");
        }
        if (Addresses.isZero(syntheticToken)) {
            throw BridgeException.zeroAddress("synthetic token");
        }
        if (syntheticDecimals < 0 || syntheticDecimals > MAX_DECIMALS) {
            throw new BridgeException(BridgeErrorCode.INVALID_AMOUNT, "Invalid synthetic decimals: " + syntheticDecimals);
        }
        TokenMappingKey key = key(sourceDomain, sourceToken, targetDomain);
        String now = Instant.now().toString();
        TokenMapping previous = mappings.get(key);
        TokenMapping mapping = TokenMapping.builder()
            .sourceDomain(sourceDomain)
            .sourceToken(key.getSourceToken())
            .targetDomain(targetDomain)
            .syntheticToken(Addresses.normalize(syntheticToken))
            .syntheticDecimals(syntheticDecimals)
            .active(true)
            .registeredAt(previous != null ? previous.getRegisteredAt() : now)
            .updatedAt(now)
            .build();
        mappings.put(key, mapping);
        if (previous != null && !Addresses.same(previous.getSyntheticToken(), mapping.getSyntheticToken())) {
            log.warn("Token mapping {}: {}:{} -> {} now mints {} (was {}); existing balances are not migrated",
                action, sourceDomain, key.getSourceToken(), targetDomain,
                mapping.getSyntheticToken(), previous.getSyntheticToken());
        } else {
            log.info("Token mapping {}: {}:{} -> {} mints {} ({} decimals)",
                action, sourceDomain, key.getSourceToken(), targetDomain, mapping.getSyntheticToken(), syntheticDecimals);
        }
        return mapping;
    }

    private static TokenMappingKey key(int sourceDomain, String sourceToken, int targetDomain) {
        return new TokenMappingKey(sourceDomain, Addresses.normalize(sourceToken), targetDomain);
    }

    private static BridgeException unmapped(int sourceDomain, String sourceToken, int targetDomain) {
        return new BridgeException(BridgeErrorCode.UNMAPPED_TOKEN,
            String.format("No token mapping for %d:%s -> %d", sourceDomain, sourceToken, targetDomain));
    }
}
