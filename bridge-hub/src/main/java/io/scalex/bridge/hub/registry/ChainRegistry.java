package io.scalex.bridge.hub.registry;

import io.scalex.bridge.access.OwnershipGuard;
import io.scalex.bridge.canonical.ChainEndpoint;
import io.scalex.bridge.canonical.enums.ChainStatus;
import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of remote domains and the single gateway trusted on each.
 * 
 * Inbound messages are authenticated against this registry: a message is
 * trusted only if its origin domain is registered, active, and the sender is
 * the registered gateway. Entries are created and replaced by the owner only;
 * nothing is discovered automatically.
 */
public class ChainRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChainRegistry.class);

    private final OwnershipGuard ownership;
    private final Map<Integer, ChainEndpoint> endpoints = new ConcurrentHashMap<>();

    public ChainRegistry(String owner) {
        this.ownership = new OwnershipGuard("ChainRegistry", owner);
    }

    public OwnershipGuard getOwnership() {
        return ownership;
    }

    public ChainEndpoint setChainEndpoint(String caller, int domain, String gatewayAddress) {
        return setChainEndpoint(caller, domain, gatewayAddress, null);
    }

    /**
     * Register or replace the trusted gateway of a domain. The entry becomes ACTIVE.
     */
    public ChainEndpoint setChainEndpoint(String caller, int domain, String gatewayAddress, String name) {
        ownership.checkOwner(caller, "setChainEndpoint");
        if (Addresses.isZero(gatewayAddress)) {
            throw BridgeException.zeroAddress("gateway address");
        }
        ChainEndpoint endpoint = ChainEndpoint.builder()
            .domain(domain)
            .gatewayAddress(Addresses.normalize(gatewayAddress))
            .name(name)
            .status(ChainStatus.ACTIVE)
            .updatedAt(Instant.now().toString())
            .build();
        ChainEndpoint previous = endpoints.put(domain, endpoint);
        if (previous == null) {
            log.info("Chain registered: domain={}, gateway={}, name={}", domain, endpoint.getGatewayAddress(), name);
        } else {
            log.info("Chain updated: domain={}, gateway {} -> {}", domain,
                previous.getGatewayAddress(), endpoint.getGatewayAddress());
        }
        return endpoint;
    }

    public ChainEndpoint setChainStatus(String caller, int domain, boolean active) {
        ownership.checkOwner(caller, "setChainStatus");
        ChainEndpoint updated = endpoints.computeIfPresent(domain, (d, existing) -> existing.toBuilder()
            .status(active ? ChainStatus.ACTIVE : ChainStatus.INACTIVE)
            .updatedAt(Instant.now().toString())
            .build());
        if (updated == null) {
            throw chainNotFound(domain);
        }
        log.info("Chain status changed: domain={}, status={}", domain, updated.getStatus().getValue());
        return updated;
    }

    public void removeChainEndpoint(String caller, int domain) {
        ownership.checkOwner(caller, "removeChainEndpoint");
        if (endpoints.remove(domain) == null) {
            throw chainNotFound(domain);
        }
        log.info("Chain removed: domain={}", domain);
    }

    public Optional<ChainEndpoint> getChainEndpoint(int domain) {
        return Optional.ofNullable(endpoints.get(domain));
    }

    /**
     * The endpoint of {@code domain} if it is registered and active.
     */
    public Optional<ChainEndpoint> getActiveEndpoint(int domain) {
        return getChainEndpoint(domain).filter(ChainEndpoint::isActive);
    }

    public boolean isTrustedSender(int domain, String sender) {
        return getActiveEndpoint(domain)
            .map(endpoint -> Addresses.same(endpoint.getGatewayAddress(), sender))
            .orElse(false);
    }

    public List<ChainEndpoint> getAllChains() {
        List<ChainEndpoint> all = new ArrayList<>(endpoints.values());
        all.sort(Comparator.comparingInt(ChainEndpoint::getDomain));
        return all;
    }

    public List<ChainEndpoint> getActiveChains() {
        return getAllChains().stream()
            .filter(ChainEndpoint::isActive)
            .collect(Collectors.toList());
    }

    private static BridgeException chainNotFound(int domain) {
        return new BridgeException(BridgeErrorCode.CHAIN_NOT_FOUND, "No chain registered for domain " + domain);
    }
}
