package io.scalex.bridge.token;

import io.scalex.bridge.codec.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Typed lookup from a token address to the token on the local network.
 */
public class TokenDirectory {

    private static final Logger log = LoggerFactory.getLogger(TokenDirectory.class);

    private final Map<String, FungibleToken> tokens = new ConcurrentHashMap<>();

    public void register(FungibleToken token) {
        tokens.put(token.getAddress(), token);
        log.info("Registered token {} at {}", token.getSymbol(), token.getAddress());
    }

    public Optional<FungibleToken> find(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokens.get(Addresses.normalize(address)));
    }

    public List<FungibleToken> all() {
        return new ArrayList<>(tokens.values());
    }
}
