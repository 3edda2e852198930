package io.scalex.bridge.hub.asset;

import io.scalex.bridge.access.OwnershipGuard;
import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Creates synthetic assets with the hub ledger as their only minter and keeps
 * them addressable.
 */
public class SyntheticAssetFactory {

    private static final Logger log = LoggerFactory.getLogger(SyntheticAssetFactory.class);

    private final OwnershipGuard ownership;
    private final String minter;
    private final Map<String, SyntheticAsset> assets = new ConcurrentHashMap<>();

    public SyntheticAssetFactory(String owner, String minter) {
        this.ownership = new OwnershipGuard("SyntheticAssetFactory", owner);
        this.minter = Addresses.normalize(minter);
    }

    public String getMinter() {
        return minter;
    }

    /**
     * Create a synthetic asset at a derived address.
     */
    public SyntheticAsset createSyntheticToken(String caller, int sourceDomain, String sourceToken,
                                               String name, String symbol, int decimals) {
        return createSyntheticToken(caller, deriveAddress(sourceDomain, sourceToken, symbol),
            sourceDomain, sourceToken, name, symbol, decimals);
    }

    /**
     * Create a synthetic asset at a given address.
     */
    public SyntheticAsset createSyntheticToken(String caller, String address, int sourceDomain, String sourceToken,
                                               String name, String symbol, int decimals) {
        ownership.checkOwner(caller, "createSyntheticToken");
        if (Addresses.isZero(sourceToken)) {
            throw BridgeException.zeroAddress("source token");
        }
        if (decimals < 0 || decimals > 255) {
            throw new BridgeException(BridgeErrorCode.INVALID_AMOUNT, "Invalid decimals: " + decimals);
        }
        SyntheticAsset asset = new SyntheticAsset(address, name, symbol, decimals, minter, sourceDomain, sourceToken);
        if (assets.putIfAbsent(asset.getAddress(), asset) != null) {
            throw new BridgeException(BridgeErrorCode.SYNTHETIC_ALREADY_EXISTS,
                "A synthetic asset already exists at " + asset.getAddress());
        }
        log.info("Synthetic asset created: {} ({}) at {} for {}:{}, {} decimals",
            symbol, name, asset.getAddress(), sourceDomain, asset.getSourceToken(), decimals);
        return asset;
    }

    public Optional<SyntheticAsset> find(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(assets.get(Addresses.normalize(address)));
    }

    public List<SyntheticAsset> getAllSyntheticTokens() {
        List<SyntheticAsset> all = new ArrayList<>(assets.values());
        all.sort(Comparator.comparing(SyntheticAsset::getSymbol));
        return all;
    }

    public List<SyntheticAsset> getChainSyntheticTokens(int sourceDomain) {
        return getAllSyntheticTokens().stream()
            .filter(a -> a.getSourceDomain() == sourceDomain)
            .collect(Collectors.toList());
    }

    private static String deriveAddress(int sourceDomain, String sourceToken, String symbol) {
        byte[] symbolBytes = symbol.getBytes(StandardCharsets.UTF_8);
        ByteBuffer seed = ByteBuffer.allocate(Integer.BYTES + Addresses.LENGTH + symbolBytes.length);
        seed.putInt(sourceDomain);
        seed.put(Addresses.toBytes(sourceToken));
        seed.put(symbolBytes);
        byte[] hash = new Keccak.Digest256().digest(seed.array());
        // EVM-style: low 20 bytes of the hash
        return "0x" + Hex.toHexString(hash, hash.length - 20, 20);
    }
}
