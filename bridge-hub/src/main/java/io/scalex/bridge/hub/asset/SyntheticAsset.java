package io.scalex.bridge.hub.asset;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.token.MintableToken;

/**
 * Synthetic representation of collateral locked on a source domain.
 * 
 * The hub ledger is the only minter: it mints on credited deposits and burns on
 * withdrawals, always from its own custody.
 */
public class SyntheticAsset extends MintableToken {

    private final int sourceDomain;
    private final String sourceToken;

    public SyntheticAsset(String address, String name, String symbol, int decimals, String minter,
                          int sourceDomain, String sourceToken) {
        super(address, name, symbol, decimals, minter);
        this.sourceDomain = sourceDomain;
        this.sourceToken = Addresses.normalize(sourceToken);
    }

    public int getSourceDomain() {
        return sourceDomain;
    }

    public String getSourceToken() {
        return sourceToken;
    }
}
