package io.scalex.bridge.token;

import java.math.BigInteger;

/**
 * Fungible token capability a bridge component depends on.
 * 
 * Implementations raise {@link io.scalex.bridge.error.BridgeException} with
 * INSUFFICIENT_FUNDS when a balance or allowance cannot cover a transfer, and
 * leave all balances unchanged in that case.
 */
public interface FungibleToken {

    String getAddress();

    String getSymbol();

    int getDecimals();

    BigInteger totalSupply();

    BigInteger balanceOf(String account);

    BigInteger allowance(String owner, String spender);

    void approve(String owner, String spender, BigInteger amount);

    void transfer(String from, String to, BigInteger amount);

    /**
     * Move {@code amount} from {@code from} to {@code to} on behalf of {@code spender},
     * consuming allowance.
     */
    void transferFrom(String spender, String from, String to, BigInteger amount);
}
