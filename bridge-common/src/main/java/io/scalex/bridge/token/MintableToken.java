package io.scalex.bridge.token;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-process fungible token with a single authorized minter.
 * 
 * Used for collateral tokens on source networks and as the base of synthetic
 * assets on the hub. Only the minter may mint or burn; no other privileged role
 * exists.
 */
public class MintableToken implements FungibleToken {

    private static final Logger log = LoggerFactory.getLogger(MintableToken.class);

    private final String address;
    private final String name;
    private final String symbol;
    private final int decimals;
    private final String minter;

    private final Map<String, BigInteger> balances = new HashMap<>();
    // Key: owner + "/" + spender
    private final Map<String, BigInteger> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public MintableToken(String address, String name, String symbol, int decimals, String minter) {
        if (Addresses.isZero(address)) {
            throw BridgeException.zeroAddress("token address");
        }
        if (Addresses.isZero(minter)) {
            throw BridgeException.zeroAddress("minter");
        }
        this.address = Addresses.normalize(address);
        this.name = name;
        this.symbol = symbol;
        this.decimals = decimals;
        this.minter = Addresses.normalize(minter);
    }

    @Override
    public String getAddress() {
        return address;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }

    @Override
    public int getDecimals() {
        return decimals;
    }

    public String getMinter() {
        return minter;
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(Addresses.normalize(account), BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(allowanceKey(owner, spender), BigInteger.ZERO);
    }

    @Override
    public synchronized void approve(String owner, String spender, BigInteger amount) {
        requireNonNegative(amount);
        allowances.put(allowanceKey(owner, spender), amount);
    }

    @Override
    public synchronized void transfer(String from, String to, BigInteger amount) {
        requireNonNegative(amount);
        if (Addresses.isZero(to)) {
            throw BridgeException.zeroAddress("recipient");
        }
        String source = Addresses.normalize(from);
        BigInteger balance = balances.getOrDefault(source, BigInteger.ZERO);
        if (balance.compareTo(amount) < 0) {
            throw new BridgeException(BridgeErrorCode.INSUFFICIENT_FUNDS,
                String.format("%s balance of %s is %s, needs %s", symbol, source, balance, amount));
        }
        balances.put(source, balance.subtract(amount));
        balances.merge(Addresses.normalize(to), amount, BigInteger::add);
    }

    @Override
    public synchronized void transferFrom(String spender, String from, String to, BigInteger amount) {
        requireNonNegative(amount);
        String key = allowanceKey(from, spender);
        BigInteger allowed = allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowed.compareTo(amount) < 0) {
            throw new BridgeException(BridgeErrorCode.INSUFFICIENT_FUNDS,
                String.format("%s allowance of %s for %s is %s, needs %s", symbol,
                    Addresses.normalize(from), Addresses.normalize(spender), allowed, amount));
        }
        transfer(from, to, amount);
        allowances.put(key, allowed.subtract(amount));
    }

    public synchronized void mint(String caller, String to, BigInteger amount) {
        requireMinter(caller, "mint " + symbol);
        requireNonNegative(amount);
        if (Addresses.isZero(to)) {
            throw BridgeException.zeroAddress("mint recipient");
        }
        balances.merge(Addresses.normalize(to), amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        log.debug("Minted {} {} to {}", amount, symbol, to);
    }

    public synchronized void burn(String caller, String from, BigInteger amount) {
        requireMinter(caller, "burn " + symbol);
        requireNonNegative(amount);
        String holder = Addresses.normalize(from);
        BigInteger balance = balances.getOrDefault(holder, BigInteger.ZERO);
        if (balance.compareTo(amount) < 0) {
            throw new BridgeException(BridgeErrorCode.INSUFFICIENT_FUNDS,
                String.format("Cannot burn %s %s from %s holding %s", amount, symbol, holder, balance));
        }
        balances.put(holder, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
        log.debug("Burned {} {} from {}", amount, symbol, from);
    }

    private void requireMinter(String caller, String action) {
        if (caller == null || !Addresses.same(caller, minter)) {
            throw BridgeException.unauthorized(caller, action);
        }
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw BridgeException.invalidAmount(amount);
        }
    }

    private static String allowanceKey(String owner, String spender) {
        return Addresses.normalize(owner) + "/" + Addresses.normalize(spender);
    }
}
