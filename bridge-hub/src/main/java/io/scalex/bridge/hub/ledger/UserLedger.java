package io.scalex.bridge.hub.ledger;

import io.scalex.bridge.codec.Addresses;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Internal per-user balances of synthetic assets held in hub custody.
 * 
 * Each method is atomic; sequences of calls (debit then burn, mint then credit)
 * run under the hub ledger's writer lock. Entries are never removed; zero is a
 * valid resting balance.
 */
public class UserLedger {

    // Key: user, Value: (asset -> balance)
    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();
    private final Map<String, Long> processedCounts = new HashMap<>();
    private final Map<String, BigInteger> withdrawNonces = new HashMap<>();

    public synchronized BigInteger balanceOf(String user, String asset) {
        Map<String, BigInteger> userBalances = balances.get(Addresses.normalize(user));
        if (userBalances == null) {
            return BigInteger.ZERO;
        }
        return userBalances.getOrDefault(Addresses.normalize(asset), BigInteger.ZERO);
    }

    public synchronized void credit(String user, String asset, BigInteger amount) {
        balances.computeIfAbsent(Addresses.normalize(user), u -> new HashMap<>())
            .merge(Addresses.normalize(asset), amount, BigInteger::add);
    }

    /**
     * @throws BridgeException INSUFFICIENT_BALANCE, leaving the balance unchanged
     */
    public synchronized void debit(String user, String asset, BigInteger amount) {
        BigInteger balance = balanceOf(user, asset);
        if (balance.compareTo(amount) < 0) {
            throw new BridgeException(BridgeErrorCode.INSUFFICIENT_BALANCE, String.format(
                "Balance of %s in %s is %s, cannot debit %s", user, asset, balance, amount));
        }
        balances.get(Addresses.normalize(user)).put(Addresses.normalize(asset), balance.subtract(amount));
    }

    /**
     * Sum of every user's balance in {@code asset}; equals the hub's custody of it.
     */
    public synchronized BigInteger totalCredited(String asset) {
        String key = Addresses.normalize(asset);
        BigInteger total = BigInteger.ZERO;
        for (Map<String, BigInteger> userBalances : balances.values()) {
            total = total.add(userBalances.getOrDefault(key, BigInteger.ZERO));
        }
        return total;
    }

    /**
     * Advisory counter of deposits credited to a user. Not a deduplication key.
     */
    public synchronized long incrementProcessedCount(String user) {
        return processedCounts.merge(Addresses.normalize(user), 1L, Long::sum);
    }

    public synchronized long processedCount(String user) {
        return processedCounts.getOrDefault(Addresses.normalize(user), 0L);
    }

    public synchronized BigInteger withdrawNonce(String user) {
        return withdrawNonces.getOrDefault(Addresses.normalize(user), BigInteger.ZERO);
    }

    public synchronized void incrementWithdrawNonce(String user) {
        withdrawNonces.merge(Addresses.normalize(user), BigInteger.ONE, BigInteger::add);
    }
}
