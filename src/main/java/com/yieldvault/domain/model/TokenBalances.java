package com.yieldvault.domain.model;

import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Token balances held by the vault, keyed by token address (case-insensitive).
 */
public class TokenBalances {

    private final Map<String, BigInteger> balances;

    public TokenBalances() {
        this.balances = new HashMap<>();
    }

    private TokenBalances(Map<String, BigInteger> balances) {
        this.balances = new HashMap<>(balances);
    }

    public BigInteger balanceOf(String token) {
        return balances.getOrDefault(key(token), BigInteger.ZERO);
    }

    public void credit(String token, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Negative credit " + amount);
        }
        if (amount.signum() == 0) {
            return;
        }
        balances.merge(key(token), amount, BigInteger::add);
    }

    public void debit(String token, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Negative debit " + amount);
        }
        BigInteger balance = balanceOf(token);
        if (balance.compareTo(amount) < 0) {
            throw new VaultException(
                    ErrorCode.INSUFFICIENT_FUNDS,
                    "Balance of " + token + " is " + balance + ", needed " + amount,
                    Map.of("token", token, "balance", balance, "required", amount));
        }
        BigInteger remaining = balance.subtract(amount);
        if (remaining.signum() == 0) {
            balances.remove(key(token));
        } else {
            balances.put(key(token), remaining);
        }
    }

    public Map<String, BigInteger> asMap() {
        return Collections.unmodifiableMap(balances);
    }

    public TokenBalances copy() {
        return new TokenBalances(balances);
    }

    private static String key(String token) {
        return token.toLowerCase();
    }
}
