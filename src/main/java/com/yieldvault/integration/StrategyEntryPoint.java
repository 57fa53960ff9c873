package com.yieldvault.integration;

import java.math.BigInteger;

/**
 * Entry point of a strategy as seen by the allocator: an opaque debtor that accepts capital
 * and returns it on request.
 */
public interface StrategyEntryPoint {

    /** Address the strategy reports debt from. */
    String address();

    void deposit(BigInteger amount);

    /**
     * Returns up to {@code amount} of capital. Implementations should fail when they cannot
     * deliver {@code minAmountOut}; the allocator checks it again regardless.
     */
    BigInteger withdraw(BigInteger amount, BigInteger minAmountOut);

    /** Exits {@code amount} with no minimum output. */
    BigInteger panicWithdraw(BigInteger amount);

    BigInteger totalAssets();
}
