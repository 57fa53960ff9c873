package com.yieldvault.integration;

import java.math.BigInteger;

/**
 * Converts amounts between tokens (vault asset, inputs, quote tokens).
 *
 * <p>Implementations must fail with {@code MISSING_ORACLE} rather than default a price when
 * either leg has no feed.
 */
public interface PriceOracle {

    boolean hasFeed(String token);

    /** Converts {@code amount} of {@code fromToken} into {@code toToken} units, rounded down. */
    BigInteger convert(String fromToken, BigInteger amount, String toToken);
}
