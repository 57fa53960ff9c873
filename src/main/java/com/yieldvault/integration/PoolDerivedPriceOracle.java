package com.yieldvault.integration;

import com.yieldvault.domain.model.PairAmounts;
import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Prices the two tokens of a paired position against each other from the pool's own reserves
 * ({@code amount * reserveTo / reserveFrom}) and delegates every other conversion to a
 * fallback oracle.
 */
public class PoolDerivedPriceOracle implements PriceOracle {

    private final PairedPositionAdapter pool;
    private final PriceOracle fallback;

    public PoolDerivedPriceOracle(PairedPositionAdapter pool, PriceOracle fallback) {
        this.pool = pool;
        this.fallback = fallback;
    }

    @Override
    public boolean hasFeed(String token) {
        return fallback.hasFeed(token) || (isPoolToken(token) && poolHasReserves());
    }

    @Override
    public BigInteger convert(String fromToken, BigInteger amount, String toToken) {
        if (!isPoolPair(fromToken, toToken) || !poolHasReserves()) {
            return fallback.convert(fromToken, amount, toToken);
        }
        PairAmounts reserves = pool.reserves();
        boolean forward = fromToken.equalsIgnoreCase(pool.token0());
        BigInteger reserveFrom = forward ? reserves.getAmount0() : reserves.getAmount1();
        BigInteger reserveTo = forward ? reserves.getAmount1() : reserves.getAmount0();
        return AmountMath.mulDiv(amount, reserveTo, reserveFrom, RoundingMode.DOWN);
    }

    private boolean isPoolToken(String token) {
        return token != null && (token.equalsIgnoreCase(pool.token0()) || token.equalsIgnoreCase(pool.token1()));
    }

    private boolean isPoolPair(String a, String b) {
        return isPoolToken(a) && isPoolToken(b) && !a.equalsIgnoreCase(b);
    }

    private boolean poolHasReserves() {
        PairAmounts reserves = pool.reserves();
        return reserves.getAmount0().signum() > 0 && reserves.getAmount1().signum() > 0;
    }
}
