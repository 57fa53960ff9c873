package com.yieldvault.domain.enums;

/**
 * How the per-leg slippage tolerance is combined when a slot needs both a swap and a
 * stake (or an unstake and a swap).
 */
public enum SlippageComposition {

    /**
     * One check on the combined result: {@code received >= expected * (BPS - 2 * maxSlippageBps) / BPS}.
     */
    DOUBLED,

    /**
     * Each leg is checked on its own against {@code (BPS - maxSlippageBps)}: the swap output
     * against the oracle quote, the stake (or unstake) delta against the amount it was given.
     */
    PER_LEG
}
