package com.yieldvault.integration;

import com.yieldvault.domain.model.SwapResult;
import java.math.BigInteger;

/**
 * Executes a swap described by caller-supplied, aggregator-specific calldata.
 *
 * <p>Failures propagate to the calling operation; nothing is retried.
 */
public interface Swapper {

    SwapResult decodeAndSwap(String inputToken, String outputToken, BigInteger amount, String params);
}
