package com.yieldvault.domain.model;

import java.math.BigInteger;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an invest or liquidate call. {@code amounts} holds, per slot, the asset amount
 * spent (invest) or recovered (liquidate).
 */
@Value
@Builder
public class AllocationResult {

    List<BigInteger> amounts;
    BigInteger total;
    BigInteger totalAssetsBefore;
    BigInteger totalAssetsAfter;
    BigInteger available;
    BigInteger sharePrice;
}
