package com.yieldvault.domain.model;

import java.math.BigInteger;
import lombok.Value;

/** Amounts of token0 and token1 of a paired position. */
@Value
public class PairAmounts {

    public static final PairAmounts ZERO = new PairAmounts(BigInteger.ZERO, BigInteger.ZERO);

    BigInteger amount0;
    BigInteger amount1;
}
