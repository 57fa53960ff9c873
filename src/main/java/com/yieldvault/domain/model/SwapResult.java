package com.yieldvault.domain.model;

import java.math.BigInteger;
import lombok.Value;

@Value
public class SwapResult {

    BigInteger spent;
    BigInteger received;
}
