package com.yieldvault.allocation;

import com.yieldvault.domain.enums.SlippageComposition;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/** Allocation engine settings from {@code yieldvault.allocation.*}. */
@Value
@Builder
public class AllocationParameters {

    /** Tolerance per leg, in basis points. */
    int maxSlippageBps;

    /** Slot targets below this amount are skipped. */
    BigInteger dustThreshold;

    SlippageComposition slippageComposition;

    /** Inputs are configured as even/odd pairs backed by AMM positions. */
    boolean pairedInputs;
}
