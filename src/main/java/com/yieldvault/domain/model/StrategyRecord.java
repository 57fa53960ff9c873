package com.yieldvault.domain.model;

import com.yieldvault.integration.StrategyEntryPoint;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Allocator-side record of a strategy. {@code debt} is tracked independently of the
 * strategy's own accounting.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StrategyRecord {

    private String name;
    private StrategyEntryPoint entryPoint;
    private BigInteger maxDeposit;
    private BigInteger debt;
    private boolean whitelisted;

    /** Sticky: set by panic liquidation, cleared only by an explicit admin call. */
    private boolean panicked;

    /** Last total reported by the strategy itself through a debt update. Informational. */
    private BigInteger lastReportedAssets;

    public StrategyRecord copy() {
        return toBuilder().build();
    }
}
