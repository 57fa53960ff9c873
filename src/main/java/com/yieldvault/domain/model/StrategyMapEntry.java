package com.yieldvault.domain.model;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Read-only snapshot of one strategy for off-chain consumers. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyMapEntry {

    private String strategyName;
    private BigInteger maxDeposit;
    private BigInteger debt;
    private BigInteger totalAssetsAvailable;
    private String entryPoint;
    private boolean whitelisted;
    private boolean panicked;
}
