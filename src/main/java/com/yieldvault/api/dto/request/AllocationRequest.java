package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Explicit invest or liquidate call. {@code targets} and {@code swapParams} are indexed by
 * input slot and must both hold eight entries; {@code minLiquidity} and {@code panic} apply to
 * liquidation only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationRequest {

    @NotNull(message = "targets are required")
    private List<BigInteger> targets;

    private List<String> swapParams;

    private BigInteger minLiquidity;

    private boolean panic;
}
