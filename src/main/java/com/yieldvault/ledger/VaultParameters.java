package com.yieldvault.ledger;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Static vault configuration from {@code yieldvault.vault.*}. Values that can change at
 * runtime (fees, cap, minimum liquidity) live in {@link com.yieldvault.domain.model.VaultState}
 * and are only seeded from here.
 */
@Value
@Builder
public class VaultParameters {

    String vaultAddress;
    String asset;
    int shareDecimals;
    String feeCollector;
    Duration profitCooldown;

    /** Callers allowed to deposit above {@code maxTotalAssets} (e.g. the allocator). */
    Set<String> capExempt;

    BigInteger initialMaxTotalAssets;
    BigInteger initialMinLiquidity;
    int perfFeeBps;
    int mgmtFeeBps;
    int entryFeeBps;
    int exitFeeBps;

    public boolean isCapExempt(String caller) {
        return caller != null && capExempt.stream().anyMatch(caller::equalsIgnoreCase);
    }
}
