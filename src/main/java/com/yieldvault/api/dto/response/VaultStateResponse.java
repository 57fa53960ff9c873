package com.yieldvault.api.dto.response;

import com.yieldvault.domain.model.Fees;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Snapshot of the vault returned by GET /api/vault. All amounts are wei of the vault asset
 * except {@code totalSupply}, which is share wei.
 */
@Getter
@Builder
public class VaultStateResponse {

    private final String asset;
    private final BigInteger totalAssets;
    private final BigInteger available;
    private final BigInteger invested;

    /** Asset value per input slot, index 0..7. */
    private final List<BigInteger> investedPerSlot;

    private final BigInteger totalSupply;
    private final BigInteger sharePrice;
    private final boolean paused;
    private final BigInteger maxTotalAssets;
    private final BigInteger minLiquidity;
    private final Fees fees;

    private final BigInteger pendingDepositAssets;
    private final BigInteger claimableRedemptionAssets;
    private final BigInteger claimableTransactionFees;
    private final BigInteger totalRedemptionRequest;
    private final BigInteger totalRedemptionRequestAssets;

    private final BigInteger lastCheckpointAssets;
    private final Instant lastCheckpointTime;
}
