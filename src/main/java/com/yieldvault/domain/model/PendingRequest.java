package com.yieldvault.domain.model;

import com.yieldvault.domain.enums.RequestStatus;
import com.yieldvault.domain.enums.RequestType;
import java.math.BigInteger;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Asynchronous deposit or redeem request, keyed by operator.
 *
 * <p>{@code amount} is assets for a deposit and shares for a redeem. {@code claimableAmount}
 * is set on settlement: shares held in escrow for a deposit, net assets reserved for a redeem.
 * {@code asset} records the vault asset at request time so a later asset swap can be detected.
 */
@Value
@Builder(toBuilder = true)
public class PendingRequest {

    RequestType type;
    RequestStatus status;
    String operator;
    String owner;
    BigInteger amount;
    BigInteger claimableAmount;
    String asset;
    Instant requestTimestamp;
    Instant settledAt;

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    public boolean isClaimable() {
        return status == RequestStatus.CLAIMABLE;
    }
}
