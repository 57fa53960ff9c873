package com.yieldvault.domain.enums;

/**
 * Reward-claim interface exposed by a protocol position. Detected once when the input is
 * configured and cached on the slot.
 */
public enum RewardClaimAbi {
    LEGACY,
    STANDARD
}
