package com.yieldvault.integration;

import com.yieldvault.domain.enums.RewardClaimAbi;
import java.math.BigInteger;

/**
 * Stake/unstake contract of one single-token position (lending market, staking pool, ...).
 *
 * <p>All amounts are in units of {@link #inputToken()}. The engine never trusts the values
 * returned by {@link #stake} and {@link #unstake} for accounting: it re-reads
 * {@link #positionBalance()} before and after each call.
 */
public interface ProtocolAdapter {

    String inputToken();

    /** Receipt token representing the position. */
    String positionToken();

    /** Supplies {@code amount} of input tokens pulled from the vault. Returns the amount staked. */
    BigInteger stake(BigInteger amount);

    /** Withdraws {@code amount} of input tokens. Returns the amount delivered to the vault. */
    BigInteger unstake(BigInteger amount);

    /** Receipt (IOU) balance held by the vault, expressed in input token units. */
    BigInteger positionBalance();

    /** Current redeemable value of the position in input token units. */
    BigInteger investedValue();

    /** Fee charged by the protocol on withdrawal, in basis points. */
    default int unstakeFeeBps() {
        return 0;
    }

    /** Reward-claim interface exposed by the underlying protocol. */
    default RewardClaimAbi rewardClaimAbi() {
        return RewardClaimAbi.STANDARD;
    }
}
