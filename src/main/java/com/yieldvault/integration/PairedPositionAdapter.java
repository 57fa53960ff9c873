package com.yieldvault.integration;

import com.yieldvault.domain.enums.RewardClaimAbi;
import com.yieldvault.domain.model.PairAmounts;
import java.math.BigInteger;

/**
 * Two-token AMM position shared by an even/odd pair of input slots. {@code token0} backs
 * the even slot and {@code token1} the odd slot.
 */
public interface PairedPositionAdapter {

    String token0();

    String token1();

    /** LP token of the pool. */
    String positionToken();

    /** Current pool reserves, used to deposit both legs in ratio. */
    PairAmounts reserves();

    /** Liquidity the pool would mint for the given amounts. */
    BigInteger quoteLiquidity(BigInteger amount0, BigInteger amount1);

    /** Deposits both legs. Returns the liquidity minted. */
    BigInteger stakePair(BigInteger amount0, BigInteger amount1);

    /** Burns {@code liquidity}. Returns the token amounts delivered to the vault. */
    PairAmounts unstakePair(BigInteger liquidity);

    /** Liquidity (LP) balance held by the vault. */
    BigInteger positionBalance();

    /** Underlying token amounts of the vault's liquidity at current reserves. */
    PairAmounts positionAmounts();

    default int unstakeFeeBps() {
        return 0;
    }

    default RewardClaimAbi rewardClaimAbi() {
        return RewardClaimAbi.STANDARD;
    }
}
