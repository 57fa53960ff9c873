package com.yieldvault.simulator;

import com.yieldvault.core.guard.Revertible;
import com.yieldvault.domain.enums.RewardClaimAbi;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.ProtocolAdapter;
import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory lending/staking position. The receipt balance tracks the redeemable value 1:1,
 * so {@code positionBalance() == investedValue()}.
 *
 * <p>{@code stakeHaircutBps} credits less than supplied on each stake and
 * {@code unstakeFeeBps} withholds part of each withdrawal. Yield is added explicitly through
 * {@link #accrueYield(int)}.
 */
public class SimulatedProtocolAdapter implements ProtocolAdapter, Revertible {

    private static final Logger log = LoggerFactory.getLogger(SimulatedProtocolAdapter.class);

    private final String inputToken;
    private final String positionToken;
    private final RewardClaimAbi rewardClaimAbi;
    private volatile int stakeHaircutBps;
    private volatile int unstakeFeeBps;

    private BigInteger position = BigInteger.ZERO;

    public SimulatedProtocolAdapter(String inputToken, String positionToken, RewardClaimAbi rewardClaimAbi) {
        this.inputToken = inputToken;
        this.positionToken = positionToken;
        this.rewardClaimAbi = rewardClaimAbi;
    }

    @Override
    public String inputToken() {
        return inputToken;
    }

    @Override
    public String positionToken() {
        return positionToken;
    }

    @Override
    public BigInteger stake(BigInteger amount) {
        BigInteger credited = AmountMath.floor(amount, stakeHaircutBps);
        position = position.add(credited);
        log.debug("{}: staked {}, credited {}, position {}", positionToken, amount, credited, position);
        return credited;
    }

    @Override
    public BigInteger unstake(BigInteger amount) {
        if (amount.compareTo(position) > 0) {
            throw new VaultException(
                    ErrorCode.AMOUNT_TOO_HIGH,
                    "Unstake of " + amount + " exceeds position " + position + " in " + positionToken,
                    Map.of("amount", amount, "position", position));
        }
        position = position.subtract(amount);
        BigInteger delivered = AmountMath.floor(amount, unstakeFeeBps);
        log.debug("{}: unstaked {}, delivered {}, position {}", positionToken, amount, delivered, position);
        return delivered;
    }

    @Override
    public BigInteger positionBalance() {
        return position;
    }

    @Override
    public BigInteger investedValue() {
        return position;
    }

    @Override
    public int unstakeFeeBps() {
        return unstakeFeeBps;
    }

    @Override
    public RewardClaimAbi rewardClaimAbi() {
        return rewardClaimAbi;
    }

    /** Grows the position by {@code bps} basis points; negative values simulate a loss. */
    public void accrueYield(int bps) {
        BigInteger delta = AmountMath.mulDiv(position, BigInteger.valueOf(Math.abs(bps)), AmountMath.BPS_BI, RoundingMode.DOWN);
        position = bps >= 0 ? position.add(delta) : position.subtract(delta);
    }

    public void setStakeHaircutBps(int stakeHaircutBps) {
        this.stakeHaircutBps = stakeHaircutBps;
    }

    public void setUnstakeFeeBps(int unstakeFeeBps) {
        this.unstakeFeeBps = unstakeFeeBps;
    }

    @Override
    public Runnable checkpoint() {
        BigInteger snapshot = position;
        return () -> position = snapshot;
    }
}
