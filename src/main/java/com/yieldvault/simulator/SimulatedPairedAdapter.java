package com.yieldvault.simulator;

import com.yieldvault.core.guard.Revertible;
import com.yieldvault.domain.model.PairAmounts;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.PairedPositionAdapter;
import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Constant-product pool with pre-existing liquidity from other providers. The vault's share is
 * {@code vaultLiquidity / totalLiquidity} of both reserves.
 */
public class SimulatedPairedAdapter implements PairedPositionAdapter, Revertible {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPairedAdapter.class);

    private final String token0;
    private final String token1;
    private final String positionToken;
    private volatile int unstakeFeeBps;

    private BigInteger reserve0;
    private BigInteger reserve1;
    private BigInteger totalLiquidity;
    private BigInteger vaultLiquidity = BigInteger.ZERO;

    public SimulatedPairedAdapter(
            String token0, String token1, String positionToken, BigInteger reserve0, BigInteger reserve1) {
        this.token0 = token0;
        this.token1 = token1;
        this.positionToken = positionToken;
        this.reserve0 = reserve0;
        this.reserve1 = reserve1;
        this.totalLiquidity = reserve0.multiply(reserve1).sqrt();
    }

    @Override
    public String token0() {
        return token0;
    }

    @Override
    public String token1() {
        return token1;
    }

    @Override
    public String positionToken() {
        return positionToken;
    }

    @Override
    public PairAmounts reserves() {
        return new PairAmounts(reserve0, reserve1);
    }

    @Override
    public BigInteger quoteLiquidity(BigInteger amount0, BigInteger amount1) {
        if (totalLiquidity.signum() == 0) {
            return amount0.multiply(amount1).sqrt();
        }
        return AmountMath.min(
                AmountMath.mulDiv(amount0, totalLiquidity, reserve0, RoundingMode.DOWN),
                AmountMath.mulDiv(amount1, totalLiquidity, reserve1, RoundingMode.DOWN));
    }

    @Override
    public BigInteger stakePair(BigInteger amount0, BigInteger amount1) {
        BigInteger minted = quoteLiquidity(amount0, amount1);
        reserve0 = reserve0.add(amount0);
        reserve1 = reserve1.add(amount1);
        totalLiquidity = totalLiquidity.add(minted);
        vaultLiquidity = vaultLiquidity.add(minted);
        log.debug("{}: deposited {} + {}, minted {} liquidity", positionToken, amount0, amount1, minted);
        return minted;
    }

    @Override
    public PairAmounts unstakePair(BigInteger liquidity) {
        if (liquidity.compareTo(vaultLiquidity) > 0) {
            throw new VaultException(
                    ErrorCode.AMOUNT_TOO_HIGH,
                    "Burn of " + liquidity + " exceeds vault liquidity " + vaultLiquidity,
                    Map.of("liquidity", liquidity, "held", vaultLiquidity));
        }
        BigInteger out0 = AmountMath.mulDiv(reserve0, liquidity, totalLiquidity, RoundingMode.DOWN);
        BigInteger out1 = AmountMath.mulDiv(reserve1, liquidity, totalLiquidity, RoundingMode.DOWN);
        reserve0 = reserve0.subtract(out0);
        reserve1 = reserve1.subtract(out1);
        totalLiquidity = totalLiquidity.subtract(liquidity);
        vaultLiquidity = vaultLiquidity.subtract(liquidity);

        PairAmounts delivered = new PairAmounts(
                AmountMath.floor(out0, unstakeFeeBps), AmountMath.floor(out1, unstakeFeeBps));
        log.debug("{}: burnt {} liquidity for {} + {}", positionToken, liquidity, delivered.getAmount0(), delivered.getAmount1());
        return delivered;
    }

    @Override
    public BigInteger positionBalance() {
        return vaultLiquidity;
    }

    @Override
    public PairAmounts positionAmounts() {
        if (totalLiquidity.signum() == 0) {
            return PairAmounts.ZERO;
        }
        return new PairAmounts(
                AmountMath.mulDiv(reserve0, vaultLiquidity, totalLiquidity, RoundingMode.DOWN),
                AmountMath.mulDiv(reserve1, vaultLiquidity, totalLiquidity, RoundingMode.DOWN));
    }

    @Override
    public int unstakeFeeBps() {
        return unstakeFeeBps;
    }

    public void setUnstakeFeeBps(int unstakeFeeBps) {
        this.unstakeFeeBps = unstakeFeeBps;
    }

    @Override
    public Runnable checkpoint() {
        BigInteger r0 = reserve0;
        BigInteger r1 = reserve1;
        BigInteger total = totalLiquidity;
        BigInteger held = vaultLiquidity;
        return () -> {
            reserve0 = r0;
            reserve1 = r1;
            totalLiquidity = total;
            vaultLiquidity = held;
        };
    }
}
