package com.yieldvault.simulator;

import com.yieldvault.core.guard.Revertible;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.StrategyEntryPoint;
import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Remote strategy stand-in for the allocator. Holds what it is given; {@code lossBps} is lost
 * on every withdrawal.
 */
public class SimulatedStrategy implements StrategyEntryPoint, Revertible {

    private final String address;
    private volatile int lossBps;
    private BigInteger holdings = BigInteger.ZERO;

    public SimulatedStrategy(String address) {
        this.address = address;
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public void deposit(BigInteger amount) {
        holdings = holdings.add(amount);
    }

    @Override
    public BigInteger withdraw(BigInteger amount, BigInteger minAmountOut) {
        BigInteger delivered = take(amount);
        if (delivered.compareTo(minAmountOut) < 0) {
            throw new VaultException(
                    ErrorCode.AMOUNT_TOO_LOW,
                    "Strategy " + address + " can deliver " + delivered + ", below " + minAmountOut,
                    Map.of("delivered", delivered, "minAmountOut", minAmountOut));
        }
        return delivered;
    }

    @Override
    public BigInteger panicWithdraw(BigInteger amount) {
        return take(amount);
    }

    @Override
    public BigInteger totalAssets() {
        return holdings;
    }

    /** Grows holdings by {@code bps} basis points. */
    public void accrueYield(int bps) {
        holdings = holdings.add(AmountMath.mulDiv(holdings, BigInteger.valueOf(bps), AmountMath.BPS_BI, RoundingMode.DOWN));
    }

    public void setLossBps(int lossBps) {
        this.lossBps = lossBps;
    }

    @Override
    public Runnable checkpoint() {
        BigInteger snapshot = holdings;
        return () -> holdings = snapshot;
    }

    private BigInteger take(BigInteger amount) {
        BigInteger taken = AmountMath.min(amount, holdings);
        holdings = holdings.subtract(taken);
        return AmountMath.floor(taken, lossBps);
    }
}
