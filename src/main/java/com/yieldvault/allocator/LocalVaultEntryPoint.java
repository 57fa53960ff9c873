package com.yieldvault.allocator;

import com.yieldvault.core.guard.Revertible;
import com.yieldvault.integration.StrategyEntryPoint;
import com.yieldvault.ledger.AmountMath;
import com.yieldvault.ledger.ShareLedger;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This instance's own vault seen as an allocator strategy. The allocator holds vault shares
 * under {@code address}, which must be cap-exempt on the vault side.
 *
 * <p>A regular withdrawal takes exactly the requested assets and fails if the vault lacks the
 * liquidity. A panic withdrawal takes whatever the vault can pay right now.
 *
 * <p>The vault state is inside the allocator's rollback: a dispatch that fails after this entry
 * point was paid also undoes the vault deposit.
 */
public class LocalVaultEntryPoint implements StrategyEntryPoint, Revertible {

    private static final Logger log = LoggerFactory.getLogger(LocalVaultEntryPoint.class);

    private final String address;
    private final ShareLedger shareLedger;

    public LocalVaultEntryPoint(String address, ShareLedger shareLedger) {
        this.address = address;
        this.shareLedger = shareLedger;
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public void deposit(BigInteger amount) {
        BigInteger shares = shareLedger.deposit(address, amount, address);
        log.debug("Allocator deposited {} into the local vault for {} shares", amount, shares);
    }

    @Override
    public BigInteger withdraw(BigInteger amount, BigInteger minAmountOut) {
        BigInteger maxShares = shareLedger.previewWithdraw(amount);
        shareLedger.safeWithdraw(address, amount, address, address, maxShares, null);
        return amount;
    }

    @Override
    public BigInteger panicWithdraw(BigInteger amount) {
        BigInteger withdrawable = AmountMath.min(amount, shareLedger.maxWithdraw(address));
        if (withdrawable.signum() == 0) {
            log.warn("Local vault has nothing withdrawable for the allocator");
            return BigInteger.ZERO;
        }
        shareLedger.withdraw(address, withdrawable, address, address);
        return withdrawable;
    }

    @Override
    public BigInteger totalAssets() {
        return shareLedger.assetsOf(address);
    }

    @Override
    public Runnable checkpoint() {
        return shareLedger.checkpoint();
    }
}
