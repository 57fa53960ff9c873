package com.yieldvault.domain.model;

import com.yieldvault.core.guard.Revertible;
import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

/**
 * Authoritative vault-level state: token wallet, share supply and balances, reserved
 * amounts and the fee checkpoint.
 *
 * <p>Cash held in the wallet is split into four buckets:
 * <ul>
 *   <li><b>pendingDepositAssets</b>: escrowed by unsettled deposit requests</li>
 *   <li><b>claimableRedemptionAssets</b>: reserved for settled redeem requests</li>
 *   <li><b>claimableTransactionFees</b>: entry/exit fees owed to the fee collector</li>
 *   <li><b>available</b>: everything else, the only bucket counted in total assets</li>
 * </ul>
 *
 * <p>Shares escrowed by the request queue ({@code escrowedShares}) are part of
 * {@code totalSupply} but belong to no account until claimed.
 *
 * <p>The state is mutated only by ledger, request queue and allocation engine operations
 * while the vault guard is held; {@link #checkpoint()} makes it part of their rollback.
 */
@Getter
@Setter
public class VaultState implements Revertible {

    private String asset;
    private int shareDecimals;
    private BigInteger weiPerShare;

    private TokenBalances wallet = new TokenBalances();

    private BigInteger totalSupply = BigInteger.ZERO;
    private Map<String, BigInteger> shareBalances = new HashMap<>();
    private Map<String, Map<String, BigInteger>> allowances = new HashMap<>();
    private BigInteger escrowedShares = BigInteger.ZERO;

    private BigInteger pendingDepositAssets = BigInteger.ZERO;
    private BigInteger claimableRedemptionAssets = BigInteger.ZERO;
    private BigInteger claimableTransactionFees = BigInteger.ZERO;

    /** Total assets at the last fee collection, shifted by net deposit/withdraw flows since. */
    private BigInteger lastCheckpointAssets = BigInteger.ZERO;

    private BigInteger lastSharePrice;
    private Instant lastCheckpointTime;

    private BigInteger maxTotalAssets = BigInteger.ZERO;
    private BigInteger minLiquidity = BigInteger.ZERO;
    private Fees fees = Fees.NONE;
    private boolean paused = true;

    public VaultState(String asset, int shareDecimals, Instant createdAt) {
        this.asset = asset;
        this.shareDecimals = shareDecimals;
        this.weiPerShare = BigInteger.TEN.pow(shareDecimals);
        this.lastSharePrice = weiPerShare;
        this.lastCheckpointTime = createdAt;
    }

    /** Asset cash not reserved for requests or fees. Never negative. */
    public BigInteger available() {
        BigInteger reserved = pendingDepositAssets.add(claimableRedemptionAssets).add(claimableTransactionFees);
        return AmountMath.subFloor(wallet.balanceOf(asset), reserved);
    }

    public BigInteger cash() {
        return wallet.balanceOf(asset);
    }

    public BigInteger sharesOf(String account) {
        return shareBalances.getOrDefault(key(account), BigInteger.ZERO);
    }

    public void setSharesOf(String account, BigInteger shares) {
        if (shares.signum() == 0) {
            shareBalances.remove(key(account));
        } else {
            shareBalances.put(key(account), shares);
        }
    }

    public BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(key(owner), Map.of()).getOrDefault(key(spender), BigInteger.ZERO);
    }

    public void setAllowance(String owner, String spender, BigInteger amount) {
        allowances.computeIfAbsent(key(owner), k -> new HashMap<>()).put(key(spender), amount);
    }

    public VaultState copy() {
        VaultState copy = new VaultState(asset, shareDecimals, lastCheckpointTime);
        copy.copyFrom(this);
        return copy;
    }

    @Override
    public Runnable checkpoint() {
        VaultState snapshot = copy();
        return () -> copyFrom(snapshot);
    }

    private void copyFrom(VaultState other) {
        this.asset = other.asset;
        this.shareDecimals = other.shareDecimals;
        this.weiPerShare = other.weiPerShare;
        this.wallet = other.wallet.copy();
        this.totalSupply = other.totalSupply;
        this.shareBalances = new HashMap<>(other.shareBalances);
        Map<String, Map<String, BigInteger>> allowanceCopy = new HashMap<>();
        other.allowances.forEach((owner, spenders) -> allowanceCopy.put(owner, new HashMap<>(spenders)));
        this.allowances = allowanceCopy;
        this.escrowedShares = other.escrowedShares;
        this.pendingDepositAssets = other.pendingDepositAssets;
        this.claimableRedemptionAssets = other.claimableRedemptionAssets;
        this.claimableTransactionFees = other.claimableTransactionFees;
        this.lastCheckpointAssets = other.lastCheckpointAssets;
        this.lastSharePrice = other.lastSharePrice;
        this.lastCheckpointTime = other.lastCheckpointTime;
        this.maxTotalAssets = other.maxTotalAssets;
        this.minLiquidity = other.minLiquidity;
        this.fees = other.fees;
        this.paused = other.paused;
    }

    private static String key(String account) {
        return account.toLowerCase();
    }
}
