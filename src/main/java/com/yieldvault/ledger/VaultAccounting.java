package com.yieldvault.ledger;

import com.yieldvault.core.guard.ReentrancyGuard;
import com.yieldvault.domain.model.VaultState;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Read model and mutation primitives over the {@link VaultState}.
 *
 * <p>Owns the vault's {@link ReentrancyGuard}. Every component that mutates the vault (share
 * ledger, fee engine, request queue, allocation engine) enters this guard in its public
 * operations; the primitives below only assert it is held and never acquire it themselves.
 *
 * <p>Totals:
 * <ul>
 *   <li>{@code available}: unreserved asset cash (see {@link VaultState#available()})</li>
 *   <li>{@code invested}: asset value of all inputs, from {@link InvestedValueSource}</li>
 *   <li>{@code totalAssets = available + invested}</li>
 * </ul>
 */
@Component
public class VaultAccounting {

    private final VaultState state;
    private final VaultParameters vaultParameters;
    private final InvestedValueSource investedValueSource;
    private final ReentrancyGuard guard = new ReentrancyGuard("vault");

    public VaultAccounting(
            VaultState state, VaultParameters vaultParameters, InvestedValueSource investedValueSource) {
        this.state = state;
        this.vaultParameters = vaultParameters;
        this.investedValueSource = investedValueSource;
    }

    public VaultState state() {
        return state;
    }

    public VaultParameters parameters() {
        return vaultParameters;
    }

    public ReentrancyGuard guard() {
        return guard;
    }

    // ==============================
    // TOTALS
    // ==============================

    public BigInteger available() {
        return state.available();
    }

    public BigInteger invested() {
        return investedValueSource.invested();
    }

    public BigInteger totalAssets() {
        return available().add(invested());
    }

    public BigInteger totalSupply() {
        return state.getTotalSupply();
    }

    /** {@code totalAssets * weiPerShare / totalSupply}, or {@code weiPerShare} before seeding. */
    public BigInteger sharePrice() {
        BigInteger supply = state.getTotalSupply();
        if (supply.signum() == 0) {
            return state.getWeiPerShare();
        }
        return AmountMath.mulDiv(totalAssets(), state.getWeiPerShare(), supply, RoundingMode.DOWN);
    }

    // ==============================
    // CONVERSIONS
    // ==============================

    /** Shares worth {@code assets} at the current price. 1:1 while the vault holds no shares or no assets. */
    public BigInteger convertToShares(BigInteger assets, RoundingMode rounding) {
        BigInteger supply = state.getTotalSupply();
        BigInteger total = totalAssets();
        if (supply.signum() == 0 || total.signum() == 0) {
            return assets;
        }
        return AmountMath.mulDiv(assets, supply, total, rounding);
    }

    public BigInteger convertToAssets(BigInteger shares, RoundingMode rounding) {
        BigInteger supply = state.getTotalSupply();
        if (supply.signum() == 0) {
            return shares;
        }
        return AmountMath.mulDiv(shares, totalAssets(), supply, rounding);
    }

    /** Gross asset value of an account's shares, before exit fees. */
    public BigInteger assetsOf(String owner) {
        return convertToAssets(state.sharesOf(owner), RoundingMode.DOWN);
    }

    // ==============================
    // MUTATION PRIMITIVES (guard must be held)
    // ==============================

    public void mint(String to, BigInteger shares) {
        guard.assertHeld();
        state.setSharesOf(to, state.sharesOf(to).add(shares));
        state.setTotalSupply(state.getTotalSupply().add(shares));
    }

    public void burn(String from, BigInteger shares) {
        guard.assertHeld();
        BigInteger balance = state.sharesOf(from);
        if (balance.compareTo(shares) < 0) {
            throw new VaultException(
                    ErrorCode.AMOUNT_TOO_HIGH,
                    "Burn of " + shares + " shares exceeds balance " + balance + " of " + from,
                    Map.of("account", from, "balance", balance, "shares", shares));
        }
        state.setSharesOf(from, balance.subtract(shares));
        state.setTotalSupply(state.getTotalSupply().subtract(shares));
    }

    public void moveShares(String from, String to, BigInteger shares) {
        guard.assertHeld();
        BigInteger balance = state.sharesOf(from);
        if (balance.compareTo(shares) < 0) {
            throw new VaultException(
                    ErrorCode.AMOUNT_TOO_HIGH,
                    "Transfer of " + shares + " shares exceeds balance " + balance + " of " + from,
                    Map.of("account", from, "balance", balance, "shares", shares));
        }
        state.setSharesOf(from, balance.subtract(shares));
        state.setSharesOf(to, state.sharesOf(to).add(shares));
    }

    /** Moves shares from an account into request escrow. Supply is unchanged. */
    public void escrowShares(String from, BigInteger shares) {
        guard.assertHeld();
        BigInteger balance = state.sharesOf(from);
        if (balance.compareTo(shares) < 0) {
            throw new VaultException(
                    ErrorCode.AMOUNT_TOO_HIGH,
                    "Escrow of " + shares + " shares exceeds balance " + balance + " of " + from,
                    Map.of("account", from, "balance", balance, "shares", shares));
        }
        state.setSharesOf(from, balance.subtract(shares));
        state.setEscrowedShares(state.getEscrowedShares().add(shares));
    }

    public void releaseEscrowedShares(String to, BigInteger shares) {
        guard.assertHeld();
        state.setEscrowedShares(state.getEscrowedShares().subtract(shares));
        state.setSharesOf(to, state.sharesOf(to).add(shares));
    }

    public void mintToEscrow(BigInteger shares) {
        guard.assertHeld();
        state.setEscrowedShares(state.getEscrowedShares().add(shares));
        state.setTotalSupply(state.getTotalSupply().add(shares));
    }

    public void burnEscrowedShares(BigInteger shares) {
        guard.assertHeld();
        state.setEscrowedShares(state.getEscrowedShares().subtract(shares));
        state.setTotalSupply(state.getTotalSupply().subtract(shares));
    }

    /** Spends {@code shares} of the allowance {@code owner} granted to {@code spender}. */
    public void spendAllowance(String owner, String spender, BigInteger shares) {
        guard.assertHeld();
        if (owner.equalsIgnoreCase(spender)) {
            return;
        }
        BigInteger allowance = state.allowance(owner, spender);
        if (allowance.compareTo(shares) < 0) {
            throw new VaultException(
                    ErrorCode.UNAUTHORIZED,
                    spender + " is not allowed to move " + shares + " shares of " + owner,
                    Map.of("owner", owner, "spender", spender, "allowance", allowance, "shares", shares));
        }
        if (!allowance.equals(AmountMath.MAX_UINT256)) {
            state.setAllowance(owner, spender, allowance.subtract(shares));
        }
    }

    public void receiveAssets(BigInteger assets) {
        guard.assertHeld();
        state.getWallet().credit(state.getAsset(), assets);
    }

    public void sendAssets(BigInteger assets) {
        guard.assertHeld();
        state.getWallet().debit(state.getAsset(), assets);
    }

    public void accrueTransactionFee(BigInteger fee) {
        guard.assertHeld();
        state.setClaimableTransactionFees(state.getClaimableTransactionFees().add(fee));
    }

    /** Shifts the fee checkpoint by a net deposit (positive) or withdrawal (negative) flow. */
    public void shiftCheckpoint(BigInteger netFlow) {
        guard.assertHeld();
        state.setLastCheckpointAssets(AmountMath.subFloor(state.getLastCheckpointAssets().add(netFlow), BigInteger.ZERO));
    }
}
