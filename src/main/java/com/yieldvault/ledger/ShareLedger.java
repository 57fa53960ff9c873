package com.yieldvault.ledger;

import static com.yieldvault.ledger.VaultChecks.amountTooHigh;
import static com.yieldvault.ledger.VaultChecks.amountTooLow;
import static com.yieldvault.ledger.VaultChecks.requireAddress;
import static com.yieldvault.ledger.VaultChecks.requireNonNegative;
import static com.yieldvault.ledger.VaultChecks.requirePositive;

import com.yieldvault.allocation.AllocationParameters;
import com.yieldvault.core.guard.ReentrancyGuard;
import com.yieldvault.core.guard.Revertible;
import com.yieldvault.core.guard.StateRollback;
import com.yieldvault.domain.model.Fees;
import com.yieldvault.domain.model.SwapResult;
import com.yieldvault.domain.model.VaultState;
import com.yieldvault.event.EventPublisherHelper;
import com.yieldvault.event.VaultEventType;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.PriceOracle;
import com.yieldvault.integration.Swapper;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Synchronous share/asset entry points of the vault: deposit, mint, withdraw and redeem (plus
 * their slippage- and deadline-checked {@code safe*} variants), previews and limits, share
 * transfers, and vault administration (seeding, caps, fees, pause, asset migration).
 *
 * <p>Conversions always round in favour of the pool:
 * <ul>
 *   <li>shares issued for a deposit and assets paid for a redemption round down</li>
 *   <li>assets charged for a mint and shares burnt for a withdrawal round up</li>
 *   <li>entry and exit fees round up</li>
 * </ul>
 *
 * <p>Entry and exit fees are moved to {@code claimableTransactionFees} and paid to the fee
 * collector on the next fee collection. Deposits and withdrawals shift the fee checkpoint by
 * their net flow so that performance fees only see yield.
 *
 * <p>Every mutating operation runs inside the vault guard and a {@link StateRollback}; any
 * failure leaves the state as it was.
 */
@Service
public class ShareLedger implements Revertible {

    private static final Logger log = LoggerFactory.getLogger(ShareLedger.class);

    private final VaultAccounting accounting;
    private final VaultState state;
    private final VaultParameters vaultParameters;
    private final AllocationParameters allocationParameters;
    private final Swapper swapper;
    private final PriceOracle priceOracle;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public ShareLedger(
            VaultAccounting accounting,
            AllocationParameters allocationParameters,
            Swapper swapper,
            PriceOracle priceOracle,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.accounting = accounting;
        this.state = accounting.state();
        this.vaultParameters = accounting.parameters();
        this.allocationParameters = allocationParameters;
        this.swapper = swapper;
        this.priceOracle = priceOracle;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ==============================
    // DEPOSIT / MINT
    // ==============================

    public BigInteger deposit(String caller, BigInteger assets, String receiver) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("deposit")) {
            return StateRollback.begin("deposit", state).run(() -> doDeposit(caller, assets, receiver));
        }
    }

    /** Deposit that fails with AMOUNT_TOO_LOW when fewer than {@code minShares} would be issued. */
    public BigInteger safeDeposit(
            String caller, BigInteger assets, String receiver, BigInteger minShares, Instant deadline) {
        checkDeadline(deadline);
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("safeDeposit")) {
            BigInteger expected = previewDeposit(assets);
            if (expected.compareTo(minShares) < 0) {
                throw amountTooLow("shares", expected, minShares);
            }
            return StateRollback.begin("safeDeposit", state).run(() -> doDeposit(caller, assets, receiver));
        }
    }

    /** Mints exactly {@code shares}; returns the assets charged, entry fee included. */
    public BigInteger mint(String caller, BigInteger shares, String receiver) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("mint")) {
            return StateRollback.begin("mint", state).run(() -> doMint(caller, shares, receiver));
        }
    }

    /** Mint that fails with AMOUNT_TOO_HIGH when more than {@code maxAssets} would be charged. */
    public BigInteger safeMint(
            String caller, BigInteger shares, String receiver, BigInteger maxAssets, Instant deadline) {
        checkDeadline(deadline);
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("safeMint")) {
            BigInteger expected = previewMint(shares);
            if (expected.compareTo(maxAssets) > 0) {
                throw amountTooHigh("assets", expected, maxAssets);
            }
            return StateRollback.begin("safeMint", state).run(() -> doMint(caller, shares, receiver));
        }
    }

    /**
     * Deposits {@code amount} of a foreign {@code token}: the token is swapped into the asset with
     * the caller's swap params and the proceeds are deposited for {@code receiver}.
     *
     * <p>The swap must return at least the oracle quote less the max slippage (AMOUNT_TOO_LOW),
     * and the deposit must issue at least {@code minShares}. Depositing the asset itself is a plain
     * safe deposit.
     */
    public BigInteger swapSafeDeposit(
            String caller,
            String token,
            BigInteger amount,
            String receiver,
            BigInteger minShares,
            String swapParams,
            Instant deadline) {
        requireAddress(token, "token");
        if (token.equalsIgnoreCase(state.getAsset())) {
            return safeDeposit(caller, amount, receiver, minShares, deadline);
        }
        checkDeadline(deadline);
        requirePositive(amount, "amount");
        requireNonNegative(minShares, "minShares");
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("swapSafeDeposit")) {
            return StateRollback.begin("swapSafeDeposit", state).track(swapper).run(() -> {
                requireActive();
                BigInteger quoted = priceOracle.convert(token, amount, state.getAsset());
                SwapResult swap = swapper.decodeAndSwap(token, state.getAsset(), amount, swapParams);
                BigInteger minimum = AmountMath.floor(quoted, allocationParameters.getMaxSlippageBps());
                if (swap.getReceived().compareTo(minimum) < 0) {
                    throw amountTooLow("received", swap.getReceived(), minimum);
                }
                BigInteger expected = previewDeposit(swap.getReceived());
                if (expected.compareTo(minShares) < 0) {
                    throw amountTooLow("shares", expected, minShares);
                }
                log.info(
                        "Swap deposit: caller={}, swapped {} {} into {} {}",
                        caller,
                        amount,
                        token,
                        swap.getReceived(),
                        state.getAsset());
                return doDeposit(caller, swap.getReceived(), receiver);
            });
        }
    }

    private BigInteger doDeposit(String caller, BigInteger assets, String receiver) {
        requireActive();
        requirePositive(assets, "assets");
        requireReceiver(receiver);
        requireSeeded();
        checkCap(caller, assets);

        BigInteger fee = entryFee(assets);
        BigInteger shares = accounting.convertToShares(assets.subtract(fee), RoundingMode.DOWN);
        if (shares.signum() == 0) {
            throw amountTooLow("shares", shares, BigInteger.ONE);
        }
        applyDeposit(caller, receiver, assets, fee, shares);
        return shares;
    }

    private BigInteger doMint(String caller, BigInteger shares, String receiver) {
        requireActive();
        requirePositive(shares, "shares");
        requireReceiver(receiver);
        requireSeeded();

        BigInteger net = accounting.convertToAssets(shares, RoundingMode.UP);
        BigInteger assets = grossUpForEntry(net);
        checkCap(caller, assets);
        applyDeposit(caller, receiver, assets, assets.subtract(net), shares);
        return assets;
    }

    private void applyDeposit(String caller, String receiver, BigInteger assets, BigInteger fee, BigInteger shares) {
        BigInteger priceBefore = accounting.sharePrice();

        accounting.receiveAssets(assets);
        accounting.accrueTransactionFee(fee);
        accounting.mint(receiver, shares);
        accounting.shiftCheckpoint(assets.subtract(fee));

        BigInteger priceAfter = accounting.sharePrice();
        log.info("Deposit: caller={}, receiver={}, assets={}, fee={}, shares={}", caller, receiver, assets, fee, shares);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("caller", caller);
        details.put("receiver", receiver);
        details.put("assets", assets);
        details.put("fee", fee);
        details.put("shares", shares);
        details.put("sharePrice", priceAfter);
        eventPublisherHelper.publishVault(this, VaultEventType.DEPOSIT, details);
        eventPublisherHelper.publishSharePriceUpdated(this, priceBefore, priceAfter);
    }

    // ==============================
    // WITHDRAW / REDEEM
    // ==============================

    /** Withdraws exactly {@code assets} to the receiver; returns the shares burnt, exit fee included. */
    public BigInteger withdraw(String caller, BigInteger assets, String receiver, String owner) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("withdraw")) {
            return StateRollback.begin("withdraw", state).run(() -> doWithdraw(caller, assets, receiver, owner));
        }
    }

    /** Withdraw that fails with AMOUNT_TOO_HIGH when more than {@code maxShares} would be burnt. */
    public BigInteger safeWithdraw(
            String caller, BigInteger assets, String receiver, String owner, BigInteger maxShares, Instant deadline) {
        checkDeadline(deadline);
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("safeWithdraw")) {
            BigInteger expected = previewWithdraw(assets);
            if (expected.compareTo(maxShares) > 0) {
                throw amountTooHigh("shares", expected, maxShares);
            }
            return StateRollback.begin("safeWithdraw", state).run(() -> doWithdraw(caller, assets, receiver, owner));
        }
    }

    /** Burns exactly {@code shares}; returns the assets sent to the receiver, exit fee deducted. */
    public BigInteger redeem(String caller, BigInteger shares, String receiver, String owner) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("redeem")) {
            return StateRollback.begin("redeem", state).run(() -> doRedeem(caller, shares, receiver, owner));
        }
    }

    /** Redeem that fails with AMOUNT_TOO_LOW when fewer than {@code minAssets} would be paid. */
    public BigInteger safeRedeem(
            String caller, BigInteger shares, String receiver, String owner, BigInteger minAssets, Instant deadline) {
        checkDeadline(deadline);
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("safeRedeem")) {
            BigInteger expected = previewRedeem(shares);
            if (expected.compareTo(minAssets) < 0) {
                throw amountTooLow("assets", expected, minAssets);
            }
            return StateRollback.begin("safeRedeem", state).run(() -> doRedeem(caller, shares, receiver, owner));
        }
    }

    private BigInteger doWithdraw(String caller, BigInteger assets, String receiver, String owner) {
        requireActive();
        requirePositive(assets, "assets");
        requireReceiver(receiver);
        requireAddress(owner, "owner");

        BigInteger fee = exitFeeOnNet(assets);
        BigInteger gross = assets.add(fee);
        BigInteger shares = accounting.convertToShares(gross, RoundingMode.UP);
        BigInteger ownerShares = state.sharesOf(owner);
        if (shares.compareTo(ownerShares) > 0) {
            throw new VaultException(
                    ErrorCode.AMOUNT_TOO_HIGH,
                    "Withdrawal of " + assets + " exceeds the assets of " + owner,
                    Map.of("owner", owner, "sharesRequired", shares, "sharesOwned", ownerShares));
        }
        requireAvailable(gross);
        applyWithdraw(caller, receiver, owner, assets, fee, shares);
        return shares;
    }

    private BigInteger doRedeem(String caller, BigInteger shares, String receiver, String owner) {
        requireActive();
        requirePositive(shares, "shares");
        requireReceiver(receiver);
        requireAddress(owner, "owner");

        BigInteger ownerShares = state.sharesOf(owner);
        if (shares.compareTo(ownerShares) > 0) {
            throw amountTooHigh("shares", shares, ownerShares);
        }
        BigInteger gross = accounting.convertToAssets(shares, RoundingMode.DOWN);
        BigInteger fee = exitFee(gross);
        BigInteger assets = gross.subtract(fee);
        if (assets.signum() == 0) {
            throw amountTooLow("assets", assets, BigInteger.ONE);
        }
        requireAvailable(gross);
        applyWithdraw(caller, receiver, owner, assets, fee, shares);
        return assets;
    }

    private void applyWithdraw(
            String caller, String receiver, String owner, BigInteger assets, BigInteger fee, BigInteger shares) {
        BigInteger priceBefore = accounting.sharePrice();

        accounting.spendAllowance(owner, caller, shares);
        accounting.burn(owner, shares);
        accounting.sendAssets(assets);
        accounting.accrueTransactionFee(fee);
        accounting.shiftCheckpoint(assets.add(fee).negate());

        BigInteger priceAfter = accounting.sharePrice();
        log.info(
                "Withdraw: caller={}, owner={}, receiver={}, assets={}, fee={}, shares={}",
                caller,
                owner,
                receiver,
                assets,
                fee,
                shares);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("caller", caller);
        details.put("receiver", receiver);
        details.put("owner", owner);
        details.put("assets", assets);
        details.put("fee", fee);
        details.put("shares", shares);
        details.put("sharePrice", priceAfter);
        eventPublisherHelper.publishVault(this, VaultEventType.WITHDRAW, details);
        eventPublisherHelper.publishSharePriceUpdated(this, priceBefore, priceAfter);
    }

    // ==============================
    // PREVIEWS & LIMITS
    // ==============================

    /** Shares issued for {@code assets}, after the entry fee. */
    public BigInteger previewDeposit(BigInteger assets) {
        return accounting.convertToShares(assets.subtract(entryFee(assets)), RoundingMode.DOWN);
    }

    /** Assets charged for {@code shares}, entry fee included. */
    public BigInteger previewMint(BigInteger shares) {
        return grossUpForEntry(accounting.convertToAssets(shares, RoundingMode.UP));
    }

    /** Shares burnt to deliver {@code assets}, exit fee included. */
    public BigInteger previewWithdraw(BigInteger assets) {
        return accounting.convertToShares(assets.add(exitFeeOnNet(assets)), RoundingMode.UP);
    }

    /** Assets delivered for {@code shares}, after the exit fee. */
    public BigInteger previewRedeem(BigInteger shares) {
        BigInteger gross = accounting.convertToAssets(shares, RoundingMode.DOWN);
        return gross.subtract(exitFee(gross));
    }

    public BigInteger maxDeposit(String caller) {
        if (state.isPaused()) {
            return BigInteger.ZERO;
        }
        if (vaultParameters.isCapExempt(caller)) {
            return AmountMath.MAX_UINT256;
        }
        return AmountMath.subFloor(state.getMaxTotalAssets(), accounting.totalAssets());
    }

    public BigInteger maxMint(String caller) {
        BigInteger maxAssets = maxDeposit(caller);
        if (maxAssets.equals(AmountMath.MAX_UINT256)) {
            return AmountMath.MAX_UINT256;
        }
        return previewDeposit(maxAssets);
    }

    /** Assets the owner can withdraw now, bounded by their shares and by available liquidity. */
    public BigInteger maxWithdraw(String owner) {
        if (state.isPaused()) {
            return BigInteger.ZERO;
        }
        BigInteger ownerNet = previewRedeem(state.sharesOf(owner));
        BigInteger liquidNet = AmountMath.mulDiv(
                accounting.available(),
                BigInteger.valueOf(AmountMath.BPS - state.getFees().getExit()),
                AmountMath.BPS_BI,
                RoundingMode.DOWN);
        return AmountMath.min(ownerNet, liquidNet);
    }

    public BigInteger maxRedeem(String owner) {
        if (state.isPaused()) {
            return BigInteger.ZERO;
        }
        BigInteger liquidShares = accounting.convertToShares(accounting.available(), RoundingMode.DOWN);
        return AmountMath.min(state.sharesOf(owner), liquidShares);
    }

    /** Net asset value of an owner's shares after the exit fee. */
    public BigInteger assetsOf(String owner) {
        return previewRedeem(state.sharesOf(owner));
    }

    // ==============================
    // SHARE TRANSFERS
    // ==============================

    /** Moves shares from {@code from} to {@code to}; {@code caller} spends an allowance unless it is {@code from}. */
    public void transfer(String caller, String from, String to, BigInteger shares) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("transfer")) {
            StateRollback.begin("transfer", state).run(() -> {
                requirePositive(shares, "shares");
                requireAddress(from, "from");
                requireAddress(to, "to");
                accounting.spendAllowance(from, caller, shares);
                accounting.moveShares(from, to, shares);

                Map<String, Object> details = new LinkedHashMap<>();
                details.put("from", from);
                details.put("to", to);
                details.put("shares", shares);
                eventPublisherHelper.publishVault(this, VaultEventType.SHARES_TRANSFERRED, details);
            });
        }
    }

    public void approve(String owner, String spender, BigInteger shares) {
        requireAddress(owner, "owner");
        requireAddress(spender, "spender");
        requireNonNegative(shares, "shares");
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("approve")) {
            state.setAllowance(owner, spender, shares);
        }
        log.debug("Approval: owner={}, spender={}, shares={}", owner, spender, shares);
    }

    /** Captures the vault state for a rollback driven from outside the ledger, e.g. by the allocator. */
    @Override
    public Runnable checkpoint() {
        return state.checkpoint();
    }

    // ==============================
    // ADMINISTRATION
    // ==============================

    /**
     * Makes the first deposit into an empty vault, sets the deposit cap and unpauses.
     * Shares are minted 1:1, so the share price starts at {@code weiPerShare}.
     */
    public BigInteger seedLiquidity(String caller, BigInteger amount, BigInteger maxTotalAssets) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("seedLiquidity")) {
            return StateRollback.begin("seedLiquidity", state).run(() -> {
                requirePositive(amount, "amount");
                requireAddress(caller, "caller");
                if (state.getTotalSupply().signum() > 0) {
                    throw new VaultException(ErrorCode.WRONG_REQUEST, "Vault is already seeded");
                }
                if (amount.compareTo(state.getMinLiquidity()) < 0) {
                    throw new VaultException(
                            ErrorCode.LIQUIDITY_TOO_LOW,
                            "Seed of " + amount + " is below the minimum liquidity " + state.getMinLiquidity(),
                            Map.of("amount", amount, "minLiquidity", state.getMinLiquidity()));
                }
                if (maxTotalAssets.compareTo(amount) < 0) {
                    throw amountTooHigh("seed", amount, maxTotalAssets);
                }

                state.setMaxTotalAssets(maxTotalAssets);
                state.setPaused(false);
                BigInteger shares = accounting.convertToShares(amount, RoundingMode.DOWN);
                applyDeposit(caller, caller, amount, BigInteger.ZERO, shares);

                state.setLastCheckpointAssets(accounting.totalAssets());
                state.setLastSharePrice(accounting.sharePrice());
                state.setLastCheckpointTime(clock.instant());

                log.info("Vault seeded: amount={}, shares={}, maxTotalAssets={}", amount, shares, maxTotalAssets);
                eventPublisherHelper.publishVault(
                        this, VaultEventType.MAX_TOTAL_ASSETS_SET, Map.of("maxTotalAssets", maxTotalAssets));
                eventPublisherHelper.publishVault(this, VaultEventType.UNPAUSED, Map.of("caller", caller));
                return shares;
            });
        }
    }

    public void setFees(Fees fees) {
        fees.validate();
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("setFees")) {
            Fees previous = state.getFees();
            state.setFees(fees);
            log.info("Fees updated: {} -> {}", previous, fees);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("perf", fees.getPerf());
            details.put("mgmt", fees.getMgmt());
            details.put("entry", fees.getEntry());
            details.put("exit", fees.getExit());
            eventPublisherHelper.publishVault(this, VaultEventType.FEES_UPDATED, details);
        }
    }

    public void setMaxTotalAssets(BigInteger maxTotalAssets) {
        requireNonNegative(maxTotalAssets, "maxTotalAssets");
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("setMaxTotalAssets")) {
            state.setMaxTotalAssets(maxTotalAssets);
            log.info("Max total assets set to {}", maxTotalAssets);
            eventPublisherHelper.publishVault(
                    this, VaultEventType.MAX_TOTAL_ASSETS_SET, Map.of("maxTotalAssets", maxTotalAssets));
        }
    }

    public void setMinLiquidity(BigInteger minLiquidity) {
        requireNonNegative(minLiquidity, "minLiquidity");
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("setMinLiquidity")) {
            state.setMinLiquidity(minLiquidity);
            log.info("Min liquidity set to {}", minLiquidity);
            eventPublisherHelper.publishVault(this, VaultEventType.MIN_LIQUIDITY_SET, Map.of("minLiquidity", minLiquidity));
        }
    }

    public void pause() {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("pause")) {
            state.setPaused(true);
        }
        log.warn("Vault paused");
        eventPublisherHelper.publishVault(this, VaultEventType.PAUSED, Map.of());
    }

    public void unpause() {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("unpause")) {
            state.setPaused(false);
        }
        log.info("Vault unpaused");
        eventPublisherHelper.publishVault(this, VaultEventType.UNPAUSED, Map.of());
    }

    /**
     * Migrates the vault to a new underlying asset by swapping the whole asset cash balance.
     *
     * <p>Refused while assets are escrowed or reserved (pending deposits, claimable redemptions,
     * unpaid transaction fees). Requests created before the migration can no longer be claimed
     * and fail with WRONG_TOKEN; they can still be canceled.
     */
    public void updateAsset(String newAsset, String swapParams) {
        requireAddress(newAsset, "asset");
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("updateAsset")) {
            StateRollback.begin("updateAsset", state).track(swapper).run(() -> {
                String oldAsset = state.getAsset();
                if (oldAsset.equalsIgnoreCase(newAsset)) {
                    throw new VaultException(ErrorCode.WRONG_TOKEN, "Asset is already " + newAsset);
                }
                if (state.getPendingDepositAssets().signum() > 0
                        || state.getClaimableRedemptionAssets().signum() > 0
                        || state.getClaimableTransactionFees().signum() > 0) {
                    throw new VaultException(
                            ErrorCode.WRONG_REQUEST, "Cannot update asset while assets are escrowed or reserved");
                }
                if (!priceOracle.hasFeed(oldAsset) || !priceOracle.hasFeed(newAsset)) {
                    throw new VaultException(
                            ErrorCode.MISSING_ORACLE,
                            "No price feed for " + oldAsset + " -> " + newAsset,
                            Map.of("from", oldAsset, "to", newAsset));
                }

                BigInteger cash = state.cash();
                BigInteger received = BigInteger.ZERO;
                if (cash.signum() > 0) {
                    BigInteger expected = priceOracle.convert(oldAsset, cash, newAsset);
                    SwapResult swap = swapper.decodeAndSwap(oldAsset, newAsset, cash, swapParams);
                    BigInteger minimum = AmountMath.floor(expected, allocationParameters.getMaxSlippageBps());
                    if (swap.getReceived().compareTo(minimum) < 0) {
                        throw amountTooLow("received", swap.getReceived(), minimum);
                    }
                    state.getWallet().debit(oldAsset, swap.getSpent());
                    state.getWallet().credit(newAsset, swap.getReceived());
                    received = swap.getReceived();
                }
                state.setAsset(newAsset);

                // profit is measured in the new denomination from here on
                state.setLastCheckpointAssets(accounting.totalAssets());
                state.setLastSharePrice(accounting.sharePrice());

                log.info("Asset updated: {} -> {}, swapped {} for {}", oldAsset, newAsset, cash, received);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("from", oldAsset);
                details.put("to", newAsset);
                details.put("swapped", cash);
                details.put("received", received);
                eventPublisherHelper.publishVault(this, VaultEventType.ASSET_UPDATED, details);
            });
        }
    }

    // ==============================
    // FEES & CHECKS
    // ==============================

    public BigInteger entryFee(BigInteger assets) {
        return AmountMath.bps(assets, state.getFees().getEntry(), RoundingMode.UP);
    }

    public BigInteger exitFee(BigInteger grossAssets) {
        return AmountMath.bps(grossAssets, state.getFees().getExit(), RoundingMode.UP);
    }

    /** Exit fee such that {@code net + fee} pays the fee on the gross amount. */
    private BigInteger exitFeeOnNet(BigInteger netAssets) {
        int exit = state.getFees().getExit();
        return AmountMath.mulDiv(
                netAssets, BigInteger.valueOf(exit), BigInteger.valueOf(AmountMath.BPS - exit), RoundingMode.UP);
    }

    private BigInteger grossUpForEntry(BigInteger netAssets) {
        int entry = state.getFees().getEntry();
        return AmountMath.mulDiv(
                netAssets, AmountMath.BPS_BI, BigInteger.valueOf(AmountMath.BPS - entry), RoundingMode.UP);
    }

    private void checkDeadline(Instant deadline) {
        VaultChecks.checkDeadline(clock, deadline);
    }

    private void requireActive() {
        if (state.isPaused()) {
            throw new VaultException(ErrorCode.PAUSED, "Vault is paused");
        }
    }

    private void requireSeeded() {
        BigInteger totalAssets = accounting.totalAssets();
        if (totalAssets.compareTo(state.getMinLiquidity()) < 0 || state.getTotalSupply().signum() == 0) {
            throw new VaultException(
                    ErrorCode.LIQUIDITY_TOO_LOW,
                    "Vault is not seeded: total assets " + totalAssets + " below " + state.getMinLiquidity(),
                    Map.of("totalAssets", totalAssets, "minLiquidity", state.getMinLiquidity()));
        }
    }

    private void checkCap(String caller, BigInteger assets) {
        if (vaultParameters.isCapExempt(caller)) {
            return;
        }
        BigInteger after = accounting.totalAssets().add(assets);
        if (after.compareTo(state.getMaxTotalAssets()) > 0) {
            throw new VaultException(
                    ErrorCode.MAX_DEPOSIT_REACHED,
                    "Deposit of " + assets + " would take total assets to " + after + ", above the cap "
                            + state.getMaxTotalAssets(),
                    Map.of("assets", assets, "maxTotalAssets", state.getMaxTotalAssets()));
        }
    }

    private void requireAvailable(BigInteger assets) {
        BigInteger available = accounting.available();
        if (available.compareTo(assets) < 0) {
            throw new VaultException(
                    ErrorCode.INSUFFICIENT_FUNDS,
                    "Available liquidity " + available + " cannot cover " + assets,
                    Map.of("available", available, "required", assets));
        }
    }

    private void requireReceiver(String receiver) {
        requireAddress(receiver, "receiver");
        if (receiver.equalsIgnoreCase(vaultParameters.getVaultAddress())) {
            throw new VaultException(ErrorCode.UNAUTHORIZED, "The vault cannot be the receiver");
        }
    }
}
