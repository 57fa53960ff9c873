package com.yieldvault.allocation;

import com.yieldvault.core.guard.ReentrancyGuard;
import com.yieldvault.core.guard.StateRollback;
import com.yieldvault.domain.model.AllocationResult;
import com.yieldvault.domain.model.InputConfig;
import com.yieldvault.domain.model.InputSlot;
import com.yieldvault.domain.model.PairAmounts;
import com.yieldvault.domain.model.SwapResult;
import com.yieldvault.domain.model.VaultState;
import com.yieldvault.event.EventPublisherHelper;
import com.yieldvault.event.VaultEventType;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.PairedPositionAdapter;
import com.yieldvault.integration.ProtocolAdapter;
import com.yieldvault.integration.Swapper;
import com.yieldvault.ledger.AmountMath;
import com.yieldvault.ledger.VaultAccounting;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Deploys vault liquidity into the input slots and recalls it.
 *
 * <p><b>Invest</b> (targets in asset units), per slot with a target at or above the dust threshold:
 * <ol>
 *   <li>swap the target from the asset into the input token with the caller's swap params,
 *       unless the input is the asset</li>
 *   <li>stake the vault's whole realized balance of the input token, which also sweeps dust
 *       left by earlier cycles</li>
 *   <li>take the position delta (re-read before and after) as the amount actually supplied
 *       and check it against the slippage floor</li>
 * </ol>
 *
 * <p><b>Liquidate</b> (targets in input units) mirrors it: unstake, swap the realized input
 * balance back into the asset, check the floor against the expected post-fee recovery. With
 * {@code panic} the floors are skipped. The call fails with LIQUIDITY_TOO_LOW if available
 * liquidity ends below the requested minimum.
 *
 * <p><b>Paired inputs</b>: investing into an even slot only stages its leg (swaps into
 * {@code token0}); the odd slot swaps into {@code token1} and then deposits both legs together
 * in the pool's reserve ratio. Liquidation is driven from the even slot only and burns
 * liquidity for both legs; odd-slot liquidation targets are ignored.
 *
 * <p>Any violation anywhere reverts the whole call through {@link StateRollback}: vault state,
 * input registry and every revertible adapter and swapper are restored.
 */
@Service
public class AllocationEngine {

    private static final Logger log = LoggerFactory.getLogger(AllocationEngine.class);

    private final VaultAccounting accounting;
    private final VaultState state;
    private final InputRegistry inputRegistry;
    private final AllocationPlanner allocationPlanner;
    private final SlippageGuard slippageGuard;
    private final Swapper swapper;
    private final AllocationParameters allocationParameters;
    private final EventPublisherHelper eventPublisherHelper;

    public AllocationEngine(
            VaultAccounting accounting,
            InputRegistry inputRegistry,
            AllocationPlanner allocationPlanner,
            SlippageGuard slippageGuard,
            Swapper swapper,
            AllocationParameters allocationParameters,
            EventPublisherHelper eventPublisherHelper) {
        this.accounting = accounting;
        this.state = accounting.state();
        this.inputRegistry = inputRegistry;
        this.allocationPlanner = allocationPlanner;
        this.slippageGuard = slippageGuard;
        this.swapper = swapper;
        this.allocationParameters = allocationParameters;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ==============================
    // INVEST
    // ==============================

    public AllocationResult invest(List<BigInteger> targets, List<String> swapParams) {
        validateArrays(targets, swapParams);
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("invest")) {
            return beginRollback("invest").run(() -> doInvest(targets, swapParams));
        }
    }

    private AllocationResult doInvest(List<BigInteger> targets, List<String> swapParams) {
        requireOccupied(targets);
        BigInteger requested = targets.stream().reduce(BigInteger.ZERO, BigInteger::add);
        BigInteger available = accounting.available();
        if (requested.compareTo(available) > 0) {
            throw new VaultException(
                    ErrorCode.INSUFFICIENT_FUNDS,
                    "Invest targets " + requested + " exceed available liquidity " + available,
                    Map.of("requested", requested, "available", available));
        }

        BigInteger totalBefore = accounting.totalAssets();
        BigInteger priceBefore = accounting.sharePrice();
        List<BigInteger> spent = new ArrayList<>(Collections.nCopies(InputRegistry.MAX_INPUTS, BigInteger.ZERO));
        boolean[] staged = new boolean[InputRegistry.MAX_INPUTS];
        BigInteger[] assetLegs = new BigInteger[InputRegistry.MAX_INPUTS];
        Arrays.fill(assetLegs, BigInteger.ZERO);

        for (int i = 0; i < InputRegistry.MAX_INPUTS; i++) {
            Optional<InputSlot> maybeSlot = inputRegistry.slot(i);
            if (maybeSlot.isEmpty()) {
                continue;
            }
            InputSlot slot = maybeSlot.get();
            BigInteger target = targets.get(i);
            boolean aboveDust = target.compareTo(allocationParameters.getDustThreshold()) >= 0;

            if (slot.isPaired()) {
                if (aboveDust) {
                    spent.set(i, target);
                    swapInto(slot, target, swapParams.get(i));
                    if (isAsset(slot.getToken())) {
                        assetLegs[i] = target;
                    }
                }
                if (slot.isPairLead()) {
                    staged[i] = aboveDust;
                    log.debug("Slot {} staged {} for its pair", i, aboveDust ? target : BigInteger.ZERO);
                } else if (aboveDust || staged[i - 1]) {
                    depositPair(slot, assetLegs[i - 1], assetLegs[i]);
                }
            } else if (aboveDust) {
                spent.set(i, target);
                investSingle(slot, target, swapParams.get(i));
            }
        }

        AllocationResult result = buildResult(spent, totalBefore);
        log.info(
                "Invested {} across slots {}: totalAssets {} -> {}, available {}",
                result.getTotal(),
                spent,
                totalBefore,
                result.getTotalAssetsAfter(),
                result.getAvailable());
        publish(VaultEventType.INVEST, result, priceBefore);
        return result;
    }

    private void investSingle(InputSlot slot, BigInteger target, String params) {
        ProtocolAdapter adapter = slot.getAdapter();
        String token = slot.getToken();
        BigInteger expectedInput = swapInto(slot, target, params);

        BigInteger toStake = isAsset(token) ? target : state.getWallet().balanceOf(token);
        BigInteger before = adapter.positionBalance();
        adapter.stake(toStake);
        state.getWallet().debit(token, toStake);
        BigInteger delta = adapter.positionBalance().subtract(before);

        log.debug("Slot {}: staked {} {}, position delta {}", slot.getIndex(), toStake, token, delta);
        slippageGuard.checkPosition(slot.getIndex(), delta, toStake, false);
        slippageGuard.checkCombined(slot.getIndex(), delta, expectedInput, false);
    }

    /**
     * Swaps {@code target} of the asset into the slot's token. Returns the oracle quote for the
     * target in input units (the target itself when the input is the asset).
     */
    private BigInteger swapInto(InputSlot slot, BigInteger target, String params) {
        String token = slot.getToken();
        if (isAsset(token)) {
            return target;
        }
        BigInteger quoted = allocationPlanner.fromAsset(token, target);
        SwapResult swap = swapper.decodeAndSwap(state.getAsset(), token, target, params);
        state.getWallet().debit(state.getAsset(), swap.getSpent());
        state.getWallet().credit(token, swap.getReceived());
        slippageGuard.checkSwap(slot.getIndex(), swap.getReceived(), quoted, false);
        return quoted;
    }

    /**
     * Deposits the realized balances of both tokens of the pair ending at {@code oddSlot}, in
     * reserve ratio. A leg that is the vault asset contributes only the amount targeted in this call.
     */
    private void depositPair(InputSlot oddSlot, BigInteger assetLeg0, BigInteger assetLeg1) {
        PairedPositionAdapter adapter = oddSlot.getPairedAdapter();
        int lead = oddSlot.getIndex() - 1;
        BigInteger balance0 = pairLegBalance(adapter.token0(), assetLeg0);
        BigInteger balance1 = pairLegBalance(adapter.token1(), assetLeg1);

        PairAmounts reserves = adapter.reserves();
        BigInteger amount0 = balance0;
        BigInteger amount1 = balance1;
        if (reserves.getAmount0().signum() > 0 && reserves.getAmount1().signum() > 0) {
            // balance0 / balance1 vs reserve0 / reserve1
            if (balance0.multiply(reserves.getAmount1()).compareTo(balance1.multiply(reserves.getAmount0())) > 0) {
                amount0 = AmountMath.mulDiv(balance1, reserves.getAmount0(), reserves.getAmount1(), RoundingMode.DOWN);
            } else {
                amount1 = AmountMath.mulDiv(balance0, reserves.getAmount1(), reserves.getAmount0(), RoundingMode.DOWN);
            }
        }
        if (amount0.signum() == 0 || amount1.signum() == 0) {
            log.debug("Pair {}/{}: nothing to deposit (amounts {} / {})", lead, oddSlot.getIndex(), amount0, amount1);
            return;
        }

        BigInteger quoted = adapter.quoteLiquidity(amount0, amount1);
        BigInteger before = adapter.positionBalance();
        adapter.stakePair(amount0, amount1);
        state.getWallet().debit(adapter.token0(), amount0);
        state.getWallet().debit(adapter.token1(), amount1);
        BigInteger delta = adapter.positionBalance().subtract(before);

        log.debug(
                "Pair {}/{}: deposited {} + {}, liquidity delta {} (quoted {})",
                lead,
                oddSlot.getIndex(),
                amount0,
                amount1,
                delta,
                quoted);
        slippageGuard.checkPosition(lead, delta, quoted, false);
        slippageGuard.checkCombined(lead, delta, quoted, false);
    }

    // ==============================
    // LIQUIDATE
    // ==============================

    public AllocationResult liquidate(
            List<BigInteger> targets, BigInteger minLiquidity, boolean panic, List<String> swapParams) {
        validateArrays(targets, swapParams);
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("liquidate")) {
            return beginRollback("liquidate").run(() -> doLiquidate(targets, minLiquidity, panic, swapParams));
        }
    }

    private AllocationResult doLiquidate(
            List<BigInteger> targets, BigInteger minLiquidity, boolean panic, List<String> swapParams) {
        requireOccupied(targets);
        BigInteger totalBefore = accounting.totalAssets();
        BigInteger priceBefore = accounting.sharePrice();
        List<BigInteger> recovered = new ArrayList<>(Collections.nCopies(InputRegistry.MAX_INPUTS, BigInteger.ZERO));

        for (int i = 0; i < InputRegistry.MAX_INPUTS; i++) {
            Optional<InputSlot> maybeSlot = inputRegistry.slot(i);
            BigInteger target = targets.get(i);
            if (maybeSlot.isEmpty() || target.compareTo(allocationParameters.getDustThreshold()) < 0) {
                continue;
            }
            InputSlot slot = maybeSlot.get();
            if (slot.isPaired() && !slot.isPairLead()) {
                log.debug("Slot {}: liquidation target {} ignored, pairs unstake from their even slot", i, target);
                continue;
            }
            BigInteger out = slot.isPaired()
                    ? liquidatePair(slot, target, swapParams.get(i), swapParams.get(i + 1), panic)
                    : liquidateSingle(slot, target, swapParams.get(i), panic);
            recovered.set(i, out);
        }

        BigInteger available = accounting.available();
        BigInteger floor = AmountMath.orZero(minLiquidity);
        if (available.compareTo(floor) < 0) {
            throw new VaultException(
                    ErrorCode.LIQUIDITY_TOO_LOW,
                    "Available liquidity " + available + " below requested minimum " + floor,
                    Map.of("available", available, "minLiquidity", floor));
        }

        AllocationResult result = buildResult(recovered, totalBefore);
        if (panic) {
            log.warn("Panic liquidation recovered {} across slots {}", result.getTotal(), recovered);
        } else {
            log.info(
                    "Liquidated {} across slots {}: totalAssets {} -> {}, available {}",
                    result.getTotal(),
                    recovered,
                    totalBefore,
                    result.getTotalAssetsAfter(),
                    result.getAvailable());
        }
        publish(VaultEventType.LIQUIDATE, result, priceBefore);
        return result;
    }

    private BigInteger liquidateSingle(InputSlot slot, BigInteger target, String params, boolean panic) {
        ProtocolAdapter adapter = slot.getAdapter();
        String token = slot.getToken();
        BigInteger amount = AmountMath.min(target, adapter.investedValue());
        if (amount.signum() == 0 && pairLegBalance(token, BigInteger.ZERO).signum() == 0) {
            return BigInteger.ZERO;
        }

        BigInteger expectedRecovery = BigInteger.ZERO;
        BigInteger recovered = BigInteger.ZERO;
        if (amount.signum() > 0) {
            expectedRecovery = AmountMath.floor(amount, adapter.unstakeFeeBps());
            recovered = adapter.unstake(amount);
            state.getWallet().credit(token, recovered);
            log.debug("Slot {}: unstaked {} {}, recovered {}", slot.getIndex(), amount, token, recovered);
            slippageGuard.checkPosition(slot.getIndex(), recovered, expectedRecovery, panic);
        }

        BigInteger assetOut = swapToAsset(slot.getIndex(), token, recovered, params, panic);
        slippageGuard.checkCombined(
                slot.getIndex(), assetOut, allocationPlanner.toAsset(token, expectedRecovery), panic);
        return assetOut;
    }

    private BigInteger liquidatePair(
            InputSlot lead, BigInteger target0, String params0, String params1, boolean panic) {
        PairedPositionAdapter adapter = lead.getPairedAdapter();
        PairAmounts position = adapter.positionAmounts();
        BigInteger liquidityHeld = adapter.positionBalance();
        if (position.getAmount0().signum() == 0 || liquidityHeld.signum() == 0) {
            return BigInteger.ZERO;
        }

        BigInteger liquidity = AmountMath.min(
                liquidityHeld,
                AmountMath.mulDiv(liquidityHeld, target0, position.getAmount0(), RoundingMode.UP));
        int fee = adapter.unstakeFeeBps();
        BigInteger expected0 = AmountMath.floor(
                AmountMath.mulDiv(position.getAmount0(), liquidity, liquidityHeld, RoundingMode.DOWN), fee);
        BigInteger expected1 = AmountMath.floor(
                AmountMath.mulDiv(position.getAmount1(), liquidity, liquidityHeld, RoundingMode.DOWN), fee);

        PairAmounts out = adapter.unstakePair(liquidity);
        state.getWallet().credit(adapter.token0(), out.getAmount0());
        state.getWallet().credit(adapter.token1(), out.getAmount1());
        log.debug(
                "Pair {}/{}: burnt {} liquidity, recovered {} + {}",
                lead.getIndex(),
                lead.getIndex() + 1,
                liquidity,
                out.getAmount0(),
                out.getAmount1());
        slippageGuard.checkPosition(lead.getIndex(), out.getAmount0(), expected0, panic);
        slippageGuard.checkPosition(lead.getIndex() + 1, out.getAmount1(), expected1, panic);

        BigInteger assetOut = swapToAsset(lead.getIndex(), adapter.token0(), out.getAmount0(), params0, panic)
                .add(swapToAsset(lead.getIndex() + 1, adapter.token1(), out.getAmount1(), params1, panic));
        BigInteger expectedAsset = allocationPlanner
                .toAsset(adapter.token0(), expected0)
                .add(allocationPlanner.toAsset(adapter.token1(), expected1));
        slippageGuard.checkCombined(lead.getIndex(), assetOut, expectedAsset, panic);
        return assetOut;
    }

    /**
     * Swaps the vault's whole realized balance of {@code token} into the asset and returns the
     * asset received. When the token is the asset nothing is swapped and {@code unstaked} is
     * returned as is.
     */
    private BigInteger swapToAsset(int slot, String token, BigInteger unstaked, String params, boolean panic) {
        if (isAsset(token)) {
            return unstaked;
        }
        BigInteger balance = state.getWallet().balanceOf(token);
        if (balance.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger quoted = allocationPlanner.toAsset(token, balance);
        SwapResult swap = swapper.decodeAndSwap(token, state.getAsset(), balance, params);
        state.getWallet().debit(token, swap.getSpent());
        state.getWallet().credit(state.getAsset(), swap.getReceived());
        log.debug("Slot {}: swapped {} {} into {} {}", slot, swap.getSpent(), token, swap.getReceived(), state.getAsset());
        slippageGuard.checkSwap(slot, swap.getReceived(), quoted, panic);
        return swap.getReceived();
    }

    // ==============================
    // INPUT CONFIGURATION
    // ==============================

    /**
     * Replaces the input set. Every currently configured slot must already be liquidated
     * (value below the dust threshold), otherwise WRONG_REQUEST.
     */
    public void updateInputs(List<InputConfig> configs) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("updateInputs")) {
            beginRollback("updateInputs").run(() -> {
                for (InputSlot slot : inputRegistry.activeSlots()) {
                    BigInteger invested = allocationPlanner.invested(slot.getIndex());
                    if (invested.compareTo(allocationParameters.getDustThreshold()) >= 0) {
                        throw new VaultException(
                                ErrorCode.WRONG_REQUEST,
                                "Slot " + slot.getIndex() + " still holds " + invested + "; liquidate it first",
                                Map.of("slot", slot.getIndex(), "invested", invested));
                    }
                }
                inputRegistry.configure(configs);
                publishInputs();
            });
        }
    }

    public void setInputWeights(int[] weights) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("setInputWeights")) {
            beginRollback("setInputWeights").run(() -> {
                inputRegistry.setWeights(weights);
                publishInputs();
            });
        }
    }

    // ==============================
    // HELPERS
    // ==============================

    private StateRollback beginRollback(String operation) {
        StateRollback rollback = StateRollback.begin(operation, state, inputRegistry).track(swapper);
        for (InputSlot slot : inputRegistry.activeSlots()) {
            rollback.track(slot.getAdapter());
            if (slot.isPairLead()) {
                rollback.track(slot.getPairedAdapter());
            }
        }
        return rollback;
    }

    private void validateArrays(List<BigInteger> targets, List<String> swapParams) {
        if (targets == null
                || swapParams == null
                || targets.size() != InputRegistry.MAX_INPUTS
                || swapParams.size() != InputRegistry.MAX_INPUTS) {
            throw new VaultException(
                    ErrorCode.INCORRECT_ARRAY_LENGTHS,
                    "Targets and swap params must both have " + InputRegistry.MAX_INPUTS + " entries");
        }
        for (BigInteger target : targets) {
            if (target == null || target.signum() < 0) {
                throw new VaultException(ErrorCode.AMOUNT_TOO_LOW, "Targets must be non-negative");
            }
        }
    }

    private void requireOccupied(List<BigInteger> targets) {
        for (int i = 0; i < targets.size(); i++) {
            if (targets.get(i).signum() > 0 && inputRegistry.slot(i).isEmpty()) {
                throw new VaultException(
                        ErrorCode.WRONG_REQUEST, "Slot " + i + " is empty", Map.of("slot", i, "target", targets.get(i)));
            }
        }
    }

    private boolean isAsset(String token) {
        return token.equalsIgnoreCase(state.getAsset());
    }

    /** Wallet balance of a non-asset token; for the asset, the amount earmarked by the caller. */
    private BigInteger pairLegBalance(String token, BigInteger assetAmount) {
        return isAsset(token) ? assetAmount : state.getWallet().balanceOf(token);
    }

    private AllocationResult buildResult(List<BigInteger> amounts, BigInteger totalBefore) {
        return AllocationResult.builder()
                .amounts(List.copyOf(amounts))
                .total(amounts.stream().reduce(BigInteger.ZERO, BigInteger::add))
                .totalAssetsBefore(totalBefore)
                .totalAssetsAfter(accounting.totalAssets())
                .available(accounting.available())
                .sharePrice(accounting.sharePrice())
                .build();
    }

    private void publish(VaultEventType type, AllocationResult result, BigInteger priceBefore) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("amounts", result.getAmounts());
        details.put("total", result.getTotal());
        details.put("totalAssetsBefore", result.getTotalAssetsBefore());
        details.put("totalAssetsAfter", result.getTotalAssetsAfter());
        details.put("available", result.getAvailable());
        details.put("sharePrice", result.getSharePrice());
        eventPublisherHelper.publishVault(this, type, details);
        eventPublisherHelper.publishSharePriceUpdated(this, priceBefore, result.getSharePrice());
    }

    private void publishInputs() {
        Map<String, Object> details = new LinkedHashMap<>();
        for (InputSlot slot : inputRegistry.activeSlots()) {
            details.put("slot" + slot.getIndex(), slot.getToken() + "@" + slot.getWeight());
        }
        details.put("totalWeight", inputRegistry.totalWeight());
        eventPublisherHelper.publishVault(this, VaultEventType.INPUTS_UPDATED, details);
    }
}
