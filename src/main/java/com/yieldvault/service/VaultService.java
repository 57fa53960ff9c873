package com.yieldvault.service;

import com.yieldvault.allocation.AllocationEngine;
import com.yieldvault.allocation.AllocationPlanner;
import com.yieldvault.allocation.InputRegistry;
import com.yieldvault.api.dto.response.VaultStateResponse;
import com.yieldvault.domain.model.AllocationResult;
import com.yieldvault.domain.model.InputSlot;
import com.yieldvault.domain.model.VaultState;
import com.yieldvault.domain.model.FeeCollectionResult;
import com.yieldvault.ledger.AmountMath;
import com.yieldvault.ledger.FeeAccrualEngine;
import com.yieldvault.ledger.ShareLedger;
import com.yieldvault.ledger.VaultAccounting;
import com.yieldvault.request.RequestQueue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeper-level workflows composed from the core components.
 *
 * <p>Each workflow is a sequence of independent core calls; a failure in a later step leaves
 * the earlier steps committed. Individual calls stay atomic.
 * <ul>
 *   <li><b>investAvailable</b>: invests available cash into slot deficits</li>
 *   <li><b>processRedemptions</b>: liquidates the shortfall of pending redemptions, then settles them</li>
 *   <li><b>rebalance</b>: liquidates over-allocated slots, then reinvests</li>
 *   <li><b>emptyStrategy</b>: closes the vault to new assets, liquidates every position and
 *       collects fees</li>
 * </ul>
 */
@Service
public class VaultService {

    private static final Logger log = LoggerFactory.getLogger(VaultService.class);

    private final VaultAccounting accounting;
    private final InputRegistry inputRegistry;
    private final AllocationPlanner allocationPlanner;
    private final AllocationEngine allocationEngine;
    private final RequestQueue requestQueue;
    private final ShareLedger shareLedger;
    private final FeeAccrualEngine feeAccrualEngine;

    public VaultService(
            VaultAccounting accounting,
            InputRegistry inputRegistry,
            AllocationPlanner allocationPlanner,
            AllocationEngine allocationEngine,
            RequestQueue requestQueue,
            ShareLedger shareLedger,
            FeeAccrualEngine feeAccrualEngine) {
        this.accounting = accounting;
        this.inputRegistry = inputRegistry;
        this.allocationPlanner = allocationPlanner;
        this.allocationEngine = allocationEngine;
        this.requestQueue = requestQueue;
        this.shareLedger = shareLedger;
        this.feeAccrualEngine = feeAccrualEngine;
    }

    public VaultStateResponse state() {
        VaultState state = accounting.state();
        return VaultStateResponse.builder()
                .asset(state.getAsset())
                .totalAssets(accounting.totalAssets())
                .available(accounting.available())
                .invested(accounting.invested())
                .investedPerSlot(allocationPlanner.investedPerSlot())
                .totalSupply(accounting.totalSupply())
                .sharePrice(accounting.sharePrice())
                .paused(state.isPaused())
                .maxTotalAssets(state.getMaxTotalAssets())
                .minLiquidity(state.getMinLiquidity())
                .fees(state.getFees())
                .pendingDepositAssets(state.getPendingDepositAssets())
                .claimableRedemptionAssets(state.getClaimableRedemptionAssets())
                .claimableTransactionFees(state.getClaimableTransactionFees())
                .totalRedemptionRequest(requestQueue.totalRedemptionRequest())
                .totalRedemptionRequestAssets(requestQueue.totalRedemptionRequestAssets())
                .lastCheckpointAssets(state.getLastCheckpointAssets())
                .lastCheckpointTime(state.getLastCheckpointTime())
                .build();
    }

    /** Per-slot targets for {@code amount}; zero resolves to the planner's default for the direction. */
    public List<BigInteger> preview(BigInteger amount, boolean investing) {
        return allocationPlanner.preview(amount, investing, requestQueue.totalRedemptionRequestAssets());
    }

    // ==============================
    // WORKFLOWS
    // ==============================

    /** Invests all available cash according to the slot weights. */
    public AllocationResult investAvailable(List<String> swapParams) {
        List<BigInteger> targets = allocationPlanner.preview(accounting.available(), true);
        if (isEmpty(targets)) {
            log.info("Nothing to invest: no slot below its weight target");
            return idleResult();
        }
        return allocationEngine.invest(targets, padSwapParams(swapParams));
    }

    /** Liquidates enough to cover {@code amount} of asset, taking from over-allocated slots first. */
    public AllocationResult liquidateFor(BigInteger amount, boolean panic, List<String> swapParams) {
        List<BigInteger> targets = allocationPlanner.preview(amount, false);
        if (isEmpty(targets)) {
            log.info("Nothing to liquidate for {}", amount);
            return idleResult();
        }
        return allocationEngine.liquidate(targets, BigInteger.ZERO, panic, padSwapParams(swapParams));
    }

    /**
     * Settles pending redemptions, liquidating first when available cash does not cover
     * them. Returns the number of requests settled.
     */
    public int processRedemptions(List<String> swapParams) {
        BigInteger shortfall = AmountMath.subFloor(requestQueue.totalRedemptionRequestAssets(), accounting.available());
        if (shortfall.signum() > 0) {
            log.info("Redemptions exceed available cash by {}, liquidating", shortfall);
            liquidateFor(shortfall, false, swapParams);
        }
        return requestQueue.settleRedemptions();
    }

    /** Brings every slot back to its weight: liquidates the total excess, then invests. */
    public AllocationResult rebalance(List<String> swapParams) {
        BigInteger total = accounting.totalAssets();
        BigInteger excess = BigInteger.ZERO;
        for (InputSlot slot : inputRegistry.activeSlots()) {
            BigInteger slotExcess = allocationPlanner.excessLiquidity(slot.getIndex(), total);
            excess = excess.add(AmountMath.max(BigInteger.ZERO, slotExcess));
        }
        if (excess.signum() > 0) {
            log.info("Rebalancing: {} over weight targets", excess);
            liquidateFor(excess, false, swapParams);
        }
        return investAvailable(swapParams);
    }

    /**
     * Winds the vault down: stops new deposits with a zero cap, drops the liquidity floor,
     * liquidates every position and collects fees on the result. Holders then exit through
     * redeem or withdraw.
     */
    public AllocationResult emptyStrategy(boolean panic, List<String> swapParams) {
        shareLedger.setMaxTotalAssets(BigInteger.ZERO);
        shareLedger.setMinLiquidity(BigInteger.ZERO);

        List<BigInteger> targets = allocationPlanner.liquidateAllTargets();
        AllocationResult result;
        if (isEmpty(targets)) {
            log.info("Emptying vault: no open position");
            result = idleResult();
        } else {
            result = allocationEngine.liquidate(targets, BigInteger.ZERO, panic, padSwapParams(swapParams));
        }
        FeeCollectionResult fees = feeAccrualEngine.collectFees();
        log.warn("Vault emptied: liquidated={}, available={}, feesCollected={}",
                result.getTotal(), accounting.available(), fees.isCollected());
        return result;
    }

    private AllocationResult idleResult() {
        BigInteger totalAssets = accounting.totalAssets();
        return AllocationResult.builder()
                .amounts(Collections.nCopies(InputRegistry.MAX_INPUTS, BigInteger.ZERO))
                .total(BigInteger.ZERO)
                .totalAssetsBefore(totalAssets)
                .totalAssetsAfter(totalAssets)
                .available(accounting.available())
                .sharePrice(accounting.sharePrice())
                .build();
    }

    private static boolean isEmpty(List<BigInteger> targets) {
        return targets.stream().allMatch(t -> t.signum() == 0);
    }

    /** Missing swap parameters default to empty strings; an overlong list is left for the engine to reject. */
    public static List<String> padSwapParams(List<String> swapParams) {
        List<String> padded = swapParams != null ? new ArrayList<>(swapParams) : new ArrayList<>();
        while (padded.size() < InputRegistry.MAX_INPUTS) {
            padded.add("");
        }
        for (int i = 0; i < padded.size(); i++) {
            if (padded.get(i) == null) {
                padded.set(i, "");
            }
        }
        return padded;
    }
}
