package com.yieldvault.allocation;

import com.yieldvault.domain.model.InputSlot;
import com.yieldvault.domain.model.PairAmounts;
import com.yieldvault.domain.model.VaultState;
import com.yieldvault.integration.PriceOracle;
import com.yieldvault.ledger.AmountMath;
import com.yieldvault.ledger.InvestedValueSource;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Read-only valuation and target planning over the input slots.
 *
 * <p>{@code invested(i)} is the asset value of slot {@code i}: the position value reported
 * by its adapter plus any idle balance of the input token left in the vault by earlier
 * cycles (dust), converted through the {@link PriceOracle}. An input that is the vault asset
 * itself contributes only its position; idle asset is cash.
 *
 * <p>{@link #preview} turns a single amount into per-slot targets:
 * <ul>
 *   <li>investing: fills each slot's deficit {@code totalAssets * weight / BPS - invested}, in
 *       slot order, until the amount is used up. Targets are asset units.</li>
 *   <li>liquidating: takes from each slot's excess over {@code (totalAssets - amount) * weight / BPS},
 *       then from remaining positions if excess alone does not cover the amount. Targets are
 *       input units; in paired mode the whole pair is targeted through its even slot.</li>
 * </ul>
 */
@Component
public class AllocationPlanner implements InvestedValueSource {

    /** Share of available cash a zero invest amount resolves to. */
    public static final int DEFAULT_INVEST_BPS = 9_000;
    /** Buffer on invested value added to pending redemptions when a zero liquidate amount is resolved. */
    public static final int DEFAULT_LIQUIDATE_BUFFER_BPS = 100;

    private final InputRegistry inputRegistry;
    private final VaultState state;
    private final PriceOracle priceOracle;

    public AllocationPlanner(InputRegistry inputRegistry, VaultState state, PriceOracle priceOracle) {
        this.inputRegistry = inputRegistry;
        this.state = state;
        this.priceOracle = priceOracle;
    }

    // ==============================
    // VALUATION
    // ==============================

    /** Asset value deployed into slot {@code index}; zero for an empty slot. */
    public BigInteger invested(int index) {
        Optional<InputSlot> slot = inputRegistry.slot(index);
        if (slot.isEmpty()) {
            return BigInteger.ZERO;
        }
        return toAsset(slot.get().getToken(), investedInput(slot.get()));
    }

    /** Value of slot {@code index} in its own input token units, idle dust included. */
    public BigInteger investedInput(InputSlot slot) {
        BigInteger position;
        if (slot.isPaired()) {
            PairAmounts amounts = slot.getPairedAdapter().positionAmounts();
            position = slot.isPairLead() ? amounts.getAmount0() : amounts.getAmount1();
        } else {
            position = slot.getAdapter().investedValue();
        }
        return position.add(idleBalance(slot.getToken()));
    }

    @Override
    public BigInteger invested() {
        BigInteger total = BigInteger.ZERO;
        for (InputSlot slot : inputRegistry.activeSlots()) {
            total = total.add(invested(slot.getIndex()));
        }
        return total;
    }

    public List<BigInteger> investedPerSlot() {
        List<BigInteger> values = new ArrayList<>(zeros());
        for (InputSlot slot : inputRegistry.activeSlots()) {
            values.set(slot.getIndex(), invested(slot.getIndex()));
        }
        return values;
    }

    public BigInteger totalAssets() {
        return state.available().add(invested());
    }

    /**
     * Signed distance of slot {@code index} from its weight target for a given total:
     * {@code invested(i) - total * weight_i / BPS}. Positive means over-allocated.
     */
    public BigInteger excessLiquidity(int index, BigInteger total) {
        Optional<InputSlot> slot = inputRegistry.slot(index);
        if (slot.isEmpty()) {
            return BigInteger.ZERO;
        }
        return invested(index).subtract(weightTarget(total, slot.get().getWeight()));
    }

    // ==============================
    // PLANNING
    // ==============================

    public List<BigInteger> preview(BigInteger amount, boolean investing) {
        return investing ? previewInvest(amount) : previewLiquidate(amount);
    }

    /**
     * Same as {@link #preview(BigInteger, boolean)}, except that a zero amount resolves to a
     * default: 90% of available cash when investing, pending redemption assets plus 1% of the
     * invested value when liquidating.
     */
    public List<BigInteger> preview(BigInteger amount, boolean investing, BigInteger pendingRedemptionAssets) {
        if (amount.signum() == 0) {
            amount = investing ? defaultInvestAmount() : defaultLiquidateAmount(pendingRedemptionAssets);
        }
        return preview(amount, investing);
    }

    public BigInteger defaultInvestAmount() {
        return AmountMath.bps(state.available(), DEFAULT_INVEST_BPS, RoundingMode.DOWN);
    }

    public BigInteger defaultLiquidateAmount(BigInteger pendingRedemptionAssets) {
        return pendingRedemptionAssets.add(AmountMath.bps(invested(), DEFAULT_LIQUIDATE_BUFFER_BPS, RoundingMode.DOWN));
    }

    /**
     * Liquidation targets covering every position: the adapter's whole position for a single
     * slot, the whole token0 amount through the even slot for a pair.
     */
    public List<BigInteger> liquidateAllTargets() {
        List<BigInteger> targets = new ArrayList<>(zeros());
        for (InputSlot slot : liquidationLeads()) {
            BigInteger position = slot.isPaired()
                    ? slot.getPairedAdapter().positionAmounts().getAmount0()
                    : slot.getAdapter().investedValue();
            targets.set(slot.getIndex(), position);
        }
        return targets;
    }

    private List<BigInteger> previewInvest(BigInteger amount) {
        List<BigInteger> targets = new ArrayList<>(zeros());
        BigInteger total = totalAssets();
        BigInteger remaining = amount;
        for (InputSlot slot : inputRegistry.activeSlots()) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigInteger deficit = excessLiquidity(slot.getIndex(), total).negate();
            if (deficit.signum() > 0) {
                BigInteger take = AmountMath.min(deficit, remaining);
                targets.set(slot.getIndex(), take);
                remaining = remaining.subtract(take);
            }
        }
        return targets;
    }

    private List<BigInteger> previewLiquidate(BigInteger amount) {
        BigInteger total = AmountMath.subFloor(totalAssets(), amount);
        List<InputSlot> leads = liquidationLeads();
        BigInteger[] taken = new BigInteger[InputRegistry.MAX_INPUTS];
        Arrays.fill(taken, BigInteger.ZERO);

        BigInteger remaining = amount;
        for (InputSlot slot : leads) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigInteger excess = leadValue(slot).subtract(weightTarget(total, leadWeight(slot)));
            if (excess.signum() > 0) {
                BigInteger take = AmountMath.min(excess, remaining);
                taken[slot.getIndex()] = take;
                remaining = remaining.subtract(take);
            }
        }
        for (InputSlot slot : leads) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigInteger room = leadValue(slot).subtract(taken[slot.getIndex()]);
            if (room.signum() > 0) {
                BigInteger take = AmountMath.min(room, remaining);
                taken[slot.getIndex()] = taken[slot.getIndex()].add(take);
                remaining = remaining.subtract(take);
            }
        }

        List<BigInteger> targets = new ArrayList<>(zeros());
        for (InputSlot slot : leads) {
            BigInteger assetAmount = taken[slot.getIndex()];
            if (assetAmount.signum() > 0) {
                targets.set(slot.getIndex(), toInputUnits(slot, assetAmount));
            }
        }
        return targets;
    }

    /** Converts an asset amount to the input units expected by a liquidation target. */
    private BigInteger toInputUnits(InputSlot slot, BigInteger assetAmount) {
        if (!slot.isPaired()) {
            return fromAsset(slot.getToken(), assetAmount);
        }
        // token0 share of the pair, proportional to the asset value taken from the whole pair
        BigInteger pairValue = leadValue(slot);
        BigInteger amount0 = slot.getPairedAdapter().positionAmounts().getAmount0();
        if (pairValue.signum() == 0) {
            return BigInteger.ZERO;
        }
        return AmountMath.min(amount0, AmountMath.mulDiv(amount0, assetAmount, pairValue, RoundingMode.UP));
    }

    /** Single slots, and only the even slot of each pair. */
    private List<InputSlot> liquidationLeads() {
        List<InputSlot> leads = new ArrayList<>();
        for (InputSlot slot : inputRegistry.activeSlots()) {
            if (!slot.isPaired() || slot.isPairLead()) {
                leads.add(slot);
            }
        }
        return leads;
    }

    private BigInteger leadValue(InputSlot slot) {
        BigInteger value = invested(slot.getIndex());
        return slot.isPaired() ? value.add(invested(slot.getIndex() + 1)) : value;
    }

    private int leadWeight(InputSlot slot) {
        int weight = slot.getWeight();
        if (slot.isPaired()) {
            weight += inputRegistry.slot(slot.getIndex() + 1).map(InputSlot::getWeight).orElse(0);
        }
        return weight;
    }

    // ==============================
    // CONVERSIONS
    // ==============================

    public BigInteger toAsset(String token, BigInteger amount) {
        if (amount.signum() == 0 || token.equalsIgnoreCase(state.getAsset())) {
            return amount;
        }
        return priceOracle.convert(token, amount, state.getAsset());
    }

    public BigInteger fromAsset(String token, BigInteger assetAmount) {
        if (assetAmount.signum() == 0 || token.equalsIgnoreCase(state.getAsset())) {
            return assetAmount;
        }
        return priceOracle.convert(state.getAsset(), assetAmount, token);
    }

    private BigInteger idleBalance(String token) {
        if (token.equalsIgnoreCase(state.getAsset())) {
            return BigInteger.ZERO;
        }
        return state.getWallet().balanceOf(token);
    }

    private static BigInteger weightTarget(BigInteger total, int weight) {
        return AmountMath.bps(total, weight, RoundingMode.DOWN);
    }

    private static List<BigInteger> zeros() {
        return Collections.nCopies(InputRegistry.MAX_INPUTS, BigInteger.ZERO);
    }
}
