package com.yieldvault.allocation;

import com.yieldvault.domain.enums.SlippageComposition;
import com.yieldvault.event.EventPublisherHelper;
import com.yieldvault.event.VaultEventType;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Slippage floors applied by the allocation engine, according to the configured
 * {@link SlippageComposition}.
 *
 * <p>With {@code DOUBLED} only {@link #checkCombined} is active and uses twice the tolerance.
 * With {@code PER_LEG} only {@link #checkSwap} and {@link #checkPosition} are active, each with
 * the plain tolerance. Every check is skipped when {@code panic} is set.
 *
 * <p>A violation fails the call with AMOUNT_TOO_LOW and publishes a SLIPPAGE_REJECTED notice.
 */
@Component
public class SlippageGuard {

    private static final Logger log = LoggerFactory.getLogger(SlippageGuard.class);

    private final AllocationParameters allocationParameters;
    private final EventPublisherHelper eventPublisherHelper;

    public SlippageGuard(AllocationParameters allocationParameters, EventPublisherHelper eventPublisherHelper) {
        this.allocationParameters = allocationParameters;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** Swap output against the oracle quote for the amount swapped. */
    public void checkSwap(int slot, BigInteger received, BigInteger quoted, boolean panic) {
        if (panic || composition() != SlippageComposition.PER_LEG) {
            return;
        }
        enforce(slot, "swap", received, AmountMath.floor(quoted, allocationParameters.getMaxSlippageBps()));
    }

    /** Stake delta against the amount staked, or unstake output against the expected recovery. */
    public void checkPosition(int slot, BigInteger actual, BigInteger expected, boolean panic) {
        if (panic || composition() != SlippageComposition.PER_LEG) {
            return;
        }
        enforce(slot, "position", actual, AmountMath.floor(expected, allocationParameters.getMaxSlippageBps()));
    }

    /** End result of swap and position legs together, against the amount expected before either ran. */
    public void checkCombined(int slot, BigInteger actual, BigInteger expected, boolean panic) {
        if (panic || composition() != SlippageComposition.DOUBLED) {
            return;
        }
        enforce(slot, "combined", actual, AmountMath.floor(expected, 2L * allocationParameters.getMaxSlippageBps()));
    }

    private SlippageComposition composition() {
        return allocationParameters.getSlippageComposition();
    }

    private void enforce(int slot, String leg, BigInteger actual, BigInteger minimum) {
        if (actual.compareTo(minimum) >= 0) {
            return;
        }
        log.warn("Slippage floor violated on slot {} ({} leg): got {}, minimum {}", slot, leg, actual, minimum);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("slot", slot);
        details.put("leg", leg);
        details.put("actual", actual);
        details.put("minimum", minimum);
        details.put("composition", composition().name());
        eventPublisherHelper.publishVault(this, VaultEventType.SLIPPAGE_REJECTED, details);

        throw new VaultException(
                ErrorCode.AMOUNT_TOO_LOW,
                "Slot " + slot + " " + leg + " returned " + actual + ", below the slippage floor " + minimum,
                details);
    }
}
