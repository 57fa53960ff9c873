package com.yieldvault.ledger;

import com.yieldvault.core.guard.ReentrancyGuard;
import com.yieldvault.core.guard.StateRollback;
import com.yieldvault.domain.model.FeeCollectionResult;
import com.yieldvault.domain.model.Fees;
import com.yieldvault.domain.model.VaultState;
import com.yieldvault.event.EventPublisherHelper;
import com.yieldvault.event.VaultEventType;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accrues performance and management fees against the fee checkpoint.
 *
 * <p>On collection:
 * <ul>
 *   <li>{@code profit = max(0, totalAssets - lastCheckpointAssets)}</li>
 *   <li>{@code perf = profit * perfBps / BPS}</li>
 *   <li>{@code mgmt = totalAssets * mgmtBps * elapsed / (BPS * YEAR)}</li>
 *   <li>the fee collector is minted {@code convertToShares(perf + mgmt)} at the current price</li>
 *   <li>accumulated entry/exit fees are paid out to the fee collector</li>
 *   <li>the checkpoint (assets, share price, time) is reset</li>
 * </ul>
 *
 * <p>Collection before {@code profitCooldown} has elapsed since the last checkpoint is a
 * silent no-op, which bounds how often share-price moves can be harvested.
 */
@Service
public class FeeAccrualEngine {

    private static final Logger log = LoggerFactory.getLogger(FeeAccrualEngine.class);

    private static final BigInteger YEAR_BPS = BigInteger.valueOf(AmountMath.SECONDS_PER_YEAR).multiply(AmountMath.BPS_BI);

    private final VaultAccounting accounting;
    private final VaultState state;
    private final VaultParameters vaultParameters;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public FeeAccrualEngine(VaultAccounting accounting, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.accounting = accounting;
        this.state = accounting.state();
        this.vaultParameters = accounting.parameters();
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public FeeCollectionResult collectFees() {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("collectFees")) {
            Instant now = clock.instant();
            if (!cooldownElapsed(now)) {
                log.debug("Fee collection skipped: cooldown not elapsed since {}", state.getLastCheckpointTime());
                return FeeCollectionResult.SKIPPED;
            }
            return StateRollback.begin("collectFees", state).run(() -> doCollect(now));
        }
    }

    /** Fees that {@link #collectFees()} would take now, ignoring the cooldown. */
    public FeeCollectionResult previewFees() {
        Instant now = clock.instant();
        BigInteger totalAssets = accounting.totalAssets();
        BigInteger profit = AmountMath.subFloor(totalAssets, state.getLastCheckpointAssets());
        BigInteger perf = performanceFee(profit);
        BigInteger mgmt = managementFee(totalAssets, now);
        return FeeCollectionResult.builder()
                .collected(false)
                .profit(profit)
                .perfFees(perf)
                .mgmtFees(mgmt)
                .feeShares(accounting.convertToShares(perf.add(mgmt), RoundingMode.DOWN))
                .transactionFeesPaid(state.getClaimableTransactionFees())
                .sharePrice(accounting.sharePrice())
                .build();
    }

    public boolean cooldownElapsed(Instant now) {
        Duration elapsed = Duration.between(state.getLastCheckpointTime(), now);
        return elapsed.compareTo(vaultParameters.getProfitCooldown()) >= 0;
    }

    private FeeCollectionResult doCollect(Instant now) {
        BigInteger totalAssets = accounting.totalAssets();
        BigInteger profit = AmountMath.subFloor(totalAssets, state.getLastCheckpointAssets());
        BigInteger perf = performanceFee(profit);
        BigInteger mgmt = managementFee(totalAssets, now);
        BigInteger feeShares = accounting.convertToShares(perf.add(mgmt), RoundingMode.DOWN);
        BigInteger previousPrice = state.getLastSharePrice();

        if (feeShares.signum() > 0) {
            accounting.mint(vaultParameters.getFeeCollector(), feeShares);
        }
        BigInteger transactionFees = state.getClaimableTransactionFees();
        if (transactionFees.signum() > 0) {
            state.setClaimableTransactionFees(BigInteger.ZERO);
            accounting.sendAssets(transactionFees);
        }

        BigInteger sharePrice = accounting.sharePrice();
        state.setLastCheckpointAssets(accounting.totalAssets());
        state.setLastSharePrice(sharePrice);
        state.setLastCheckpointTime(now);

        log.info(
                "Fees collected: profit={}, perf={}, mgmt={}, feeShares={}, transactionFees={}, sharePrice={}",
                profit,
                perf,
                mgmt,
                feeShares,
                transactionFees,
                sharePrice);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("profit", profit);
        details.put("perfFees", perf);
        details.put("mgmtFees", mgmt);
        details.put("feeShares", feeShares);
        details.put("transactionFees", transactionFees);
        details.put("feeCollector", vaultParameters.getFeeCollector());
        details.put("sharePrice", sharePrice);
        eventPublisherHelper.publishVault(this, VaultEventType.FEES_COLLECTED, details);
        eventPublisherHelper.publishSharePriceUpdated(this, previousPrice, sharePrice);

        return FeeCollectionResult.builder()
                .collected(true)
                .profit(profit)
                .perfFees(perf)
                .mgmtFees(mgmt)
                .feeShares(feeShares)
                .transactionFeesPaid(transactionFees)
                .sharePrice(sharePrice)
                .build();
    }

    private BigInteger performanceFee(BigInteger profit) {
        Fees fees = state.getFees();
        return AmountMath.bps(profit, fees.getPerf(), RoundingMode.DOWN);
    }

    private BigInteger managementFee(BigInteger totalAssets, Instant now) {
        long elapsed = Math.max(0, Duration.between(state.getLastCheckpointTime(), now).getSeconds());
        BigInteger rate = BigInteger.valueOf(state.getFees().getMgmt()).multiply(BigInteger.valueOf(elapsed));
        return AmountMath.mulDiv(totalAssets, rate, YEAR_BPS, RoundingMode.DOWN);
    }
}
