package com.yieldvault.observability;

import com.yieldvault.allocator.Allocator;
import com.yieldvault.event.AllocatorEvent;
import com.yieldvault.event.AllocatorEventType;
import com.yieldvault.event.VaultEvent;
import com.yieldvault.ledger.VaultAccounting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the vault's Micrometer metrics, exposed through the actuator.
 * <ul>
 *   <li><b>vault.deposits</b> (counter): DEPOSIT events</li>
 *   <li><b>vault.withdrawals</b> (counter): WITHDRAW events</li>
 *   <li><b>vault.fee.collections</b> (counter): FEES_COLLECTED events</li>
 *   <li><b>vault.slippage.rejections</b> (counter): SLIPPAGE_REJECTED events</li>
 *   <li><b>allocator.panics</b> (counter): PANIC_LIQUIDATE events</li>
 *   <li><b>vault.total.assets</b> (gauge): available plus invested, in asset wei</li>
 *   <li><b>vault.share.price</b> (gauge): assets per whole share</li>
 *   <li><b>allocator.chain.debt</b> (gauge): sum of strategy debts</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily when scraped. Values are wei, so they lose precision as
 * doubles; the journal holds the exact figures.
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final Counter depositsCounter;
    private final Counter withdrawalsCounter;
    private final Counter feeCollectionsCounter;
    private final Counter slippageRejectionsCounter;
    private final Counter panicsCounter;

    public CustomMetricsService(MeterRegistry meterRegistry, VaultAccounting vaultAccounting, Allocator allocator) {
        this.depositsCounter = Counter.builder("vault.deposits")
                .description("Total direct deposits and mints into the vault")
                .register(meterRegistry);

        this.withdrawalsCounter = Counter.builder("vault.withdrawals")
                .description("Total direct withdrawals and redemptions from the vault")
                .register(meterRegistry);

        this.feeCollectionsCounter = Counter.builder("vault.fee.collections")
                .description("Fee collections that minted shares to the fee receiver")
                .register(meterRegistry);

        this.slippageRejectionsCounter = Counter.builder("vault.slippage.rejections")
                .description("Invest or liquidate calls reverted by a slippage floor")
                .register(meterRegistry);

        this.panicsCounter = Counter.builder("allocator.panics")
                .description("Strategies panic-liquidated by the allocator")
                .register(meterRegistry);

        meterRegistry.gauge("vault.total.assets", vaultAccounting, accounting -> accounting.totalAssets()
                .doubleValue());

        meterRegistry.gauge("vault.share.price", vaultAccounting, accounting -> accounting.sharePrice()
                .doubleValue());

        meterRegistry.gauge("allocator.chain.debt", allocator, a -> a.totalChainDebt().doubleValue());
    }

    @EventListener
    @Order(20)
    public void onVaultEvent(VaultEvent event) {
        switch (event.getEventType()) {
            case DEPOSIT -> depositsCounter.increment();
            case WITHDRAW -> withdrawalsCounter.increment();
            case FEES_COLLECTED -> feeCollectionsCounter.increment();
            case SLIPPAGE_REJECTED -> slippageRejectionsCounter.increment();
            default -> {
                // not counted
            }
        }
    }

    @EventListener
    @Order(20)
    public void onAllocatorEvent(AllocatorEvent event) {
        if (event.getEventType() == AllocatorEventType.PANIC_LIQUIDATE) {
            panicsCounter.increment();
            log.warn("Panic liquidation recorded for strategy {}", event.getStrategyName());
        }
    }

    // Expose for testing
    Counter getDepositsCounter() {
        return depositsCounter;
    }

    Counter getWithdrawalsCounter() {
        return withdrawalsCounter;
    }

    Counter getFeeCollectionsCounter() {
        return feeCollectionsCounter;
    }

    Counter getSlippageRejectionsCounter() {
        return slippageRejectionsCounter;
    }

    Counter getPanicsCounter() {
        return panicsCounter;
    }
}
