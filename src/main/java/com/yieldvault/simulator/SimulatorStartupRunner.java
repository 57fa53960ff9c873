package com.yieldvault.simulator;

import com.yieldvault.allocation.AllocationEngine;
import com.yieldvault.domain.model.InputConfig;
import com.yieldvault.ledger.ShareLedger;
import java.math.BigInteger;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Configures the simulated inputs once the application is up and, when
 * {@code yieldvault.simulator.seed-amount} is positive, seeds the vault so it starts unpaused.
 */
@Component
@ConditionalOnProperty(name = "yieldvault.simulator.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatorStartupRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(SimulatorStartupRunner.class);

    private final SimulatedMarket simulatedMarket;
    private final AllocationEngine allocationEngine;
    private final ShareLedger shareLedger;
    private final BigInteger seedAmount;
    private final BigInteger seedMaxTotalAssets;
    private final String seeder;

    public SimulatorStartupRunner(
            SimulatedMarket simulatedMarket,
            AllocationEngine allocationEngine,
            ShareLedger shareLedger,
            @Value("${yieldvault.simulator.seed-amount:0}") BigInteger seedAmount,
            @Value("${yieldvault.simulator.seed-max-total-assets:0}") BigInteger seedMaxTotalAssets,
            @Value("${yieldvault.simulator.seeder:0x00000000000000000000000000000000000000c1}") String seeder) {
        this.simulatedMarket = simulatedMarket;
        this.allocationEngine = allocationEngine;
        this.shareLedger = shareLedger;
        this.seedAmount = seedAmount;
        this.seedMaxTotalAssets = seedMaxTotalAssets;
        this.seeder = seeder;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        List<InputConfig> configs = simulatedMarket.inputConfigs();
        if (!configs.isEmpty()) {
            allocationEngine.updateInputs(configs);
            log.info("Simulator: configured {} inputs", configs.size());
        }
        if (seedAmount.signum() > 0) {
            shareLedger.seedLiquidity(seeder, seedAmount, seedMaxTotalAssets.max(seedAmount));
            log.info("Simulator: vault seeded with {} by {}", seedAmount, seeder);
        }
    }
}
