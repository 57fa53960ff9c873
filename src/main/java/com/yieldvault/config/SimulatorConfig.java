package com.yieldvault.config;

import com.yieldvault.allocation.AllocationParameters;
import com.yieldvault.domain.enums.RewardClaimAbi;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.PoolDerivedPriceOracle;
import com.yieldvault.integration.PriceOracle;
import com.yieldvault.integration.Swapper;
import com.yieldvault.simulator.SimulatedMarket;
import com.yieldvault.simulator.SimulatedMarket.InputSpec;
import com.yieldvault.simulator.SimulatedPairedAdapter;
import com.yieldvault.simulator.SimulatedProtocolAdapter;
import com.yieldvault.simulator.SimulatedStrategy;
import com.yieldvault.simulator.SimulatedSwapper;
import com.yieldvault.simulator.StaticPriceOracle;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires simulated protocols in place of real ones: a static-price oracle, an oracle-rate
 * swapper, one in-memory position per input (or one shared pool in paired mode) and a remote
 * strategy for the allocator.
 *
 * <p>Enabled unless {@code yieldvault.simulator.enabled=false}; a deployment against real
 * protocols disables it and provides its own {@link PriceOracle} and {@link Swapper}.
 *
 * <p>Properties prefix: {@code yieldvault.simulator.*}
 * <ul>
 *   <li>{@code prices}: {@code token:price:decimals,...}, price in 18-decimal quote units</li>
 *   <li>{@code inputs}: {@code token:weight:decimals,...} in slot order</li>
 *   <li>{@code pool}: {@code token0:token1:reserve0:reserve1}, used in paired mode</li>
 * </ul>
 */
@Configuration
@ConditionalOnProperty(name = "yieldvault.simulator.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatorConfig {

    @Bean
    public SimulatedMarket simulatedMarket(
            AllocationParameters allocationParameters,
            @Value("${yieldvault.simulator.prices:}") String prices,
            @Value("${yieldvault.simulator.inputs:}") String inputs,
            @Value("${yieldvault.simulator.pool:}") String pool,
            @Value("${yieldvault.simulator.swap-fee-bps:0}") int swapFeeBps) {
        StaticPriceOracle oracle = new StaticPriceOracle();
        for (String[] parts : parse(prices, 3, "prices")) {
            oracle.setPrice(parts[0], new BigInteger(parts[1]), Integer.parseInt(parts[2]));
        }

        List<InputSpec> specs = new ArrayList<>();
        for (String[] parts : parse(inputs, 3, "inputs")) {
            specs.add(new InputSpec(parts[0], Integer.parseInt(parts[1]), Integer.parseInt(parts[2])));
        }

        SimulatedPairedAdapter pairedAdapter = null;
        List<SimulatedProtocolAdapter> adapters = new ArrayList<>();
        if (allocationParameters.isPairedInputs()) {
            List<String[]> poolSpec = parse(pool, 4, "pool");
            if (poolSpec.size() != 1) {
                throw new VaultException(
                        ErrorCode.INVALID_CONFIGURATION, "Paired inputs need exactly one yieldvault.simulator.pool");
            }
            String[] parts = poolSpec.get(0);
            pairedAdapter = new SimulatedPairedAdapter(
                    parts[0], parts[1], "sim-lp-" + parts[0] + "-" + parts[1], new BigInteger(parts[2]), new BigInteger(parts[3]));
        } else {
            for (InputSpec spec : specs) {
                adapters.add(new SimulatedProtocolAdapter(spec.token(), "sim-" + spec.token(), RewardClaimAbi.STANDARD));
            }
        }

        return SimulatedMarket.builder()
                .priceOracle(oracle)
                .swapper(new SimulatedSwapper(oracle, swapFeeBps))
                .inputs(specs)
                .adapters(adapters)
                .pool(pairedAdapter)
                .build();
    }

    @Bean
    public PriceOracle priceOracle(SimulatedMarket simulatedMarket) {
        if (simulatedMarket.getPool() != null) {
            return new PoolDerivedPriceOracle(simulatedMarket.getPool(), simulatedMarket.getPriceOracle());
        }
        return simulatedMarket.getPriceOracle();
    }

    @Bean
    public Swapper swapper(SimulatedMarket simulatedMarket) {
        return simulatedMarket.getSwapper();
    }

    @Bean
    public SimulatedStrategy simulatedStrategy(
            @Value("${yieldvault.simulator.strategy-address:0x00000000000000000000000000000000000000b1}") String address) {
        return new SimulatedStrategy(address);
    }

    private static List<String[]> parse(String csv, int fields, String property) {
        List<String[]> entries = new ArrayList<>();
        if (csv == null || csv.isBlank()) {
            return entries;
        }
        for (String entry : csv.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split(":");
            if (parts.length != fields) {
                throw new VaultException(
                        ErrorCode.INVALID_CONFIGURATION,
                        "yieldvault.simulator." + property + " entry '" + trimmed + "' needs " + fields + " fields");
            }
            entries.add(parts);
        }
        return entries;
    }
}
