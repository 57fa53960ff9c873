package com.yieldvault.simulator;

import com.yieldvault.domain.model.InputConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything the simulator wires in place of real protocols: oracle, swapper, per-input
 * adapters (single mode) or one shared pool (paired mode), and the input layout to configure
 * at startup.
 */
@Getter
@Builder
public class SimulatedMarket {

    private final StaticPriceOracle priceOracle;
    private final SimulatedSwapper swapper;

    private final List<InputSpec> inputs;

    private final List<SimulatedProtocolAdapter> adapters;

    /** Null unless paired inputs are enabled. */
    private final SimulatedPairedAdapter pool;

    /** Input layout resolved against the simulated adapters, in slot order. */
    public List<InputConfig> inputConfigs() {
        List<InputConfig> configs = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            InputSpec spec = inputs.get(i);
            InputConfig.InputConfigBuilder builder = InputConfig.builder()
                    .token(spec.token())
                    .weight(spec.weight())
                    .decimals(spec.decimals());
            if (pool != null) {
                builder.pairedAdapter(pool);
            } else {
                builder.adapter(adapters.get(i));
            }
            configs.add(builder.build());
        }
        return configs;
    }

    /** One configured input: {@code token:weight:decimals}. */
    public record InputSpec(String token, int weight, int decimals) {}
}
