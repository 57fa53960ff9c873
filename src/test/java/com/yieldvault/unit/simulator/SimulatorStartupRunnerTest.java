package com.yieldvault.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.yieldvault.allocation.AllocationEngine;
import com.yieldvault.domain.enums.RewardClaimAbi;
import com.yieldvault.domain.model.InputConfig;
import com.yieldvault.ledger.ShareLedger;
import com.yieldvault.simulator.SimulatedMarket;
import com.yieldvault.simulator.SimulatedMarket.InputSpec;
import com.yieldvault.simulator.SimulatedPairedAdapter;
import com.yieldvault.simulator.SimulatedProtocolAdapter;
import com.yieldvault.simulator.SimulatorStartupRunner;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.context.event.ApplicationReadyEvent;

/**
 * Tests for SimulatorStartupRunner and the input layout built by SimulatedMarket.
 */
@ExtendWith(MockitoExtension.class)
class SimulatorStartupRunnerTest {

    private static final String SEEDER = "0x00000000000000000000000000000000000000c1";

    @Mock
    private AllocationEngine allocationEngine;

    @Mock
    private ShareLedger shareLedger;

    private SimulatedMarket singleMarket;

    @BeforeEach
    void setUp() {
        singleMarket = SimulatedMarket.builder()
                .inputs(List.of(new InputSpec("USDC", 5000, 6), new InputSpec("WETH", 4500, 18)))
                .adapters(List.of(
                        new SimulatedProtocolAdapter("USDC", "sim-USDC", RewardClaimAbi.STANDARD),
                        new SimulatedProtocolAdapter("WETH", "sim-WETH", RewardClaimAbi.STANDARD)))
                .build();
    }

    @Test
    @DisplayName("single inputs get their own adapter in slot order")
    void singleInputs() {
        List<InputConfig> configs = singleMarket.inputConfigs();

        assertThat(configs).extracting(InputConfig::getToken).containsExactly("USDC", "WETH");
        assertThat(configs.get(1).getAdapter()).isSameAs(singleMarket.getAdapters().get(1));
        assertThat(configs).allMatch(c -> c.getPairedAdapter() == null);
    }

    @Test
    @DisplayName("paired inputs share the pool")
    void pairedInputs() {
        SimulatedPairedAdapter pool =
                new SimulatedPairedAdapter("DAI", "WETH", "DAI-WETH-LP", BigInteger.valueOf(2000), BigInteger.ONE);
        SimulatedMarket market = SimulatedMarket.builder()
                .inputs(List.of(new InputSpec("DAI", 5000, 18), new InputSpec("WETH", 5000, 18)))
                .adapters(List.of())
                .pool(pool)
                .build();

        assertThat(market.inputConfigs()).allMatch(c -> c.getPairedAdapter() == pool);
    }

    @Test
    @DisplayName("configures inputs and seeds with a cap no lower than the seed")
    @SuppressWarnings("unchecked")
    void configuresAndSeeds() {
        SimulatorStartupRunner runner = new SimulatorStartupRunner(
                singleMarket, allocationEngine, shareLedger, BigInteger.valueOf(1000), BigInteger.ZERO, SEEDER);

        runner.onApplicationEvent(mock(ApplicationReadyEvent.class));

        ArgumentCaptor<List<InputConfig>> captor = ArgumentCaptor.forClass(List.class);
        verify(allocationEngine).updateInputs(captor.capture());
        assertThat(captor.getValue()).hasSize(2);
        verify(shareLedger).seedLiquidity(SEEDER, BigInteger.valueOf(1000), BigInteger.valueOf(1000));
    }

    @Test
    @DisplayName("a zero seed amount leaves the vault unseeded")
    void noSeed() {
        SimulatorStartupRunner runner = new SimulatorStartupRunner(
                singleMarket, allocationEngine, shareLedger, BigInteger.ZERO, BigInteger.ZERO, SEEDER);

        runner.onApplicationEvent(mock(ApplicationReadyEvent.class));

        verify(allocationEngine).updateInputs(anyList());
        verify(shareLedger, never()).seedLiquidity(anyString(), any(), any());
    }
}
