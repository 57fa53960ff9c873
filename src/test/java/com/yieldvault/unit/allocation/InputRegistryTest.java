package com.yieldvault.unit.allocation;

import static com.yieldvault.support.VaultHarness.ASSET;
import static com.yieldvault.support.VaultHarness.DAI;
import static com.yieldvault.support.VaultHarness.WETH;
import static com.yieldvault.support.VaultHarness.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yieldvault.allocation.InputRegistry;
import com.yieldvault.domain.enums.RewardClaimAbi;
import com.yieldvault.domain.enums.SlippageComposition;
import com.yieldvault.domain.model.InputConfig;
import com.yieldvault.domain.model.InputSlot;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.simulator.SimulatedPairedAdapter;
import com.yieldvault.simulator.SimulatedProtocolAdapter;
import com.yieldvault.support.VaultHarness;
import java.util.List;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InputRegistryTest {

    private final InputRegistry registry =
            new InputRegistry(VaultHarness.parameters(SlippageComposition.DOUBLED, false));

    private static InputConfig single(String token, int weight) {
        return InputConfig.builder()
                .token(token)
                .weight(weight)
                .decimals(18)
                .adapter(new SimulatedProtocolAdapter(token, "a" + token, RewardClaimAbi.LEGACY))
                .build();
    }

    private static void assertVaultError(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOf(VaultException.class)
                .extracting("errorCode")
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("inputs land in stable slots with the reward interface resolved once")
    void configuresSlots() {
        registry.configure(List.of(single(ASSET, 4000), single(DAI, 3000)));

        InputSlot slot = registry.slot(1).orElseThrow();
        assertThat(slot.getToken()).isEqualTo(DAI);
        assertThat(slot.getPositionHandle()).isEqualTo("aDAI");
        assertThat(slot.getRewardClaimAbi()).isEqualTo(RewardClaimAbi.LEGACY);
        assertThat(registry.slot(2)).isEmpty();
        assertThat(registry.slot(8)).isEmpty();
        assertThat(registry.totalWeight()).isEqualTo(7000);
    }

    @Test
    @DisplayName("weights may not exceed 10000 bps in total")
    void weightCap() {
        assertVaultError(
                () -> registry.configure(List.of(single(ASSET, 6000), single(DAI, 4001))),
                ErrorCode.INVALID_CONFIGURATION);
    }

    @Test
    @DisplayName("a token can be configured only once")
    void duplicateToken() {
        assertVaultError(
                () -> registry.configure(List.of(single(DAI, 1000), single(DAI, 1000))),
                ErrorCode.INVALID_CONFIGURATION);
    }

    @Test
    @DisplayName("the adapter must stake the configured token")
    void adapterTokenMismatch() {
        InputConfig wrong = InputConfig.builder()
                .token(DAI)
                .weight(1000)
                .decimals(18)
                .adapter(new SimulatedProtocolAdapter(WETH, "aWETH", RewardClaimAbi.STANDARD))
                .build();

        assertVaultError(() -> registry.configure(List.of(wrong)), ErrorCode.WRONG_TOKEN);
    }

    @Test
    @DisplayName("setWeights refuses a weight on an empty slot and too many entries")
    void setWeights() {
        registry.configure(List.of(single(ASSET, 4000), single(DAI, 3000)));

        registry.setWeights(new int[] {2000, 1000});
        assertThat(registry.totalWeight()).isEqualTo(3000);

        assertVaultError(() -> registry.setWeights(new int[] {1000, 1000, 1000}), ErrorCode.WRONG_REQUEST);
        assertVaultError(() -> registry.setWeights(new int[9]), ErrorCode.INCORRECT_ARRAY_LENGTHS);
        assertThat(registry.totalWeight()).isEqualTo(3000);
    }

    @Test
    @DisplayName("checkpoint restores the previous slot layout")
    void checkpointRestores() {
        registry.configure(List.of(single(ASSET, 4000)));
        Runnable restore = registry.checkpoint();

        registry.configure(List.of(single(DAI, 1000), single(WETH, 1000)));
        restore.run();

        assertThat(registry.activeSlots()).extracting(InputSlot::getToken).containsExactly(ASSET);
    }

    @Test
    @DisplayName("paired inputs come in even/odd pairs over one position")
    void pairedSlots() {
        InputRegistry paired = new InputRegistry(VaultHarness.parameters(SlippageComposition.DOUBLED, true));
        SimulatedPairedAdapter pool = new SimulatedPairedAdapter(DAI, WETH, "LP", units(1000), units(1));
        InputConfig dai = InputConfig.builder().token(DAI).weight(3000).decimals(18).pairedAdapter(pool).build();
        InputConfig weth = InputConfig.builder().token(WETH).weight(3000).decimals(18).pairedAdapter(pool).build();

        assertVaultError(() -> paired.configure(List.of(dai)), ErrorCode.INVALID_CONFIGURATION);
        assertVaultError(() -> paired.configure(List.of(weth, dai)), ErrorCode.WRONG_TOKEN);

        paired.configure(List.of(dai, weth));
        assertThat(paired.slot(0).orElseThrow().isPairLead()).isTrue();
        assertThat(paired.slot(1).orElseThrow().isPairLead()).isFalse();
        assertThat(paired.slot(1).orElseThrow().isPaired()).isTrue();
    }
}
