package com.yieldvault.unit.allocation;

import static com.yieldvault.support.VaultHarness.DAI;
import static com.yieldvault.support.VaultHarness.noSwapParams;
import static com.yieldvault.support.VaultHarness.targets;
import static com.yieldvault.support.VaultHarness.units;
import static org.assertj.core.api.Assertions.assertThat;

import com.yieldvault.support.VaultHarness;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AllocationPlannerTest {

    private VaultHarness vault;

    @BeforeEach
    void setUp() {
        vault = VaultHarness.standard();
        vault.seed(1000);
        vault.configureSingleInputs(5000, 4500);
    }

    @Test
    @DisplayName("invest preview fills weight deficits in slot order")
    void investPreview() {
        assertThat(vault.allocationPlanner.preview(units(1000), true)).isEqualTo(targets(500, 450));
        assertThat(vault.allocationPlanner.preview(units(600), true)).isEqualTo(targets(500, 100));
    }

    @Test
    @DisplayName("liquidation preview takes excess first, then remaining positions")
    void liquidatePreview() {
        vault.allocationEngine.invest(targets(500, 450), noSwapParams());

        // target total 900: slot 0 holds 50 over its 450, slot 1 45 over its 405
        assertThat(vault.allocationPlanner.preview(units(100), false)).isEqualTo(targets(55, 45));
    }

    @Test
    @DisplayName("excess liquidity is signed distance from the weight target")
    void excessLiquidity() {
        vault.allocationEngine.invest(targets(600, 300), noSwapParams());

        assertThat(vault.allocationPlanner.excessLiquidity(0, units(1000))).isEqualTo(units(100));
        assertThat(vault.allocationPlanner.excessLiquidity(1, units(1000))).isEqualTo(units(-150));
        assertThat(vault.allocationPlanner.excessLiquidity(5, units(1000))).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("idle input tokens count toward the slot's invested value")
    void idleBalanceCounts() {
        vault.state.getWallet().credit(DAI, units(3));

        assertThat(vault.allocationPlanner.invested(1)).isEqualTo(units(3));
        assertThat(vault.allocationPlanner.investedPerSlot()).isEqualTo(targets(0, 3));
        assertThat(vault.accounting.totalAssets()).isEqualTo(units(1003));
    }

    @Test
    @DisplayName("non-asset positions are valued through the oracle")
    void valuesThroughOracle() {
        vault.allocationEngine.invest(targets(0, 450), noSwapParams());
        vault.priceOracle.setPrice(DAI, units(2), 18);

        assertThat(vault.allocationPlanner.invested(1)).isEqualTo(units(900));
        assertThat(vault.accounting.totalAssets()).isEqualTo(units(1450));
    }

    @Test
    @DisplayName("a zero invest amount defaults to 90% of available cash")
    void defaultInvestAmount() {
        assertThat(vault.allocationPlanner.defaultInvestAmount()).isEqualTo(units(900));
        assertThat(vault.allocationPlanner.preview(BigInteger.ZERO, true, BigInteger.ZERO))
                .isEqualTo(targets(500, 400));
    }

    @Test
    @DisplayName("a zero liquidate amount defaults to pending redemptions plus 1% of invested")
    void defaultLiquidateAmount() {
        vault.allocationEngine.invest(targets(500, 450), noSwapParams());
        BigInteger expected = units(30).add(units(95).divide(BigInteger.TEN));

        assertThat(vault.allocationPlanner.defaultLiquidateAmount(units(30))).isEqualTo(expected);
        assertThat(vault.allocationPlanner.preview(BigInteger.ZERO, false, units(30)))
                .isEqualTo(vault.allocationPlanner.preview(expected, false));
    }

    @Test
    @DisplayName("an explicit amount ignores the defaults")
    void explicitAmount() {
        vault.allocationEngine.invest(targets(500, 450), noSwapParams());

        assertThat(vault.allocationPlanner.preview(units(100), false, units(999))).isEqualTo(targets(55, 45));
    }

    @Test
    @DisplayName("liquidate-all targets every position but not idle dust")
    void liquidateAllTargets() {
        vault.allocationEngine.invest(targets(500, 450), noSwapParams());
        vault.state.getWallet().credit(DAI, units(3));

        assertThat(vault.allocationPlanner.liquidateAllTargets()).isEqualTo(targets(500, 450));
    }
}
