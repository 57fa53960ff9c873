package com.yieldvault.unit.allocator;

import static com.yieldvault.support.VaultHarness.LOCAL_ENTRY_POINT;
import static com.yieldvault.support.VaultHarness.REMOTE_STRATEGY;
import static com.yieldvault.support.VaultHarness.noSwapParams;
import static com.yieldvault.support.VaultHarness.targets;
import static com.yieldvault.support.VaultHarness.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yieldvault.domain.model.StrategyMapEntry;
import com.yieldvault.domain.model.StrategyRecord;
import com.yieldvault.event.AllocatorEventType;
import com.yieldvault.event.VaultEventType;
import com.yieldvault.exception.BaseException;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.ResourceNotFoundException;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.StrategyEntryPoint;
import com.yieldvault.support.VaultHarness;
import java.math.BigInteger;
import java.util.List;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for Allocator: crate funding, strategy registry, dispatch, recall and self-reported debt,
 * against the simulated remote strategy and the local vault entry point.
 */
class AllocatorTest {

    private static final String REMOTE = "remote";
    private static final String LOCAL = "local";

    private VaultHarness vault;

    @BeforeEach
    void setUp() {
        vault = VaultHarness.standard();
        vault.seed(1000);
        vault.allocator.fundCrate(units(1000));
        vault.allocator.addStrategy(REMOTE, REMOTE_STRATEGY, units(500));
        vault.allocator.addStrategy(LOCAL, LOCAL_ENTRY_POINT, units(1000));
    }

    private static void assertError(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOf(BaseException.class)
                .extracting("errorCode")
                .isEqualTo(expected);
    }

    private BigInteger debtOf(String name) {
        return vault.allocator.strategy(name).map(StrategyRecord::getDebt).orElseThrow();
    }

    /** Entry point that refuses every deposit. */
    private static StrategyEntryPoint rejectingEntryPoint() {
        return new StrategyEntryPoint() {
            @Override
            public String address() {
                return "0x00000000000000000000000000000000000000d1";
            }

            @Override
            public void deposit(BigInteger amount) {
                throw new VaultException(ErrorCode.BAD_REQUEST, "Strategy rejected the deposit");
            }

            @Override
            public BigInteger withdraw(BigInteger amount, BigInteger minAmountOut) {
                return BigInteger.ZERO;
            }

            @Override
            public BigInteger panicWithdraw(BigInteger amount) {
                return BigInteger.ZERO;
            }

            @Override
            public BigInteger totalAssets() {
                return BigInteger.ZERO;
            }
        };
    }

    @Nested
    @DisplayName("Crate and registry")
    class CrateAndRegistry {

        @Test
        @DisplayName("crate withdrawals are limited to idle capital")
        void crateWithdrawal() {
            vault.allocator.withdrawFromCrate(units(400), VaultHarness.ALICE);

            assertThat(vault.allocator.crateBalance()).isEqualTo(units(600));
            assertThat(vault.allocatorEventTypes()).contains(AllocatorEventType.WITHDRAW);
            assertError(
                    () -> vault.allocator.withdrawFromCrate(units(601), VaultHarness.ALICE),
                    ErrorCode.INSUFFICIENT_FUNDS);
        }

        @Test
        @DisplayName("strategy names are unique and entry points must be known")
        void registry() {
            assertError(() -> vault.allocator.addStrategy(REMOTE, REMOTE_STRATEGY, units(1)), ErrorCode.WRONG_REQUEST);
            assertThatThrownBy(() -> vault.allocator.addStrategy(
                            "ghost", "0x00000000000000000000000000000000000000ee", units(1)))
                    .isInstanceOf(ResourceNotFoundException.class);
            assertError(() -> vault.allocator.setMaxDeposit("ghost", units(1)), ErrorCode.NOT_FOUND);
        }

        @Test
        @DisplayName("the ceiling cannot drop below the debt unless the strategy is panicked")
        void ceilingBelowDebt() {
            vault.allocator.dispatchAssets(List.of(units(400)), List.of(REMOTE));

            assertError(() -> vault.allocator.setMaxDeposit(REMOTE, units(100)), ErrorCode.AMOUNT_TOO_LOW);
            assertThat(vault.allocator.strategy(REMOTE).orElseThrow().getMaxDeposit()).isEqualTo(units(500));

            vault.allocator.setMaxDeposit(REMOTE, units(400));
            vault.allocator.setPanicked(REMOTE, true);
            vault.allocator.setMaxDeposit(REMOTE, units(100));

            assertThat(vault.allocator.strategy(REMOTE).orElseThrow().getMaxDeposit()).isEqualTo(units(100));
            assertError(() -> vault.allocator.setPanicked(REMOTE, false), ErrorCode.MAX_DEPOSIT_REACHED);
            assertThat(vault.allocator.strategy(REMOTE).orElseThrow().isPanicked()).isTrue();
        }

        @Test
        @DisplayName("a strategy can only be retired once its debt is recalled")
        void retire() {
            vault.allocator.dispatchAssets(List.of(units(100)), List.of(REMOTE));
            assertError(() -> vault.allocator.retireStrategy(REMOTE), ErrorCode.CANT_UPDATE_CRATE);

            vault.allocator.liquidateStrategy(units(100), units(100), REMOTE);
            vault.allocator.retireStrategy(REMOTE);

            assertThat(vault.allocator.strategy(REMOTE)).isEmpty();
            assertThat(vault.allocator.strategyMap()).extracting(StrategyMapEntry::getStrategyName).containsExactly(LOCAL);
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("capital moves from the crate into strategy debt")
        void dispatches() {
            BigInteger total = vault.allocator.dispatchAssets(List.of(units(300), units(200)), List.of(REMOTE, LOCAL));

            assertThat(total).isEqualTo(units(500));
            assertThat(vault.allocator.crateBalance()).isEqualTo(units(500));
            assertThat(vault.allocator.totalChainDebt()).isEqualTo(units(500));
            assertThat(vault.remoteStrategy.totalAssets()).isEqualTo(units(300));
            assertThat(vault.state.sharesOf(LOCAL_ENTRY_POINT)).isEqualTo(units(200));
            assertThat(vault.allocatorEventTypes())
                    .contains(AllocatorEventType.DEPOSIT_IN_STRATEGY, AllocatorEventType.CHAIN_DEBT_UPDATE);
        }

        @Test
        @DisplayName("the local vault entry point is exempt from the vault deposit cap")
        void localEntryPointCapExempt() {
            vault.shareLedger.setMaxTotalAssets(units(1000));

            vault.allocator.dispatchAssets(List.of(units(200)), List.of(LOCAL));

            assertThat(vault.accounting.totalAssets()).isEqualTo(units(1200));
        }

        @Test
        @DisplayName("ceilings are checked cumulatively before anything moves")
        void cumulativeCeiling() {
            assertError(
                    () -> vault.allocator.dispatchAssets(List.of(units(300), units(300)), List.of(REMOTE, REMOTE)),
                    ErrorCode.MAX_DEPOSIT_REACHED);

            assertThat(vault.allocator.crateBalance()).isEqualTo(units(1000));
            assertThat(vault.remoteStrategy.totalAssets()).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("lists must line up and the crate must cover the total")
        void shapeAndFunds() {
            assertError(
                    () -> vault.allocator.dispatchAssets(List.of(units(1)), List.of(REMOTE, LOCAL)),
                    ErrorCode.INCORRECT_ARRAY_LENGTHS);
            assertError(
                    () -> vault.allocator.dispatchAssets(List.of(units(500), units(600)), List.of(REMOTE, LOCAL)),
                    ErrorCode.INSUFFICIENT_FUNDS);
        }

        @Test
        @DisplayName("de-whitelisted and panicked strategies take no new capital")
        void eligibility() {
            vault.allocator.setWhitelisted(REMOTE, false);
            assertError(
                    () -> vault.allocator.dispatchAssets(List.of(units(1)), List.of(REMOTE)), ErrorCode.NOT_WHITELISTED);

            vault.allocator.setWhitelisted(REMOTE, true);
            vault.allocator.setPanicked(REMOTE, true);
            assertError(
                    () -> vault.allocator.dispatchAssets(List.of(units(1)), List.of(REMOTE)),
                    ErrorCode.STRATEGY_PANICKED);

            vault.allocator.setPanicked(REMOTE, false);
            vault.allocator.dispatchAssets(List.of(units(1)), List.of(REMOTE));
            assertThat(debtOf(REMOTE)).isEqualTo(units(1));
        }

        @Test
        @DisplayName("a failing entry point rolls back transfers already made in the same call")
        void rollbackOnEntryPointFailure() {
            vault.shareLedger.pause();

            assertError(
                    () -> vault.allocator.dispatchAssets(List.of(units(300), units(200)), List.of(REMOTE, LOCAL)),
                    ErrorCode.PAUSED);

            assertThat(vault.remoteStrategy.totalAssets()).isEqualTo(BigInteger.ZERO);
            assertThat(vault.allocator.crateBalance()).isEqualTo(units(1000));
            assertThat(debtOf(REMOTE)).isEqualTo(BigInteger.ZERO);
            assertThat(vault.allocatorEventTypes())
                    .containsExactly(AllocatorEventType.STRATEGY_ADDED, AllocatorEventType.STRATEGY_ADDED);
        }

        @Test
        @DisplayName("a failure after the local vault was paid undoes the vault deposit")
        void rollbackUndoesLocalVaultDeposit() {
            vault.allocator.addStrategy("rejecting", rejectingEntryPoint(), units(500));
            BigInteger totalAssetsBefore = vault.accounting.totalAssets();
            BigInteger supplyBefore = vault.state.getTotalSupply();
            int eventsBefore = vault.events.size();

            assertError(
                    () -> vault.allocator.dispatchAssets(List.of(units(300), units(100)), List.of(LOCAL, "rejecting")),
                    ErrorCode.BAD_REQUEST);

            assertThat(vault.allocator.crateBalance()).isEqualTo(units(1000));
            assertThat(debtOf(LOCAL)).isEqualTo(BigInteger.ZERO);
            assertThat(vault.accounting.totalAssets()).isEqualTo(totalAssetsBefore);
            assertThat(vault.state.getTotalSupply()).isEqualTo(supplyBefore);
            assertThat(vault.state.sharesOf(LOCAL_ENTRY_POINT)).isZero();
            assertThat(vault.events).hasSize(eventsBefore);
        }

        @Test
        @DisplayName("events of a successful dispatch are delivered after the transfers, vault deposit included")
        void eventsAfterSuccess() {
            vault.events.clear();

            vault.allocator.dispatchAssets(List.of(units(200)), List.of(LOCAL));

            assertThat(vault.vaultEventTypes()).contains(VaultEventType.DEPOSIT);
            assertThat(vault.allocatorEventTypes())
                    .containsExactly(AllocatorEventType.DEPOSIT_IN_STRATEGY, AllocatorEventType.CHAIN_DEBT_UPDATE);
        }
    }

    @Nested
    @DisplayName("Recall")
    class Recall {

        @BeforeEach
        void dispatch() {
            vault.allocator.dispatchAssets(List.of(units(300), units(200)), List.of(REMOTE, LOCAL));
        }

        @Test
        @DisplayName("debt drops by the recalled amount and a shortfall is reported as a loss")
        void liquidateWithLoss() {
            vault.remoteStrategy.setLossBps(1000);

            BigInteger recovered = vault.allocator.liquidateStrategy(units(100), units(90), REMOTE);

            assertThat(recovered).isEqualTo(units(90));
            assertThat(debtOf(REMOTE)).isEqualTo(units(200));
            assertThat(vault.allocator.crateBalance()).isEqualTo(units(590));
            assertThat(vault.allocatorEventTypes())
                    .contains(AllocatorEventType.LOSSES, AllocatorEventType.STRAT_POSITION_UPDATED);
        }

        @Test
        @DisplayName("recall above debt or below the minimum output is refused without side effects")
        void liquidateRefused() {
            vault.remoteStrategy.setLossBps(1000);

            assertError(() -> vault.allocator.liquidateStrategy(units(301), BigInteger.ZERO, REMOTE), ErrorCode.AMOUNT_TOO_HIGH);
            assertError(() -> vault.allocator.liquidateStrategy(units(100), units(95), REMOTE), ErrorCode.AMOUNT_TOO_LOW);

            assertThat(debtOf(REMOTE)).isEqualTo(units(300));
            assertThat(vault.remoteStrategy.totalAssets()).isEqualTo(units(300));
        }

        @Test
        @DisplayName("recall from the local vault withdraws exactly the amount")
        void localRecall() {
            BigInteger recovered = vault.allocator.liquidateStrategy(units(200), units(200), LOCAL);

            assertThat(recovered).isEqualTo(units(200));
            assertThat(vault.state.sharesOf(LOCAL_ENTRY_POINT)).isEqualTo(BigInteger.ZERO);
            assertThat(debtOf(LOCAL)).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("panic recalls the whole debt, zeroes it and makes the flag sticky")
        void panic() {
            vault.remoteStrategy.setLossBps(500);

            BigInteger recovered = vault.allocator.panicLiquidateStrategy(REMOTE);

            StrategyRecord record = vault.allocator.strategy(REMOTE).orElseThrow();
            assertThat(recovered).isEqualTo(units(285));
            assertThat(record.getDebt()).isEqualTo(BigInteger.ZERO);
            assertThat(record.isPanicked()).isTrue();
            assertThat(vault.allocator.totalChainDebt()).isEqualTo(units(200));
            assertThat(vault.allocatorEventTypes())
                    .contains(AllocatorEventType.PANIC_LIQUIDATE, AllocatorEventType.LOSSES);
        }

        @Test
        @DisplayName("panic on the local vault takes only what it can pay right now")
        void localPanicLimitedByLiquidity() {
            vault.configureSingleInputs(10_000, 0);
            vault.allocationEngine.invest(targets(1100), noSwapParams());

            BigInteger recovered = vault.allocator.panicLiquidateStrategy(LOCAL);

            assertThat(recovered).isEqualTo(units(100));
            assertThat(debtOf(LOCAL)).isEqualTo(BigInteger.ZERO);
            assertThat(vault.allocatorEventTypes()).contains(AllocatorEventType.LOSSES);
        }
    }

    @Nested
    @DisplayName("Self-reported debt")
    class SelfReportedDebt {

        @Test
        @DisplayName("a registered strategy may report a new debt within its ceiling")
        void reportWithinCeiling() {
            vault.allocator.updateStrategyDebt(REMOTE_STRATEGY, units(350), units(360));

            StrategyRecord record = vault.allocator.strategy(REMOTE).orElseThrow();
            assertThat(record.getDebt()).isEqualTo(units(350));
            assertThat(record.getLastReportedAssets()).isEqualTo(units(360));
            assertThat(vault.allocator.totalChainDebt()).isEqualTo(units(350));
        }

        @Test
        @DisplayName("unknown callers are unauthorized and the ceiling binds unless panicked")
        void reportRefused() {
            assertError(
                    () -> vault.allocator.updateStrategyDebt(VaultHarness.ALICE, units(1), null), ErrorCode.UNAUTHORIZED);
            assertError(
                    () -> vault.allocator.updateStrategyDebt(REMOTE_STRATEGY, units(600), null),
                    ErrorCode.MAX_DEPOSIT_REACHED);

            vault.allocator.setPanicked(REMOTE, true);
            vault.allocator.updateStrategyDebt(REMOTE_STRATEGY, units(600), null);
            assertThat(debtOf(REMOTE)).isEqualTo(units(600));
        }
    }

    @Test
    @DisplayName("strategy map reports the allocator's debt and the strategy's own assets")
    void strategyMap() {
        vault.allocator.dispatchAssets(List.of(units(300)), List.of(REMOTE));
        vault.remoteStrategy.accrueYield(1000);

        StrategyMapEntry entry = vault.allocator.strategyMap().get(0);

        assertThat(entry.getStrategyName()).isEqualTo(REMOTE);
        assertThat(entry.getEntryPoint()).isEqualTo(REMOTE_STRATEGY);
        assertThat(entry.getMaxDeposit()).isEqualTo(units(500));
        assertThat(entry.getDebt()).isEqualTo(units(300));
        assertThat(entry.getTotalAssetsAvailable()).isEqualTo(units(330));
        assertThat(entry.isWhitelisted()).isTrue();
        assertThat(entry.isPanicked()).isFalse();
    }
}
