package com.yieldvault.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.yieldvault.allocator.Allocator;
import com.yieldvault.event.AllocatorEvent;
import com.yieldvault.event.AllocatorEventType;
import com.yieldvault.event.VaultEvent;
import com.yieldvault.event.VaultEventType;
import com.yieldvault.ledger.VaultAccounting;
import com.yieldvault.observability.CustomMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for CustomMetricsService.
 *
 * <p>Lenient strictness because gauges only call the mocks when scraped, so stubs set up for
 * every test look unnecessary to counter-only tests.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CustomMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private CustomMetricsService customMetricsService;

    @Mock
    private VaultAccounting vaultAccounting;

    @Mock
    private Allocator allocator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(vaultAccounting.totalAssets()).thenReturn(BigInteger.ZERO);
        when(vaultAccounting.sharePrice()).thenReturn(BigInteger.ZERO);
        when(allocator.totalChainDebt()).thenReturn(BigInteger.ZERO);
        customMetricsService = new CustomMetricsService(meterRegistry, vaultAccounting, allocator);
    }

    private VaultEvent vaultEvent(VaultEventType type) {
        return new VaultEvent(this, type, Map.of());
    }

    @Nested
    @DisplayName("Counter metrics")
    class CounterMetrics {

        @Test
        @DisplayName("vault.deposits and vault.withdrawals count their events")
        void depositAndWithdrawCounters() {
            customMetricsService.onVaultEvent(vaultEvent(VaultEventType.DEPOSIT));
            customMetricsService.onVaultEvent(vaultEvent(VaultEventType.DEPOSIT));
            customMetricsService.onVaultEvent(vaultEvent(VaultEventType.WITHDRAW));

            assertThat(meterRegistry.get("vault.deposits").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("vault.withdrawals").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("fee collections and slippage rejections are counted")
        void feeAndSlippageCounters() {
            customMetricsService.onVaultEvent(vaultEvent(VaultEventType.FEES_COLLECTED));
            customMetricsService.onVaultEvent(vaultEvent(VaultEventType.SLIPPAGE_REJECTED));

            assertThat(meterRegistry.get("vault.fee.collections").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("vault.slippage.rejections").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("other vault events are not counted")
        void otherEventsIgnored() {
            customMetricsService.onVaultEvent(vaultEvent(VaultEventType.INVEST));
            customMetricsService.onVaultEvent(vaultEvent(VaultEventType.SHARE_PRICE_UPDATED));

            assertThat(meterRegistry.get("vault.deposits").counter().count()).isZero();
            assertThat(meterRegistry.get("vault.withdrawals").counter().count()).isZero();
        }

        @Test
        @DisplayName("allocator.panics counts panic liquidations only")
        void panicCounter() {
            customMetricsService.onAllocatorEvent(
                    new AllocatorEvent(this, AllocatorEventType.PANIC_LIQUIDATE, "remote", Map.of()));
            customMetricsService.onAllocatorEvent(
                    new AllocatorEvent(this, AllocatorEventType.LOSSES, "remote", Map.of()));

            assertThat(meterRegistry.get("allocator.panics").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Gauge metrics")
    class GaugeMetrics {

        @Test
        @DisplayName("vault.total.assets reads the accounting on scrape")
        void totalAssetsGauge() {
            when(vaultAccounting.totalAssets()).thenReturn(BigInteger.valueOf(1_500_000));

            assertThat(meterRegistry.get("vault.total.assets").gauge().value()).isEqualTo(1_500_000.0);
        }

        @Test
        @DisplayName("vault.share.price reads the current price")
        void sharePriceGauge() {
            when(vaultAccounting.sharePrice()).thenReturn(BigInteger.valueOf(1_010_000));

            assertThat(meterRegistry.get("vault.share.price").gauge().value()).isEqualTo(1_010_000.0);
        }

        @Test
        @DisplayName("allocator.chain.debt reads the allocator")
        void chainDebtGauge() {
            when(allocator.totalChainDebt()).thenReturn(BigInteger.valueOf(42));

            assertThat(meterRegistry.get("allocator.chain.debt").gauge().value()).isEqualTo(42.0);
        }
    }
}
