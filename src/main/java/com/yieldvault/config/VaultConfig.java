package com.yieldvault.config;

import com.yieldvault.domain.model.Fees;
import com.yieldvault.domain.model.VaultState;
import com.yieldvault.ledger.VaultParameters;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides {@link VaultParameters}, the {@link VaultState} of this instance's vault and the
 * {@link Clock} used for cooldowns and deadlines.
 *
 * <p>The vault starts paused; {@code seedLiquidity} unpauses it.
 *
 * <p>Properties prefix: {@code yieldvault.vault.*}
 */
@Configuration
public class VaultConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VaultParameters vaultParameters(
            @Value("${yieldvault.vault.address:0x00000000000000000000000000000000000000aa}") String vaultAddress,
            @Value("${yieldvault.vault.asset:USDC}") String asset,
            @Value("${yieldvault.vault.share-decimals:18}") int shareDecimals,
            @Value("${yieldvault.vault.fee-collector:0x00000000000000000000000000000000000000fe}") String feeCollector,
            @Value("${yieldvault.vault.profit-cooldown:PT24H}") Duration profitCooldown,
            @Value("${yieldvault.vault.cap-exempt:}") String capExempt,
            @Value("${yieldvault.vault.max-total-assets:0}") BigInteger maxTotalAssets,
            @Value("${yieldvault.vault.min-liquidity:0}") BigInteger minLiquidity,
            @Value("${yieldvault.vault.fees.perf:1000}") int perf,
            @Value("${yieldvault.vault.fees.mgmt:50}") int mgmt,
            @Value("${yieldvault.vault.fees.entry:0}") int entry,
            @Value("${yieldvault.vault.fees.exit:0}") int exit) {
        return VaultParameters.builder()
                .vaultAddress(vaultAddress)
                .asset(asset)
                .shareDecimals(shareDecimals)
                .feeCollector(feeCollector)
                .profitCooldown(profitCooldown)
                .capExempt(parseAddresses(capExempt))
                .initialMaxTotalAssets(maxTotalAssets)
                .initialMinLiquidity(minLiquidity)
                .perfFeeBps(perf)
                .mgmtFeeBps(mgmt)
                .entryFeeBps(entry)
                .exitFeeBps(exit)
                .build();
    }

    @Bean
    public VaultState vaultState(VaultParameters vaultParameters, Clock clock) {
        Fees fees = Fees.builder()
                .perf(vaultParameters.getPerfFeeBps())
                .mgmt(vaultParameters.getMgmtFeeBps())
                .entry(vaultParameters.getEntryFeeBps())
                .exit(vaultParameters.getExitFeeBps())
                .build();
        fees.validate();

        VaultState state = new VaultState(vaultParameters.getAsset(), vaultParameters.getShareDecimals(), clock.instant());
        state.setFees(fees);
        state.setMaxTotalAssets(vaultParameters.getInitialMaxTotalAssets());
        state.setMinLiquidity(vaultParameters.getInitialMinLiquidity());
        return state;
    }

    private static Set<String> parseAddresses(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
